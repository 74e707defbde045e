package com.helpdesk.web.common;

import java.io.Serializable;

/**
 * 统一 HTTP 响应格式
 *
 * @param code    状态码（200 成功，400 参数错误，401 未认证，403 非员工，404 会话不存在，409 状态冲突，500 服务器错误）
 * @param message 响应消息
 * @param data    响应数据
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    public static <T> ApiResponse<T> unauthorized(String message) {
        return error(401, message);
    }

    public static <T> ApiResponse<T> forbidden(String message) {
        return error(403, message);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    /**
     * 409：会话状态不允许该操作（例如已关闭的会话再次激活）
     */
    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return error(500, message);
    }

    public boolean isSuccess() {
        return code == 200;
    }
}
