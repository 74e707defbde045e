package com.helpdesk.remoteservice.application;

/**
 * 下发给客户端的错误码（/user/queue/remote.error）
 */
public enum ErrorCode {
    /** 会话不存在、已过期或已关闭 */
    SESSION_NOT_FOUND,
    /** 令牌错误 */
    AUTH_FAILED,
    /** 连接没有执行该操作的权限 */
    NOT_AUTHORIZED,
    /** 请求参数缺失或格式不对 */
    BAD_REQUEST,
    /** 双方未全部在线，无法激活 */
    ACTIVATION_REJECTED,
    /** 输入注入失败 */
    DISPATCH_FAILED
}
