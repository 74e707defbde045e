package com.helpdesk.remoteservice.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 创建远程会话请求。操作员名称取自当前员工 JWT，不由请求体提供。
 */
public record CreateSessionRequest(
        @NotBlank String workItemId,
        @NotBlank String userName
) {
}
