package com.helpdesk.remoteservice.interfaces.http.dto;

import java.time.Instant;

/**
 * 创建结果：两枚令牌只在此处返回一次，由员工分别转交给终端用户和自己的查看页。
 */
public record CreateSessionResponse(
        String sessionId,
        String workItemId,
        String userToken,
        String operatorToken,
        Instant expiresAt
) {
}
