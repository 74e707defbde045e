package com.helpdesk.session.model;

import java.time.Instant;

/**
 * 会话只读快照（不含令牌），用于 HTTP 查询和 STOMP 下发。
 */
public record SessionSnapshot(
        String sessionId,
        String workItemId,
        String userName,
        String operatorName,
        Instant createdAt,
        Instant expiresAt,
        Instant lastActivityAt,
        SessionStatus status,
        boolean userConnected,
        boolean operatorConnected
) {
}
