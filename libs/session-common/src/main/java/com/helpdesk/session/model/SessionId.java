package com.helpdesk.session.model;

/**
 * 远程会话 ID（不可猜测的随机串，见 {@link com.helpdesk.session.SecureTokens#newSessionId()}）
 */
public record SessionId(String value) {

    public SessionId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
    }

    public static SessionId of(String value) {
        return new SessionId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
