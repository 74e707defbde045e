package com.helpdesk.remoteservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳（所有 STOMP 下行消息共用）
 * - kind：STATE=完整状态，EVENT=会话事件，ERROR=错误通知
 * - type：具体类型（JOINED、FRAME、USER_CONNECTED、SESSION_CLOSED、错误码 …）
 * - sessionId：所属远程会话，可能为 null（例如接入前的参数错误）
 *
 * 用法示例：
 *   Envelope<Object> msg = Envelope.event("SESSION_ACTIVATED", sessionId, snapshot);
 *   Envelope<ErrorPayload> err = Envelope.error("AUTH_FAILED", sessionId, new ErrorPayload(...));
 */
public record Envelope<T>(Kind kind, String type, String sessionId, T payload, long ts) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public enum Kind { STATE, EVENT, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(type, "type");
    }

    public static <T> Envelope<T> of(Kind kind, String type, String sessionId, T payload) {
        return new Envelope<>(kind, type, sessionId, payload, Instant.now().toEpochMilli());
    }

    public static <T> Envelope<T> state(String type, String sessionId, T payload) {
        return of(Kind.STATE, type, sessionId, payload);
    }

    public static <T> Envelope<T> event(String type, String sessionId, T payload) {
        return of(Kind.EVENT, type, sessionId, payload);
    }

    public static <T> Envelope<T> error(String type, String sessionId, T payload) {
        return of(Kind.ERROR, type, sessionId, payload);
    }

    /**
     * 错误载荷
     */
    public record ErrorPayload(String code, String message) implements Serializable {
    }
}
