package com.helpdesk.remoteservice.platform.ws;

import com.helpdesk.remoteservice.application.ErrorCode;
import com.helpdesk.remoteservice.application.SessionEventPublisher;
import com.helpdesk.remoteservice.application.SessionEventType;
import com.helpdesk.remoteservice.platform.transport.Envelope;
import com.helpdesk.session.model.SessionId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * STOMP 下行消息工具类。
 *
 * - {@link #publish}：会话频道广播（实现 {@link SessionEventPublisher}）
 * - {@link #sendToConnection}：只发给某一个连接（带 sessionId header 精确投递）
 */
@Slf4j
@Component
public class RemoteMessageSender implements SessionEventPublisher {

    public static final String SESSION_TOPIC_PREFIX = "/topic/remote.session.";
    public static final String JOINED_QUEUE = "/queue/remote.joined";
    public static final String FRAME_QUEUE = "/queue/remote.frame";
    public static final String ACTIVATED_QUEUE = "/queue/remote.activated";
    public static final String ERROR_QUEUE = "/queue/remote.error";

    private final SimpMessagingTemplate messagingTemplate;

    public RemoteMessageSender(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public static String sessionTopic(SessionId sessionId) {
        return SESSION_TOPIC_PREFIX + sessionId.value();
    }

    @Override
    public void publish(SessionId sessionId, SessionEventType type, Object payload) {
        try {
            messagingTemplate.convertAndSend(sessionTopic(sessionId),
                    Envelope.event(type.name(), sessionId.value(), payload));
        } catch (Exception e) {
            log.warn("广播会话事件失败: sessionId={}, type={}", sessionId, type, e);
        }
    }

    /**
     * 点对点发送。user 为 null（连接未经过 CONNECT 拦截）时丢弃并记录。
     */
    public void sendToConnection(Principal user, String connectionId, String destination, Object payload) {
        if (user == null) {
            log.warn("连接缺少身份，无法点对点发送: connection={}, destination={}", connectionId, destination);
            return;
        }
        try {
            SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
            headerAccessor.setSessionId(connectionId);
            headerAccessor.setLeaveMutable(true);
            messagingTemplate.convertAndSendToUser(user.getName(), destination, payload,
                    headerAccessor.getMessageHeaders());
        } catch (Exception e) {
            log.warn("点对点发送失败: connection={}, destination={}", connectionId, destination, e);
        }
    }

    public void sendError(Principal user, String connectionId, String sessionId, ErrorCode code, String message) {
        sendToConnection(user, connectionId, ERROR_QUEUE,
                Envelope.error(code.name(), sessionId, new Envelope.ErrorPayload(code.name(), message)));
    }
}
