package com.helpdesk.remoteservice.application;

import com.helpdesk.session.model.SessionId;

/**
 * 会话事件出口，由传输层实现
 */
public interface SessionEventPublisher {

    void publish(SessionId sessionId, SessionEventType type, Object payload);
}
