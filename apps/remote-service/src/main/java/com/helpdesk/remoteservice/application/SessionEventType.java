package com.helpdesk.remoteservice.application;

/**
 * 会话频道（/topic/remote.session.{id}）上广播的事件
 */
public enum SessionEventType {
    USER_CONNECTED,
    OPERATOR_CONNECTED,
    SESSION_ACTIVATED,
    USER_DISCONNECTED,
    OPERATOR_DISCONNECTED,
    SESSION_CLOSED
}
