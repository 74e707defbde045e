package com.helpdesk.remoteservice.application;

import com.helpdesk.session.model.PartyRole;
import com.helpdesk.session.model.SessionId;

/**
 * 连接接入后绑定的会话与角色
 */
public record ConnectionBinding(SessionId sessionId, PartyRole role) {
}
