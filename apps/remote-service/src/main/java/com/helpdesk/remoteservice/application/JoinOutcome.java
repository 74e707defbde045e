package com.helpdesk.remoteservice.application;

import com.helpdesk.session.model.PartyRole;
import com.helpdesk.session.model.SessionSnapshot;

/**
 * 接入结果：成功时带角色与会话快照，失败时带错误码
 */
public record JoinOutcome(boolean joined, PartyRole role, SessionSnapshot session, ErrorCode error, String message) {

    public static JoinOutcome joined(PartyRole role, SessionSnapshot session) {
        return new JoinOutcome(true, role, session, null, null);
    }

    public static JoinOutcome rejected(ErrorCode error, String message) {
        return new JoinOutcome(false, null, null, error, message);
    }
}
