package com.helpdesk.session;

import com.helpdesk.session.model.PartyRole;
import com.helpdesk.session.model.SessionId;
import com.helpdesk.session.model.SessionSnapshot;
import com.helpdesk.session.model.SessionStatus;
import com.helpdesk.session.model.WorkItemId;
import lombok.Getter;

import java.time.Instant;

/**
 * 一次远程协助会话。
 *
 * 可变状态只能由 {@link SessionRegistry} 在写锁内修改；字段声明为 volatile，
 * 锁外读取 getter 可以看到最近一次提交的值。
 */
@Getter
public class RemoteSession {

    private final SessionId sessionId;
    private final WorkItemId workItemId;
    private final String userName;
    private final String operatorName;
    private final String userToken;
    private final String operatorToken;
    private final Instant createdAt;
    private final Instant expiresAt;

    private volatile Instant lastActivityAt;
    private volatile SessionStatus status;
    private volatile boolean userConnected;
    private volatile boolean operatorConnected;
    private volatile int failedAuthAttempts;

    RemoteSession(SessionId sessionId, WorkItemId workItemId, String userName, String operatorName,
                  String userToken, String operatorToken, Instant createdAt, Instant expiresAt) {
        this.sessionId = sessionId;
        this.workItemId = workItemId;
        this.userName = userName;
        this.operatorName = operatorName;
        this.userToken = userToken;
        this.operatorToken = operatorToken;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.lastActivityAt = createdAt;
        this.status = SessionStatus.PENDING;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    /**
     * 未过期且未关闭
     */
    public boolean isLive(Instant now) {
        return !isExpired(now) && status != SessionStatus.CLOSED;
    }

    public boolean isConnected(PartyRole role) {
        return role == PartyRole.USER ? userConnected : operatorConnected;
    }

    String tokenFor(PartyRole role) {
        return role == PartyRole.USER ? userToken : operatorToken;
    }

    void markConnected(PartyRole role, Instant now) {
        if (role == PartyRole.USER) {
            userConnected = true;
        } else {
            operatorConnected = true;
        }
        lastActivityAt = now;
    }

    /**
     * 任一方掉线时，ACTIVE 降级为 PENDING
     */
    void markDisconnected(PartyRole role) {
        if (role == PartyRole.USER) {
            userConnected = false;
        } else {
            operatorConnected = false;
        }
        if (status == SessionStatus.ACTIVE) {
            status = SessionStatus.PENDING;
        }
    }

    void activate(Instant now) {
        status = SessionStatus.ACTIVE;
        lastActivityAt = now;
    }

    void touch(Instant now) {
        lastActivityAt = now;
    }

    int recordAuthFailure() {
        return ++failedAuthAttempts;
    }

    void close() {
        status = SessionStatus.CLOSED;
        userConnected = false;
        operatorConnected = false;
    }

    public SessionSnapshot snapshot() {
        return new SessionSnapshot(
                sessionId.value(),
                workItemId.value(),
                userName,
                operatorName,
                createdAt,
                expiresAt,
                lastActivityAt,
                status,
                userConnected,
                operatorConnected);
    }
}
