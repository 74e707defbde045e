package com.helpdesk.session;

import com.helpdesk.session.model.CloseReason;
import com.helpdesk.session.model.PartyRole;
import com.helpdesk.session.model.SessionId;
import com.helpdesk.session.model.SessionSnapshot;
import com.helpdesk.session.model.SessionStats;
import com.helpdesk.session.model.SessionStatus;
import com.helpdesk.session.model.WorkItemId;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 远程会话注册表。
 *
 * 职责：
 * - 创建会话并签发两枚接入令牌（用户一枚、员工一枚）。
 * - 校验令牌、记录双方在线状态、双方到齐后激活。
 * - 维护 工单 -> 会话 的一对一索引，同一工单新建会话时关闭旧会话。
 * - 过期回收（由 {@link SessionSweeper} 周期调用 {@link #sweepExpired()}）。
 *
 * 存储：进程内两张表（会话表、工单索引），由同一把读写锁保护，
 * 任一写操作对两张表的修改对其他线程原子可见。
 *
 * 读取时即判断过期：过期或已关闭的会话对外表现为“不存在”，
 * 即使清理任务尚未运行。
 */
@Slf4j
public class SessionRegistry {

    /** 会话表：sessionId -> session */
    private final Map<SessionId, RemoteSession> sessions = new HashMap<>();
    /** 工单索引：workItemId -> sessionId */
    private final Map<WorkItemId, SessionId> sessionsByWorkItem = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final List<SessionLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Duration ttl;
    /** 单个会话允许的令牌校验失败次数，<=0 表示不限制 */
    private final int maxAuthFailures;

    public SessionRegistry(Clock clock, Duration ttl, int maxAuthFailures) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.maxAuthFailures = maxAuthFailures;
    }

    public void addListener(SessionLifecycleListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /* =========================
     * 创建 / 查询
     * ========================= */

    /**
     * 为工单创建新会话。若该工单已有会话（无论是否过期），旧会话先被关闭。
     * 参与方名称只用于展示，不做校验（null 记为空串），由调用方在接口层校验。
     *
     * @return 新会话（状态 PENDING，双方均未接入）
     */
    public RemoteSession createSession(WorkItemId workItemId, String userName, String operatorName) {
        Objects.requireNonNull(workItemId, "workItemId must not be null");
        userName = Objects.toString(userName, "");
        operatorName = Objects.toString(operatorName, "");

        Instant now = clock.instant();
        RemoteSession replaced;
        RemoteSession session = new RemoteSession(
                SessionId.of(SecureTokens.newSessionId()),
                workItemId,
                userName,
                operatorName,
                SecureTokens.newToken(),
                SecureTokens.newToken(),
                now,
                now.plus(ttl));

        lock.writeLock().lock();
        try {
            SessionId previous = sessionsByWorkItem.get(workItemId);
            replaced = previous != null ? closeLocked(previous) : null;
            sessions.put(session.getSessionId(), session);
            sessionsByWorkItem.put(workItemId, session.getSessionId());
        } finally {
            lock.writeLock().unlock();
        }

        if (replaced != null) {
            log.info("工单已有远程会话，旧会话被替换: workItemId={}, oldSessionId={}, newSessionId={}",
                    workItemId, replaced.getSessionId(), session.getSessionId());
            fireClosed(replaced, CloseReason.REPLACED);
        }
        log.info("创建远程会话: sessionId={}, workItemId={}, user={}, operator={}, expiresAt={}",
                session.getSessionId(), workItemId, userName, operatorName, session.getExpiresAt());
        return session;
    }

    /**
     * @return 未过期且未关闭的会话
     */
    public Optional<RemoteSession> getSession(SessionId sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(liveLocked(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RemoteSession> findByWorkItem(WorkItemId workItemId) {
        if (workItemId == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            SessionId sessionId = sessionsByWorkItem.get(workItemId);
            return Optional.ofNullable(sessionId != null ? liveLocked(sessionId) : null);
        } finally {
            lock.readLock().unlock();
        }
    }

    /* =========================
     * 认证 / 激活 / 在线状态
     * ========================= */

    public boolean authenticateAsUser(SessionId sessionId, String token) {
        return authenticate(sessionId, PartyRole.USER, token);
    }

    public boolean authenticateAsOperator(SessionId sessionId, String token) {
        return authenticate(sessionId, PartyRole.OPERATOR, token);
    }

    /**
     * 校验令牌；成功则标记该方在线并刷新活跃时间。
     * 失败计数达到上限时会话被关闭。
     */
    public boolean authenticate(SessionId sessionId, PartyRole role, String token) {
        Objects.requireNonNull(role, "role must not be null");
        if (sessionId == null) {
            return false;
        }
        RemoteSession lockedOut = null;
        lock.writeLock().lock();
        try {
            RemoteSession session = liveLocked(sessionId);
            if (session == null) {
                log.debug("认证失败，会话不存在或已失效: sessionId={}, role={}", sessionId, role);
                return false;
            }
            if (SecureTokens.matches(session.tokenFor(role), token)) {
                session.markConnected(role, clock.instant());
                log.info("会话认证成功: sessionId={}, role={}", sessionId, role);
                return true;
            }
            int failures = session.recordAuthFailure();
            log.warn("会话令牌校验失败: sessionId={}, role={}, failures={}", sessionId, role, failures);
            if (maxAuthFailures > 0 && failures >= maxAuthFailures) {
                lockedOut = closeLocked(sessionId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (lockedOut != null) {
            log.warn("令牌校验失败次数达到上限，会话已关闭: sessionId={}, max={}", sessionId, maxAuthFailures);
            fireClosed(lockedOut, CloseReason.AUTH_LOCKOUT);
        }
        return false;
    }

    /**
     * 双方都在线时转为 ACTIVE。
     *
     * @return 是否激活成功；会话已失效或有一方不在线时返回 false
     */
    public boolean activate(SessionId sessionId) {
        lock.writeLock().lock();
        try {
            RemoteSession session = sessionId != null ? liveLocked(sessionId) : null;
            if (session == null) {
                return false;
            }
            if (!session.isUserConnected() || !session.isOperatorConnected()) {
                log.debug("激活被拒绝，双方未全部在线: sessionId={}, user={}, operator={}",
                        sessionId, session.isUserConnected(), session.isOperatorConnected());
                return false;
            }
            session.activate(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("远程会话已激活: sessionId={}", sessionId);
        return true;
    }

    /**
     * 刷新活跃时间（仅记录，不影响 TTL）
     */
    public void recordActivity(SessionId sessionId) {
        lock.writeLock().lock();
        try {
            RemoteSession session = sessionId != null ? liveLocked(sessionId) : null;
            if (session != null) {
                session.touch(clock.instant());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean disconnectUser(SessionId sessionId) {
        return disconnect(sessionId, PartyRole.USER);
    }

    public boolean disconnectOperator(SessionId sessionId) {
        return disconnect(sessionId, PartyRole.OPERATOR);
    }

    /**
     * 标记某方离线；ACTIVE 会话降级为 PENDING。会话已失效时为 no-op。
     *
     * @return 会话是否仍然有效（即是否做了修改）
     */
    public boolean disconnect(SessionId sessionId, PartyRole role) {
        lock.writeLock().lock();
        try {
            RemoteSession session = sessionId != null ? liveLocked(sessionId) : null;
            if (session == null) {
                return false;
            }
            session.markDisconnected(role);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("会话参与方离线: sessionId={}, role={}", sessionId, role);
        return true;
    }

    /* =========================
     * 关闭 / 回收
     * ========================= */

    /**
     * 关闭会话并移除工单索引（仅当索引仍指向该会话）。
     *
     * @return 本次调用是否真正关闭了会话；不存在或已关闭时返回 false
     */
    public boolean closeSession(SessionId sessionId) {
        if (sessionId == null) {
            return false;
        }
        RemoteSession closed;
        lock.writeLock().lock();
        try {
            closed = closeLocked(sessionId);
        } finally {
            lock.writeLock().unlock();
        }
        if (closed == null) {
            return false;
        }
        log.info("远程会话已关闭: sessionId={}, workItemId={}", sessionId, closed.getWorkItemId());
        fireClosed(closed, CloseReason.CLOSED);
        return true;
    }

    /**
     * 移除所有过期会话，顺带清掉已关闭会话的残留记录。
     *
     * @return 本次回收的过期会话数
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        List<RemoteSession> expired = new ArrayList<>();
        int pruned = 0;
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<SessionId, RemoteSession>> it = sessions.entrySet().iterator();
            while (it.hasNext()) {
                RemoteSession session = it.next().getValue();
                if (session.isExpired(now)) {
                    RemoteSession closed = closeLocked(session.getSessionId());
                    if (closed != null) {
                        expired.add(closed);
                    }
                    it.remove();
                } else if (session.getStatus() == SessionStatus.CLOSED) {
                    it.remove();
                    pruned++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (RemoteSession session : expired) {
            fireClosed(session, CloseReason.EXPIRED);
        }
        if (!expired.isEmpty() || pruned > 0) {
            log.info("清理远程会话: expired={}, prunedClosed={}", expired.size(), pruned);
        }
        return expired.size();
    }

    /* =========================
     * 统计 / 观测
     * ========================= */

    public SessionStats stats() {
        lock.readLock().lock();
        try {
            int active = 0;
            int pending = 0;
            int closed = 0;
            for (RemoteSession session : sessions.values()) {
                switch (session.getStatus()) {
                    case ACTIVE:
                        active++;
                        break;
                    case PENDING:
                        pending++;
                        break;
                    default:
                        closed++;
                }
            }
            return new SessionStats(sessions.size(), active, pending, closed);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 当前处于 ACTIVE 且未过期的会话
     */
    public List<SessionSnapshot> activeSessions() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            List<SessionSnapshot> result = new ArrayList<>();
            for (RemoteSession session : sessions.values()) {
                if (session.getStatus() == SessionStatus.ACTIVE && !session.isExpired(now)) {
                    result.add(session.snapshot());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 原始查询：表中是否还留有该会话记录（不论是否过期/关闭）
     */
    public boolean isTracked(SessionId sessionId) {
        lock.readLock().lock();
        try {
            return sessions.containsKey(sessionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 原始查询：工单索引当前指向的会话 ID（不论是否过期）
     */
    public Optional<SessionId> trackedSessionIdFor(WorkItemId workItemId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sessionsByWorkItem.get(workItemId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /* =========================
     * 内部工具
     * ========================= */

    /** 调用方需持有读锁或写锁 */
    private RemoteSession liveLocked(SessionId sessionId) {
        RemoteSession session = sessions.get(sessionId);
        if (session == null || !session.isLive(clock.instant())) {
            return null;
        }
        return session;
    }

    /**
     * 调用方需持有写锁。
     *
     * @return 原本未关闭、本次被关闭的会话；否则 null
     */
    private RemoteSession closeLocked(SessionId sessionId) {
        RemoteSession session = sessions.get(sessionId);
        if (session == null) {
            return null;
        }
        boolean wasOpen = session.getStatus() != SessionStatus.CLOSED;
        session.close();
        sessionsByWorkItem.remove(session.getWorkItemId(), sessionId);
        return wasOpen ? session : null;
    }

    private void fireClosed(RemoteSession session, CloseReason reason) {
        for (SessionLifecycleListener listener : listeners) {
            try {
                listener.onSessionClosed(session, reason);
            } catch (RuntimeException e) {
                log.error("会话关闭回调异常: sessionId={}, reason={}, listener={}",
                        session.getSessionId(), reason, listener.getClass().getSimpleName(), e);
            }
        }
    }
}
