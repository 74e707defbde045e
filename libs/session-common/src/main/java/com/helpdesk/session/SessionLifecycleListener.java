package com.helpdesk.session;

import com.helpdesk.session.model.CloseReason;

/**
 * 会话关闭回调。
 *
 * 由 {@link SessionRegistry} 在释放锁之后调用，实现方可以安全地回查注册表。
 * 每个会话只会回调一次（从未关闭转为关闭的那一刻）。
 */
@FunctionalInterface
public interface SessionLifecycleListener {

    void onSessionClosed(RemoteSession session, CloseReason reason);
}
