package com.helpdesk.session.model;

/**
 * 远程会话状态。
 *
 * PENDING 与 ACTIVE 可以来回切换（断线降级、重新激活），CLOSED 是终态。
 */
public enum SessionStatus {

    /** 已创建，双方尚未全部接入或有一方掉线 */
    PENDING,

    /** 双方均已认证并完成激活 */
    ACTIVE,

    /** 已关闭（显式关闭、被替换、过期清理或认证失败锁定） */
    CLOSED
}
