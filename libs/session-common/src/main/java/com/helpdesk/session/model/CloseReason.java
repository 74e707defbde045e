package com.helpdesk.session.model;

/**
 * 会话关闭原因（随 SESSION_CLOSED 事件下发）
 */
public enum CloseReason {
    /** 员工或接口显式关闭 */
    CLOSED,
    /** 同一工单创建了新会话 */
    REPLACED,
    /** TTL 到期后被清理任务回收 */
    EXPIRED,
    /** 令牌连续校验失败次数达到上限 */
    AUTH_LOCKOUT
}
