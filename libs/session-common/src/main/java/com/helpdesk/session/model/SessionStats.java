package com.helpdesk.session.model;

/**
 * 注册表中按状态统计的会话数量（包含尚未被清理的过期/已关闭会话）
 */
public record SessionStats(int total, int active, int pending, int closed) {
}
