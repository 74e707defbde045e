package com.helpdesk.session.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 会话参与方角色
 */
public enum PartyRole {

    /** 终端用户（被协助方，屏幕被共享） */
    USER,

    /** IT 员工（操作方，查看屏幕并注入输入） */
    OPERATOR;

    /**
     * 解析客户端上报的角色名；兼容旧客户端的 it_staff / staff。
     */
    public static Optional<PartyRole> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "user":
                return Optional.of(USER);
            case "operator":
            case "it_staff":
            case "staff":
                return Optional.of(OPERATOR);
            default:
                return Optional.empty();
        }
    }
}
