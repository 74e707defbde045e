package com.helpdesk.web.common;

import java.util.Collection;

/**
 * 从 JWT 中提取的员工身份
 */
public record CurrentUserInfo(
    /** Keycloak subject */
    String userId,

    /** preferred_username，缺失时回退为 userId */
    String username,

    /** name 声明，可能为 null */
    String nickname,

    /** Realm 角色 */
    Collection<String> realmRoles
) {
    /**
     * 显示名称：nickname > username > userId
     * 创建远程会话时作为操作员名称写入会话
     */
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }

    public boolean hasRealmRole(String role) {
        return realmRoles != null && realmRoles.contains(role);
    }
}
