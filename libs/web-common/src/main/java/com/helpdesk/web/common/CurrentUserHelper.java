package com.helpdesk.web.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * 当前员工身份提取工具类
 *
 * 远程协助里只有 IT 员工持有 JWT；终端用户靠会话令牌接入，不经过这里。
 *
 * <pre>
 * {@code
 * @PostMapping("/api/remote/sessions")
 * public ApiResponse<?> create(@AuthenticationPrincipal Jwt jwt) {
 *     String operatorName = CurrentUserHelper.getDisplayName(jwt);
 *     // ...
 * }
 * }
 * </pre>
 */
@Slf4j
public final class CurrentUserHelper {

    private CurrentUserHelper() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return 员工身份；jwt 为 null 时返回 null
     */
    public static CurrentUserInfo from(Jwt jwt) {
        if (jwt == null) {
            return null;
        }
        String userId = jwt.getSubject();
        String username = Optional.ofNullable(jwt.getClaimAsString("preferred_username"))
                .filter(s -> !s.isBlank())
                .orElse(userId);
        String nickname = Optional.ofNullable(jwt.getClaimAsString("name"))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .orElse(null);
        return new CurrentUserInfo(userId, username, nickname, extractRealmRoles(jwt));
    }

    public static String getDisplayName(Jwt jwt) {
        CurrentUserInfo user = from(jwt);
        return user != null ? user.getDisplayName() : null;
    }

    /**
     * 判断 JWT 是否具备员工身份。
     * requiredRole 为空时，任何有效 JWT 都视为员工。
     */
    public static boolean isStaff(Jwt jwt, String requiredRole) {
        if (jwt == null) {
            return false;
        }
        if (requiredRole == null || requiredRole.isBlank()) {
            return true;
        }
        return from(jwt).hasRealmRole(requiredRole);
    }

    @SuppressWarnings("unchecked")
    private static Collection<String> extractRealmRoles(Jwt jwt) {
        try {
            Object realmAccess = jwt.getClaim("realm_access");
            if (realmAccess instanceof Map<?, ?> realm) {
                Object roles = realm.get("roles");
                if (roles instanceof Collection<?> r) {
                    return (Collection<String>) r;
                }
            }
        } catch (RuntimeException e) {
            log.debug("提取 Realm 角色失败", e);
        }
        return Collections.emptyList();
    }
}
