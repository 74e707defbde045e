package com.helpdesk.remoteservice.interfaces.http;

import com.helpdesk.remoteservice.common.StaffRequiredException;
import com.helpdesk.session.config.RemoteSessionProperties;
import com.helpdesk.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

/**
 * HTTP 管理接口的员工校验，与 STOMP 侧操作员接入使用同一个 remote.session.staff-role
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaffGuard {

    private final RemoteSessionProperties properties;

    public void require(Jwt jwt) {
        if (!CurrentUserHelper.isStaff(jwt, properties.getStaffRole())) {
            log.warn("非员工调用远程会话管理接口: subject={}", jwt != null ? jwt.getSubject() : null);
            throw new StaffRequiredException("需要员工角色: " + properties.getStaffRole());
        }
    }
}
