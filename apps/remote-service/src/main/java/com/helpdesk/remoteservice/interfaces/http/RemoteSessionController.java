package com.helpdesk.remoteservice.interfaces.http;

import com.helpdesk.remoteservice.application.RemoteSessionCoordinator;
import com.helpdesk.remoteservice.common.RemoteSessionNotFoundException;
import com.helpdesk.remoteservice.interfaces.http.dto.CreateSessionRequest;
import com.helpdesk.remoteservice.interfaces.http.dto.CreateSessionResponse;
import com.helpdesk.session.RemoteSession;
import com.helpdesk.session.SessionRegistry;
import com.helpdesk.session.model.SessionId;
import com.helpdesk.session.model.SessionSnapshot;
import com.helpdesk.session.model.WorkItemId;
import com.helpdesk.web.common.ApiResponse;
import com.helpdesk.web.common.CurrentUserHelper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 远程会话管理接口（员工侧）
 */
@Slf4j
@RestController
@RequestMapping("/api/remote/sessions")
@RequiredArgsConstructor
public class RemoteSessionController {

    private final SessionRegistry registry;
    private final RemoteSessionCoordinator coordinator;
    private final StaffGuard staffGuard;

    /**
     * 为工单创建远程会话；同一工单的旧会话会被关闭
     */
    @PostMapping
    public ApiResponse<CreateSessionResponse> create(@Valid @RequestBody CreateSessionRequest request,
                                                     @AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        String operatorName = CurrentUserHelper.getDisplayName(jwt);
        if (StringUtils.isBlank(operatorName)) {
            throw new IllegalArgumentException("无法从登录信息中识别操作员");
        }
        RemoteSession session = registry.createSession(
                WorkItemId.of(request.workItemId()), request.userName(), operatorName);
        return ApiResponse.success(new CreateSessionResponse(
                session.getSessionId().value(),
                session.getWorkItemId().value(),
                session.getUserToken(),
                session.getOperatorToken(),
                session.getExpiresAt()));
    }

    @GetMapping("/{sessionId}")
    public ApiResponse<SessionSnapshot> get(@PathVariable String sessionId, @AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        return registry.getSession(SessionId.of(sessionId))
                .map(RemoteSession::snapshot)
                .map(ApiResponse::success)
                .orElseThrow(() -> new RemoteSessionNotFoundException("会话不存在或已失效: " + sessionId));
    }

    @GetMapping("/by-work-item/{workItemId}")
    public ApiResponse<SessionSnapshot> byWorkItem(@PathVariable String workItemId,
                                                   @AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        return registry.findByWorkItem(WorkItemId.of(workItemId))
                .map(RemoteSession::snapshot)
                .map(ApiResponse::success)
                .orElseThrow(() -> new RemoteSessionNotFoundException("工单没有有效的远程会话: " + workItemId));
    }

    @DeleteMapping("/{sessionId}")
    public ApiResponse<Void> close(@PathVariable String sessionId, @AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        if (!coordinator.closeSession(SessionId.of(sessionId))) {
            throw new RemoteSessionNotFoundException("会话不存在或已关闭: " + sessionId);
        }
        log.info("员工关闭远程会话: sessionId={}, by={}", sessionId, CurrentUserHelper.getDisplayName(jwt));
        return ApiResponse.success();
    }
}
