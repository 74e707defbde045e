package com.helpdesk.remoteservice.interfaces.http;

import com.helpdesk.remoteservice.capture.CaptureStats;
import com.helpdesk.remoteservice.capture.FrameProducer;
import com.helpdesk.remoteservice.input.InputAuthorizer;
import com.helpdesk.remoteservice.input.InputStats;
import com.helpdesk.session.SessionRegistry;
import com.helpdesk.session.model.SessionSnapshot;
import com.helpdesk.session.model.SessionStats;
import com.helpdesk.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 运行状态查询（员工侧监控页）
 */
@RestController
@RequestMapping("/api/remote/stats")
@RequiredArgsConstructor
public class RemoteStatsController {

    private final SessionRegistry registry;
    private final FrameProducer frameProducer;
    private final InputAuthorizer inputAuthorizer;
    private final StaffGuard staffGuard;

    @GetMapping("/sessions")
    public ApiResponse<SessionStats> sessions(@AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        return ApiResponse.success(registry.stats());
    }

    @GetMapping("/sessions/active")
    public ApiResponse<List<SessionSnapshot>> activeSessions(@AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        return ApiResponse.success(registry.activeSessions());
    }

    @GetMapping("/capture")
    public ApiResponse<CaptureStats> capture(@AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        return ApiResponse.success(frameProducer.stats());
    }

    @GetMapping("/input")
    public ApiResponse<InputStats> input(@AuthenticationPrincipal Jwt jwt) {
        staffGuard.require(jwt);
        return ApiResponse.success(inputAuthorizer.stats());
    }
}
