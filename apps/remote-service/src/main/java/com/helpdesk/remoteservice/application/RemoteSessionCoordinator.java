package com.helpdesk.remoteservice.application;

import com.helpdesk.remoteservice.capture.Frame;
import com.helpdesk.remoteservice.capture.FrameProducer;
import com.helpdesk.remoteservice.input.ClickKind;
import com.helpdesk.remoteservice.input.InputAuthorizer;
import com.helpdesk.remoteservice.input.KeyAction;
import com.helpdesk.remoteservice.input.PointerButton;
import com.helpdesk.session.RemoteSession;
import com.helpdesk.session.SessionLifecycleListener;
import com.helpdesk.session.SessionRegistry;
import com.helpdesk.session.config.RemoteSessionProperties;
import com.helpdesk.session.model.CloseReason;
import com.helpdesk.session.model.PartyRole;
import com.helpdesk.session.model.SessionId;
import com.helpdesk.session.model.SessionSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * RemoteSessionCoordinator
 * -------------------------------------------------
 * 远程协助应用编排层：把会话注册表、屏幕帧生产者、输入授权三者串起来。
 *
 * 职责与边界：
 * 1) 接入：校验令牌 → 绑定连接 → 员工连接额外获得输入授权与观看资格 → 广播 *_CONNECTED；
 * 2) 输入：只接受已授权、且所属会话仍有效的连接；注入成功后刷新会话活跃时间；
 * 3) 断线：撤销授权、移除观看者、会话降级为 PENDING；
 * 4) 会话关闭（任何原因）：通过注册表回调释放该会话的全部连接资源并广播 SESSION_CLOSED。
 *
 * 本类不接触 STOMP 细节，事件经 {@link SessionEventPublisher} 发出。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteSessionCoordinator implements SessionLifecycleListener {

    private final SessionRegistry registry;
    private final FrameProducer frameProducer;
    private final InputAuthorizer inputAuthorizer;
    private final ConnectionRegistry connections;
    private final SessionEventPublisher events;
    private final RemoteSessionProperties properties;

    /**
     * 应用启动后注册会话关闭回调
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        registry.addListener(this);
        log.info("远程协助协调器已注册会话关闭回调");
    }

    /* =========================
     * 接入 / 激活 / 断线
     * ========================= */

    /**
     * 连接以某个角色接入会话。
     *
     * @param staffPrincipal 连接是否携带员工身份（员工方接入的前置条件，可配置关闭）
     */
    public JoinOutcome join(String connectionId, String rawSessionId, String token, String rawRole,
                            boolean staffPrincipal) {
        if (StringUtils.isAnyBlank(connectionId, rawSessionId, token)) {
            return JoinOutcome.rejected(ErrorCode.BAD_REQUEST, "sessionId 和 token 不能为空");
        }
        Optional<PartyRole> parsedRole = PartyRole.parse(rawRole);
        if (parsedRole.isEmpty()) {
            return JoinOutcome.rejected(ErrorCode.BAD_REQUEST, "未知角色: " + rawRole);
        }
        PartyRole role = parsedRole.get();
        SessionId sessionId = SessionId.of(rawSessionId);

        if (registry.getSession(sessionId).isEmpty()) {
            return JoinOutcome.rejected(ErrorCode.SESSION_NOT_FOUND, "会话不存在或已失效");
        }
        if (role == PartyRole.OPERATOR && properties.isRequireStaffForOperator() && !staffPrincipal) {
            log.warn("非员工连接尝试以操作员身份接入: connection={}, sessionId={}", connectionId, sessionId);
            return JoinOutcome.rejected(ErrorCode.NOT_AUTHORIZED, "操作员接入需要员工登录");
        }
        if (!registry.authenticate(sessionId, role, token)) {
            return JoinOutcome.rejected(ErrorCode.AUTH_FAILED, "令牌校验失败");
        }

        // 同一连接改接其他会话或换了角色时，先退出旧绑定
        ConnectionBinding binding = new ConnectionBinding(sessionId, role);
        connections.bind(connectionId, sessionId, role)
                .filter(previous -> !previous.equals(binding))
                .ifPresent(previous -> leave(connectionId, previous));

        if (role == PartyRole.OPERATOR) {
            inputAuthorizer.authorize(connectionId);
            frameProducer.addReader(connectionId);
        }

        Optional<SessionSnapshot> snapshot = registry.getSession(sessionId).map(RemoteSession::snapshot);
        if (snapshot.isEmpty()) {
            // 认证成功后会话恰好被关闭，回调已经或即将释放资源
            release(connectionId);
            return JoinOutcome.rejected(ErrorCode.SESSION_NOT_FOUND, "会话已失效");
        }
        log.info("连接接入远程会话: connection={}, sessionId={}, role={}", connectionId, sessionId, role);
        events.publish(sessionId,
                role == PartyRole.USER ? SessionEventType.USER_CONNECTED : SessionEventType.OPERATOR_CONNECTED,
                snapshot.get());
        return JoinOutcome.joined(role, snapshot.get());
    }

    /**
     * 激活会话。只有已接入该会话的连接可以发起。
     *
     * @return 激活后的快照；未接入、会话失效或双方未到齐时为空
     */
    public Optional<SessionSnapshot> activate(String connectionId, String rawSessionId) {
        if (StringUtils.isBlank(rawSessionId)) {
            return Optional.empty();
        }
        SessionId sessionId = SessionId.of(rawSessionId);
        if (!connections.isBoundTo(connectionId, sessionId)) {
            log.debug("未接入的连接尝试激活会话: connection={}, sessionId={}", connectionId, sessionId);
            return Optional.empty();
        }
        if (!registry.activate(sessionId)) {
            return Optional.empty();
        }
        Optional<SessionSnapshot> snapshot = registry.getSession(sessionId).map(RemoteSession::snapshot);
        snapshot.ifPresent(s -> events.publish(sessionId, SessionEventType.SESSION_ACTIVATED, s));
        return snapshot;
    }

    public boolean isBound(String connectionId, String rawSessionId) {
        return StringUtils.isNotBlank(rawSessionId) && connections.isBoundTo(connectionId, SessionId.of(rawSessionId));
    }

    /**
     * 连接断开（STOMP DISCONNECT 或传输层断线）。重复调用无副作用。
     */
    public void disconnect(String connectionId) {
        connections.unbind(connectionId).ifPresentOrElse(
                binding -> leave(connectionId, binding),
                () -> release(connectionId));
    }

    /**
     * 显式关闭会话；资源释放与广播在 {@link #onSessionClosed} 中完成
     */
    public boolean closeSession(SessionId sessionId) {
        return registry.closeSession(sessionId);
    }

    @Override
    public void onSessionClosed(RemoteSession session, CloseReason reason) {
        SessionId sessionId = session.getSessionId();
        List<String> released = connections.unbindAll(sessionId);
        released.forEach(this::release);
        log.info("远程会话关闭，释放连接: sessionId={}, reason={}, connections={}",
                sessionId, reason, released.size());
        events.publish(sessionId, SessionEventType.SESSION_CLOSED,
                Map.of("sessionId", sessionId.value(), "reason", reason.name()));
    }

    /* =========================
     * 屏幕帧
     * ========================= */

    /**
     * 只有观看者（已接入的员工连接）可以拉取帧
     */
    public boolean canView(String connectionId) {
        return frameProducer.hasReader(connectionId);
    }

    public Optional<Frame> latestFrame() {
        return frameProducer.latestFrame();
    }

    /* =========================
     * 输入
     * ========================= */

    public InputOutcome pointerMove(String connectionId, double x, double y, double sourceWidth, double sourceHeight) {
        return dispatch(connectionId,
                () -> inputAuthorizer.pointerMove(connectionId, x, y, sourceWidth, sourceHeight));
    }

    public InputOutcome pointerClick(String connectionId, double x, double y, double sourceWidth, double sourceHeight,
                                     PointerButton button, ClickKind kind) {
        return dispatch(connectionId,
                () -> inputAuthorizer.pointerClick(connectionId, x, y, sourceWidth, sourceHeight, button, kind));
    }

    public InputOutcome pointerScroll(String connectionId, double x, double y, double sourceWidth,
                                      double sourceHeight, int delta) {
        return dispatch(connectionId,
                () -> inputAuthorizer.pointerScroll(connectionId, x, y, sourceWidth, sourceHeight, delta));
    }

    public InputOutcome key(String connectionId, String key, KeyAction action) {
        return dispatch(connectionId, () -> inputAuthorizer.keyAction(connectionId, key, action));
    }

    public InputOutcome keyCombination(String connectionId, List<String> keys) {
        return dispatch(connectionId, () -> inputAuthorizer.keyCombination(connectionId, keys));
    }

    public InputOutcome text(String connectionId, String text) {
        return dispatch(connectionId, () -> inputAuthorizer.textInput(connectionId, text));
    }

    /* =========================
     * 内部工具
     * ========================= */

    private InputOutcome dispatch(String connectionId, BooleanSupplier action) {
        if (!inputAuthorizer.isAuthorized(connectionId)) {
            return InputOutcome.NOT_AUTHORIZED;
        }
        Optional<ConnectionBinding> binding = connections.find(connectionId);
        if (binding.isEmpty() || registry.getSession(binding.get().sessionId()).isEmpty()) {
            // 会话已过期但清理任务尚未运行：顺手收回该连接的权限
            log.info("会话已失效，收回连接输入权限: connection={}", connectionId);
            connections.unbind(connectionId);
            release(connectionId);
            return InputOutcome.SESSION_NOT_FOUND;
        }
        if (!action.getAsBoolean()) {
            return InputOutcome.FAILED;
        }
        registry.recordActivity(binding.get().sessionId());
        return InputOutcome.APPLIED;
    }

    /** 撤销输入授权并移出观看者 */
    private void release(String connectionId) {
        inputAuthorizer.revoke(connectionId);
        frameProducer.removeReader(connectionId);
    }

    /** 标记参与方离线并广播 */
    private void leave(String connectionId, ConnectionBinding binding) {
        if (binding.role() == PartyRole.OPERATOR) {
            release(connectionId);
        }
        if (registry.disconnect(binding.sessionId(), binding.role())) {
            events.publish(binding.sessionId(),
                    binding.role() == PartyRole.USER
                            ? SessionEventType.USER_DISCONNECTED
                            : SessionEventType.OPERATOR_DISCONNECTED,
                    Map.of("sessionId", binding.sessionId().value(), "role", binding.role().name()));
        }
    }
}
