package com.helpdesk.remoteservice.interfaces.ws;

import com.helpdesk.remoteservice.application.ErrorCode;
import com.helpdesk.remoteservice.application.InputOutcome;
import com.helpdesk.remoteservice.application.JoinOutcome;
import com.helpdesk.remoteservice.application.RemoteSessionCoordinator;
import com.helpdesk.remoteservice.capture.Frame;
import com.helpdesk.remoteservice.input.ClickKind;
import com.helpdesk.remoteservice.input.KeyAction;
import com.helpdesk.remoteservice.input.PointerButton;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.FramePayload;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.JoinCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.Joined;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.KeyCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.KeyComboCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.PointerClickCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.PointerMoveCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.PointerScrollCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.SessionCmd;
import com.helpdesk.remoteservice.interfaces.ws.dto.RemoteMessages.TextCmd;
import com.helpdesk.remoteservice.platform.transport.Envelope;
import com.helpdesk.remoteservice.platform.ws.RemoteMessageSender;
import com.helpdesk.session.config.RemoteSessionProperties;
import com.helpdesk.web.common.CurrentUserHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Optional;

/**
 * 远程协助 WebSocket 控制器
 * ----------------------------------------
 * 接收 /app/remote.* 指令，交给 {@link RemoteSessionCoordinator} 处理，
 * 结果只回给发起连接（/user/queue/remote.*）；会话级事件由协调器广播。
 *
 * 输入类指令成功时不回消息，失败时回 remote.error。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class RemoteControlWsController {

    private final RemoteSessionCoordinator coordinator;
    private final RemoteMessageSender sender;
    private final RemoteSessionProperties properties;

    /**
     * 接入会话：/app/remote.join
     */
    @MessageMapping("/remote.join")
    public void join(JoinCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        Principal user = sha.getUser();
        try {
            JoinOutcome outcome = coordinator.join(connectionId, cmd.getSessionId(), cmd.getToken(), cmd.getRole(),
                    isStaff(user));
            if (!outcome.joined()) {
                sender.sendError(user, connectionId, cmd.getSessionId(), outcome.error(), outcome.message());
                return;
            }
            sender.sendToConnection(user, connectionId, RemoteMessageSender.JOINED_QUEUE,
                    Envelope.state("JOINED", cmd.getSessionId(),
                            new Joined(outcome.role().name(), outcome.session())));
        } catch (Exception e) {
            log.warn("接入处理异常: connection={}, sessionId={}", connectionId, cmd.getSessionId(), e);
            sender.sendError(user, connectionId, cmd.getSessionId(), ErrorCode.BAD_REQUEST, e.getMessage());
        }
    }

    /**
     * 激活会话：/app/remote.activate
     */
    @MessageMapping("/remote.activate")
    public void activate(SessionCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        Principal user = sha.getUser();
        if (!coordinator.isBound(connectionId, cmd.getSessionId())) {
            sender.sendError(user, connectionId, cmd.getSessionId(), ErrorCode.NOT_AUTHORIZED, "尚未接入该会话");
            return;
        }
        coordinator.activate(connectionId, cmd.getSessionId()).ifPresentOrElse(
                snapshot -> sender.sendToConnection(user, connectionId, RemoteMessageSender.ACTIVATED_QUEUE,
                        Envelope.state("ACTIVATED", cmd.getSessionId(), snapshot)),
                () -> sender.sendError(user, connectionId, cmd.getSessionId(),
                        ErrorCode.ACTIVATION_REJECTED, "双方未全部在线或会话已失效"));
    }

    /**
     * 拉取最新帧：/app/remote.frame。还没有帧时不回复。
     */
    @MessageMapping("/remote.frame")
    public void frame(SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        Principal user = sha.getUser();
        if (!coordinator.canView(connectionId)) {
            sender.sendError(user, connectionId, null, ErrorCode.NOT_AUTHORIZED, "没有观看权限");
            return;
        }
        Optional<Frame> frame = coordinator.latestFrame();
        frame.ifPresent(f -> sender.sendToConnection(user, connectionId, RemoteMessageSender.FRAME_QUEUE,
                Envelope.state("FRAME", null, new FramePayload(
                        f.base64(), f.width(), f.height(), f.capturedAt().toEpochMilli()))));
    }

    @MessageMapping("/remote.pointer.move")
    public void pointerMove(PointerMoveCmd cmd, SimpMessageHeaderAccessor sha) {
        String connectionId = sha.getSessionId();
        reply(sha, coordinator.pointerMove(connectionId, cmd.getX(), cmd.getY(),
                cmd.getScreenWidth(), cmd.getScreenHeight()));
    }

    @MessageMapping("/remote.pointer.click")
    public void pointerClick(PointerClickCmd cmd, SimpMessageHeaderAccessor sha) {
        Optional<PointerButton> button = PointerButton.parse(cmd.getButton());
        Optional<ClickKind> kind = ClickKind.parse(cmd.getClickType());
        if (button.isEmpty() || kind.isEmpty()) {
            badRequest(sha, "未知的按键或点击方式: " + cmd.getButton() + "/" + cmd.getClickType());
            return;
        }
        reply(sha, coordinator.pointerClick(sha.getSessionId(), cmd.getX(), cmd.getY(),
                cmd.getScreenWidth(), cmd.getScreenHeight(), button.get(), kind.get()));
    }

    @MessageMapping("/remote.pointer.scroll")
    public void pointerScroll(PointerScrollCmd cmd, SimpMessageHeaderAccessor sha) {
        reply(sha, coordinator.pointerScroll(sha.getSessionId(), cmd.getX(), cmd.getY(),
                cmd.getScreenWidth(), cmd.getScreenHeight(), cmd.getDelta()));
    }

    @MessageMapping("/remote.key")
    public void key(KeyCmd cmd, SimpMessageHeaderAccessor sha) {
        Optional<KeyAction> action = KeyAction.parse(cmd.getAction());
        if (action.isEmpty()) {
            badRequest(sha, "未知的按键动作: " + cmd.getAction());
            return;
        }
        reply(sha, coordinator.key(sha.getSessionId(), cmd.getKey(), action.get()));
    }

    @MessageMapping("/remote.key.combo")
    public void keyCombo(KeyComboCmd cmd, SimpMessageHeaderAccessor sha) {
        reply(sha, coordinator.keyCombination(sha.getSessionId(), cmd.getKeys()));
    }

    @MessageMapping("/remote.text")
    public void text(TextCmd cmd, SimpMessageHeaderAccessor sha) {
        reply(sha, coordinator.text(sha.getSessionId(), cmd.getText()));
    }

    /* =========================
     * 内部工具
     * ========================= */

    private boolean isStaff(Principal user) {
        if (user instanceof JwtAuthenticationToken jwtAuth) {
            return CurrentUserHelper.isStaff(jwtAuth.getToken(), properties.getStaffRole());
        }
        return false;
    }

    private void reply(SimpMessageHeaderAccessor sha, InputOutcome outcome) {
        switch (outcome) {
            case APPLIED:
                return;
            case NOT_AUTHORIZED:
                sender.sendError(sha.getUser(), sha.getSessionId(), null, ErrorCode.NOT_AUTHORIZED, "没有输入控制权限");
                return;
            case SESSION_NOT_FOUND:
                sender.sendError(sha.getUser(), sha.getSessionId(), null, ErrorCode.SESSION_NOT_FOUND, "会话已失效");
                return;
            default:
                sender.sendError(sha.getUser(), sha.getSessionId(), null, ErrorCode.DISPATCH_FAILED, "输入注入失败");
        }
    }

    private void badRequest(SimpMessageHeaderAccessor sha, String message) {
        sender.sendError(sha.getUser(), sha.getSessionId(), null, ErrorCode.BAD_REQUEST, message);
    }
}
