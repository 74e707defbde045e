package com.helpdesk.remoteservice.platform.ws;

import com.helpdesk.remoteservice.application.RemoteSessionCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * 监听 STOMP 连接/断开事件。
 *
 * 断开事件覆盖所有断线方式（正常关闭、浏览器崩溃、网络中断），
 * 据此撤销输入授权、移除观看者并把会话降级为 PENDING。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final RemoteSessionCoordinator coordinator;

    public WebSocketSessionManager(RemoteSessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @EventListener
    public void handleSessionConnected(SessionConnectedEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal user = event.getUser();
        log.info("WebSocket 连接建立: connection={}, user={}",
                accessor.getSessionId(), user != null ? user.getName() : null);
    }

    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        log.info("WebSocket 连接断开: connection={}, closeStatus={}", connectionId, event.getCloseStatus());
        coordinator.disconnect(connectionId);
    }
}
