package com.helpdesk.remoteservice.platform.ws;

import com.helpdesk.remoteservice.application.ConnectionRegistry;
import com.helpdesk.session.model.SessionId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.security.oauth2.server.resource.authentication.JwtGrantedAuthoritiesConverter;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * WebSocket STOMP 入站拦截器
 *
 * CONNECT：
 *   - 携带有效 Bearer JWT → JwtAuthenticationToken（员工）；
 *   - 未携带或无效 → {@link ConnectionPrincipal}（终端用户，靠会话令牌接入）。
 * SUBSCRIBE：
 *   - /topic/remote.session.{id} 只允许已接入该会话的连接订阅，否则丢弃该订阅帧。
 */
@Slf4j
@Component
public class WebSocketAuthChannelInterceptor implements ChannelInterceptor {

    private final JwtDecoder jwtDecoder;
    private final ConnectionRegistry connections;
    private final JwtGrantedAuthoritiesConverter authoritiesConverter = new JwtGrantedAuthoritiesConverter();

    public WebSocketAuthChannelInterceptor(JwtDecoder jwtDecoder, ConnectionRegistry connections) {
        this.jwtDecoder = jwtDecoder;
        this.connections = connections;
    }

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        StompCommand command = accessor.getCommand();
        if (StompCommand.CONNECT.equals(command)) {
            authenticate(accessor);
        } else if (StompCommand.SUBSCRIBE.equals(command) && !maySubscribe(accessor)) {
            log.warn("拒绝订阅会话频道: connection={}, destination={}",
                    accessor.getSessionId(), accessor.getDestination());
            return null;
        }
        return message;
    }

    private void authenticate(StompHeaderAccessor accessor) {
        String token = bearerToken(accessor);
        if (token != null) {
            try {
                Jwt jwt = jwtDecoder.decode(token);
                Collection<GrantedAuthority> authorities = authoritiesConverter.convert(jwt);
                String name = Objects.requireNonNullElse(
                        jwt.getClaimAsString("preferred_username"),
                        jwt.getSubject());
                accessor.setUser(new JwtAuthenticationToken(jwt, authorities, name));
                log.debug("员工连接认证成功: connection={}, user={}", accessor.getSessionId(), name);
                return;
            } catch (JwtException e) {
                log.info("WebSocket JWT 校验失败，按匿名连接处理: connection={}, reason={}",
                        accessor.getSessionId(), e.getMessage());
            }
        }
        accessor.setUser(new ConnectionPrincipal(accessor.getSessionId()));
    }

    private boolean maySubscribe(StompHeaderAccessor accessor) {
        String destination = accessor.getDestination();
        if (destination == null || !destination.startsWith(RemoteMessageSender.SESSION_TOPIC_PREFIX)) {
            return true;
        }
        String rawSessionId = destination.substring(RemoteMessageSender.SESSION_TOPIC_PREFIX.length());
        if (rawSessionId.isBlank()) {
            return false;
        }
        return connections.isBoundTo(accessor.getSessionId(), SessionId.of(rawSessionId));
    }

    /**
     * Authorization / authorization / access_token 三种 header 任选其一
     */
    private static String bearerToken(StompHeaderAccessor accessor) {
        String auth = firstHeader(accessor, "Authorization");
        if (auth == null) {
            auth = firstHeader(accessor, "authorization");
        }
        if (auth == null) {
            String tokenOnly = firstHeader(accessor, "access_token");
            if (tokenOnly != null && !tokenOnly.isBlank()) {
                return tokenOnly.trim();
            }
            return null;
        }
        if (auth.toLowerCase(Locale.ROOT).startsWith("bearer ")) {
            String token = auth.substring(7).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }

    private static String firstHeader(StompHeaderAccessor accessor, String key) {
        List<String> vals = accessor.getNativeHeader(key);
        return (vals == null || vals.isEmpty()) ? null : vals.get(0);
    }
}
