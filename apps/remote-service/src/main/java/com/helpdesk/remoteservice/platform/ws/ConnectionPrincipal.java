package com.helpdesk.remoteservice.platform.ws;

import java.security.Principal;

/**
 * 未携带 JWT 的连接（终端用户）使用的匿名身份。
 *
 * 名称取自 STOMP sessionId，保证 /user/queue/... 点对点消息能投递到该连接。
 */
public record ConnectionPrincipal(String connectionId) implements Principal {

    static final String NAME_PREFIX = "conn-";

    @Override
    public String getName() {
        return NAME_PREFIX + connectionId;
    }
}
