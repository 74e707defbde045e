package com.helpdesk.remoteservice.application;

import com.helpdesk.session.model.PartyRole;
import com.helpdesk.session.model.SessionId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 连接 → 会话绑定表（进程内）。
 *
 * 连接 ID 为 STOMP sessionId；一个连接同一时刻只绑定一个会话。
 */
@Component
public class ConnectionRegistry {

    private final ConcurrentMap<String, ConnectionBinding> bindings = new ConcurrentHashMap<>();

    /**
     * @return 该连接此前的绑定（如有）
     */
    public Optional<ConnectionBinding> bind(String connectionId, SessionId sessionId, PartyRole role) {
        return Optional.ofNullable(bindings.put(connectionId, new ConnectionBinding(sessionId, role)));
    }

    public Optional<ConnectionBinding> find(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(bindings.get(connectionId));
    }

    public Optional<ConnectionBinding> unbind(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(bindings.remove(connectionId));
    }

    /**
     * 解除某会话的全部连接绑定
     *
     * @return 被解除的连接 ID
     */
    public List<String> unbindAll(SessionId sessionId) {
        List<String> removed = new ArrayList<>();
        for (Map.Entry<String, ConnectionBinding> e : bindings.entrySet()) {
            if (e.getValue().sessionId().equals(sessionId) && bindings.remove(e.getKey(), e.getValue())) {
                removed.add(e.getKey());
            }
        }
        return removed;
    }

    public boolean isBoundTo(String connectionId, SessionId sessionId) {
        return find(connectionId).map(b -> b.sessionId().equals(sessionId)).orElse(false);
    }

    public int size() {
        return bindings.size();
    }
}
