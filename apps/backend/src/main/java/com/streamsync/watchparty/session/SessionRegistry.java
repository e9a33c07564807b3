package com.streamsync.watchparty.session;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * 연결 id → 참가 중인 방.
 *
 * 연결은 이 노드에 붙어 있으므로 노드 로컬 메모리로 충분하다.
 * 연결 하나는 한 번에 한 방에만 속한다.
 */
@Component
public class SessionRegistry {

    private final ConcurrentMap<String, SessionRecord> sessions = new ConcurrentHashMap<>();

    public void bind(String connectionId, SessionRecord record) {
        sessions.put(connectionId, record);
    }

    public Optional<SessionRecord> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public Optional<SessionRecord> unbind(String connectionId) {
        return Optional.ofNullable(sessions.remove(connectionId));
    }

    /**
     * 연결이 roomId 에 묶여 있을 때만 해제한다.
     */
    public boolean unbind(String connectionId, String roomId) {
        boolean[] removed = {false};
        sessions.computeIfPresent(connectionId, (key, record) -> {
            if (record.roomId().equals(roomId)) {
                removed[0] = true;
                return null;
            }
            return record;
        });
        return removed[0];
    }
}
