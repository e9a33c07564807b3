package com.streamsync.watchparty.state;

import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.state.lock.RoomLockManager;
import com.streamsync.watchparty.state.store.RoomStateStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 방별 최근 채팅 기록. 용량(기본 50)을 넘으면 가장 오래된 메시지부터 버린다.
 */
@Component
@RequiredArgsConstructor
public class ChatLog {

    private final RoomStateStore store;
    private final RoomLockManager lockManager;
    private final RoomStateProperties properties;

    public void append(String roomId, ChatMessage message) {
        lockManager.runWithRoomLock(roomId, () ->
                store.appendMessage(roomId, message, properties.getMessageCapacity()));
    }

    public List<ChatMessage> list(String roomId) {
        return store.findMessages(roomId);
    }

    public void clear(String roomId) {
        lockManager.runWithRoomLock(roomId, () -> store.clearMessages(roomId));
    }
}
