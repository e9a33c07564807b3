package com.streamsync.watchparty.state;

import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.state.lock.RoomLockManager;
import com.streamsync.watchparty.state.store.RoomStateStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 방 런타임 상태 진입점.
 *
 * 참가자(ParticipantRegistry), 채팅(ChatLog), 방 수명 관리(정리/삭제)를 한 곳에서 제공한다.
 * 인메모리/Redis 중 어느 저장소를 쓰는지는 호출자가 알 필요 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomStateService {

    private final ParticipantRegistry participantRegistry;
    private final ChatLog chatLog;
    private final RoomStateStore store;
    private final RoomLockManager lockManager;

    public <T> T withRoomLock(String roomId, Supplier<T> action) {
        return lockManager.withRoomLock(roomId, action);
    }

    public void runWithRoomLock(String roomId, Runnable action) {
        lockManager.runWithRoomLock(roomId, action);
    }

    // 참가자

    public void addParticipant(String roomId, Participant participant) {
        participantRegistry.addOrUpdate(roomId, participant);
    }

    public boolean removeParticipant(String roomId, String participantId) {
        return participantRegistry.remove(roomId, participantId);
    }

    public Optional<Participant> getParticipant(String roomId, String participantId) {
        return participantRegistry.get(roomId, participantId);
    }

    public List<Participant> listParticipants(String roomId) {
        return participantRegistry.listOrderedByJoin(roomId);
    }

    public int countParticipants(String roomId) {
        return participantRegistry.count(roomId);
    }

    public Optional<Participant> findController(String roomId) {
        return participantRegistry.findController(roomId);
    }

    public void setController(String roomId, String participantId) {
        participantRegistry.setController(roomId, participantId);
    }

    public Optional<Participant> transferControlToNext(String roomId, String excludingId) {
        return participantRegistry.transferControlToNext(roomId, excludingId);
    }

    public Optional<Participant> ensureControlConsistency(String roomId) {
        return participantRegistry.ensureControlConsistency(roomId);
    }

    // 채팅

    public void appendMessage(String roomId, ChatMessage message) {
        chatLog.append(roomId, message);
    }

    public List<ChatMessage> listMessages(String roomId) {
        return chatLog.list(roomId);
    }

    public void clearMessages(String roomId) {
        chatLog.clear(roomId);
    }

    // 방 수명

    /**
     * 방의 참가자와 채팅 기록을 즉시 모두 삭제한다. 방 종료 시 사용.
     */
    public void clearRoomData(String roomId) {
        lockManager.runWithRoomLock(roomId, () -> store.clearRoom(roomId));
        log.info("Room state cleared - roomId: {}", roomId);
    }

    public Set<String> listActiveRoomIds() {
        return store.findActiveRoomIds();
    }

    /**
     * 보관 기간이 지난 빈 방을 정리한다. 방마다 락을 잡고 다시 확인한 뒤 지운다.
     *
     * @return 정리된 방 id
     */
    public List<String> cleanupEmptyRooms() {
        List<String> purged = new ArrayList<>();
        for (String roomId : store.findExpiredRoomIds()) {
            try {
                if (lockManager.withRoomLock(roomId, () -> store.purgeIfExpired(roomId))) {
                    purged.add(roomId);
                }
            } catch (RoomActionException e) {
                if (e.getErrorCode() != ErrorCode.ROOM_BUSY) {
                    throw e;
                }
                // 사용 중인 방은 다음 주기에 다시 본다
                log.debug("Skipping purge of busy room - roomId: {}", roomId);
            }
        }
        if (!purged.isEmpty()) {
            log.info("Purged {} expired rooms: {}", purged.size(), purged);
        }
        return purged;
    }
}
