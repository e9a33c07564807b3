package com.streamsync.watchparty.state;

import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.state.lock.RoomLockManager;
import com.streamsync.watchparty.state.store.RoomStateStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 방별 참가자 목록과 제어권(hasControl) 관리.
 *
 * 변경 연산은 모두 방 락 안에서 읽고 쓴다. 락을 벗어난 시점에서 방의 제어권자는 최대 한 명이다.
 * 입장 순서는 joinedAt, 같으면 id 로 정한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParticipantRegistry {

    static final Comparator<Participant> JOIN_ORDER = Comparator
            .comparing(Participant::joinedAt)
            .thenComparing(Participant::id);

    private final RoomStateStore store;
    private final RoomLockManager lockManager;

    /**
     * 참가자를 추가하거나 같은 id 의 기존 항목을 교체한다.
     */
    public void addOrUpdate(String roomId, Participant participant) {
        lockManager.runWithRoomLock(roomId, () -> store.saveParticipant(roomId, participant));
    }

    /**
     * @return 제거되었으면 true. 없는 참가자면 false (아무 변화 없음).
     */
    public boolean remove(String roomId, String participantId) {
        return lockManager.withRoomLock(roomId, () -> store.removeParticipant(roomId, participantId));
    }

    public Optional<Participant> get(String roomId, String participantId) {
        return store.findParticipant(roomId, participantId);
    }

    public List<Participant> listOrderedByJoin(String roomId) {
        return store.findParticipants(roomId).stream()
                .sorted(JOIN_ORDER)
                .toList();
    }

    public int count(String roomId) {
        return store.countParticipants(roomId);
    }

    public Optional<Participant> findController(String roomId) {
        return listOrderedByJoin(roomId).stream()
                .filter(Participant::hasControl)
                .findFirst();
    }

    /**
     * 지정한 참가자만 hasControl=true 로 만든다.
     * 방에 없는 id 를 주면 모든 참가자의 제어권이 해제된다.
     */
    public void setController(String roomId, String participantId) {
        lockManager.runWithRoomLock(roomId, () ->
                applyController(roomId, listOrderedByJoin(roomId), participantId));
    }

    /**
     * excludingId 를 제외하고 가장 먼저 들어온 참가자에게 제어권을 준다.
     *
     * @return 새 제어권자. 후보가 없으면 empty (아무 변화 없음).
     */
    public Optional<Participant> transferControlToNext(String roomId, String excludingId) {
        return lockManager.withRoomLock(roomId, () -> {
            List<Participant> participants = listOrderedByJoin(roomId);
            Optional<Participant> next = participants.stream()
                    .filter(participant -> !participant.id().equals(excludingId))
                    .findFirst();
            next.ifPresent(candidate -> applyController(roomId, participants, candidate.id()));
            return next.map(candidate -> candidate.withControl(true));
        });
    }

    /**
     * 제어권자가 정확히 한 명이 되도록 맞춘다.
     * 없으면 가장 오래된 참가자에게 주고, 여럿이면 가장 오래된 한 명만 남긴다.
     *
     * @return 보정 후 제어권자. 방이 비었으면 empty.
     */
    public Optional<Participant> ensureControlConsistency(String roomId) {
        return lockManager.withRoomLock(roomId, () -> {
            List<Participant> participants = listOrderedByJoin(roomId);
            if (participants.isEmpty()) {
                return Optional.empty();
            }

            Participant controller = participants.stream()
                    .filter(Participant::hasControl)
                    .findFirst()
                    .orElse(participants.get(0));

            long controllers = participants.stream().filter(Participant::hasControl).count();
            if (controllers != 1) {
                log.info("Repairing control in room {} - controllers: {}, assigning: {}",
                        roomId, controllers, controller.id());
                applyController(roomId, participants, controller.id());
            }
            return Optional.of(controller.withControl(true));
        });
    }

    private void applyController(String roomId, List<Participant> participants, String controllerId) {
        List<Participant> changed = new ArrayList<>();
        for (Participant participant : participants) {
            Participant updated = participant.withControl(Objects.equals(participant.id(), controllerId));
            if (updated != participant) {
                changed.add(updated);
            }
        }
        if (!changed.isEmpty()) {
            store.saveParticipants(roomId, changed);
        }
    }
}
