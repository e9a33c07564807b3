package com.streamsync.watchparty.state.control;

import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.state.RoomStateService;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 제어권 배정/이양/승계 규칙.
 *
 * - 첫 입장자가 제어권을 받는다.
 * - 방장이 입장하면 제어권이 방장에게 넘어간다.
 * - 방장 또는 현재 제어권자만 다른 참가자에게 제어권을 넘길 수 있다.
 * - 제어권자가 나가면 가장 먼저 들어온 참가자가 이어받는다.
 *
 * 모든 메서드는 방 락 안에서 동작하며, 반환값은 "제어권자가 바뀐 경우"의 새 제어권자다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ControlTransferProtocol {

    private final RoomStateService roomState;

    /**
     * 새 참가자를 등록하고 제어권을 배정한다.
     */
    public Optional<Participant> admit(String roomId, Participant newcomer, boolean admin) {
        return roomState.withRoomLock(roomId, () -> {
            Optional<Participant> before = roomState.findController(roomId);
            boolean first = roomState.countParticipants(roomId) == 0;

            roomState.addParticipant(roomId, newcomer.withControl(first));
            if (admin && !first) {
                roomState.setController(roomId, newcomer.id());
            }

            Optional<Participant> after = roomState.ensureControlConsistency(roomId);
            return changed(before, after);
        });
    }

    /**
     * 요청자가 방장 또는 현재 제어권자일 때 대상에게 제어권을 넘긴다.
     *
     * @return 새 제어권자
     */
    public Participant transfer(String roomId, String requesterId, boolean requesterIsAdmin, String targetId) {
        return roomState.withRoomLock(roomId, () -> {
            boolean requesterHasControl = roomState.getParticipant(roomId, requesterId)
                    .map(Participant::hasControl)
                    .orElse(false);
            if (!requesterIsAdmin && !requesterHasControl) {
                throw RoomActionException.permissionDenied("방장 또는 현재 제어권자만 제어권을 넘길 수 있습니다.");
            }

            Participant target = roomState.getParticipant(roomId, targetId)
                    .orElseThrow(() -> new RoomActionException(
                            ErrorCode.PARTICIPANT_NOT_FOUND, "대상 참가자를 찾을 수 없습니다."));

            roomState.setController(roomId, target.id());
            log.info("Control transferred in room {} - from: {}, to: {}", roomId, requesterId, target.id());
            return target.withControl(true);
        });
    }

    /**
     * 참가자를 제거하고 필요하면 제어권을 승계시킨다.
     * 없는 참가자면 empty.
     */
    public Optional<Departure> depart(String roomId, String participantId) {
        return roomState.withRoomLock(roomId, () -> {
            Optional<Participant> leaving = roomState.getParticipant(roomId, participantId);
            if (leaving.isEmpty() || !roomState.removeParticipant(roomId, participantId)) {
                return Optional.empty();
            }
            Participant participant = leaving.get();

            int remaining = roomState.countParticipants(roomId);
            if (remaining == 0) {
                return Optional.of(new Departure(participant, null, 0));
            }

            Optional<Participant> before = participant.hasControl()
                    ? Optional.of(participant)
                    : roomState.findController(roomId);
            if (participant.hasControl()) {
                roomState.transferControlToNext(roomId, participant.id());
            }
            Optional<Participant> after = roomState.ensureControlConsistency(roomId);

            return Optional.of(new Departure(participant, changed(before, after).orElse(null), remaining));
        });
    }

    /**
     * 제어권자가 없거나 여럿인 상태를 바로잡는다.
     */
    public Optional<Participant> repair(String roomId) {
        return roomState.withRoomLock(roomId, () -> {
            Optional<Participant> before = roomState.findController(roomId);
            Optional<Participant> after = roomState.ensureControlConsistency(roomId);
            return changed(before, after);
        });
    }

    private static Optional<Participant> changed(Optional<Participant> before, Optional<Participant> after) {
        if (after.isEmpty()) {
            return Optional.empty();
        }
        if (before.isPresent() && before.get().id().equals(after.get().id())) {
            return Optional.empty();
        }
        return after;
    }
}
