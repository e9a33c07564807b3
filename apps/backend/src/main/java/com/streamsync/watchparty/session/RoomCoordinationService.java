package com.streamsync.watchparty.session;

import static com.streamsync.watchparty.websocket.socketio.SocketIOEvents.*;

import com.streamsync.watchparty.dto.ChangeVideoRequest;
import com.streamsync.watchparty.dto.ChatMessageRequest;
import com.streamsync.watchparty.dto.ChatMessageResponse;
import com.streamsync.watchparty.dto.ControlTransferredResponse;
import com.streamsync.watchparty.dto.ErrorResponse;
import com.streamsync.watchparty.dto.HeartbeatResponse;
import com.streamsync.watchparty.dto.JoinRoomRequest;
import com.streamsync.watchparty.dto.KickUserRequest;
import com.streamsync.watchparty.dto.ParticipantNoticeResponse;
import com.streamsync.watchparty.dto.ParticipantResponse;
import com.streamsync.watchparty.dto.PlaybackStateResponse;
import com.streamsync.watchparty.dto.PositionRequest;
import com.streamsync.watchparty.dto.RoomJoinedResponse;
import com.streamsync.watchparty.dto.RoomLeftResponse;
import com.streamsync.watchparty.dto.RoomNoticeResponse;
import com.streamsync.watchparty.dto.SyncModeChangedResponse;
import com.streamsync.watchparty.dto.SyncModeRequest;
import com.streamsync.watchparty.dto.TransferControlRequest;
import com.streamsync.watchparty.dto.VideoChangedResponse;
import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.model.Room;
import com.streamsync.watchparty.model.SyncMode;
import com.streamsync.watchparty.service.RoomService;
import com.streamsync.watchparty.state.RoomStateService;
import com.streamsync.watchparty.state.control.ControlTransferProtocol;
import com.streamsync.watchparty.state.control.Departure;
import com.streamsync.watchparty.state.sync.PositionReconciler;
import com.streamsync.watchparty.state.sync.ReconciliationResult;
import com.streamsync.watchparty.websocket.socketio.broadcast.BroadcastService;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 방 입장/퇴장/재접속, 채팅, 재생 제어, 방장 기능을 처리한다.
 *
 * [처리 순서]
 * 1. 방 조회, 비밀번호 확인 같은 외부 조회는 락 밖에서
 * 2. 방 락 안에서 권한 검증 → 상태 변경 → 알림 발송
 * 3. 검증에 실패하면 아무것도 바꾸지 않고 호출자에게만 error 이벤트
 *
 * 전송 계층(Socket.IO)을 모른다. 모든 발송은 BroadcastService 를 통한다.
 * 어떤 예외도 호출자(핸들러)로 던지지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomCoordinationService {

    static final String UNKNOWN_USER = "Unknown User";
    private static final String DEFAULT_ADMIN_NAME = "Admin";

    private final RoomService roomService;
    private final RoomStateService roomState;
    private final ControlTransferProtocol controlProtocol;
    private final PositionReconciler positionReconciler;
    private final SessionRegistry sessionRegistry;
    private final BroadcastService broadcastService;
    private final Clock clock;

    // ===== 입장 / 퇴장 =====

    public void joinRoom(RoomCaller caller, JoinRoomRequest request) {
        execute(caller, JOIN_ROOM, () -> {
            if (request == null) {
                throw RoomActionException.validation("방 정보가 필요합니다.");
            }
            Room room = resolveRoom(request);
            String roomId = room.getId();
            boolean admin = room.isAdmin(caller.userId());

            if (room.isPrivateRoom() && !admin
                    && !callRoomService(() -> roomService.validatePassword(roomId, request.password()))) {
                throw RoomActionException.permissionDenied("비밀번호가 올바르지 않습니다.");
            }

            leavePreviousRoom(caller, roomId);

            roomState.runWithRoomLock(roomId, () -> {
                Room current = loadLatestActiveRoom(roomId);
                Optional<Participant> existing = roomState.getParticipant(roomId, caller.userId());
                if (existing.isPresent()) {
                    reconnect(caller, current, existing.get());
                } else {
                    admit(caller, current, admin);
                }
            });
        });
    }

    public void leaveRoom(RoomCaller caller, String roomId) {
        execute(caller, LEAVE_ROOM, () -> {
            requireRoomId(roomId);
            leave(caller.connectionId(), caller.userId(), roomId);
        });
    }

    /**
     * 연결 종료. 재접속 유예 없이 바로 퇴장 처리한다.
     */
    public void disconnect(String connectionId, String userId) {
        sessionRegistry.find(connectionId).ifPresent(session -> {
            try {
                leave(connectionId, userId != null ? userId : session.participantId(), session.roomId());
            } catch (Exception e) {
                log.error("Error handling disconnect - connectionId: {}, roomId: {}",
                        connectionId, session.roomId(), e);
            }
        });
        sessionRegistry.unbind(connectionId);
    }

    // ===== 채팅 =====

    public void sendMessage(RoomCaller caller, ChatMessageRequest request) {
        execute(caller, SEND_MESSAGE, () -> {
            if (request == null) {
                throw RoomActionException.validation("메시지 정보가 필요합니다.");
            }
            String roomId = requireRoomId(request.roomId());
            if (request.content() == null || request.content().isBlank()) {
                throw RoomActionException.validation("메시지 내용을 입력해주세요.");
            }

            roomState.runWithRoomLock(roomId, () -> {
                Participant sender = requireParticipant(roomId, caller.userId());
                ChatMessage message = ChatMessage.of(sender, request.content(), clock.instant());
                roomState.appendMessage(roomId, message);
                broadcastService.broadcastToRoom(roomId, RECEIVE_MESSAGE, ChatMessageResponse.from(message));
            });
        });
    }

    // ===== 재생 제어 =====

    public void changeVideo(RoomCaller caller, ChangeVideoRequest request) {
        execute(caller, CHANGE_VIDEO, () -> {
            if (request == null) {
                throw RoomActionException.validation("영상 정보가 필요합니다.");
            }
            String roomId = requireRoomId(request.roomId());
            if (request.videoUrl() == null || request.videoUrl().isBlank()) {
                throw RoomActionException.validation("영상 URL 을 입력해주세요.");
            }
            loadActiveRoom(roomId);

            roomState.runWithRoomLock(roomId, () -> {
                if (!callRoomService(() -> roomService.canControl(roomId, caller.userId()))) {
                    throw RoomActionException.permissionDenied("영상을 변경할 권한이 없습니다.");
                }
                if (!callRoomService(() -> roomService.updateVideoUrl(roomId, request.videoUrl()))) {
                    throw new RoomActionException(ErrorCode.COLLABORATOR_FAILURE, "영상을 변경하지 못했습니다.");
                }
                broadcastService.broadcastToRoom(roomId, VIDEO_CHANGED, new VideoChangedResponse(
                        request.videoUrl(), request.videoTitle(), request.videoThumbnail()));
                log.info("Video changed - roomId: {}, by: {}", roomId, caller.userId());
            });
        });
    }

    public void playVideo(RoomCaller caller, String roomId) {
        execute(caller, PLAY_VIDEO, () -> changePlayback(caller, roomId,
                room -> new PlaybackStateResponse(room.getCurrentPosition(), true)));
    }

    public void pauseVideo(RoomCaller caller, String roomId) {
        execute(caller, PAUSE_VIDEO, () -> changePlayback(caller, roomId,
                room -> new PlaybackStateResponse(room.getCurrentPosition(), false)));
    }

    public void seekVideo(RoomCaller caller, PositionRequest request) {
        execute(caller, SEEK_VIDEO, () -> {
            if (request == null) {
                throw RoomActionException.validation("재생 위치가 필요합니다.");
            }
            double position = requirePosition(request.position());
            changePlayback(caller, request.roomId(),
                    room -> new PlaybackStateResponse(position, room.isPlaying()));
        });
    }

    /**
     * 재생 위치 보고.
     * 현재 제어권자의 보고는 하트비트를 겸한다. 모든 보고는 위치 보정에 사용된다.
     */
    public void reportPosition(RoomCaller caller, PositionRequest request) {
        execute(caller, REPORT_POSITION, () -> {
            if (request == null) {
                throw RoomActionException.validation("재생 위치가 필요합니다.");
            }
            String roomId = requireRoomId(request.roomId());
            double position = requirePosition(request.position());

            Optional<Participant> reporter = roomState.getParticipant(roomId, caller.userId());
            if (reporter.isEmpty() || !caller.connectionId().equals(reporter.get().connectionId())) {
                log.debug("Ignoring position report from non-participant - roomId: {}, userId: {}",
                        roomId, caller.userId());
                return;
            }

            if (reporter.get().hasControl()) {
                heartbeat(caller, roomId, position);
            }

            positionReconciler.report(roomId, caller.connectionId(), position, roomState.countParticipants(roomId))
                    .filter(ReconciliationResult::hasOutliers)
                    .ifPresent(result -> correctDrift(roomId, result));
        });
    }

    public void requestSync(RoomCaller caller, String roomId) {
        execute(caller, REQUEST_SYNC, () -> {
            Room room = loadLatestActiveRoom(requireRoomId(roomId));
            broadcastService.sendToConnection(caller.connectionId(), FORCE_SYNC_PLAYBACK,
                    PlaybackStateResponse.of(room));
        });
    }

    // ===== 제어권 / 방장 기능 =====

    public void transferControl(RoomCaller caller, TransferControlRequest request) {
        execute(caller, TRANSFER_CONTROL, () -> {
            if (request == null || request.targetParticipantId() == null) {
                throw RoomActionException.validation("제어권을 넘길 대상을 지정해주세요.");
            }
            Room room = loadActiveRoom(requireRoomId(request.roomId()));
            String roomId = room.getId();
            boolean admin = room.isAdmin(caller.userId());

            roomState.runWithRoomLock(roomId, () -> {
                Participant controller = controlProtocol.transfer(
                        roomId, caller.userId(), admin, request.targetParticipantId());
                broadcastService.broadcastToRoom(roomId, CONTROL_TRANSFERRED,
                        ControlTransferredResponse.from(controller));
                broadcastService.broadcastToRoom(roomId, RECEIVE_ROOM_PARTICIPANTS,
                        participantSnapshot(roomId, room.getAdminId()));
            });
        });
    }

    public void kickUser(RoomCaller caller, KickUserRequest request) {
        execute(caller, KICK_USER, () -> {
            if (request == null || request.targetUserId() == null) {
                throw RoomActionException.validation("강퇴할 사용자를 지정해주세요.");
            }
            Room room = loadActiveRoom(requireRoomId(request.roomId()));
            String roomId = room.getId();
            if (!room.isAdmin(caller.userId())) {
                throw RoomActionException.permissionDenied("방장만 사용자를 강퇴할 수 있습니다.");
            }
            if (request.targetUserId().equals(caller.userId())) {
                throw RoomActionException.validation("자기 자신은 강퇴할 수 없습니다.");
            }

            roomState.runWithRoomLock(roomId, () -> {
                Participant target = roomState.getParticipant(roomId, request.targetUserId())
                        .orElseThrow(() -> new RoomActionException(
                                ErrorCode.PARTICIPANT_NOT_FOUND, "대상 사용자를 찾을 수 없습니다."));
                String adminName = roomState.getParticipant(roomId, caller.userId())
                        .map(Participant::displayName)
                        .orElse(DEFAULT_ADMIN_NAME);

                broadcastService.sendToConnection(target.connectionId(), USER_KICKED,
                        new RoomNoticeResponse(roomId, adminName + "님에 의해 강퇴되었습니다."));

                Optional<Departure> departure = controlProtocol.depart(roomId, target.id());
                broadcastService.leaveRoom(target.connectionId(), roomId);
                sessionRegistry.unbind(target.connectionId(), roomId);

                ChatMessage notice = ChatMessage.system(
                        target.displayName() + "님이 " + adminName + "님에 의해 강퇴되었습니다.", clock.instant());
                roomState.appendMessage(roomId, notice);
                broadcastService.broadcastToRoom(roomId, RECEIVE_MESSAGE, ChatMessageResponse.from(notice));

                departure.flatMap(Departure::successor).ifPresent(controller ->
                        broadcastService.broadcastToRoom(roomId, CONTROL_TRANSFERRED,
                                ControlTransferredResponse.from(controller)));
                broadcastService.broadcastToRoom(roomId, RECEIVE_ROOM_PARTICIPANTS,
                        participantSnapshot(roomId, room.getAdminId()));

                if (departure.map(Departure::roomEmptied).orElse(false)) {
                    positionReconciler.clearRoom(roomId);
                }
                log.info("User kicked - roomId: {}, target: {}, by: {}", roomId, target.id(), caller.userId());
            });
        });
    }

    public void updateSyncMode(RoomCaller caller, SyncModeRequest request) {
        execute(caller, UPDATE_SYNC_MODE, () -> {
            if (request == null) {
                throw RoomActionException.validation("동기화 모드가 필요합니다.");
            }
            Room room = loadActiveRoom(requireRoomId(request.roomId()));
            String roomId = room.getId();
            if (!room.isAdmin(caller.userId())) {
                throw RoomActionException.permissionDenied("방장만 동기화 모드를 변경할 수 있습니다.");
            }
            SyncMode syncMode = SyncMode.fromValue(request.syncMode())
                    .orElseThrow(() -> RoomActionException.validation(
                            "동기화 모드는 'strict' 또는 'relaxed' 여야 합니다."));

            if (!callRoomService(() -> roomService.updateSyncMode(roomId, syncMode))) {
                throw new RoomActionException(ErrorCode.COLLABORATOR_FAILURE, "동기화 모드를 변경하지 못했습니다.");
            }

            roomState.runWithRoomLock(roomId, () -> {
                broadcastService.broadcastToRoom(roomId, SYNC_MODE_CHANGED,
                        new SyncModeChangedResponse(syncMode.getValue()));
                if (syncMode == SyncMode.STRICT) {
                    broadcastService.broadcastToRoom(roomId, FORCE_SYNC_PLAYBACK,
                            PlaybackStateResponse.of(loadLatestActiveRoom(roomId)));
                }
            });
            log.info("Sync mode changed - roomId: {}, mode: {}", roomId, syncMode.getValue());
        });
    }

    public void requestRoomParticipants(RoomCaller caller, String roomId) {
        execute(caller, REQUEST_ROOM_PARTICIPANTS, () -> {
            requireRoomId(roomId);
            broadcastService.sendToConnection(caller.connectionId(), RECEIVE_ROOM_PARTICIPANTS,
                    participantSnapshot(roomId, findAdminIdQuietly(roomId)));
        });
    }

    public void closeRoom(RoomCaller caller, String roomId) {
        execute(caller, CLOSE_ROOM, () -> {
            requireRoomId(roomId);
            if (!callRoomService(() -> roomService.isAdmin(roomId, caller.userId()))) {
                throw RoomActionException.permissionDenied("방장만 방을 종료할 수 있습니다.");
            }
            if (!callRoomService(() -> roomService.endRoom(roomId, caller.userId()))) {
                throw new RoomActionException(ErrorCode.COLLABORATOR_FAILURE, "방을 종료하지 못했습니다.");
            }

            RoomNoticeResponse notice = new RoomNoticeResponse(roomId, "방장이 방을 종료했습니다.");
            roomState.runWithRoomLock(roomId, () -> {
                // 방 그룹에서 빼기 전에 연결마다 직접 보낸다. 방 단위 발송은 비동기라 그룹에서 빠진 뒤 도착할 수 있다.
                for (Participant participant : roomState.listParticipants(roomId)) {
                    broadcastService.sendToConnection(participant.connectionId(), ROOM_CLOSED, notice);
                    broadcastService.leaveRoom(participant.connectionId(), roomId);
                    sessionRegistry.unbind(participant.connectionId(), roomId);
                }
                roomState.clearRoomData(roomId);
                positionReconciler.clearRoom(roomId);
            });
            log.info("Room closed - roomId: {}, by: {}", roomId, caller.userId());
        });
    }

    // ===== 내부 처리 =====

    private void admit(RoomCaller caller, Room room, boolean admin) {
        String roomId = room.getId();
        String displayName = displayNameOf(caller);
        Participant newcomer = new Participant(
                caller.userId(),
                caller.connectionId(),
                displayName,
                caller.avatarUrl(),
                false,
                clock.instant()
        );

        Optional<Participant> newController = controlProtocol.admit(roomId, newcomer, admin);

        sessionRegistry.bind(caller.connectionId(), new SessionRecord(roomId, caller.userId(), displayName));
        broadcastService.joinRoom(caller.connectionId(), roomId);

        RoomJoinedResponse joined = joinedResponse(room, newcomer, admin);
        broadcastService.sendToConnection(caller.connectionId(), ROOM_JOINED, joined);
        broadcastService.broadcastToRoomExcept(roomId, caller.connectionId(), ROOM_JOINED, joined);
        broadcastService.broadcastToRoomExcept(roomId, caller.connectionId(), PARTICIPANT_JOINED_NOTICE,
                new ParticipantNoticeResponse(roomId, displayName));

        newController.ifPresent(controller ->
                broadcastService.broadcastToRoom(roomId, CONTROL_TRANSFERRED,
                        ControlTransferredResponse.from(controller)));

        broadcastService.broadcastToRoom(roomId, RECEIVE_ROOM_PARTICIPANTS,
                participantSnapshot(roomId, room.getAdminId()));
        broadcastService.sendToConnection(caller.connectionId(), FORCE_SYNC_PLAYBACK, PlaybackStateResponse.of(room));
        broadcastService.sendToConnection(caller.connectionId(), RECEIVE_CHAT_HISTORY, chatHistory(roomId));

        log.info("[JOIN] userId={} roomId={} admin={}", caller.userId(), roomId, admin);
    }

    /**
     * 이미 참가 중인 사용자가 새 연결로 다시 들어온 경우.
     * joinedAt 과 hasControl 은 그대로 두고 연결만 바꾼다. 다른 참가자에게는 알리지 않는다.
     */
    private void reconnect(RoomCaller caller, Room room, Participant existing) {
        String roomId = room.getId();
        String displayName = displayNameOf(caller);
        Participant updated = existing.withConnection(caller.connectionId(), displayName, caller.avatarUrl());
        roomState.addParticipant(roomId, updated);

        String previousConnectionId = existing.connectionId();
        if (previousConnectionId != null && !previousConnectionId.equals(caller.connectionId())) {
            broadcastService.leaveRoom(previousConnectionId, roomId);
            sessionRegistry.unbind(previousConnectionId, roomId);
        }

        controlProtocol.repair(roomId).ifPresent(controller ->
                broadcastService.broadcastToRoom(roomId, CONTROL_TRANSFERRED,
                        ControlTransferredResponse.from(controller)));

        sessionRegistry.bind(caller.connectionId(), new SessionRecord(roomId, caller.userId(), displayName));
        broadcastService.joinRoom(caller.connectionId(), roomId);

        boolean admin = room.isAdmin(caller.userId());
        broadcastService.sendToConnection(caller.connectionId(), ROOM_JOINED, joinedResponse(room, updated, admin));
        broadcastService.sendToConnection(caller.connectionId(), RECEIVE_ROOM_PARTICIPANTS,
                participantSnapshot(roomId, room.getAdminId()));
        broadcastService.sendToConnection(caller.connectionId(), RECEIVE_CHAT_HISTORY, chatHistory(roomId));

        roomState.getParticipant(roomId, caller.userId())
                .filter(Participant::hasControl)
                .ifPresent(self -> broadcastService.sendToConnection(caller.connectionId(), CONTROL_TRANSFERRED,
                        ControlTransferredResponse.from(self)));
        broadcastService.sendToConnection(caller.connectionId(), FORCE_SYNC_PLAYBACK, PlaybackStateResponse.of(room));

        log.info("[RECONNECT] userId={} roomId={} connectionId={}", caller.userId(), roomId, caller.connectionId());
    }

    private void leave(String connectionId, String userId, String roomId) {
        String adminId = findAdminIdQuietly(roomId);

        roomState.runWithRoomLock(roomId, () -> {
            broadcastService.leaveRoom(connectionId, roomId);
            sessionRegistry.unbind(connectionId, roomId);

            Optional<Participant> current = roomState.getParticipant(roomId, userId);
            if (current.isEmpty()) {
                return;
            }
            if (!connectionId.equals(current.get().connectionId())) {
                // 이미 다른 연결로 재접속한 사용자
                log.info("Ignoring leave from stale connection - roomId: {}, userId: {}, connectionId: {}",
                        roomId, userId, connectionId);
                return;
            }

            controlProtocol.depart(roomId, userId).ifPresent(departure -> announceDeparture(roomId, adminId, departure));
        });
    }

    private void announceDeparture(String roomId, String adminId, Departure departure) {
        Participant participant = departure.participant();

        departure.successor().ifPresent(controller ->
                broadcastService.broadcastToRoom(roomId, CONTROL_TRANSFERRED,
                        ControlTransferredResponse.from(controller)));

        broadcastService.broadcastToRoom(roomId, ROOM_LEFT,
                new RoomLeftResponse(roomId, participant.id(), participant.displayName()));
        broadcastService.broadcastToRoom(roomId, PARTICIPANT_LEFT_NOTICE,
                new ParticipantNoticeResponse(roomId, participant.displayName()));

        if (departure.roomEmptied()) {
            positionReconciler.clearRoom(roomId);
        } else {
            broadcastService.broadcastToRoom(roomId, RECEIVE_ROOM_PARTICIPANTS,
                    participantSnapshot(roomId, adminId));
        }
        log.info("[LEAVE] userId={} roomId={} remaining={}", participant.id(), roomId, departure.remaining());
    }

    private void leavePreviousRoom(RoomCaller caller, String nextRoomId) {
        sessionRegistry.find(caller.connectionId())
                .filter(session -> !session.roomId().equals(nextRoomId))
                .ifPresent(session -> {
                    log.info("Connection {} moves from room {} to {}",
                            caller.connectionId(), session.roomId(), nextRoomId);
                    leave(caller.connectionId(), session.participantId(), session.roomId());
                });
    }

    /**
     * 재생 상태 변경. 다음 상태는 락 안에서 저장소의 최신 값으로 계산한다.
     */
    private void changePlayback(RoomCaller caller, String roomId,
                                Function<Room, PlaybackStateResponse> nextState) {
        Room room = loadActiveRoom(requireRoomId(roomId));
        boolean admin = room.isAdmin(caller.userId());

        roomState.runWithRoomLock(roomId, () -> {
            Participant participant = requireParticipant(roomId, caller.userId());
            if (!participant.hasControl() && !admin) {
                throw RoomActionException.permissionDenied("재생을 제어할 권한이 없습니다.");
            }

            PlaybackStateResponse state = nextState.apply(loadLatestActiveRoom(roomId));
            if (!callRoomService(() -> roomService.updatePlaybackState(roomId, state.position(), state.playing()))) {
                throw new RoomActionException(ErrorCode.COLLABORATOR_FAILURE, "재생 상태를 저장하지 못했습니다.");
            }
            broadcastService.broadcastToRoom(roomId, RECEIVE_PLAYBACK_UPDATE, state);
            log.debug("Playback updated - roomId: {}, position: {}, playing: {}",
                    roomId, state.position(), state.playing());
        });
    }

    private void heartbeat(RoomCaller caller, String roomId, double position) {
        roomState.runWithRoomLock(roomId, () -> {
            boolean stillController = roomState.getParticipant(roomId, caller.userId())
                    .map(Participant::hasControl)
                    .orElse(false);
            if (!stillController) {
                return;
            }
            if (!callRoomService(() -> roomService.updatePlaybackState(roomId, position, true))) {
                log.warn("Heartbeat position not persisted - roomId: {}, position: {}", roomId, position);
                return;
            }
            broadcastService.broadcastToRoomExcept(roomId, caller.connectionId(), RECEIVE_HEARTBEAT,
                    new HeartbeatResponse(position));
        });
    }

    private void correctDrift(String roomId, ReconciliationResult result) {
        Optional<Room> room = callRoomService(() -> roomService.findLatest(roomId));
        if (room.isEmpty()) {
            return;
        }
        PlaybackStateResponse correction = new PlaybackStateResponse(result.median(), room.get().isPlaying());

        roomState.runWithRoomLock(roomId, () -> {
            for (String connectionId : result.outlierConnectionIds()) {
                broadcastService.sendToConnection(connectionId, FORCE_SYNC_PLAYBACK, correction);
            }
        });
        log.debug("Drift corrected - roomId: {}, median: {}, connections: {}",
                roomId, result.median(), result.outlierConnectionIds().size());
    }

    private Room resolveRoom(JoinRoomRequest request) {
        Optional<Room> room;
        if (request.roomId() != null && !request.roomId().isBlank()) {
            room = callRoomService(() -> roomService.findById(request.roomId()));
        } else if (request.inviteCode() != null && !request.inviteCode().isBlank()) {
            room = callRoomService(() -> roomService.findByInviteCode(request.inviteCode()));
        } else {
            throw RoomActionException.validation("방 ID 또는 초대 코드가 필요합니다.");
        }
        return room.filter(Room::isActive).orElseThrow(RoomActionException::roomNotFound);
    }

    private Room loadActiveRoom(String roomId) {
        return callRoomService(() -> roomService.findById(roomId))
                .filter(Room::isActive)
                .orElseThrow(RoomActionException::roomNotFound);
    }

    private Room loadLatestActiveRoom(String roomId) {
        return callRoomService(() -> roomService.findLatest(roomId))
                .filter(Room::isActive)
                .orElseThrow(RoomActionException::roomNotFound);
    }

    private Participant requireParticipant(String roomId, String userId) {
        return roomState.getParticipant(roomId, userId).orElseThrow(RoomActionException::notParticipant);
    }

    private static String requireRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw RoomActionException.validation("방 ID 가 필요합니다.");
        }
        return roomId;
    }

    private static double requirePosition(Double position) {
        if (position == null || position.isNaN() || position.isInfinite() || position < 0) {
            throw RoomActionException.validation("재생 위치가 올바르지 않습니다.");
        }
        return position;
    }

    private List<ParticipantResponse> participantSnapshot(String roomId, String adminId) {
        return roomState.listParticipants(roomId).stream()
                .map(participant -> ParticipantResponse.from(participant, adminId))
                .toList();
    }

    private List<ChatMessageResponse> chatHistory(String roomId) {
        return roomState.listMessages(roomId).stream()
                .map(ChatMessageResponse::from)
                .toList();
    }

    private static RoomJoinedResponse joinedResponse(Room room, Participant participant, boolean admin) {
        return new RoomJoinedResponse(
                room.getId(),
                room.getName(),
                participant.id(),
                participant.displayName(),
                participant.avatarUrl(),
                admin,
                room.getVideoUrl(),
                room.getSyncMode()
        );
    }

    private static String displayNameOf(RoomCaller caller) {
        return caller.displayName() == null || caller.displayName().isBlank()
                ? UNKNOWN_USER
                : caller.displayName();
    }

    private String findAdminIdQuietly(String roomId) {
        try {
            return roomService.findById(roomId).map(Room::getAdminId).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Room lookup failed, participant snapshot will omit admin flag - roomId: {}", roomId, e);
            return null;
        }
    }

    private <T> T callRoomService(Supplier<T> call) {
        try {
            return call.get();
        } catch (RoomActionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RoomActionException(ErrorCode.COLLABORATOR_FAILURE, ErrorCode.COLLABORATOR_FAILURE.getMessage(), e);
        }
    }

    private void execute(RoomCaller caller, String action, Runnable body) {
        try {
            body.run();
        } catch (RoomActionException e) {
            if (e.getErrorCode() == ErrorCode.COLLABORATOR_FAILURE && e.getCause() != null) {
                log.error("[{}] collaborator failure - userId: {}", action, caller.userId(), e);
            } else {
                log.warn("[{}] rejected - userId: {}, code: {}, reason: {}",
                        action, caller.userId(), e.getCode(), e.getMessage());
            }
            sendError(caller, e.getCode(), e.getMessage());
        } catch (Exception e) {
            log.error("[{}] unexpected error - userId: {}", action, caller.userId(), e);
            sendError(caller, ErrorCode.INTERNAL_ERROR.getCode(), ErrorCode.INTERNAL_ERROR.getMessage());
        }
    }

    private void sendError(RoomCaller caller, String code, String message) {
        try {
            broadcastService.sendToConnection(caller.connectionId(), ERROR, new ErrorResponse(code, message));
        } catch (Exception e) {
            log.warn("Failed to deliver error event - connectionId: {}", caller.connectionId(), e);
        }
    }
}
