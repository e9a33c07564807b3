package com.streamsync.watchparty.websocket.socketio.handler;

import static com.streamsync.watchparty.websocket.socketio.SocketIOEvents.*;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnEvent;
import com.streamsync.watchparty.dto.KickUserRequest;
import com.streamsync.watchparty.dto.SyncModeRequest;
import com.streamsync.watchparty.dto.TransferControlRequest;
import com.streamsync.watchparty.session.RoomCoordinationService;
import com.streamsync.watchparty.websocket.socketio.SocketCallers;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 제어권 이양, 방장 기능(강퇴, 동기화 모드, 방 종료), 참가자 목록 요청
 */
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class RoomControlHandler {

    private final RoomCoordinationService coordinationService;

    @OnEvent(TRANSFER_CONTROL)
    public void handleTransferControl(SocketIOClient client, TransferControlRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.transferControl(caller, request));
    }

    @OnEvent(KICK_USER)
    public void handleKickUser(SocketIOClient client, KickUserRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.kickUser(caller, request));
    }

    @OnEvent(UPDATE_SYNC_MODE)
    public void handleUpdateSyncMode(SocketIOClient client, SyncModeRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.updateSyncMode(caller, request));
    }

    @OnEvent(REQUEST_ROOM_PARTICIPANTS)
    public void handleRequestParticipants(SocketIOClient client, String roomId) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.requestRoomParticipants(caller, roomId));
    }

    @OnEvent(CLOSE_ROOM)
    public void handleCloseRoom(SocketIOClient client, String roomId) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.closeRoom(caller, roomId));
    }
}
