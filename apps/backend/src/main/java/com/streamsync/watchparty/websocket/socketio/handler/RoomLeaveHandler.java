package com.streamsync.watchparty.websocket.socketio.handler;

import static com.streamsync.watchparty.websocket.socketio.SocketIOEvents.LEAVE_ROOM;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnEvent;
import com.streamsync.watchparty.session.RoomCoordinationService;
import com.streamsync.watchparty.websocket.socketio.SocketCallers;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 방 퇴장 처리 핸들러
 */
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class RoomLeaveHandler {

    private final RoomCoordinationService coordinationService;

    @OnEvent(LEAVE_ROOM)
    public void handleLeaveRoom(SocketIOClient client, String roomId) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.leaveRoom(caller, roomId));
    }
}
