package com.streamsync.watchparty.websocket.socketio.handler;

import static com.streamsync.watchparty.websocket.socketio.SocketIOEvents.JOIN_ROOM;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnEvent;
import com.streamsync.watchparty.dto.JoinRoomRequest;
import com.streamsync.watchparty.session.RoomCoordinationService;
import com.streamsync.watchparty.websocket.socketio.SocketCallers;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 방 입장 처리 핸들러
 * 방 id 또는 초대 코드로 입장, 같은 사용자의 재접속도 여기서 처리된다.
 */
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class RoomJoinHandler {

    private final RoomCoordinationService coordinationService;

    @OnEvent(JOIN_ROOM)
    public void handleJoinRoom(SocketIOClient client, JoinRoomRequest request) {
        SocketCallers.resolve(client).ifPresent(caller -> coordinationService.joinRoom(caller, request));
    }
}
