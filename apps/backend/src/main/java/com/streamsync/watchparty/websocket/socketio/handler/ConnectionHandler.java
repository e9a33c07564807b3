package com.streamsync.watchparty.websocket.socketio.handler;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnConnect;
import com.corundumstudio.socketio.annotation.OnDisconnect;
import com.streamsync.watchparty.session.RoomCoordinationService;
import com.streamsync.watchparty.websocket.socketio.SocketIOEvents;
import com.streamsync.watchparty.websocket.socketio.SocketUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 연결/연결 종료 처리.
 * 연결이 끊기면 참가 중이던 방에서 바로 퇴장시킨다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ConnectionHandler {

    private final RoomCoordinationService coordinationService;

    @OnConnect
    public void onConnect(SocketIOClient client) {
        SocketUser user = client.get(SocketIOEvents.USER_ATTRIBUTE);
        if (user == null) {
            log.warn("[CONNECT] unauthenticated client - socketId={}", client.getSessionId());
            client.disconnect();
            return;
        }
        log.info("[CONNECT] userId={} socketId={}", user.id(), client.getSessionId());
    }

    @OnDisconnect
    public void onDisconnect(SocketIOClient client) {
        SocketUser user = client.get(SocketIOEvents.USER_ATTRIBUTE);
        String connectionId = client.getSessionId().toString();
        log.info("[DISCONNECT] userId={} socketId={}", user != null ? user.id() : null, connectionId);

        coordinationService.disconnect(connectionId, user != null ? user.id() : null);
    }
}
