package com.streamsync.watchparty.websocket.socketio.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * 로컬 브로드캐스트 서비스 (단일 서버용).
 *
 * 단일 서버 환경에서 직접 Socket.IO로 브로드캐스트한다.
 * 개발/테스트 환경 또는 단일 인스턴스 배포 시 사용.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "watchparty.broadcast.type", havingValue = "local")
@RequiredArgsConstructor
public class LocalBroadcastService implements BroadcastService {

    private final SocketIODelivery delivery;

    @Override
    public void broadcastToRoom(String roomId, String socketEvent, Object payload) {
        delivery.toRoom(roomId, socketEvent, payload);
        log.debug("Broadcast to room (local) - room: {}, socketEvent: {}", roomId, socketEvent);
    }

    @Override
    public void broadcastToRoomExcept(String roomId, String excludedConnectionId, String socketEvent, Object payload) {
        delivery.toRoomExcept(roomId, excludedConnectionId, socketEvent, payload);
        log.debug("Broadcast to room except {} (local) - room: {}, socketEvent: {}",
                excludedConnectionId, roomId, socketEvent);
    }

    @Override
    public void sendToConnection(String connectionId, String socketEvent, Object payload) {
        if (!delivery.toConnection(connectionId, socketEvent, payload)) {
            log.debug("Connection not found (local) - connectionId: {}, socketEvent: {}", connectionId, socketEvent);
        }
    }

    @Override
    public void joinRoom(String connectionId, String roomId) {
        delivery.attach(connectionId, roomId);
    }

    @Override
    public void leaveRoom(String connectionId, String roomId) {
        delivery.detach(connectionId, roomId);
    }
}
