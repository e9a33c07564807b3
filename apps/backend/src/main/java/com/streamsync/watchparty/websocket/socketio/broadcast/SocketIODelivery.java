package com.streamsync.watchparty.websocket.socketio.broadcast;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/**
 * 이 서버에 연결된 클라이언트에게 실제로 Socket.IO 이벤트를 보낸다.
 * LocalBroadcastService 와 RedisMessageSubscriber 가 공유한다.
 */
@Slf4j
@Component
public class SocketIODelivery {

    private final SocketIOServer socketIOServer;

    public SocketIODelivery(@Lazy SocketIOServer socketIOServer) {
        this.socketIOServer = socketIOServer;
    }

    public void toRoom(String roomId, String socketEvent, Object payload) {
        socketIOServer.getRoomOperations(roomId).sendEvent(socketEvent, payload);
    }

    public void toRoomExcept(String roomId, String excludedConnectionId, String socketEvent, Object payload) {
        SocketIOClient excluded = findClient(excludedConnectionId);
        if (excluded == null) {
            toRoom(roomId, socketEvent, payload);
            return;
        }
        socketIOServer.getRoomOperations(roomId).sendEvent(socketEvent, excluded, payload);
    }

    /**
     * @return 이 서버에 해당 연결이 있어서 보냈으면 true
     */
    public boolean toConnection(String connectionId, String socketEvent, Object payload) {
        SocketIOClient client = findClient(connectionId);
        if (client == null) {
            return false;
        }
        client.sendEvent(socketEvent, payload);
        return true;
    }

    public boolean attach(String connectionId, String roomId) {
        SocketIOClient client = findClient(connectionId);
        if (client == null) {
            return false;
        }
        client.joinRoom(roomId);
        return true;
    }

    public boolean detach(String connectionId, String roomId) {
        SocketIOClient client = findClient(connectionId);
        if (client == null) {
            return false;
        }
        client.leaveRoom(roomId);
        return true;
    }

    private SocketIOClient findClient(String connectionId) {
        if (connectionId == null) {
            return null;
        }
        try {
            return socketIOServer.getClient(UUID.fromString(connectionId));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid connection id: {}", connectionId);
            return null;
        }
    }
}
