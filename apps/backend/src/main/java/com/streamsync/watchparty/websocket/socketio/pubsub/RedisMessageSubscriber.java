package com.streamsync.watchparty.websocket.socketio.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamsync.watchparty.websocket.socketio.broadcast.SocketIODelivery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Redis Pub/Sub 메시지 수신자.
 *
 *   Redis (Pub/Sub)  →  RedisMessageSubscriber  →  Socket.IO (클라이언트)
 *
 * 각 서버는 자신에게 연결된 클라이언트에게만 전송한다.
 * 대상 연결이 이 서버에 없으면 조용히 건너뛴다 (다른 서버가 처리).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "watchparty.broadcast.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisMessageSubscriber {

    private final SocketIODelivery delivery;
    private final ObjectMapper objectMapper;

    /**
     * Redis에서 메시지 수신 시 호출 (MessageListenerAdapter)
     *
     * @param message Redis에서 수신한 JSON 문자열
     */
    public void onMessage(String message) {
        try {
            RoomBroadcastEvent event = objectMapper.readValue(message, RoomBroadcastEvent.class);

            log.debug("Redis 메시지 수신 - type: {}, room: {}, socketEvent: {}",
                    event.getEventType(), event.getRoomId(), event.getSocketEvent());

            dispatch(event);
        } catch (Exception e) {
            log.error("Redis 메시지 처리 실패 - message: {}", message, e);
        }
    }

    void dispatch(RoomBroadcastEvent event) {
        switch (event.getEventType()) {
            case RoomBroadcastEvent.TYPE_ROOM ->
                    delivery.toRoom(event.getRoomId(), event.getSocketEvent(), event.getPayload());
            case RoomBroadcastEvent.TYPE_ROOM_EXCEPT ->
                    delivery.toRoomExcept(event.getRoomId(), event.getConnectionId(),
                            event.getSocketEvent(), event.getPayload());
            case RoomBroadcastEvent.TYPE_CONNECTION ->
                    delivery.toConnection(event.getConnectionId(), event.getSocketEvent(), event.getPayload());
            case RoomBroadcastEvent.TYPE_DETACH ->
                    delivery.detach(event.getConnectionId(), event.getRoomId());
            default -> log.warn("Unknown broadcast event type: {}", event.getEventType());
        }
    }
}
