package com.streamsync.watchparty.websocket.socketio.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamsync.watchparty.config.RedisPubSubConfig;
import com.streamsync.watchparty.websocket.socketio.pubsub.RoomBroadcastEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Redis Pub/Sub 기반 브로드캐스트 서비스.
 *
 * 멀티 서버 환경에서 모든 서버에 이벤트를 전파한다.
 * Redis에 PUBLISH하면 모든 구독 서버가 이벤트를 수신하여
 * 각자의 Socket.IO 클라이언트에게 전달한다.
 *
 * 방 그룹 가입은 요청한 연결이 항상 이 서버에 있으므로 로컬에서 바로 처리한다.
 *
 * [흐름]
 * RoomCoordinationService → RedisBroadcastService.publish() → Redis → 모든 서버의 RedisMessageSubscriber
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "watchparty.broadcast.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisBroadcastService implements BroadcastService {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final SocketIODelivery delivery;

    @Override
    public void broadcastToRoom(String roomId, String socketEvent, Object payload) {
        publish(RoomBroadcastEvent.builder()
                .eventType(RoomBroadcastEvent.TYPE_ROOM)
                .roomId(roomId)
                .socketEvent(socketEvent)
                .payload(payload)
                .build());
    }

    @Override
    public void broadcastToRoomExcept(String roomId, String excludedConnectionId, String socketEvent, Object payload) {
        publish(RoomBroadcastEvent.builder()
                .eventType(RoomBroadcastEvent.TYPE_ROOM_EXCEPT)
                .roomId(roomId)
                .connectionId(excludedConnectionId)
                .socketEvent(socketEvent)
                .payload(payload)
                .build());
    }

    @Override
    public void sendToConnection(String connectionId, String socketEvent, Object payload) {
        // 대부분 요청한 연결에게 보내는 응답이므로 로컬에 있으면 Redis 를 거치지 않는다
        if (delivery.toConnection(connectionId, socketEvent, payload)) {
            return;
        }
        publish(RoomBroadcastEvent.builder()
                .eventType(RoomBroadcastEvent.TYPE_CONNECTION)
                .connectionId(connectionId)
                .socketEvent(socketEvent)
                .payload(payload)
                .build());
    }

    @Override
    public void joinRoom(String connectionId, String roomId) {
        delivery.attach(connectionId, roomId);
    }

    @Override
    public void leaveRoom(String connectionId, String roomId) {
        if (delivery.detach(connectionId, roomId)) {
            return;
        }
        publish(RoomBroadcastEvent.builder()
                .eventType(RoomBroadcastEvent.TYPE_DETACH)
                .roomId(roomId)
                .connectionId(connectionId)
                .build());
    }

    private void publish(RoomBroadcastEvent event) {
        try {
            redisTemplate.convertAndSend(RedisPubSubConfig.EVENT_CHANNEL, objectMapper.writeValueAsString(event));
            log.debug("Broadcast via Redis - eventType: {}, room: {}, socketEvent: {}",
                    event.getEventType(), event.getRoomId(), event.getSocketEvent());
        } catch (JsonProcessingException e) {
            log.error("Redis 메시지 직렬화 실패 - eventType: {}, socketEvent: {}",
                    event.getEventType(), event.getSocketEvent(), e);
        }
    }
}
