package com.streamsync.watchparty.websocket.socketio.pubsub;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Redis Pub/Sub를 통해 서버 간 전달되는 방 이벤트.
 *
 * [흐름 예시]
 * 1. 서버1에서 제어권자가 재생 버튼을 누름
 * 2. 서버1이 RoomBroadcastEvent 생성 후 Redis에 PUBLISH
 * 3. 서버1~N이 모두 이 이벤트를 수신
 * 4. 각 서버는 자신에게 연결된 해당 방 클라이언트에게 socketEvent 발송
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomBroadcastEvent {

    /**
     * 전달 범위 - TYPE_* 중 하나
     */
    private String eventType;

    private String roomId;

    /**
     * TYPE_ROOM_EXCEPT: 제외할 연결, TYPE_CONNECTION: 받을 연결, TYPE_DETACH: 방에서 뺄 연결
     */
    private String connectionId;

    private String socketEvent;

    private Object payload;

    public static final String TYPE_ROOM = "ROOM";
    public static final String TYPE_ROOM_EXCEPT = "ROOM_EXCEPT";
    public static final String TYPE_CONNECTION = "CONNECTION";
    public static final String TYPE_DETACH = "DETACH";
}
