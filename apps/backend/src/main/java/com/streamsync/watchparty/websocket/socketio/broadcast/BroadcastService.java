package com.streamsync.watchparty.websocket.socketio.broadcast;

/**
 * 방 이벤트 브로드캐스트 서비스 인터페이스.
 *
 * 단일 서버 환경에서는 직접 Socket.IO로 전송하고,
 * 멀티 서버 환경에서는 Redis Pub/Sub를 통해 모든 서버에 전파한다.
 */
public interface BroadcastService {

    /**
     * 방 전체에 이벤트 브로드캐스트
     *
     * @param roomId      대상 방 ID
     * @param socketEvent Socket.IO 이벤트 이름
     * @param payload     전송할 데이터
     */
    void broadcastToRoom(String roomId, String socketEvent, Object payload);

    /**
     * 특정 연결을 제외한 방 전체에 브로드캐스트
     */
    void broadcastToRoomExcept(String roomId, String excludedConnectionId, String socketEvent, Object payload);

    /**
     * 연결 하나에만 전송. 연결이 어느 서버에 붙어 있는지는 몰라도 된다.
     */
    void sendToConnection(String connectionId, String socketEvent, Object payload);

    /**
     * 연결을 방의 브로드캐스트 그룹에 넣는다. 호출한 연결은 항상 이 서버에 붙어 있다.
     */
    void joinRoom(String connectionId, String roomId);

    /**
     * 연결을 방의 브로드캐스트 그룹에서 뺀다. 다른 서버에 붙은 연결일 수도 있다 (강퇴, 방 종료).
     */
    void leaveRoom(String connectionId, String roomId);
}
