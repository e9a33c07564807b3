package com.streamsync.watchparty.websocket.socketio;

/**
 * 핸드셰이크에서 인증된 사용자. client.get("user") 로 꺼낸다.
 */
public record SocketUser(String id, String name, String avatarUrl, String socketId) {
}
