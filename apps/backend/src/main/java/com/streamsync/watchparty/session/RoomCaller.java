package com.streamsync.watchparty.session;

/**
 * 요청을 보낸 연결과 인증된 사용자.
 */
public record RoomCaller(String connectionId, String userId, String displayName, String avatarUrl) {
}
