package com.streamsync.watchparty.session;

/**
 * 연결이 현재 참가 중인 방.
 */
public record SessionRecord(String roomId, String participantId, String displayName) {
}
