package com.streamsync.watchparty.dto;

/**
 * roomId 또는 inviteCode 중 하나로 방을 지정한다. 둘 다 있으면 roomId 우선.
 */
public record JoinRoomRequest(String roomId, String inviteCode, String password) {
}
