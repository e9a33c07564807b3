package com.streamsync.watchparty.dto;

public record KickUserRequest(String roomId, String targetUserId) {
}
