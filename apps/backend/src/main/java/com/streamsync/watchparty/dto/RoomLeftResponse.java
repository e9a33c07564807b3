package com.streamsync.watchparty.dto;

public record RoomLeftResponse(String roomId, String participantId, String displayName) {
}
