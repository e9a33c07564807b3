package com.streamsync.watchparty.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoomJoinedResponse(
        String roomId,
        String roomName,
        String participantId,
        String displayName,
        String avatarUrl,
        @JsonProperty("isAdmin") boolean admin,
        String videoUrl,
        String syncMode
) {
}
