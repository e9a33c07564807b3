package com.streamsync.watchparty.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamsync.watchparty.model.Participant;
import java.time.Instant;

public record ParticipantResponse(
        String id,
        String displayName,
        String avatarUrl,
        boolean hasControl,
        @JsonProperty("isAdmin") boolean admin,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant joinedAt
) {

    public static ParticipantResponse from(Participant participant, String adminId) {
        return new ParticipantResponse(
                participant.id(),
                participant.displayName(),
                participant.avatarUrl(),
                participant.hasControl(),
                participant.id().equals(adminId),
                participant.joinedAt()
        );
    }
}
