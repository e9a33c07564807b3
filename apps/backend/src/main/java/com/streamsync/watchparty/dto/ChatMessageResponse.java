package com.streamsync.watchparty.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamsync.watchparty.model.ChatMessage;
import java.time.Instant;

public record ChatMessageResponse(
        String id,
        String senderId,
        String senderName,
        String avatarUrl,
        String content,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Instant sentAt,
        @JsonProperty("isSystem") boolean system
) {

    public static ChatMessageResponse from(ChatMessage message) {
        return new ChatMessageResponse(
                message.id(),
                message.senderId(),
                message.senderName(),
                message.avatarUrl(),
                message.content(),
                message.sentAt(),
                message.isSystem()
        );
    }
}
