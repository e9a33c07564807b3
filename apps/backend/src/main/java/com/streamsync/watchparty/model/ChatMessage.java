package com.streamsync.watchparty.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.UUID;

/**
 * 채팅 메시지. 생성 후 변경되지 않는다.
 * 입장/퇴장/강퇴 같은 시스템 메시지는 senderId 가 {@link #SYSTEM_SENDER_ID} 이다.
 */
public record ChatMessage(
        String id,
        String senderId,
        String senderName,
        String avatarUrl,
        String content,
        Instant sentAt
) {

    public static final String SYSTEM_SENDER_ID = "system";
    public static final String SYSTEM_SENDER_NAME = "System";

    public static ChatMessage of(Participant sender, String content, Instant sentAt) {
        return new ChatMessage(
                UUID.randomUUID().toString(),
                sender.id(),
                sender.displayName(),
                sender.avatarUrl(),
                content,
                sentAt
        );
    }

    public static ChatMessage system(String content, Instant sentAt) {
        return new ChatMessage(
                UUID.randomUUID().toString(),
                SYSTEM_SENDER_ID,
                SYSTEM_SENDER_NAME,
                null,
                content,
                sentAt
        );
    }

    @JsonIgnore
    public boolean isSystem() {
        return SYSTEM_SENDER_ID.equals(senderId);
    }
}
