package com.streamsync.watchparty.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 방 메타데이터 (영속 데이터).
 * 참가자와 채팅은 여기 저장하지 않고 RoomStateStore 가 관리한다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "rooms")
public class Room {

    @Id
    private String id;

    private String name;

    @Indexed(unique = true)
    private String inviteCode;

    private String adminId;

    private boolean active;

    private boolean privateRoom;

    private String passwordHash;

    private String videoUrl;

    private double currentPosition;

    private boolean playing;

    @Builder.Default
    private String syncMode = SyncMode.STRICT.getValue();

    private LocalDateTime createdAt;

    private LocalDateTime endedAt;

    public boolean isAdmin(String userId) {
        return adminId != null && adminId.equals(userId);
    }
}
