package com.streamsync.watchparty.model;

import java.time.Instant;

/**
 * 방 참가자.
 * id 는 사용자 식별자로 재접속 후에도 유지되고, connectionId 는 소켓 연결마다 바뀐다.
 * joinedAt 은 한 번 정해지면 바뀌지 않으며 제어권 승계 순서의 기준이 된다.
 */
public record Participant(
        String id,
        String connectionId,
        String displayName,
        String avatarUrl,
        boolean hasControl,
        Instant joinedAt
) {

    public Participant withConnection(String connectionId, String displayName, String avatarUrl) {
        return new Participant(id, connectionId, displayName, avatarUrl, hasControl, joinedAt);
    }

    public Participant withControl(boolean hasControl) {
        if (this.hasControl == hasControl) {
            return this;
        }
        return new Participant(id, connectionId, displayName, avatarUrl, hasControl, joinedAt);
    }
}
