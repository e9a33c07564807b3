package com.streamsync.watchparty.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 방 상태 저장소 설정 (watchparty.state.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "watchparty.state")
public class RoomStateProperties {

    /**
     * redis | memory. 저장소와 방 단위 락 구현이 함께 선택된다.
     */
    private String type = "redis";

    /**
     * 방별로 보관하는 채팅 메시지 수 (ring buffer)
     */
    private int messageCapacity = 50;

    /**
     * 방이 비었을 때 채팅/참가자 데이터를 남겨두는 시간
     */
    private Duration emptyRoomRetention = Duration.ofHours(3);

    /**
     * 참가자가 있는 방의 안전망 만료 시간. 입장/메시지마다 갱신된다.
     */
    private Duration roomExpiry = Duration.ofHours(24);

    private Duration lockWait = Duration.ofSeconds(3);

    private Duration lockLease = Duration.ofSeconds(10);

    private long cleanupIntervalMs = 300_000L;
}
