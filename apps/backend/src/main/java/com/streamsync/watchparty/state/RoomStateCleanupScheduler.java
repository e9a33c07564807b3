package com.streamsync.watchparty.state;

import com.streamsync.watchparty.state.sync.PositionReconciler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 빈 방 정리 스케줄러.
 *
 * 보관 기간이 지난 빈 방의 채팅/참가자 데이터를 주기적으로 삭제한다.
 * 실패해도 다음 주기에 다시 시도하므로 예외는 로그만 남긴다.
 */
@Slf4j
@Component
public class RoomStateCleanupScheduler {

    private final RoomStateService roomStateService;
    private final PositionReconciler positionReconciler;
    private final Counter purgedRooms;

    public RoomStateCleanupScheduler(RoomStateService roomStateService,
                                     PositionReconciler positionReconciler,
                                     MeterRegistry meterRegistry) {
        this.roomStateService = roomStateService;
        this.positionReconciler = positionReconciler;
        this.purgedRooms = Counter.builder("watchparty.rooms.purged")
                .description("Number of empty rooms purged after the retention window")
                .register(meterRegistry);

        Gauge.builder("watchparty.rooms.active", roomStateService, service -> service.listActiveRoomIds().size())
                .description("Number of rooms with at least one participant")
                .register(meterRegistry);
    }

    @Scheduled(
            initialDelayString = "${watchparty.state.cleanup-interval-ms:300000}",
            fixedDelayString = "${watchparty.state.cleanup-interval-ms:300000}"
    )
    public void cleanupEmptyRooms() {
        try {
            List<String> purged = roomStateService.cleanupEmptyRooms();
            purged.forEach(positionReconciler::clearRoom);
            purgedRooms.increment(purged.size());
        } catch (Exception e) {
            log.error("Empty room cleanup failed", e);
        }
    }
}
