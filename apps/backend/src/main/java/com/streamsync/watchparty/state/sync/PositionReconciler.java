package com.streamsync.watchparty.state.sync;

import com.streamsync.watchparty.config.PlaybackSyncProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 참가자들이 보고한 재생 위치를 모아 기준 위치에서 벗어난 연결을 찾는다.
 *
 * [동작]
 * 1. 연결별 최신 보고 위치를 방 단위로 모은다 (같은 연결은 덮어씀)
 * 2. 보고 수가 참가자 수 x quorumRatio 이상이고 minReports 이상이면 평가
 * 3. 중앙값(짝수 개면 아래쪽 가운데 값)을 기준으로 |위치 - 기준| > tolerance 인 연결이 보정 대상
 * 4. 평가한 보고는 비운다
 *
 * 보고 데이터는 이 노드 메모리에만 있다. 정족수는 각 노드가 받은 보고만으로 판단한다.
 */
@Slf4j
@Component
public class PositionReconciler {

    private final ConcurrentMap<String, Map<String, Double>> reports = new ConcurrentHashMap<>();

    private final PlaybackSyncProperties properties;
    private final Counter corrections;

    public PositionReconciler(PlaybackSyncProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.corrections = Counter.builder("watchparty.sync.corrections")
                .description("Number of forced resyncs sent to drifting connections")
                .register(meterRegistry);
    }

    /**
     * 위치 보고를 기록하고, 정족수가 찼으면 평가 결과를 반환한다.
     *
     * @param participantCount 현재 방 참가자 수
     */
    public Optional<ReconciliationResult> report(String roomId, String connectionId,
                                                 double position, int participantCount) {
        AtomicReference<ReconciliationResult> result = new AtomicReference<>();

        reports.compute(roomId, (key, current) -> {
            Map<String, Double> positions = current != null ? current : new HashMap<>();
            positions.put(connectionId, position);

            if (!quorumReached(positions.size(), participantCount)) {
                return positions;
            }
            result.set(evaluate(positions));
            return null;
        });

        ReconciliationResult evaluated = result.get();
        if (evaluated != null && evaluated.hasOutliers()) {
            corrections.increment(evaluated.outlierConnectionIds().size());
            log.debug("Position drift in room {} - median: {}, outliers: {}",
                    roomId, evaluated.median(), evaluated.outlierConnectionIds());
        }
        return Optional.ofNullable(evaluated);
    }

    public void clearRoom(String roomId) {
        reports.remove(roomId);
    }

    int pendingReports(String roomId) {
        Map<String, Double> positions = reports.get(roomId);
        return positions != null ? positions.size() : 0;
    }

    private boolean quorumReached(int reportCount, int participantCount) {
        return reportCount >= properties.getMinReports()
                && reportCount >= participantCount * properties.getQuorumRatio();
    }

    private ReconciliationResult evaluate(Map<String, Double> positions) {
        double median = median(new ArrayList<>(positions.values()));

        List<String> outliers = new ArrayList<>();
        positions.forEach((connectionId, position) -> {
            if (Math.abs(position - median) > properties.getTolerance()) {
                outliers.add(connectionId);
            }
        });
        return new ReconciliationResult(median, List.copyOf(outliers), positions.size());
    }

    static double median(List<Double> positions) {
        List<Double> sorted = new ArrayList<>(positions);
        sorted.sort(null);
        return sorted.get((sorted.size() - 1) / 2);
    }
}
