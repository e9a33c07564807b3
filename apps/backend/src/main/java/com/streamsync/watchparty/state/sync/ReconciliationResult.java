package com.streamsync.watchparty.state.sync;

import java.util.List;

/**
 * 한 번의 위치 보정 결과.
 *
 * @param median               기준 재생 위치(초)
 * @param outlierConnectionIds 기준에서 허용 오차보다 멀리 떨어진 연결
 * @param sampleSize           이번 평가에 사용된 보고 수
 */
public record ReconciliationResult(double median, List<String> outlierConnectionIds, int sampleSize) {

    public boolean hasOutliers() {
        return !outlierConnectionIds.isEmpty();
    }
}
