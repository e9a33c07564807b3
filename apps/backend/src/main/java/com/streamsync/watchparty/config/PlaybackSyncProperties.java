package com.streamsync.watchparty.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 재생 위치 보정 설정 (watchparty.sync.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "watchparty.sync")
public class PlaybackSyncProperties {

    /**
     * 중앙값과 이 값(초)보다 더 벌어진 클라이언트를 강제 동기화한다.
     */
    private double tolerance = 3.0;

    /**
     * 참가자 수 대비 보고 비율이 이 값 이상이어야 보정을 수행한다.
     */
    private double quorumRatio = 0.8;

    private int minReports = 2;
}
