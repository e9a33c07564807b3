package com.streamsync.watchparty.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({RoomStateProperties.class, PlaybackSyncProperties.class})
public class RoomStateConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
