package com.streamsync.watchparty.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 클라이언트.
 * 방 단위 분산 락(watchparty.state.type=redis)과 Socket.IO 세션 스토어(socketio.store.type=redis)에 사용한다.
 * 둘 다 local/memory 면 만들지 않는다.
 */
@Slf4j
@Configuration
@ConditionalOnExpression("'${watchparty.state.type:redis}' == 'redis' or '${socketio.store.type:redis}' == 'redis'")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(
            @Value("${spring.data.redis.host:localhost}") String host,
            @Value("${spring.data.redis.port:6379}") int port,
            @Value("${spring.data.redis.password:}") String password) {

        Config config = new Config();
        var server = config.useSingleServer()
                .setAddress("redis://" + host + ":" + port)
                .setConnectionMinimumIdleSize(4)
                .setConnectionPoolSize(16);
        if (password != null && !password.isBlank()) {
            server.setPassword(password);
        }

        log.info("Redisson client connecting to {}:{}", host, port);
        return Redisson.create(config);
    }
}
