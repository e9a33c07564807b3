package com.streamsync.watchparty.state.store;

import static com.streamsync.watchparty.support.InMemoryRoomState.START;
import static com.streamsync.watchparty.support.InMemoryRoomState.participant;
import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.support.MutableClock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * 실제 Redis 위에서 RedisRoomStateStore 를 인메모리 저장소와 같은 시나리오로 돌린다.
 * Docker 가 없으면 건너뛴다.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisRoomStateStoreIntegrationTest extends RoomStateStoreContractTest {

    @Container
    private static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine")).withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .build();

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void flushRedis() {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
    }

    @Override
    protected RoomStateStore createStore(MutableClock clock, RoomStateProperties properties) {
        return new RedisRoomStateStore(redisTemplate, objectMapper, clock, properties);
    }

    @Test
    void writesRefreshSafetyExpiry() {
        store.saveParticipant(ROOM_ID, participant("alice", START));
        store.appendMessage(ROOM_ID, ChatMessage.system("hello", START), 50);

        assertThat(redisTemplate.getExpire("room:room-1:participants", TimeUnit.SECONDS))
                .isBetween(Duration.ofHours(23).toSeconds(), Duration.ofHours(24).toSeconds());
        assertThat(redisTemplate.getExpire("room:room-1:messages", TimeUnit.SECONDS))
                .isBetween(Duration.ofHours(23).toSeconds(), Duration.ofHours(24).toSeconds());
    }

    @Test
    void emptiedRoomMessagesExpireWithRetention() {
        store.saveParticipant(ROOM_ID, participant("alice", START));
        store.appendMessage(ROOM_ID, ChatMessage.system("hello", START), 50);

        store.removeParticipant(ROOM_ID, "alice");

        assertThat(redisTemplate.getExpire("room:room-1:messages", TimeUnit.SECONDS))
                .isBetween(Duration.ofHours(2).toSeconds(), Duration.ofHours(3).toSeconds());
    }

    @Test
    void roomWhoseParticipantsExpiredIsPurged() {
        store.saveParticipant(ROOM_ID, participant("alice", START));
        store.appendMessage(ROOM_ID, ChatMessage.system("hello", START), 50);

        // 24시간 TTL 이 지난 상태
        redisTemplate.delete("room:room-1:participants");

        assertThat(store.findExpiredRoomIds()).containsExactly(ROOM_ID);
        assertThat(store.purgeIfExpired(ROOM_ID)).isTrue();
        assertThat(store.findActiveRoomIds()).isEmpty();
        assertThat(store.findMessages(ROOM_ID)).isEmpty();
    }
}
