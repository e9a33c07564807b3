package com.streamsync.watchparty.state.store;

import static com.streamsync.watchparty.support.InMemoryRoomState.START;
import static com.streamsync.watchparty.support.InMemoryRoomState.participant;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.ZSetOperations;

@ExtendWith(MockitoExtension.class)
class RedisRoomStateStoreTest {

    private static final String ROOM_ID = "room-1";
    private static final String PARTICIPANTS_KEY = "room:room-1:participants";
    private static final String MESSAGES_KEY = "room:room-1:messages";

    @Mock
    private RedisTemplate<String, String> redisTemplate;

    @Mock
    private HashOperations<String, String, String> hashOperations;

    @Mock
    private ListOperations<String, String> listOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .build();

    private final MutableClock clock = new MutableClock(START);

    private RedisRoomStateStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.<String, String>opsForHash()).thenReturn(hashOperations);
        lenient().when(redisTemplate.opsForList()).thenReturn(listOperations);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOperations);
        lenient().when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);

        store = new RedisRoomStateStore(redisTemplate, objectMapper, clock, new RoomStateProperties());
    }

    @Test
    void saveParticipantWritesHashAndMarksRoomActive() throws Exception {
        Participant alice = participant("alice", START);

        store.saveParticipant(ROOM_ID, alice);

        verify(hashOperations).put(PARTICIPANTS_KEY, "alice", objectMapper.writeValueAsString(alice));
        verify(redisTemplate).expire(PARTICIPANTS_KEY, Duration.ofHours(24));
        verify(redisTemplate).expire(MESSAGES_KEY, Duration.ofHours(24));
        verify(setOperations).add("active_rooms", ROOM_ID);
        verify(zSetOperations).remove("empty_rooms", ROOM_ID);
    }

    @Test
    void findParticipantsReadsJsonValues() throws Exception {
        Participant alice = participant("alice", START);
        Participant bob = participant("bob", START.plusSeconds(1)).withControl(true);
        when(hashOperations.values(PARTICIPANTS_KEY)).thenReturn(List.of(
                objectMapper.writeValueAsString(alice),
                objectMapper.writeValueAsString(bob)));

        assertThat(store.findParticipants(ROOM_ID)).containsExactlyInAnyOrder(alice, bob);
    }

    @Test
    void removingLastParticipantStartsRetention() {
        when(hashOperations.delete(PARTICIPANTS_KEY, "alice")).thenReturn(1L);
        when(hashOperations.size(PARTICIPANTS_KEY)).thenReturn(0L);

        assertThat(store.removeParticipant(ROOM_ID, "alice")).isTrue();

        verify(setOperations).remove("active_rooms", ROOM_ID);
        verify(zSetOperations).add("empty_rooms", ROOM_ID, (double) START.toEpochMilli());
        verify(redisTemplate).expire(MESSAGES_KEY, Duration.ofHours(3));
    }

    @Test
    void removingUnknownParticipantIsNoOp() {
        when(hashOperations.delete(PARTICIPANTS_KEY, "ghost")).thenReturn(0L);

        assertThat(store.removeParticipant(ROOM_ID, "ghost")).isFalse();

        verifyNoInteractions(setOperations, zSetOperations);
    }

    @Test
    void appendMessagePushesAndTrimsToCapacity() {
        store.appendMessage(ROOM_ID, ChatMessage.system("hello", START), 50);

        verify(listOperations).rightPush(eq(MESSAGES_KEY), contains("hello"));
        verify(listOperations).trim(MESSAGES_KEY, -50, -1);
        verify(redisTemplate).expire(MESSAGES_KEY, Duration.ofHours(24));
    }

    @Test
    void expiredRoomsComeFromRetentionWindowAndOrphanedActiveRooms() {
        clock.advance(Duration.ofHours(4));
        when(zSetOperations.rangeByScore(eq("empty_rooms"), anyDouble(), anyDouble())).thenReturn(Set.of(ROOM_ID));
        when(setOperations.members("active_rooms")).thenReturn(Set.of("room-2", "room-3"));
        when(redisTemplate.hasKey("room:room-2:participants")).thenReturn(false);
        when(redisTemplate.hasKey("room:room-3:participants")).thenReturn(true);

        assertThat(store.findExpiredRoomIds()).containsExactlyInAnyOrder(ROOM_ID, "room-2");

        verify(zSetOperations).rangeByScore("empty_rooms", 0, (double) START.plus(Duration.ofHours(1)).toEpochMilli());
        verify(redisTemplate, never()).delete(anyList());
    }

    @Test
    void purgeRemovesRoomPastRetention() {
        clock.advance(Duration.ofHours(4));
        when(hashOperations.size(PARTICIPANTS_KEY)).thenReturn(0L);
        when(zSetOperations.score("empty_rooms", ROOM_ID)).thenReturn((double) START.toEpochMilli());

        assertThat(store.purgeIfExpired(ROOM_ID)).isTrue();

        verify(redisTemplate).delete(List.of(PARTICIPANTS_KEY, MESSAGES_KEY));
        verify(zSetOperations).remove("empty_rooms", ROOM_ID);
    }

    @Test
    void purgeKeepsRoomStillInsideRetention() {
        clock.advance(Duration.ofHours(2));
        when(hashOperations.size(PARTICIPANTS_KEY)).thenReturn(0L);
        when(zSetOperations.score("empty_rooms", ROOM_ID)).thenReturn((double) START.toEpochMilli());
        when(setOperations.isMember("active_rooms", ROOM_ID)).thenReturn(false);

        assertThat(store.purgeIfExpired(ROOM_ID)).isFalse();

        verify(redisTemplate, never()).delete(anyList());
    }

    @Test
    void purgeSkipsRoomThatWasRejoined() {
        when(hashOperations.size(PARTICIPANTS_KEY)).thenReturn(2L);

        assertThat(store.purgeIfExpired(ROOM_ID)).isFalse();

        verify(redisTemplate, never()).delete(anyList());
    }
}
