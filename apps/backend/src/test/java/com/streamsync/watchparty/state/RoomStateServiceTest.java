package com.streamsync.watchparty.state;

import static com.streamsync.watchparty.support.InMemoryRoomState.START;
import static com.streamsync.watchparty.support.InMemoryRoomState.participant;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.state.lock.LocalRoomLockManager;
import com.streamsync.watchparty.state.store.InMemoryRoomStateStore;
import com.streamsync.watchparty.support.InMemoryRoomState;
import com.streamsync.watchparty.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RoomStateServiceTest {

    private static final String ROOM_ID = "room-1";

    private InMemoryRoomState state;
    private RoomStateService service;

    @BeforeEach
    void setUp() {
        state = new InMemoryRoomState();
        service = state.service();
    }

    @Test
    void messagesSurviveUntilEmptyRoomRetentionEnds() {
        service.addParticipant(ROOM_ID, participant("alice", START));
        for (int i = 1; i <= 5; i++) {
            service.appendMessage(ROOM_ID, ChatMessage.system("message " + i, START));
        }

        service.removeParticipant(ROOM_ID, "alice");
        assertThat(service.listMessages(ROOM_ID)).hasSize(5);
        assertThat(service.listActiveRoomIds()).isEmpty();

        state.clock().advance(Duration.ofHours(1));
        assertThat(service.cleanupEmptyRooms()).isEmpty();
        assertThat(service.listMessages(ROOM_ID)).hasSize(5);

        state.clock().advance(Duration.ofHours(2).plusSeconds(1));
        assertThat(service.cleanupEmptyRooms()).containsExactly(ROOM_ID);
        assertThat(service.listMessages(ROOM_ID)).isEmpty();
    }

    @Test
    void clearRoomDataRemovesParticipantsAndMessagesImmediately() {
        service.addParticipant(ROOM_ID, participant("alice", START));
        service.appendMessage(ROOM_ID, ChatMessage.system("hello", START));

        service.clearRoomData(ROOM_ID);

        assertThat(service.countParticipants(ROOM_ID)).isZero();
        assertThat(service.listMessages(ROOM_ID)).isEmpty();
    }

    @Test
    void roomsAreIndependent() {
        service.addParticipant("room-a", participant("alice", START));
        service.addParticipant("room-b", participant("bob", START));
        service.appendMessage("room-a", ChatMessage.system("only in a", START));

        assertThat(service.listParticipants("room-b")).extracting(Participant::id).containsExactly("bob");
        assertThat(service.listMessages("room-b")).isEmpty();
        assertThat(service.listActiveRoomIds()).containsExactlyInAnyOrder("room-a", "room-b");
    }

    @Test
    void sweepDoesNotPurgeRoomWhileJoinHoldsItsLock() throws Exception {
        state.properties().setLockWait(Duration.ofMillis(50));
        service.addParticipant(ROOM_ID, participant("alice", START));
        service.appendMessage(ROOM_ID, ChatMessage.system("hello", START));
        service.removeParticipant(ROOM_ID, "alice");
        state.clock().advance(Duration.ofHours(4));

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService joiner = Executors.newSingleThreadExecutor();
        try {
            Future<?> join = joiner.submit(() -> service.runWithRoomLock(ROOM_ID, () -> {
                locked.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                service.addParticipant(ROOM_ID, participant("bob", state.clock().instant()));
            }));
            assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(service.cleanupEmptyRooms()).isEmpty();

            release.countDown();
            join.get(5, TimeUnit.SECONDS);
        } finally {
            joiner.shutdownNow();
        }

        assertThat(service.getParticipant(ROOM_ID, "bob")).isPresent();
        assertThat(service.listActiveRoomIds()).containsExactly(ROOM_ID);
        assertThat(service.listMessages(ROOM_ID)).hasSize(1);
        assertThat(service.cleanupEmptyRooms()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void joinAfterScanKeepsRoomAlive() {
        MutableClock clock = new MutableClock(START);
        RoomStateProperties properties = new RoomStateProperties();
        InMemoryRoomStateStore store = spy(new InMemoryRoomStateStore(clock, properties));
        LocalRoomLockManager locks = new LocalRoomLockManager(properties);
        ParticipantRegistry registry = new ParticipantRegistry(store, locks);
        RoomStateService sweeper = new RoomStateService(registry, new ChatLog(store, locks, properties), store, locks);

        registry.addOrUpdate(ROOM_ID, participant("alice", START));
        registry.remove(ROOM_ID, "alice");
        clock.advance(Duration.ofHours(4));

        doAnswer(invocation -> {
            List<String> candidates = (List<String>) invocation.callRealMethod();
            registry.addOrUpdate(ROOM_ID, participant("bob", clock.instant()));
            return candidates;
        }).when(store).findExpiredRoomIds();

        assertThat(sweeper.cleanupEmptyRooms()).isEmpty();
        assertThat(sweeper.getParticipant(ROOM_ID, "bob")).isPresent();
        assertThat(sweeper.listActiveRoomIds()).containsExactly(ROOM_ID);
    }
}
