package com.streamsync.watchparty.state.lock;

import static org.assertj.core.api.Assertions.*;

import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocalRoomLockManagerTest {

    private LocalRoomLockManager lockManager;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        RoomStateProperties properties = new RoomStateProperties();
        properties.setLockWait(Duration.ofMillis(50));
        lockManager = new LocalRoomLockManager(properties);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void lockIsReentrant() {
        String result = lockManager.withRoomLock("room-1", () ->
                lockManager.withRoomLock("room-1", () -> "nested"));

        assertThat(result).isEqualTo("nested");
    }

    @Test
    void failsWithRoomBusyWhenLockIsHeldElsewhere() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> lockManager.runWithRoomLock("room-1", () -> {
            acquired.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> lockManager.runWithRoomLock("room-1", () -> { }))
                    .isInstanceOf(RoomActionException.class)
                    .extracting(e -> ((RoomActionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ROOM_BUSY);
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void differentRoomsDoNotBlockEachOther() throws Exception {
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<?> holder = executor.submit(() -> lockManager.runWithRoomLock("room-1", () -> {
            acquired.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

        try {
            assertThat(lockManager.withRoomLock("room-2", () -> "done")).isEqualTo("done");
        } finally {
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void releasesLockWhenActionThrows() {
        assertThatThrownBy(() -> lockManager.runWithRoomLock("room-1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lockManager.withRoomLock("room-1", () -> true)).isTrue();
    }
}
