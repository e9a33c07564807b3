package com.streamsync.watchparty.state.lock;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 단일 노드용 방 락. 방마다 ReentrantLock 하나.
 *
 * 락 객체는 weakValues 캐시에 두므로 아무도 잡고 있지 않은 방의 락은 GC 대상이 된다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "watchparty.state.type", havingValue = "memory")
public class LocalRoomLockManager implements RoomLockManager {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(roomId -> new ReentrantLock());

    private final RoomStateProperties properties;

    public LocalRoomLockManager(RoomStateProperties properties) {
        this.properties = properties;
    }

    @Override
    public <T> T withRoomLock(String roomId, Supplier<T> action) {
        ReentrantLock lock = locks.get(roomId);
        boolean acquired;
        try {
            acquired = lock.tryLock(properties.getLockWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RoomActionException(ErrorCode.ROOM_BUSY, ErrorCode.ROOM_BUSY.getMessage(), e);
        }

        if (!acquired) {
            log.warn("Room lock timeout - roomId: {}, wait: {}", roomId, properties.getLockWait());
            throw new RoomActionException(ErrorCode.ROOM_BUSY);
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
