package com.streamsync.watchparty.state.lock;

import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.exception.ErrorCode;
import com.streamsync.watchparty.exception.RoomActionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 멀티 노드용 방 락 (Redisson RLock, 키: lock:room:{roomId}).
 *
 * lease 시간이 지나면 락이 자동 해제되므로 노드가 죽어도 방이 영구히 잠기지 않는다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "watchparty.state.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedissonRoomLockManager implements RoomLockManager {

    private static final String LOCK_KEY_PREFIX = "lock:room:";

    private final RedissonClient redissonClient;
    private final RoomStateProperties properties;

    @Override
    public <T> T withRoomLock(String roomId, Supplier<T> action) {
        RLock lock = redissonClient.getLock(LOCK_KEY_PREFIX + roomId);
        boolean acquired;
        try {
            acquired = lock.tryLock(
                    properties.getLockWait().toMillis(),
                    properties.getLockLease().toMillis(),
                    TimeUnit.MILLISECONDS);
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
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
