package com.streamsync.watchparty.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.streamsync.watchparty.model.Room;
import com.streamsync.watchparty.model.SyncMode;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

/**
 * 방 메타데이터 조회 캐시.
 *
 * 재생/채팅 이벤트마다 방을 조회하므로 짧게 캐시한다.
 * 갱신은 원본 서비스에 위임한 뒤 해당 방 캐시를 무효화한다.
 * 다른 서버의 갱신은 무효화되지 않으므로 최신 재생 상태가 필요하면 findLatest 를 쓴다.
 *
 * Room 은 변경 가능한 객체라서 캐시에 넣을 때와 꺼낼 때 모두 복사한다.
 */
@Slf4j
@Primary
@Service
public class CachingRoomService implements RoomService {

    private static final Duration CACHE_TTL = Duration.ofSeconds(5);
    private static final long MAX_CACHED_ROOMS = 10_000;

    private final RoomService delegate;

    private final Cache<String, Room> rooms = Caffeine.newBuilder()
            .expireAfterWrite(CACHE_TTL)
            .maximumSize(MAX_CACHED_ROOMS)
            .build();

    public CachingRoomService(@Qualifier("mongoRoomService") RoomService delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<Room> findById(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        Room cached = rooms.getIfPresent(roomId);
        if (cached != null) {
            return Optional.of(copyOf(cached));
        }
        return load(delegate.findById(roomId));
    }

    @Override
    public Optional<Room> findLatest(String roomId) {
        if (roomId == null) {
            return Optional.empty();
        }
        return load(delegate.findLatest(roomId));
    }

    @Override
    public Optional<Room> findByInviteCode(String inviteCode) {
        return load(delegate.findByInviteCode(inviteCode));
    }

    @Override
    public boolean validatePassword(String roomId, String password) {
        return delegate.validatePassword(roomId, password);
    }

    @Override
    public boolean isAdmin(String roomId, String userId) {
        return findById(roomId).map(room -> room.isAdmin(userId)).orElse(false);
    }

    @Override
    public boolean canControl(String roomId, String userId) {
        return delegate.canControl(roomId, userId);
    }

    @Override
    public boolean updatePlaybackState(String roomId, double position, boolean playing) {
        try {
            return delegate.updatePlaybackState(roomId, position, playing);
        } finally {
            evict(roomId);
        }
    }

    @Override
    public boolean updateVideoUrl(String roomId, String videoUrl) {
        try {
            return delegate.updateVideoUrl(roomId, videoUrl);
        } finally {
            evict(roomId);
        }
    }

    @Override
    public boolean updateSyncMode(String roomId, SyncMode syncMode) {
        try {
            return delegate.updateSyncMode(roomId, syncMode);
        } finally {
            evict(roomId);
        }
    }

    @Override
    public boolean endRoom(String roomId, String userId) {
        try {
            return delegate.endRoom(roomId, userId);
        } finally {
            evict(roomId);
        }
    }

    private Optional<Room> load(Optional<Room> room) {
        room.ifPresent(found -> rooms.put(found.getId(), copyOf(found)));
        return room;
    }

    private static Room copyOf(Room room) {
        return room.toBuilder().build();
    }

    public void evict(String roomId) {
        rooms.invalidate(roomId);
        log.debug("Room cache evicted - roomId: {}", roomId);
    }
}
