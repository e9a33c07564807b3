package com.streamsync.watchparty.state.store;

import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 인메모리 RoomStateStore 구현체 (단일 노드 전용).
 *
 * 방마다 불변 스냅샷(RoomSnapshot)을 두고 ConcurrentHashMap.compute 로 통째로 교체한다.
 * 읽기는 락 없이 스냅샷 하나를 보므로 변경 도중의 상태를 볼 일이 없다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "watchparty.state.type", havingValue = "memory")
@RequiredArgsConstructor
public class InMemoryRoomStateStore implements RoomStateStore {

    private final ConcurrentMap<String, RoomSnapshot> rooms = new ConcurrentHashMap<>();

    private final Clock clock;
    private final RoomStateProperties properties;

    @Override
    public void saveParticipant(String roomId, Participant participant) {
        Instant now = clock.instant();
        rooms.compute(roomId, (key, current) -> {
            RoomSnapshot base = current != null ? current : RoomSnapshot.EMPTY;
            Map<String, Participant> participants = new HashMap<>(base.participants());
            participants.put(participant.id(), participant);
            return new RoomSnapshot(
                    Map.copyOf(participants),
                    base.messages(),
                    null,
                    now.plus(properties.getRoomExpiry())
            );
        });
    }

    @Override
    public void saveParticipants(String roomId, Collection<Participant> updates) {
        rooms.computeIfPresent(roomId, (key, current) -> {
            Map<String, Participant> participants = new HashMap<>(current.participants());
            boolean changed = false;
            for (Participant participant : updates) {
                if (participants.containsKey(participant.id())) {
                    participants.put(participant.id(), participant);
                    changed = true;
                }
            }
            return changed ? current.withParticipants(Map.copyOf(participants)) : current;
        });
    }

    @Override
    public boolean removeParticipant(String roomId, String participantId) {
        AtomicBoolean removed = new AtomicBoolean(false);
        Instant now = clock.instant();

        rooms.computeIfPresent(roomId, (key, current) -> {
            if (!current.participants().containsKey(participantId)) {
                return current;
            }
            removed.set(true);

            Map<String, Participant> participants = new HashMap<>(current.participants());
            participants.remove(participantId);

            if (participants.isEmpty()) {
                log.info("Room {} is now empty. Messages will be retained for {}.",
                        roomId, properties.getEmptyRoomRetention());
                return new RoomSnapshot(Map.of(), current.messages(), now, current.expiresAt());
            }
            return current.withParticipants(Map.copyOf(participants));
        });
        return removed.get();
    }

    @Override
    public Optional<Participant> findParticipant(String roomId, String participantId) {
        RoomSnapshot snapshot = rooms.get(roomId);
        if (snapshot == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.participants().get(participantId));
    }

    @Override
    public List<Participant> findParticipants(String roomId) {
        RoomSnapshot snapshot = rooms.get(roomId);
        return snapshot != null ? List.copyOf(snapshot.participants().values()) : List.of();
    }

    @Override
    public int countParticipants(String roomId) {
        RoomSnapshot snapshot = rooms.get(roomId);
        return snapshot != null ? snapshot.participants().size() : 0;
    }

    @Override
    public void appendMessage(String roomId, ChatMessage message, int capacity) {
        Instant now = clock.instant();
        rooms.compute(roomId, (key, current) -> {
            RoomSnapshot base = current != null ? current : RoomSnapshot.EMPTY;
            List<ChatMessage> messages = new ArrayList<>(base.messages());
            messages.add(message);
            int overflow = messages.size() - capacity;
            if (overflow > 0) {
                messages.subList(0, overflow).clear();
            }
            return new RoomSnapshot(
                    base.participants(),
                    List.copyOf(messages),
                    base.emptiedAt(),
                    now.plus(properties.getRoomExpiry())
            );
        });
    }

    @Override
    public List<ChatMessage> findMessages(String roomId) {
        RoomSnapshot snapshot = rooms.get(roomId);
        return snapshot != null ? snapshot.messages() : List.of();
    }

    @Override
    public void clearMessages(String roomId) {
        rooms.computeIfPresent(roomId, (key, current) -> current.withMessages(List.of()));
    }

    @Override
    public void clearRoom(String roomId) {
        rooms.remove(roomId);
    }

    @Override
    public Set<String> findActiveRoomIds() {
        return rooms.entrySet().stream()
                .filter(entry -> !entry.getValue().participants().isEmpty())
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public List<String> findExpiredRoomIds() {
        Instant now = clock.instant();
        return rooms.entrySet().stream()
                .filter(entry -> entry.getValue().isExpired(now, properties))
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public boolean purgeIfExpired(String roomId) {
        RoomSnapshot snapshot = rooms.get(roomId);
        return snapshot != null
                && snapshot.isExpired(clock.instant(), properties)
                && rooms.remove(roomId, snapshot);
    }

    /**
     * 방 하나의 상태. 모든 컬렉션은 불변이다.
     *
     * @param emptiedAt 마지막 참가자가 나간 시각. 참가자가 있으면 null.
     * @param expiresAt 안전망 만료 시각. 입장/메시지마다 갱신된다.
     */
    record RoomSnapshot(
            Map<String, Participant> participants,
            List<ChatMessage> messages,
            Instant emptiedAt,
            Instant expiresAt
    ) {

        static final RoomSnapshot EMPTY = new RoomSnapshot(Map.of(), List.of(), null, null);

        RoomSnapshot withParticipants(Map<String, Participant> participants) {
            return new RoomSnapshot(participants, messages, emptiedAt, expiresAt);
        }

        RoomSnapshot withMessages(List<ChatMessage> messages) {
            return new RoomSnapshot(participants, messages, emptiedAt, expiresAt);
        }

        boolean isExpired(Instant now, RoomStateProperties properties) {
            if (emptiedAt != null && !now.isBefore(emptiedAt.plus(properties.getEmptyRoomRetention()))) {
                return true;
            }
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
