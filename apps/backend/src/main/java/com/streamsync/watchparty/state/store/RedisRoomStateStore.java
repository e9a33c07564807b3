package com.streamsync.watchparty.state.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamsync.watchparty.config.RoomStateProperties;
import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis 기반 RoomStateStore 구현체.
 *
 * [왜 Redis를 사용하는가?]
 * - 같은 방의 참가자가 서로 다른 서버에 연결될 수 있음
 * - 참가자 목록과 채팅 기록은 모든 서버가 같은 값을 봐야 함
 *
 * [키 구조]
 * - room:{roomId}:participants : Hash (participantId → Participant JSON)
 * - room:{roomId}:messages     : List (ChatMessage JSON, 오래된 순)
 * - active_rooms               : Set (참가자가 있는 방 id)
 * - empty_rooms                : Sorted Set (방 id, score = 비워진 시각 epoch millis)
 *
 * [TTL]
 * - 입장/메시지 추가 시 24시간 안전망 TTL 갱신
 * - 방이 비면 메시지 키 TTL 을 보관 기간(기본 3시간)으로 줄이고 empty_rooms 에 기록
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "watchparty.state.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisRoomStateStore implements RoomStateStore {

    static final String ACTIVE_ROOMS_KEY = "active_rooms";
    static final String EMPTY_ROOMS_KEY = "empty_rooms";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RoomStateProperties properties;

    @Override
    public void saveParticipant(String roomId, Participant participant) {
        String participantsKey = participantsKey(roomId);
        hashOps().put(participantsKey, participant.id(), toJson(participant));
        redisTemplate.expire(participantsKey, properties.getRoomExpiry());
        redisTemplate.expire(messagesKey(roomId), properties.getRoomExpiry());

        redisTemplate.opsForSet().add(ACTIVE_ROOMS_KEY, roomId);
        redisTemplate.opsForZSet().remove(EMPTY_ROOMS_KEY, roomId);
    }

    @Override
    public void saveParticipants(String roomId, Collection<Participant> participants) {
        String participantsKey = participantsKey(roomId);
        Set<String> existing = hashOps().keys(participantsKey);

        Map<String, String> entries = new LinkedHashMap<>();
        for (Participant participant : participants) {
            if (existing.contains(participant.id())) {
                entries.put(participant.id(), toJson(participant));
            }
        }
        if (!entries.isEmpty()) {
            hashOps().putAll(participantsKey, entries);
        }
    }

    @Override
    public boolean removeParticipant(String roomId, String participantId) {
        String participantsKey = participantsKey(roomId);
        Long removed = hashOps().delete(participantsKey, participantId);
        if (removed == null || removed == 0) {
            return false;
        }

        Long remaining = hashOps().size(participantsKey);
        if (remaining == null || remaining == 0) {
            markEmpty(roomId);
        }
        return true;
    }

    @Override
    public Optional<Participant> findParticipant(String roomId, String participantId) {
        String json = hashOps().get(participantsKey(roomId), participantId);
        return json != null ? fromJson(json, Participant.class) : Optional.empty();
    }

    @Override
    public List<Participant> findParticipants(String roomId) {
        List<String> values = hashOps().values(participantsKey(roomId));
        List<Participant> participants = new ArrayList<>(values.size());
        for (String json : values) {
            fromJson(json, Participant.class).ifPresent(participants::add);
        }
        return participants;
    }

    @Override
    public int countParticipants(String roomId) {
        Long size = hashOps().size(participantsKey(roomId));
        return size != null ? size.intValue() : 0;
    }

    /**
     * RPUSH 후 LTRIM -capacity -1 로 최근 메시지만 남긴다.
     */
    @Override
    public void appendMessage(String roomId, ChatMessage message, int capacity) {
        String messagesKey = messagesKey(roomId);
        ListOperations<String, String> listOps = redisTemplate.opsForList();
        listOps.rightPush(messagesKey, toJson(message));
        listOps.trim(messagesKey, -capacity, -1);
        redisTemplate.expire(messagesKey, properties.getRoomExpiry());
    }

    @Override
    public List<ChatMessage> findMessages(String roomId) {
        List<String> values = redisTemplate.opsForList().range(messagesKey(roomId), 0, -1);
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<ChatMessage> messages = new ArrayList<>(values.size());
        for (String json : values) {
            fromJson(json, ChatMessage.class).ifPresent(messages::add);
        }
        return messages;
    }

    @Override
    public void clearMessages(String roomId) {
        redisTemplate.delete(messagesKey(roomId));
    }

    @Override
    public void clearRoom(String roomId) {
        redisTemplate.delete(List.of(participantsKey(roomId), messagesKey(roomId)));
        redisTemplate.opsForSet().remove(ACTIVE_ROOMS_KEY, roomId);
        redisTemplate.opsForZSet().remove(EMPTY_ROOMS_KEY, roomId);
        log.debug("Redis 방 상태 삭제 - roomId: {}", roomId);
    }

    @Override
    public Set<String> findActiveRoomIds() {
        Set<String> members = redisTemplate.opsForSet().members(ACTIVE_ROOMS_KEY);
        return members != null ? members : Set.of();
    }

    /**
     * 보관 기간이 지난 빈 방과, TTL 로 참가자 해시가 사라졌는데 active_rooms 에 남은 방.
     */
    @Override
    public List<String> findExpiredRoomIds() {
        long cutoff = retentionCutoff();
        Set<String> candidates = new HashSet<>();

        Set<String> expired = redisTemplate.opsForZSet().rangeByScore(EMPTY_ROOMS_KEY, 0, cutoff);
        if (expired != null) {
            candidates.addAll(expired);
        }
        for (String roomId : findActiveRoomIds()) {
            if (!Boolean.TRUE.equals(redisTemplate.hasKey(participantsKey(roomId)))) {
                candidates.add(roomId);
            }
        }
        return new ArrayList<>(candidates);
    }

    @Override
    public boolean purgeIfExpired(String roomId) {
        if (countParticipants(roomId) > 0) {
            return false;
        }
        Double emptiedAt = redisTemplate.opsForZSet().score(EMPTY_ROOMS_KEY, roomId);
        boolean retentionOver = emptiedAt != null && emptiedAt <= retentionCutoff();
        boolean orphaned = Boolean.TRUE.equals(redisTemplate.opsForSet().isMember(ACTIVE_ROOMS_KEY, roomId));
        if (!retentionOver && !orphaned) {
            return false;
        }
        clearRoom(roomId);
        return true;
    }

    private long retentionCutoff() {
        return clock.millis() - properties.getEmptyRoomRetention().toMillis();
    }

    private void markEmpty(String roomId) {
        redisTemplate.opsForSet().remove(ACTIVE_ROOMS_KEY, roomId);
        redisTemplate.opsForZSet().add(EMPTY_ROOMS_KEY, roomId, clock.millis());
        redisTemplate.expire(messagesKey(roomId), properties.getEmptyRoomRetention());
        log.info("Room {} is now empty. Messages will be retained for {}.",
                roomId, properties.getEmptyRoomRetention());
    }

    private HashOperations<String, String, String> hashOps() {
        return redisTemplate.opsForHash();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Redis 방 상태 직렬화 실패 - type: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("방 상태 저장 실패", e);
        }
    }

    private <T> Optional<T> fromJson(String json, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("Redis 방 상태 역직렬화 실패 - type: {}", type.getSimpleName(), e);
            return Optional.empty();
        }
    }

    static String participantsKey(String roomId) {
        return "room:" + roomId + ":participants";
    }

    static String messagesKey(String roomId) {
        return "room:" + roomId + ":messages";
    }
}
