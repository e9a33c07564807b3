package com.streamsync.watchparty.state.store;

import com.streamsync.watchparty.model.ChatMessage;
import com.streamsync.watchparty.model.Participant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 방 런타임 상태(참가자, 채팅) 저장소.
 *
 * 단일 서버에서는 프로세스 메모리에, 멀티 서버에서는 Redis 에 저장한다.
 * 두 구현은 같은 입력에 대해 같은 결과를 내야 한다.
 * 제어권 승계 같은 정책은 여기 두지 않고 ParticipantRegistry 가 이 인터페이스만 사용해서 처리한다.
 *
 * "활성 방"은 참가자가 한 명 이상 있는 방을 뜻한다.
 */
public interface RoomStateStore {

    /**
     * 참가자를 추가하거나 같은 id 의 참가자를 덮어쓴다.
     * 방의 빈 방 표시를 지우고 안전망 만료 시간을 갱신한다.
     */
    void saveParticipant(String roomId, Participant participant);

    /**
     * 이미 방에 있는 참가자들을 한 번에 덮어쓴다. 방에 없는 id 는 무시한다.
     */
    void saveParticipants(String roomId, Collection<Participant> participants);

    /**
     * @return 실제로 제거했으면 true. 없는 id 면 아무것도 하지 않고 false.
     * 마지막 참가자가 나가면 빈 방 보관 기간이 시작된다.
     */
    boolean removeParticipant(String roomId, String participantId);

    Optional<Participant> findParticipant(String roomId, String participantId);

    /**
     * 순서는 보장하지 않는다.
     */
    List<Participant> findParticipants(String roomId);

    int countParticipants(String roomId);

    /**
     * 메시지를 끝에 추가하고 capacity 를 넘는 오래된 메시지를 앞에서부터 버린다.
     */
    void appendMessage(String roomId, ChatMessage message, int capacity);

    /**
     * 오래된 순서로 반환한다.
     */
    List<ChatMessage> findMessages(String roomId);

    void clearMessages(String roomId);

    void clearRoom(String roomId);

    Set<String> findActiveRoomIds();

    /**
     * 빈 방 보관 기간이 지났거나 안전망 만료 시간이 지난 방 id. 아무것도 지우지 않는다.
     */
    List<String> findExpiredRoomIds();

    /**
     * 방이 여전히 만료 상태이면 삭제한다. 그 사이 누가 다시 들어왔으면 그대로 둔다.
     * 호출자가 방 락을 잡은 상태에서 불러야 한다.
     *
     * @return 삭제했으면 true
     */
    boolean purgeIfExpired(String roomId);
}
