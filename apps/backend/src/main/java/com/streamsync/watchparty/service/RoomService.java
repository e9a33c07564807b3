package com.streamsync.watchparty.service;

import com.streamsync.watchparty.model.Room;
import com.streamsync.watchparty.model.SyncMode;
import java.util.Optional;

/**
 * 방 메타데이터(영속) 서비스.
 *
 * 갱신 메서드는 성공 여부를 boolean 으로 돌려준다. 방이 없거나 종료되었으면 false.
 */
public interface RoomService {

    Optional<Room> findById(String roomId);

    /**
     * 캐시를 거치지 않고 저장소에서 바로 읽는다. 방 락 안에서 현재 재생 상태가 필요할 때 사용.
     */
    Optional<Room> findLatest(String roomId);

    Optional<Room> findByInviteCode(String inviteCode);

    /**
     * 공개 방이거나 비밀번호가 설정되지 않은 방이면 항상 true.
     */
    boolean validatePassword(String roomId, String password);

    boolean isAdmin(String roomId, String userId);

    /**
     * 방장이거나 현재 제어권자면 true.
     */
    boolean canControl(String roomId, String userId);

    /**
     * 음수 위치는 거절한다.
     */
    boolean updatePlaybackState(String roomId, double position, boolean playing);

    /**
     * 영상 URL 을 바꾸고 위치 0, 일시정지 상태로 되돌린다.
     */
    boolean updateVideoUrl(String roomId, String videoUrl);

    boolean updateSyncMode(String roomId, SyncMode syncMode);

    /**
     * 방장만 종료할 수 있다.
     */
    boolean endRoom(String roomId, String userId);
}
