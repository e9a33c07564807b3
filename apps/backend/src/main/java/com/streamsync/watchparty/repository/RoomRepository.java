package com.streamsync.watchparty.repository;

import com.streamsync.watchparty.model.Room;
import java.util.Optional;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

@Repository
public interface RoomRepository extends MongoRepository<Room, String> {

    Optional<Room> findByInviteCode(String inviteCode);

    // 활성 방만 갱신, 반환값은 갱신된 문서 수
    @Query("{'_id': ?0, 'active': true}")
    @Update("{'$set': {'currentPosition': ?1, 'playing': ?2}}")
    long updatePlaybackState(String roomId, double position, boolean playing);

    // 영상 변경 시 처음부터 일시정지 상태로
    @Query("{'_id': ?0, 'active': true}")
    @Update("{'$set': {'videoUrl': ?1, 'currentPosition': 0, 'playing': false}}")
    long updateVideo(String roomId, String videoUrl);

    @Query("{'_id': ?0, 'active': true}")
    @Update("{'$set': {'syncMode': ?1}}")
    long updateSyncMode(String roomId, String syncMode);
}
