package com.streamsync.watchparty.service;

import com.streamsync.watchparty.model.Participant;
import com.streamsync.watchparty.model.Room;
import com.streamsync.watchparty.model.SyncMode;
import com.streamsync.watchparty.repository.RoomRepository;
import com.streamsync.watchparty.state.RoomStateService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MongoRoomService implements RoomService {

    private final RoomRepository roomRepository;
    private final RoomStateService roomStateService;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Override
    public Optional<Room> findById(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            return Optional.empty();
        }
        return roomRepository.findById(roomId);
    }

    @Override
    public Optional<Room> findLatest(String roomId) {
        return findById(roomId);
    }

    @Override
    public Optional<Room> findByInviteCode(String inviteCode) {
        if (inviteCode == null || inviteCode.isBlank()) {
            return Optional.empty();
        }
        return roomRepository.findByInviteCode(inviteCode);
    }

    @Override
    public boolean validatePassword(String roomId, String password) {
        Optional<Room> room = findById(roomId);
        if (room.isEmpty()) {
            return false;
        }

        String passwordHash = room.get().getPasswordHash();
        if (!room.get().isPrivateRoom() || passwordHash == null || passwordHash.isBlank()) {
            return true;
        }
        return password != null && passwordEncoder.matches(password, passwordHash);
    }

    @Override
    public boolean isAdmin(String roomId, String userId) {
        return findById(roomId).map(room -> room.isAdmin(userId)).orElse(false);
    }

    @Override
    public boolean canControl(String roomId, String userId) {
        if (isAdmin(roomId, userId)) {
            return true;
        }
        return roomStateService.getParticipant(roomId, userId)
                .map(Participant::hasControl)
                .orElse(false);
    }

    @Override
    public boolean updatePlaybackState(String roomId, double position, boolean playing) {
        if (position < 0 || Double.isNaN(position)) {
            log.warn("Rejected playback update with invalid position - roomId: {}, position: {}", roomId, position);
            return false;
        }
        try {
            return roomRepository.updatePlaybackState(roomId, position, playing) > 0;
        } catch (DataAccessException e) {
            log.error("Failed to update playback state - roomId: {}", roomId, e);
            return false;
        }
    }

    @Override
    public boolean updateVideoUrl(String roomId, String videoUrl) {
        try {
            return roomRepository.updateVideo(roomId, videoUrl) > 0;
        } catch (DataAccessException e) {
            log.error("Failed to update video - roomId: {}", roomId, e);
            return false;
        }
    }

    @Override
    public boolean updateSyncMode(String roomId, SyncMode syncMode) {
        try {
            return roomRepository.updateSyncMode(roomId, syncMode.getValue()) > 0;
        } catch (DataAccessException e) {
            log.error("Failed to update sync mode - roomId: {}", roomId, e);
            return false;
        }
    }

    @Override
    public boolean endRoom(String roomId, String userId) {
        Optional<Room> found = findById(roomId);
        if (found.isEmpty()) {
            return false;
        }

        Room room = found.get();
        if (!room.isAdmin(userId) || !room.isActive()) {
            return false;
        }

        room.setActive(false);
        room.setEndedAt(LocalDateTime.now(clock));
        try {
            roomRepository.save(room);
        } catch (DataAccessException e) {
            log.error("Failed to end room - roomId: {}", roomId, e);
            return false;
        }
        log.info("Room ended - roomId: {}, by: {}", roomId, userId);
        return true;
    }
}
