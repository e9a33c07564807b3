package com.streamsync.watchparty.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamsync.watchparty.model.Room;

/**
 * receivePlaybackUpdate, forceSyncPlayback 공용 페이로드.
 */
public record PlaybackStateResponse(double position, @JsonProperty("isPlaying") boolean playing) {

    public static PlaybackStateResponse of(Room room) {
        return new PlaybackStateResponse(room.getCurrentPosition(), room.isPlaying());
    }
}
