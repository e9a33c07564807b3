package com.streamsync.watchparty.dto;

/**
 * seekVideo, reportPosition 공용. position 은 초 단위.
 */
public record PositionRequest(String roomId, Double position) {
}
