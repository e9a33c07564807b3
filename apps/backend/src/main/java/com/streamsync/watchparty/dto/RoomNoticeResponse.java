package com.streamsync.watchparty.dto;

/**
 * userKicked, roomClosed 페이로드.
 */
public record RoomNoticeResponse(String roomId, String reason) {
}
