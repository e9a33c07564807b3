package com.streamsync.watchparty.dto;

/**
 * participantJoinedNotice, participantLeftNotice 페이로드.
 */
public record ParticipantNoticeResponse(String roomId, String displayName) {
}
