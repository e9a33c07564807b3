package com.streamsync.watchparty.dto;

public record TransferControlRequest(String roomId, String targetParticipantId) {
}
