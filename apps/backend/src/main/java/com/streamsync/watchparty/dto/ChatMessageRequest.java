package com.streamsync.watchparty.dto;

public record ChatMessageRequest(String roomId, String content) {
}
