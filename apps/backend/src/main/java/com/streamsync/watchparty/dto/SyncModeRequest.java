package com.streamsync.watchparty.dto;

public record SyncModeRequest(String roomId, String syncMode) {
}
