package com.streamsync.watchparty.dto;

public record SyncModeChangedResponse(String syncMode) {
}
