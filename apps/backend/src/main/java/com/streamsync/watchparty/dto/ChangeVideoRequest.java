package com.streamsync.watchparty.dto;

public record ChangeVideoRequest(String roomId, String videoUrl, String videoTitle, String videoThumbnail) {
}
