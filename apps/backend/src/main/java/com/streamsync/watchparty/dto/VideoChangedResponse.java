package com.streamsync.watchparty.dto;

public record VideoChangedResponse(String videoUrl, String videoTitle, String videoThumbnail) {
}
