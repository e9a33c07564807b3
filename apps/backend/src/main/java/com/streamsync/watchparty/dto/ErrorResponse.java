package com.streamsync.watchparty.dto;

public record ErrorResponse(String code, String message) {
}
