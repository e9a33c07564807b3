package com.streamsync.watchparty.dto;

public record HeartbeatResponse(double position) {
}
