package com.streamsync.watchparty.model;

import java.util.Arrays;
import java.util.Optional;

public enum SyncMode {
    STRICT("strict"),
    RELAXED("relaxed");

    private final String value;

    SyncMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<SyncMode> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(mode -> mode.value.equals(value))
                .findFirst();
    }
}
