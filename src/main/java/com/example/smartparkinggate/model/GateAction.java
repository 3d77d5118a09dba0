package com.example.smartparkinggate.model;

import java.util.Locale;
import java.util.Optional;

public enum GateAction {
    ENTRY,
    EXIT;

    public static Optional<GateAction> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (GateAction action : values()) {
            if (action.name().equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    public String keyPrefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
