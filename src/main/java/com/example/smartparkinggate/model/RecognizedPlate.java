package com.example.smartparkinggate.model;

import java.util.Objects;

public record RecognizedPlate(String text) {

    public static final String UNKNOWN_TEXT = "UNKNOWN";

    private static final RecognizedPlate UNKNOWN = new RecognizedPlate(UNKNOWN_TEXT);

    public RecognizedPlate {
        Objects.requireNonNull(text, "text");
    }

    public static RecognizedPlate unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return UNKNOWN_TEXT.equals(text);
    }
}
