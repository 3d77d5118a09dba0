package com.example.smartparkinggate.model;

/**
 * A single text item reported by the recognition engine.
 *
 * @param confidence engine confidence on a 0-100 scale
 */
public record TextDetection(Type type, float confidence, String text) {

    public enum Type {
        LINE,
        WORD
    }
}
