package com.example.smartparkinggate.model;

/**
 * Inbound capture as received from the gate camera.
 *
 * @param action        raw action header value, {@code null} when the header is absent
 * @param body          base64 encoded image
 * @param base64Encoded transport flag reported by the caller; decoding does not depend on it
 */
public record GateRequest(String action, String body, boolean base64Encoded) {
}
