package com.example.smartparkinggate.model;

import java.util.Objects;

public record GateDecision(int statusCode, GateMessage message) {

    public GateDecision {
        Objects.requireNonNull(message, "message");
    }

    public static GateDecision ok(GateMessage message) {
        return new GateDecision(200, message);
    }

    public static GateDecision badRequest(GateMessage message) {
        return new GateDecision(400, message);
    }
}
