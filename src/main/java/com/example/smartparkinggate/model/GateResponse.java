package com.example.smartparkinggate.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Gate decision in gateway envelope form")
public record GateResponse(
        @Schema(description = "HTTP status of the decision", example = "200") int statusCode,
        @Schema(description = "Gate instruction", example = "OPEN_GATE") String body) {

    public static GateResponse from(GateDecision decision) {
        return new GateResponse(decision.statusCode(), decision.message().name());
    }
}
