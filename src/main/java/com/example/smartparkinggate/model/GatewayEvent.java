package com.example.smartparkinggate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Proxy style envelope forwarded by an API gateway")
public record GatewayEvent(
        @Schema(description = "Request headers, looked up case-insensitively", example = "{\"x-parking-action\": \"ENTRY\"}")
        Map<String, String> headers,
        @Schema(description = "Base64 encoded JPEG capture") String body,
        @JsonProperty("isBase64Encoded")
        @Schema(description = "Whether the gateway base64 encoded the body", example = "true") boolean base64Encoded) {
}
