package com.example.smartparkinggate.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Current occupancy of the parking lot")
public record LotStatusResponse(
        @Schema(description = "Lot identifier", example = "lot1") String lotId,
        @Schema(description = "Free slots as stored", example = "29") long availableSlots,
        @Schema(description = "Configured capacity", example = "30") int maxSpots) {
}
