package com.example.smartparkinggate.controller;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.model.LotStatusResponse;
import com.example.smartparkinggate.service.store.OccupancyStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/lot")
@Tag(name = "Lot", description = "Parking lot occupancy")
public class LotController {

    private final OccupancyStore occupancyStore;
    private final ParkingProperties properties;

    public LotController(OccupancyStore occupancyStore, ParkingProperties properties) {
        this.occupancyStore = occupancyStore;
        this.properties = properties;
    }

    @GetMapping
    @Operation(summary = "Retrieve current free slots", description = "A lot that has not seen an entry yet reports its full capacity.")
    public ResponseEntity<LotStatusResponse> status() {
        String lotId = properties.getLotId();
        long available = occupancyStore.findAvailableSlots(lotId).orElse((long) properties.getMaxSpots());
        return ResponseEntity.ok(new LotStatusResponse(lotId, available, properties.getMaxSpots()));
    }
}
