package com.example.smartparkinggate.controller;

import com.example.smartparkinggate.model.GateDecision;
import com.example.smartparkinggate.model.GateRequest;
import com.example.smartparkinggate.model.GateResponse;
import com.example.smartparkinggate.model.GatewayEvent;
import com.example.smartparkinggate.service.GateRequestDecoder;
import com.example.smartparkinggate.service.ParkingGateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/gate")
@Tag(name = "Gate", description = "Entry and exit captures from the gate cameras")
public class ParkingGateController {

    private final ParkingGateService service;
    private final GateRequestDecoder decoder;

    public ParkingGateController(ParkingGateService service, GateRequestDecoder decoder) {
        this.service = service;
        this.decoder = decoder;
    }

    @Operation(
            summary = "Process a gate capture",
            description = "Reads the plate from a base64 encoded JPEG, updates lot occupancy and answers with the gate instruction.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "FULL, DENIED_NO_TEXT, OPEN_GATE or EXIT_SUCCESS",
                    content = @Content(mediaType = MediaType.TEXT_PLAIN_VALUE, schema = @Schema(implementation = String.class))),
            @ApiResponse(responseCode = "400", description = "IMAGE_DECODE_ERROR or INVALID_ACTION",
                    content = @Content(mediaType = MediaType.TEXT_PLAIN_VALUE))
    })
    @PostMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> capture(
            @Parameter(description = "ENTRY or EXIT, defaults to ENTRY")
            @RequestHeader(value = GateRequestDecoder.ACTION_HEADER_CANONICAL, required = false) String action,
            @RequestBody(required = false) String body) {
        GateDecision decision = service.handle(new GateRequest(action, body, true));
        return ResponseEntity.status(decision.statusCode())
                .contentType(MediaType.TEXT_PLAIN)
                .body(decision.message().name());
    }

    @Operation(
            summary = "Process a gateway envelope",
            description = "Accepts the proxy event an API gateway forwards and answers with a {statusCode, body} envelope.")
    @PostMapping(value = "/events",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GateResponse> event(@RequestBody GatewayEvent event) {
        String action = decoder.actionFromHeaders(event.headers());
        GateDecision decision = service.handle(new GateRequest(action, event.body(), event.base64Encoded()));
        return ResponseEntity.status(decision.statusCode()).body(GateResponse.from(decision));
    }
}
