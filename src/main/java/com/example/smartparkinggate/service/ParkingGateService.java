package com.example.smartparkinggate.service;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.exception.ImageDecodeException;
import com.example.smartparkinggate.exception.StorageWriteException;
import com.example.smartparkinggate.model.GateAction;
import com.example.smartparkinggate.model.GateDecision;
import com.example.smartparkinggate.model.GateMessage;
import com.example.smartparkinggate.model.GateRequest;
import com.example.smartparkinggate.model.RecognizedPlate;
import com.example.smartparkinggate.service.image.ImageStore;
import com.example.smartparkinggate.service.recognition.PlateTextRecognizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Handles one gate capture end to end: decode, archive, read the plate and
 * route to the entry or exit flow.
 */
@Service
public class ParkingGateService {

    private static final Logger log = LoggerFactory.getLogger(ParkingGateService.class);

    static final String NO_CAPTURE_KEY = "error.jpg";
    private static final String CAPTURE_CONTENT_TYPE = "image/jpeg";

    private final GateRequestDecoder decoder;
    private final ImageStore imageStore;
    private final PlateTextRecognizer recognizer;
    private final EntryHandler entryHandler;
    private final ExitHandler exitHandler;
    private final ParkingProperties properties;
    private final Clock clock;

    public ParkingGateService(GateRequestDecoder decoder,
                              ImageStore imageStore,
                              PlateTextRecognizer recognizer,
                              EntryHandler entryHandler,
                              ExitHandler exitHandler,
                              ParkingProperties properties,
                              Clock clock) {
        this.decoder = decoder;
        this.imageStore = imageStore;
        this.recognizer = recognizer;
        this.entryHandler = entryHandler;
        this.exitHandler = exitHandler;
        this.properties = properties;
        this.clock = clock;
    }

    public GateDecision handle(GateRequest request) {
        log.info("Received capture: action header={}, body length={}",
                request.action(), request.body() == null ? 0 : request.body().length());

        String rawAction = decoder.resolveAction(request);
        log.info("Action detected: {}", rawAction);

        byte[] image;
        try {
            image = decoder.decodeImage(request);
        } catch (ImageDecodeException ex) {
            log.warn("Decoding error: {}", ex.getMessage());
            return GateDecision.badRequest(GateMessage.IMAGE_DECODE_ERROR);
        }

        Optional<GateAction> action = GateAction.parse(rawAction);
        if (action.isEmpty()) {
            log.warn("Rejecting unsupported action '{}'", rawAction);
            return GateDecision.badRequest(GateMessage.INVALID_ACTION);
        }

        String imageKey = archiveCapture(action.get(), image);

        RecognizedPlate plate = recognizer.recognize(image)
                .orElse(RecognizedPlate.unknown(),
                        error -> log.warn("Text recognition failed, treating plate as unknown: {}", error.getMessage()));

        if (action.get() == GateAction.ENTRY) {
            return entryHandler.handle(plate, imageKey);
        }
        return exitHandler.handle(plate);
    }

    private String archiveCapture(GateAction action, byte[] image) {
        if (!properties.isDebugMode() || image.length == 0) {
            return NO_CAPTURE_KEY;
        }
        String key = action.keyPrefix() + "_" + clock.instant().getEpochSecond() + ".jpg";
        storeCapture(key, image)
                .error()
                .ifPresent(error -> log.warn("Image upload failed: {}", error.getMessage()));
        return key;
    }

    private CollaboratorResult<Void> storeCapture(String key, byte[] image) {
        try {
            imageStore.put(key, image, CAPTURE_CONTENT_TYPE);
            return CollaboratorResult.done();
        } catch (StorageWriteException ex) {
            return CollaboratorResult.failure(ex);
        } catch (RuntimeException ex) {
            return CollaboratorResult.failure(new StorageWriteException("Image upload failed for " + key, ex));
        }
    }
}
