package com.example.smartparkinggate.service.recognition;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.exception.RecognitionException;
import com.example.smartparkinggate.model.RecognizedPlate;
import com.example.smartparkinggate.model.TextDetection;
import com.example.smartparkinggate.service.CollaboratorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives a single plate string from the detector output: the first text
 * line whose confidence is above the configured threshold.
 */
@Service
public class PlateTextRecognizer {

    private static final Logger log = LoggerFactory.getLogger(PlateTextRecognizer.class);

    private final TextDetector detector;
    private final ParkingProperties properties;

    public PlateTextRecognizer(TextDetector detector, ParkingProperties properties) {
        this.detector = detector;
        this.properties = properties;
    }

    public CollaboratorResult<RecognizedPlate> recognize(byte[] image) {
        if (image == null || image.length == 0) {
            return CollaboratorResult.success(RecognizedPlate.unknown());
        }
        List<TextDetection> detections;
        try {
            detections = detector.detectText(image);
        } catch (RecognitionException ex) {
            return CollaboratorResult.failure(ex);
        }

        double threshold = properties.getRecognition().getConfidenceThreshold();
        List<String> lines = detections.stream()
                .filter(detection -> detection.type() == TextDetection.Type.LINE)
                .filter(detection -> detection.confidence() > threshold)
                .map(TextDetection::text)
                .filter(text -> text != null && !text.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        log.info("Plate read: {}", lines);

        if (lines.isEmpty()) {
            return CollaboratorResult.success(RecognizedPlate.unknown());
        }
        return CollaboratorResult.success(new RecognizedPlate(lines.get(0)));
    }
}
