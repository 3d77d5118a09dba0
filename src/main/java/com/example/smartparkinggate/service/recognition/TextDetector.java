package com.example.smartparkinggate.service.recognition;

import com.example.smartparkinggate.exception.RecognitionException;
import com.example.smartparkinggate.model.TextDetection;

import java.util.List;

/**
 * Runs text detection on an encoded image. Implementations wrap an OCR
 * engine and report every line and word they find, unfiltered.
 */
public interface TextDetector {

    /**
     * @param image encoded image bytes, never empty
     * @return detections in reading order; empty when no text is found
     * @throws RecognitionException when the engine cannot process the image
     */
    List<TextDetection> detectText(byte[] image);
}
