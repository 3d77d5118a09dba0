package com.example.smartparkinggate.service.recognition;

import com.example.smartparkinggate.exception.RecognitionException;
import com.example.smartparkinggate.model.TextDetection;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Component
public class TesseractTextDetector implements TextDetector {

    private static final Logger log = LoggerFactory.getLogger(TesseractTextDetector.class);

    private final ITesseract tesseract;

    public TesseractTextDetector(ITesseract tesseract) {
        this.tesseract = Objects.requireNonNull(tesseract, "tesseract");
    }

    @Override
    public List<TextDetection> detectText(byte[] image) {
        BufferedImage bufferedImage = readImage(image);
        try {
            List<TextDetection> detections = new ArrayList<>();
            collect(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_TEXTLINE, TextDetection.Type.LINE, detections);
            collect(bufferedImage, ITessAPI.TessPageIteratorLevel.RIL_WORD, TextDetection.Type.WORD, detections);
            log.debug("Tesseract reported {} text items", detections.size());
            return detections;
        } catch (RuntimeException ex) {
            throw new RecognitionException("Tesseract failed: " + ex.getMessage(), ex);
        } catch (LinkageError ex) {
            // libtesseract missing or unloadable
            throw new RecognitionException("Tesseract native library unavailable: " + ex.getMessage(), ex);
        } catch (Error ex) {
            if ("Invalid memory access".equalsIgnoreCase(ex.getMessage())) {
                throw new RecognitionException(
                        "Tesseract native layer failed. Verify that the tessdata directory contains the configured language.",
                        ex);
            }
            throw ex;
        }
    }

    private void collect(BufferedImage image, int level, TextDetection.Type type, List<TextDetection> target) {
        List<Word> words = tesseract.getWords(image, level);
        if (words == null) {
            return;
        }
        for (Word word : words) {
            String text = word.getText() == null ? "" : word.getText().replace('\u0000', ' ').trim();
            if (!text.isEmpty()) {
                target.add(new TextDetection(type, word.getConfidence(), text));
            }
        }
    }

    private BufferedImage readImage(byte[] image) {
        try (ByteArrayInputStream inputStream = new ByteArrayInputStream(image)) {
            BufferedImage bufferedImage = ImageIO.read(inputStream);
            if (bufferedImage == null) {
                throw new RecognitionException("Unsupported image format");
            }
            return bufferedImage;
        } catch (IOException ex) {
            throw new RecognitionException("Failed to read capture: " + ex.getMessage(), ex);
        }
    }
}
