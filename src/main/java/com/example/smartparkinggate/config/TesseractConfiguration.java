package com.example.smartparkinggate.config;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.util.LoadLibs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

@Configuration
public class TesseractConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseractConfiguration.class);

    static final String TESSDATA_PREFIX = "TESSDATA_PREFIX";

    @Bean
    public ITesseract tesseract(ParkingProperties properties) {
        ParkingProperties.Recognition recognition = properties.getRecognition();
        String language = recognition.getLanguage();

        Tesseract tesseract = new Tesseract();
        String dataPath = resolveDataPath(recognition.getTessdataPath(), System.getenv(TESSDATA_PREFIX), language)
                .orElseGet(() -> {
                    String bundled = LoadLibs.extractTessResources("tessdata").getAbsolutePath();
                    log.warn("No tessdata with {}.traineddata configured; using bundled tessdata at {}", language, bundled);
                    return bundled;
                });
        log.info("Tesseract data path: {}, language: {}", dataPath, language);
        tesseract.setDatapath(dataPath);
        tesseract.setLanguage(language);
        tesseract.setOcrEngineMode(1); // LSTM only
        tesseract.setPageSegMode(11); // sparse text, plates rarely form a block
        return tesseract;
    }

    /**
     * First of the configured path and the environment prefix that holds the
     * language's traineddata file.
     */
    static Optional<String> resolveDataPath(String configured, String environment, String language) {
        return Stream.of(configured, environment)
                .filter(candidate -> candidate != null && !candidate.isBlank())
                .map(candidate -> Path.of(candidate.trim()))
                .filter(path -> Files.isRegularFile(path.resolve(language + ".traineddata")))
                .map(Path::toString)
                .findFirst();
    }
}
