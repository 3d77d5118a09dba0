package com.example.smartparkinggate.service.image;

import com.example.smartparkinggate.config.ParkingProperties;
import com.example.smartparkinggate.exception.StorageWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Keeps captures under {@code <directory>/<bucket>/<key>} and publishes them
 * with the bucket's public URL layout.
 */
@Component
public class FileSystemImageStore implements ImageStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemImageStore.class);

    private final ParkingProperties.Images settings;

    public FileSystemImageStore(ParkingProperties properties) {
        this.settings = properties.getImages();
    }

    @Override
    public void put(String key, byte[] content, String contentType) {
        Path target;
        try {
            Path bucketRoot = Path.of(settings.getDirectory(), settings.getBucket()).toAbsolutePath().normalize();
            target = bucketRoot.resolve(key).normalize();
            if (!target.startsWith(bucketRoot)) {
                throw new StorageWriteException("Image key escapes the bucket: " + key);
            }
        } catch (InvalidPathException ex) {
            throw new StorageWriteException("Invalid image location for key " + key, ex);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
            log.debug("Stored {} bytes ({}) at {}", content.length, contentType, target);
        } catch (IOException ex) {
            throw new StorageWriteException("Failed to write image " + key + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String urlFor(String key) {
        return String.format(Locale.ROOT, "https://%s.s3.%s.amazonaws.com/%s",
                settings.getBucket(), settings.getRegion(), key);
    }
}
