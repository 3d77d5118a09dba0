package com.example.smartparkinggate.service.image;

import com.example.smartparkinggate.exception.StorageWriteException;

/**
 * Write-only store for raw gate captures. Stored objects are only ever
 * referenced through {@link #urlFor(String)}.
 */
public interface ImageStore {

    /**
     * @throws StorageWriteException when the bytes cannot be written
     */
    void put(String key, byte[] content, String contentType);

    String urlFor(String key);
}
