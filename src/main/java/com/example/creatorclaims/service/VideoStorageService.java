package com.example.creatorclaims.service;

import com.example.creatorclaims.exceptions.VideoStorageException;
import org.springframework.web.multipart.MultipartFile;

public interface VideoStorageService {

    /**
     * Writes the uploaded file to the given relative path under the storage root.
     * Intermediate directories are created as needed.
     *
     * @param file        the uploaded video.
     * @param storagePath relative path, e.g. {@code 42/17/<uuid>.mp4}.
     * @return the relative path the file was written to.
     * @throws VideoStorageException if the path is invalid, already taken, or the write fails.
     */
    String store(MultipartFile file, String storagePath) throws VideoStorageException;

    /**
     * Deletes the file at the given relative path. Deleting a missing file is not an error.
     *
     * @throws VideoStorageException if the path is invalid or deletion fails.
     */
    void delete(String storagePath) throws VideoStorageException;

    boolean exists(String storagePath);
}
