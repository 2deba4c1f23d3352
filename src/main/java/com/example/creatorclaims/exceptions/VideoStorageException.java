package com.example.creatorclaims.exceptions;

/**
 * Low-level filesystem failure in the raw video bucket.
 */
public class VideoStorageException extends RuntimeException {
    public VideoStorageException(String message) {
        super(message);
    }

    public VideoStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
