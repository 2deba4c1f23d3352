package com.example.creatorclaims.exceptions;

/**
 * The video object could not be written to storage. No metadata row exists for it.
 */
public class UploadException extends RuntimeException {
    public UploadException(String message) {
        super(message);
    }

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
