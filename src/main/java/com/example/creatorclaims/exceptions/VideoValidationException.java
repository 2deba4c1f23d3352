package com.example.creatorclaims.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.server.ResponseStatusException;

/**
 * An uploaded raw video was rejected before anything was stored.
 */
public class VideoValidationException extends ResponseStatusException {

    public VideoValidationException(HttpStatusCode status, String reason) {
        super(status, reason);
    }

    public VideoValidationException(HttpStatusCode status, String reason, Throwable cause) {
        super(status, reason, cause);
    }

    public static VideoValidationException badRequest(String reason) {
        return new VideoValidationException(HttpStatus.BAD_REQUEST, reason);
    }
}
