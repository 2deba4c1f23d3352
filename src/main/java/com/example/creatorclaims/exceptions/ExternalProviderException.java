package com.example.creatorclaims.exceptions;

/**
 * The scraping provider is misconfigured or one of its calls failed.
 */
public class ExternalProviderException extends RuntimeException {

    private final boolean misconfigured;

    public ExternalProviderException(String message) {
        this(message, null, false);
    }

    public ExternalProviderException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private ExternalProviderException(String message, Throwable cause, boolean misconfigured) {
        super(message, cause);
        this.misconfigured = misconfigured;
    }

    public static ExternalProviderException misconfigured(String message) {
        return new ExternalProviderException(message, null, true);
    }

    public boolean isMisconfigured() {
        return misconfigured;
    }
}
