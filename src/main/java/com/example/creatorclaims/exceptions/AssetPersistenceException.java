package com.example.creatorclaims.exceptions;

/**
 * The asset metadata insert failed after its object was stored. The object has already been
 * removed by the time this is thrown, unless {@link #isObjectOrphaned()} says otherwise.
 */
public class AssetPersistenceException extends RuntimeException {

    private final boolean objectOrphaned;

    public AssetPersistenceException(String message, Throwable cause, boolean objectOrphaned) {
        super(message, cause);
        this.objectOrphaned = objectOrphaned;
    }

    public boolean isObjectOrphaned() {
        return objectOrphaned;
    }
}
