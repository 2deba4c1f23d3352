package com.example.creatorclaims.provider;

import java.util.Locale;
import java.util.Set;

/**
 * Provider job state as seen by a status poll.
 */
public enum SnapshotStatus {
    READY,
    NOT_READY,
    FAILED,
    NOT_FOUND;

    private static final Set<String> READY_WORDS = Set.of("ready", "completed", "done", "success");
    private static final Set<String> FAILED_WORDS = Set.of("failed", "error");

    /**
     * Maps the provider's free-form status word. Unknown or missing words mean the job is still running.
     */
    public static SnapshotStatus fromProviderValue(String value) {
        if (value == null) {
            return NOT_READY;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (READY_WORDS.contains(normalized)) {
            return READY;
        }
        if (FAILED_WORDS.contains(normalized)) {
            return FAILED;
        }
        return NOT_READY;
    }
}
