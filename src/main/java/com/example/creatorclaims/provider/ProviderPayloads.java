package com.example.creatorclaims.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered structural probes over the provider's loosely shaped JSON documents.
 * Each lookup walks its probe list and returns the first non-blank scalar found.
 */
public final class ProviderPayloads {

    public static final List<String> SNAPSHOT_ID_HEADERS =
            List.of("x-snapshot-id", "snapshot-id", "x-brightdata-snapshot-id");

    static final List<String> SNAPSHOT_ID_PROBES = List.of(
            "snapshot_id", "id", "snapshotId", "snapshot", "collection_id",
            "input.snapshot_id", "input.id", "metadata.snapshot_id", "_snapshot_id");

    // A scraped profile record carries its own "id" (the profile's), so the job id only comes from job fields
    static final List<String> PROFILE_RECORD_SNAPSHOT_ID_PROBES = List.of(
            "snapshot_id", "snapshotId", "input.snapshot_id", "input.id", "metadata.snapshot_id",
            "_snapshot_id", "snapshot", "collection_id");

    static final List<String> TRIGGER_ID_PROBES = List.of("snapshot_id", "id", "collection_id");

    static final List<String> STATUS_PROBES = List.of("status", "state");

    private static final List<String> RESULT_WRAPPER_FIELDS = List.of("data", "result", "results");

    // Keys a bare job notification carries; anything beyond these is treated as profile content
    private static final Set<String> NOTIFICATION_FIELDS = Set.of(
            "snapshot_id", "snapshotId", "snapshot", "collection_id", "id", "_snapshot_id",
            "status", "state", "error", "message", "metadata", "input", "dataset_id", "timestamp");

    private ProviderPayloads() {
    }

    /**
     * Finds the job id in a webhook body. Arrays are probed through their first element.
     * When that element is itself a profile record its top-level {@code id} is not a job id.
     */
    public static Optional<String> findSnapshotId(JsonNode payload) {
        JsonNode record = firstRecord(payload);
        return firstText(record, isProfileRecord(record) ? PROFILE_RECORD_SNAPSHOT_ID_PROBES : SNAPSHOT_ID_PROBES);
    }

    /**
     * Finds the job id in a trigger response, e.g. {@code [{"snapshot_id": "s_1"}]} or {@code {"id": "s_1"}}.
     */
    public static Optional<String> findTriggerSnapshotId(JsonNode response) {
        return firstText(firstRecord(response), TRIGGER_ID_PROBES);
    }

    public static Optional<String> findStatus(JsonNode payload) {
        return firstText(firstRecord(payload), STATUS_PROBES);
    }

    /**
     * Extracts the profile document from a webhook body.
     * <ul>
     *     <li>{@code [profile, ...]}: the first element</li>
     *     <li>{@code {snapshot_id, data|result|results: ...}}: the first wrapped record</li>
     *     <li>a bare profile object: itself</li>
     *     <li>a notification carrying only job fields: empty</li>
     * </ul>
     */
    public static Optional<JsonNode> extractProfile(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Optional.empty();
        }
        if (payload.isArray()) {
            JsonNode first = firstRecord(payload);
            return first.isObject() && first.size() > 0 ? Optional.of(first) : Optional.empty();
        }
        if (!payload.isObject()) {
            return Optional.empty();
        }
        for (String wrapper : RESULT_WRAPPER_FIELDS) {
            JsonNode wrapped = payload.get(wrapper);
            if (wrapped != null && (wrapped.isObject() || wrapped.isArray())) {
                JsonNode record = firstRecord(wrapped);
                return record.isObject() && record.size() > 0 ? Optional.of(record) : Optional.empty();
            }
        }
        return hasProfileFields(payload) ? Optional.of(payload) : Optional.empty();
    }

    private static boolean isProfileRecord(JsonNode record) {
        if (record == null || !record.isObject()) {
            return false;
        }
        for (String wrapper : RESULT_WRAPPER_FIELDS) {
            if (record.has(wrapper)) {
                return false;
            }
        }
        return hasProfileFields(record);
    }

    private static boolean hasProfileFields(JsonNode node) {
        var names = node.fieldNames();
        while (names.hasNext()) {
            if (!NOTIFICATION_FIELDS.contains(names.next())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reduces an array to its first element; other nodes are returned as-is.
     */
    public static JsonNode firstRecord(JsonNode node) {
        if (node != null && node.isArray()) {
            return node.isEmpty() ? node : node.get(0);
        }
        return node;
    }

    /**
     * Returns the first probe path (dot separated) that resolves to a non-blank scalar.
     */
    public static Optional<String> firstText(JsonNode node, List<String> probes) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String probe : probes) {
            JsonNode current = node;
            for (String segment : probe.split("\\.")) {
                current = current == null ? null : current.get(segment);
            }
            if (current != null && current.isValueNode() && !current.isNull()) {
                String text = current.asText().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }
}
