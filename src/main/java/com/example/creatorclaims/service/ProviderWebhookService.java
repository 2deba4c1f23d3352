package com.example.creatorclaims.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Push-side delivery of provider results. Routes every usable delivery into the same
 * {@link SocialAccountVerifier} entry points the reconciler uses.
 */
public interface ProviderWebhookService {

    enum DeliveryOutcome {
        VERIFIED,
        FAILED,
        ALREADY_RESOLVED,
        /** No account waits on this snapshot id; acknowledged and dropped. */
        IGNORED,
        /** Nothing usable yet; the reconciler will pick the job up. */
        PENDING
    }

    record Delivery(String snapshotId, DeliveryOutcome outcome) {
    }

    /**
     * @param headers request headers, names lower-cased.
     * @throws org.springframework.web.server.ResponseStatusException 400 when no snapshot id can be found.
     */
    Delivery handleProfileDelivery(Map<String, String> headers, JsonNode payload);
}
