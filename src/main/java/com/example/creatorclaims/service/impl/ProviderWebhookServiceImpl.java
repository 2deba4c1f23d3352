package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.exceptions.ExternalProviderException;
import com.example.creatorclaims.provider.ProviderPayloads;
import com.example.creatorclaims.provider.ScraperProviderClient;
import com.example.creatorclaims.provider.SnapshotStatus;
import com.example.creatorclaims.service.ProviderWebhookService;
import com.example.creatorclaims.service.SocialAccountVerifier;
import com.example.creatorclaims.service.SocialAccountVerifier.IngestOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Optional;

@Service
public class ProviderWebhookServiceImpl implements ProviderWebhookService {

    private static final Logger log = LoggerFactory.getLogger(ProviderWebhookServiceImpl.class);

    private final SocialAccountVerifier verifier;
    private final ScraperProviderClient providerClient;

    public ProviderWebhookServiceImpl(SocialAccountVerifier verifier, ScraperProviderClient providerClient) {
        this.verifier = verifier;
        this.providerClient = providerClient;
    }

    @Override
    public Delivery handleProfileDelivery(Map<String, String> headers, JsonNode payload) {
        String snapshotId = snapshotIdFromHeaders(headers)
                .or(() -> ProviderPayloads.findSnapshotId(payload))
                .orElseThrow(() -> {
                    log.warn("[Webhook] Delivery without a snapshot id rejected");
                    return new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing snapshot id.");
                });

        Optional<JsonNode> profile = ProviderPayloads.extractProfile(payload);
        if (profile.isPresent()) {
            log.info("[Webhook] Profile data received for job {}", snapshotId);
            return new Delivery(snapshotId, toDeliveryOutcome(verifier.ingestResultForSnapshot(snapshotId, profile.get())));
        }

        SnapshotStatus status = ProviderPayloads.findStatus(payload)
                .map(SnapshotStatus::fromProviderValue)
                .orElse(SnapshotStatus.NOT_READY);
        if (status == SnapshotStatus.FAILED) {
            boolean marked = verifier.markJobFailed(snapshotId);
            log.info("[Webhook] Provider reported job {} failed (applied={})", snapshotId, marked);
            return new Delivery(snapshotId, marked ? DeliveryOutcome.FAILED : DeliveryOutcome.ALREADY_RESOLVED);
        }
        if (status != SnapshotStatus.READY) {
            log.debug("[Webhook] Job {} notification without result (status {})", snapshotId, status);
            return new Delivery(snapshotId, DeliveryOutcome.PENDING);
        }

        // Ready notification without data: fetch once, the reconciler covers failures
        Optional<JsonNode> fetched;
        try {
            fetched = providerClient.fetchSnapshotData(snapshotId);
        } catch (ExternalProviderException e) {
            log.warn("[Webhook] Fetch for ready job {} failed, leaving it to the reconciler: {}",
                    snapshotId, e.getMessage());
            return new Delivery(snapshotId, DeliveryOutcome.PENDING);
        }
        if (fetched.isEmpty()) {
            log.debug("[Webhook] Job {} reported ready but has no data yet", snapshotId);
            return new Delivery(snapshotId, DeliveryOutcome.PENDING);
        }
        return new Delivery(snapshotId, toDeliveryOutcome(verifier.ingestResultForSnapshot(snapshotId, fetched.get())));
    }

    private static Optional<String> snapshotIdFromHeaders(Map<String, String> headers) {
        if (headers == null) {
            return Optional.empty();
        }
        for (String name : ProviderPayloads.SNAPSHOT_ID_HEADERS) {
            String value = headers.get(name);
            if (StringUtils.hasText(value)) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    private static DeliveryOutcome toDeliveryOutcome(IngestOutcome outcome) {
        return switch (outcome) {
            case VERIFIED -> DeliveryOutcome.VERIFIED;
            case FAILED -> DeliveryOutcome.FAILED;
            case ALREADY_RESOLVED -> DeliveryOutcome.ALREADY_RESOLVED;
            case UNKNOWN_SNAPSHOT -> DeliveryOutcome.IGNORED;
        };
    }
}
