package com.example.creatorclaims.web.controller;

import com.example.creatorclaims.service.ProviderWebhookService;
import com.example.creatorclaims.service.ProviderWebhookService.Delivery;
import com.example.creatorclaims.web.dto.WebhookAckResponse;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Receives the scraping provider's result pushes. Every delivery with a job id is acknowledged
 * with 200 so the provider does not retry results that were already applied or are unknown.
 */
@RestController
@RequestMapping("/api/provider/webhook")
public class ProviderWebhookController {

    private static final Logger log = LoggerFactory.getLogger(ProviderWebhookController.class);

    private final ProviderWebhookService webhookService;

    public ProviderWebhookController(ProviderWebhookService webhookService) {
        this.webhookService = webhookService;
    }

    @PostMapping("/profile")
    public ResponseEntity<WebhookAckResponse> receiveProfile(@RequestHeader HttpHeaders headers,
                                                             @RequestBody(required = false) JsonNode payload) {
        Map<String, String> lowerCased = new HashMap<>();
        headers.forEach((name, values) -> {
            if (!values.isEmpty()) {
                lowerCased.put(name.toLowerCase(Locale.ROOT), values.get(0));
            }
        });

        Delivery delivery = webhookService.handleProfileDelivery(lowerCased, payload);
        log.debug("Webhook delivery for job {} handled: {}", delivery.snapshotId(), delivery.outcome());
        return ResponseEntity.ok(new WebhookAckResponse(
                delivery.snapshotId(), delivery.outcome().name().toLowerCase(Locale.ROOT)));
    }
}
