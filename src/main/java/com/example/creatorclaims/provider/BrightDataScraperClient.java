package com.example.creatorclaims.provider;

import com.example.creatorclaims.config.ProviderProperties;
import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.exceptions.ExternalProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bright Data dataset API: {@code /datasets/v3/trigger}, {@code /snapshot/{id}} and {@code /snapshot/{id}/data}.
 */
@Component
public class BrightDataScraperClient implements ScraperProviderClient {

    private static final Logger log = LoggerFactory.getLogger(BrightDataScraperClient.class);

    private final RestTemplate restTemplate;
    private final ProviderProperties properties;

    public BrightDataScraperClient(RestTemplate providerRestTemplate, ProviderProperties properties) {
        this.restTemplate = providerRestTemplate;
        this.properties = properties;
    }

    @Override
    public void assertConfigured(Platform platform) {
        if (!properties.hasApiKey()) {
            throw ExternalProviderException.misconfigured("Scraping provider API key is not configured");
        }
        String datasetId = properties.getDatasets().forPlatform(platform);
        if (datasetId == null || datasetId.isBlank()) {
            throw ExternalProviderException.misconfigured(
                    "No profile dataset configured for platform " + platform.value());
        }
    }

    @Override
    public String triggerProfileScrape(Platform platform, String profileUrl) {
        assertConfigured(platform);
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path("/datasets/v3/trigger")
                .queryParam("dataset_id", properties.getDatasets().forPlatform(platform))
                .queryParam("format", "json")
                .queryParam("uncompressed_webhook", "true")
                .queryParam("include_errors", "true");
        if (properties.getWebhookUrl() != null && !properties.getWebhookUrl().isBlank()) {
            uri.queryParam("webhook_url", properties.getWebhookUrl());
        }
        URI triggerUri = uri.encode().build().toUri();

        HttpEntity<List<Map<String, String>>> request =
                new HttpEntity<>(List.of(Map.of("url", profileUrl)), authHeaders(MediaType.APPLICATION_JSON));

        log.info("[Provider] Triggering {} profile scrape for {}", platform.value(), profileUrl);
        JsonNode body;
        try {
            body = restTemplate.exchange(triggerUri, HttpMethod.POST, request, JsonNode.class).getBody();
        } catch (RestClientResponseException e) {
            log.error("[Provider] Trigger rejected with status {}: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ExternalProviderException("Provider rejected the scrape request (" + e.getStatusCode().value() + ")", e);
        } catch (RestClientException e) {
            throw new ExternalProviderException("Provider trigger call failed: " + e.getMessage(), e);
        }

        String snapshotId = ProviderPayloads.findTriggerSnapshotId(body)
                .orElseThrow(() -> new ExternalProviderException("Provider response did not include a snapshot id"));
        log.info("[Provider] Scrape job {} accepted for {}", snapshotId, profileUrl);
        return snapshotId;
    }

    @Override
    public SnapshotStatus getSnapshotStatus(String snapshotId) {
        URI statusUri = snapshotUri(snapshotId, false);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    statusUri, HttpMethod.GET, new HttpEntity<>(authHeaders(null)), JsonNode.class);
            SnapshotStatus status = SnapshotStatus.fromProviderValue(
                    ProviderPayloads.findStatus(response.getBody()).orElse(null));
            log.debug("[Provider] Snapshot {} status: {}", snapshotId, status);
            return status;
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("[Provider] Snapshot {} not found (404)", snapshotId);
            return SnapshotStatus.NOT_FOUND;
        } catch (RestClientException e) {
            throw new ExternalProviderException("Provider status call failed for snapshot " + snapshotId, e);
        }
    }

    @Override
    public Optional<JsonNode> fetchSnapshotData(String snapshotId) {
        URI dataUri = snapshotUri(snapshotId, true);
        try {
            JsonNode body = restTemplate.exchange(
                    dataUri, HttpMethod.GET, new HttpEntity<>(authHeaders(null)), JsonNode.class).getBody();
            JsonNode record = ProviderPayloads.firstRecord(body);
            if (record == null || record.isNull() || record.isMissingNode() || record.isEmpty()) {
                log.debug("[Provider] Snapshot {} returned no data", snapshotId);
                return Optional.empty();
            }
            return Optional.of(record);
        } catch (HttpClientErrorException e) {
            log.debug("[Provider] Data for snapshot {} not available yet ({})", snapshotId, e.getStatusCode());
            return Optional.empty();
        } catch (RestClientException e) {
            throw new ExternalProviderException("Provider data call failed for snapshot " + snapshotId, e);
        }
    }

    private URI snapshotUri(String snapshotId, boolean data) {
        if (!properties.hasApiKey()) {
            throw ExternalProviderException.misconfigured("Scraping provider API key is not configured");
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path("/datasets/v3/snapshot/{id}");
        if (data) {
            builder.path("/data");
        }
        return builder.buildAndExpand(snapshotId).encode().toUri();
    }

    private HttpHeaders authHeaders(MediaType contentType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getApiKey());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (contentType != null) {
            headers.setContentType(contentType);
        }
        return headers;
    }
}
