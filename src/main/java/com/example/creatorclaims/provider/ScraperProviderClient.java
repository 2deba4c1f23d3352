package com.example.creatorclaims.provider;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.exceptions.ExternalProviderException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Asynchronous profile scraping jobs: trigger, poll, fetch.
 */
public interface ScraperProviderClient {

    /**
     * Checks that credentials and the platform's dataset are configured, without calling out.
     *
     * @throws ExternalProviderException (misconfigured) when something is missing.
     */
    void assertConfigured(Platform platform);

    /**
     * Starts a profile scrape whose result is also pushed to the configured webhook.
     *
     * @return the provider's snapshot id for the job.
     * @throws ExternalProviderException if the provider is misconfigured, rejects the job or returns no id.
     */
    String triggerProfileScrape(Platform platform, String profileUrl);

    /**
     * @throws ExternalProviderException on transport errors and non-404 error responses.
     */
    SnapshotStatus getSnapshotStatus(String snapshotId);

    /**
     * Downloads the job result. Array payloads are reduced to their first element.
     *
     * @return the profile document, or empty when the provider has no data yet.
     * @throws ExternalProviderException on transport errors.
     */
    Optional<JsonNode> fetchSnapshotData(String snapshotId);
}
