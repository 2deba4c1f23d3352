package com.example.creatorclaims.web.dto;

/**
 * @param outcome what happened to the delivery: verified, failed, already_resolved, ignored or pending.
 */
public record WebhookAckResponse(String snapshotId, String outcome) {}
