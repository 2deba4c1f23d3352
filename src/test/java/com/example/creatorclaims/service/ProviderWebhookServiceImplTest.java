package com.example.creatorclaims.service;

import com.example.creatorclaims.exceptions.ExternalProviderException;
import com.example.creatorclaims.provider.ScraperProviderClient;
import com.example.creatorclaims.service.ProviderWebhookService.Delivery;
import com.example.creatorclaims.service.ProviderWebhookService.DeliveryOutcome;
import com.example.creatorclaims.service.SocialAccountVerifier.IngestOutcome;
import com.example.creatorclaims.service.impl.ProviderWebhookServiceImpl;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProviderWebhookService Implementation Tests")
class ProviderWebhookServiceImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private SocialAccountVerifier verifier;
    @Mock
    private ScraperProviderClient providerClient;

    private ProviderWebhookServiceImpl webhookService;

    @BeforeEach
    void setUp() {
        webhookService = new ProviderWebhookServiceImpl(verifier, providerClient);
    }

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw);
    }

    @Nested
    @DisplayName("Deliveries carrying profile data")
    class ProfileDeliveries {

        @Test
        @DisplayName("✅ Should ingest the first element of an array body")
        void arrayBody_IngestsFirstRecord() throws Exception {
            JsonNode body = json("[{\"snapshot_id\":\"s_1\",\"biography\":\"code ABC123\"},{\"biography\":\"other\"}]");
            given(verifier.ingestResultForSnapshot(eq("s_1"), any(JsonNode.class))).willReturn(IngestOutcome.VERIFIED);

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), body);

            assertThat(delivery).isEqualTo(new Delivery("s_1", DeliveryOutcome.VERIFIED));
            ArgumentCaptor<JsonNode> captor = ArgumentCaptor.forClass(JsonNode.class);
            then(verifier).should().ingestResultForSnapshot(eq("s_1"), captor.capture());
            assertThat(captor.getValue().get("biography").asText()).isEqualTo("code ABC123");
            then(providerClient).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("✅ Should route a profile record by its input snapshot id, not the profile's own id")
        void profileRecord_RoutedByInputSnapshotId() throws Exception {
            JsonNode body = json("[{\"id\":\"7001234567\",\"biography\":\"Code ABC123\","
                    + "\"input\":{\"url\":\"https://www.tiktok.com/@creator\",\"snapshot_id\":\"s_42\"}}]");
            given(verifier.ingestResultForSnapshot(eq("s_42"), any(JsonNode.class))).willReturn(IngestOutcome.VERIFIED);

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), body);

            assertThat(delivery).isEqualTo(new Delivery("s_42", DeliveryOutcome.VERIFIED));
            then(verifier).should(never()).ingestResultForSnapshot(eq("7001234567"), any(JsonNode.class));
        }

        @Test
        @DisplayName("✅ Should prefer the snapshot id header over the body")
        void headerSnapshotId_WinsOverBody() throws Exception {
            JsonNode body = json("{\"snapshot_id\":\"s_body\",\"data\":{\"biography\":\"hello\"}}");
            given(verifier.ingestResultForSnapshot(eq("s_header"), any(JsonNode.class))).willReturn(IngestOutcome.FAILED);

            Delivery delivery = webhookService.handleProfileDelivery(Map.of("x-snapshot-id", " s_header "), body);

            assertThat(delivery).isEqualTo(new Delivery("s_header", DeliveryOutcome.FAILED));
        }

        @Test
        @DisplayName("⚠️ Should acknowledge an unknown snapshot as ignored")
        void unknownSnapshot_Ignored() throws Exception {
            JsonNode body = json("{\"snapshot_id\":\"s_gone\",\"biography\":\"hello\"}");
            given(verifier.ingestResultForSnapshot(eq("s_gone"), any(JsonNode.class))).willReturn(IngestOutcome.UNKNOWN_SNAPSHOT);

            assertThat(webhookService.handleProfileDelivery(Map.of(), body).outcome()).isEqualTo(DeliveryOutcome.IGNORED);
        }

        @Test
        @DisplayName("⚠️ Should report a duplicate delivery as already resolved")
        void duplicate_AlreadyResolved() throws Exception {
            JsonNode body = json("{\"snapshot_id\":\"s_1\",\"biography\":\"hello\"}");
            given(verifier.ingestResultForSnapshot(eq("s_1"), any(JsonNode.class))).willReturn(IngestOutcome.ALREADY_RESOLVED);

            assertThat(webhookService.handleProfileDelivery(Map.of(), body).outcome()).isEqualTo(DeliveryOutcome.ALREADY_RESOLVED);
        }
    }

    @Nested
    @DisplayName("Status-only notifications")
    class Notifications {

        @Test
        @DisplayName("✅ Should mark the job failed when the provider reports failure")
        void failedStatus_MarksJobFailed() throws Exception {
            given(verifier.markJobFailed("s_1")).willReturn(true);

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), json("{\"snapshot_id\":\"s_1\",\"status\":\"failed\"}"));

            assertThat(delivery.outcome()).isEqualTo(DeliveryOutcome.FAILED);
            then(verifier).should(never()).ingestResultForSnapshot(anyString(), any());
        }

        @Test
        @DisplayName("⚠️ Should report a repeated failure notification as already resolved")
        void failedStatus_Repeated() throws Exception {
            given(verifier.markJobFailed("s_1")).willReturn(false);

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), json("{\"snapshot_id\":\"s_1\",\"status\":\"error\"}"));

            assertThat(delivery.outcome()).isEqualTo(DeliveryOutcome.ALREADY_RESOLVED);
        }

        @Test
        @DisplayName("✅ Should leave a running job pending")
        void runningStatus_Pending() throws Exception {
            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), json("{\"snapshot_id\":\"s_1\",\"status\":\"running\"}"));

            assertThat(delivery.outcome()).isEqualTo(DeliveryOutcome.PENDING);
            then(verifier).shouldHaveNoInteractions();
            then(providerClient).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("✅ Should fetch the result once for a ready notification")
        void readyStatus_FetchesAndIngests() throws Exception {
            JsonNode profile = json("{\"biography\":\"ABC123\"}");
            given(providerClient.fetchSnapshotData("s_1")).willReturn(Optional.of(profile));
            given(verifier.ingestResultForSnapshot("s_1", profile)).willReturn(IngestOutcome.VERIFIED);

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), json("{\"snapshot_id\":\"s_1\",\"status\":\"ready\"}"));

            assertThat(delivery.outcome()).isEqualTo(DeliveryOutcome.VERIFIED);
        }

        @Test
        @DisplayName("⚠️ Should leave the job pending when the ready fetch has no data")
        void readyStatus_NoDataYet() throws Exception {
            given(providerClient.fetchSnapshotData("s_1")).willReturn(Optional.empty());

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), json("{\"snapshot_id\":\"s_1\",\"status\":\"completed\"}"));

            assertThat(delivery.outcome()).isEqualTo(DeliveryOutcome.PENDING);
            then(verifier).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("⚠️ Should leave the job pending when the ready fetch fails")
        void readyStatus_FetchFails() throws Exception {
            given(providerClient.fetchSnapshotData("s_1")).willThrow(new ExternalProviderException("timeout"));

            Delivery delivery = webhookService.handleProfileDelivery(Map.of(), json("{\"snapshot_id\":\"s_1\",\"status\":\"ready\"}"));

            assertThat(delivery.outcome()).isEqualTo(DeliveryOutcome.PENDING);
            then(verifier).shouldHaveNoInteractions();
        }
    }

    @Test
    @DisplayName("❌ Should reject a delivery without any snapshot id")
    void missingSnapshotId_BadRequest() throws Exception {
        assertThatThrownBy(() -> webhookService.handleProfileDelivery(Map.of(), json("{\"biography\":\"hello\"}")))
                .isInstanceOf(ResponseStatusException.class)
                .satisfies(ex -> assertThat(((ResponseStatusException) ex).getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
        then(verifier).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("❌ Should reject an empty body without headers")
    void nullBody_BadRequest() {
        assertThatThrownBy(() -> webhookService.handleProfileDelivery(null, null))
                .isInstanceOf(ResponseStatusException.class);
    }
}
