package com.example.creatorclaims.listeners;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.provider.ScraperProviderClient;
import com.example.creatorclaims.repository.OwnershipClaimRepository;
import com.example.creatorclaims.repository.RawVideoAssetRepository;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.SocialAccountVerifier;
import com.example.creatorclaims.service.SocialAccountVerifier.IngestOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Drives a verification result through the real transaction boundary and waits for the
 * asynchronous ownership resolution it triggers.
 */
@SpringBootTest
class OwnershipResolutionListenerIntegrationTest {

    private static final String FINGERPRINT = "tiktok:7234567890123456789";
    private static final long ASYNC_AWAIT_TIMEOUT_SECONDS = 10;

    @Autowired
    private SocialAccountVerifier verifier;
    @Autowired
    private SocialAccountRepository accountRepository;
    @Autowired
    private RawVideoAssetRepository assetRepository;
    @Autowired
    private OwnershipClaimRepository claimRepository;
    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ScraperProviderClient providerClient;

    @AfterEach
    void tearDown() {
        assetRepository.deleteAll();
        claimRepository.deleteAll();
        accountRepository.deleteAll();
    }

    private RawVideoAsset upload(Long userId, String handle) {
        RawVideoAsset asset = new RawVideoAsset(userId, SubmissionType.GENERAL, Platform.TIKTOK,
                "https://www.tiktok.com/@" + handle + "/video/7234567890123456789", FINGERPRINT,
                "general/" + userId + "/" + UUID.randomUUID() + ".mp4", 1024L, "video/mp4");
        return assetRepository.save(asset);
    }

    @Test
    @DisplayName("✅ A verified account takes ownership and the competing upload is disqualified")
    void verifiedAccount_ResolvesOwnershipAsynchronously() throws Exception {
        SocialAccount alice = new SocialAccount(1L, Platform.TIKTOK, "https://www.tiktok.com/@alice", "alice", "ABC123");
        alice.beginVerification("s_flow");
        alice = accountRepository.save(alice);
        RawVideoAsset original = upload(1L, "alice");
        RawVideoAsset copy = upload(2L, "alice");

        IngestOutcome outcome = verifier.ingestResultForSnapshot("s_flow",
                objectMapper.readTree("{\"biography\":\"verify abc123 please\"}"));

        assertThat(outcome).isEqualTo(IngestOutcome.VERIFIED);
        Long aliceId = alice.getId();
        await().atMost(ASYNC_AWAIT_TIMEOUT_SECONDS, TimeUnit.SECONDS).untilAsserted(() -> {
            RawVideoAsset winner = assetRepository.findById(original.getId()).orElseThrow();
            assertThat(winner.getOwnershipStatus()).isEqualTo(OwnershipStatus.VERIFIED);
            assertThat(winner.getOwnerSocialAccountId()).isEqualTo(aliceId);
            assertThat(assetRepository.findById(copy.getId()).orElseThrow().getOwnershipStatus())
                    .isEqualTo(OwnershipStatus.FAILED);
        });
        assertThat(claimRepository.findById(FINGERPRINT)).isPresent();
    }
}
