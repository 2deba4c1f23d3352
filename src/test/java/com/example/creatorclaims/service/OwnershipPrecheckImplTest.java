package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.repository.RawVideoAssetRepository;
import com.example.creatorclaims.repository.SocialAccountRepository;
import com.example.creatorclaims.service.OwnershipPrecheck.Decision;
import com.example.creatorclaims.service.impl.OwnershipPrecheckImpl;
import com.example.creatorclaims.service.impl.VideoFingerprintServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("OwnershipPrecheckImpl Tests")
class OwnershipPrecheckImplTest {

    @Mock
    private RawVideoAssetRepository assetRepository;
    @Mock
    private SocialAccountRepository accountRepository;

    private OwnershipPrecheckImpl precheck;
    private VideoFingerprint fingerprint;

    private static final Long USER_ID = 1L;
    private static final Long OTHER_USER_ID = 2L;
    private static final String VIDEO_URL = "https://www.tiktok.com/@alice/video/123";

    @BeforeEach
    void setUp() {
        VideoFingerprintServiceImpl fingerprintService = new VideoFingerprintServiceImpl();
        precheck = new OwnershipPrecheckImpl(assetRepository, accountRepository, new SocialAccountMatcher(fingerprintService));
        fingerprint = fingerprintService.fingerprint(Platform.TIKTOK, VIDEO_URL);
    }

    private RawVideoAsset existing(Long userId, OwnershipStatus status, Long ownerAccountId) {
        RawVideoAsset asset = new RawVideoAsset(userId, SubmissionType.GENERAL, Platform.TIKTOK, VIDEO_URL,
                fingerprint.key(), "general/" + userId + "/a.mp4", 10L, "video/mp4");
        ReflectionTestUtils.setField(asset, "id", 900L + userId);
        asset.setOwnershipStatus(status);
        asset.setOwnerSocialAccountId(ownerAccountId);
        return asset;
    }

    private SocialAccount account(Long id, Long userId, String handle, VerificationStatus status) {
        SocialAccount account = new SocialAccount(userId, Platform.TIKTOK, "https://www.tiktok.com/@" + handle, handle, "C" + id);
        ReflectionTestUtils.setField(account, "id", id);
        account.setVerificationStatus(status);
        return account;
    }

    @Test
    @DisplayName("❌ Video verified for another user is rejected with the owner's handle")
    void claimedByAnotherUser() {
        given(assetRepository.findByVideoFingerprint(fingerprint.key()))
                .willReturn(List.of(existing(OTHER_USER_ID, OwnershipStatus.VERIFIED, 20L)));
        given(accountRepository.findById(20L))
                .willReturn(Optional.of(account(20L, OTHER_USER_ID, "alice", VerificationStatus.VERIFIED)));

        assertThatThrownBy(() -> precheck.check(USER_ID, fingerprint, VIDEO_URL))
                .isInstanceOfSatisfying(ResponseStatusException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(e.getReason()).contains("@alice");
                });
    }

    @Test
    @DisplayName("❌ Re-uploading one's own verified video is a conflict")
    void duplicateOwnUpload() {
        given(assetRepository.findByVideoFingerprint(fingerprint.key()))
                .willReturn(List.of(existing(USER_ID, OwnershipStatus.VERIFIED, 10L)));

        assertThatThrownBy(() -> precheck.check(USER_ID, fingerprint, VIDEO_URL))
                .isInstanceOfSatisfying(ResponseStatusException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
    }

    @Test
    @DisplayName("✅ Verified matching account makes the upload VERIFIED immediately")
    void verifiedAccountMatch() {
        given(assetRepository.findByVideoFingerprint(fingerprint.key())).willReturn(List.of());
        given(accountRepository.findByUserIdOrderByCreatedAtAsc(USER_ID))
                .willReturn(List.of(account(10L, USER_ID, "alice", VerificationStatus.VERIFIED)));

        Decision decision = precheck.check(USER_ID, fingerprint, VIDEO_URL);

        assertThat(decision.status()).isEqualTo(OwnershipStatus.VERIFIED);
        assertThat(decision.ownerSocialAccountId()).isEqualTo(10L);
    }

    @Test
    @DisplayName("✅ Another user's pending upload makes this one CONTESTED")
    void contested() {
        given(assetRepository.findByVideoFingerprint(fingerprint.key()))
                .willReturn(List.of(existing(OTHER_USER_ID, OwnershipStatus.PENDING, null)));
        given(accountRepository.findByUserIdOrderByCreatedAtAsc(USER_ID)).willReturn(List.of());

        Decision decision = precheck.check(USER_ID, fingerprint, VIDEO_URL);

        assertThat(decision.status()).isEqualTo(OwnershipStatus.CONTESTED);
        assertThat(decision.ownerSocialAccountId()).isNull();
    }

    @Test
    @DisplayName("✅ Unverified matching account is bound to a PENDING upload")
    void pendingBoundToUnverifiedAccount() {
        given(assetRepository.findByVideoFingerprint(fingerprint.key())).willReturn(List.of());
        given(accountRepository.findByUserIdOrderByCreatedAtAsc(USER_ID)).willReturn(List.of(
                account(11L, USER_ID, "someoneelse", VerificationStatus.VERIFIED),
                account(12L, USER_ID, "alice", VerificationStatus.UNVERIFIED)));

        Decision decision = precheck.check(USER_ID, fingerprint, VIDEO_URL);

        assertThat(decision.status()).isEqualTo(OwnershipStatus.PENDING);
        assertThat(decision.ownerSocialAccountId()).isEqualTo(12L);
    }
}
