package com.example.creatorclaims.repository;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.SocialAccount;
import com.example.creatorclaims.domain.SocialAccount.VerificationStatus;
import com.example.creatorclaims.domain.SocialAccount.WebhookStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("SocialAccountRepository Tests")
class SocialAccountRepositoryTest {

    @Autowired
    private SocialAccountRepository repository;

    private SocialAccount pending(String handle, String snapshotId, Instant attemptAt) {
        SocialAccount account = new SocialAccount(1L, Platform.TIKTOK, "https://www.tiktok.com/@" + handle, handle, "C" + handle);
        account.beginVerification(snapshotId);
        ReflectionTestUtils.setField(account, "lastVerificationAttemptAt", attemptAt);
        return repository.save(account);
    }

    private SocialAccount reload(SocialAccount account) {
        return repository.findById(account.getId()).orElseThrow();
    }

    @Test
    @DisplayName("✅ findAwaitingResult should return outstanding jobs oldest first, capped by the page size")
    void findAwaitingResult_OldestFirstAndBounded() {
        repository.deleteAll();
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        SocialAccount newest = pending("c", "s_c", base.plusSeconds(30));
        SocialAccount oldest = pending("a", "s_a", base);
        pending("b", "s_b", base.plusSeconds(10));

        SocialAccount verified = pending("d", "s_d", base.minusSeconds(60));
        verified.setVerificationStatus(VerificationStatus.VERIFIED);
        verified.setWebhookStatus(WebhookStatus.COMPLETED);
        repository.save(verified);

        repository.save(new SocialAccount(1L, Platform.TIKTOK, "https://www.tiktok.com/@e", "e", "Ce"));

        List<SocialAccount> batch = repository.findAwaitingResult(PageRequest.of(0, 2));

        assertThat(batch).extracting(SocialAccount::getSnapshotId).containsExactly("s_a", "s_b");
        assertThat(batch).doesNotContain(newest);
        assertThat(batch.get(0).getId()).isEqualTo(oldest.getId());
    }

    @Nested
    @DisplayName("Compare-and-set resolution")
    class CompareAndSet {

        @Test
        @DisplayName("✅ completeVerified should apply once and reset attempts")
        void completeVerified_AppliesOnce() {
            SocialAccount account = pending("alice", "s_1", Instant.now());
            account.setVerificationAttempts(2);
            repository.save(account);

            int first = repository.completeVerified(account.getId(), "s_1", "{\"biography\":\"Cx\"}", Instant.now());
            int second = repository.completeVerified(account.getId(), "s_1", "{}", Instant.now());

            assertThat(first).isEqualTo(1);
            assertThat(second).isZero();
            SocialAccount stored = reload(account);
            assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
            assertThat(stored.getWebhookStatus()).isEqualTo(WebhookStatus.COMPLETED);
            assertThat(stored.getVerificationAttempts()).isZero();
            assertThat(stored.getProfileData()).contains("biography");
        }

        @Test
        @DisplayName("✅ completeFailed should count an attempt and keep the payload")
        void completeFailed_CountsAttempt() {
            SocialAccount account = pending("bob", "s_2", Instant.now());

            assertThat(repository.completeFailed(account.getId(), "s_2", "{\"biography\":\"nope\"}", Instant.now())).isEqualTo(1);

            SocialAccount stored = reload(account);
            assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
            assertThat(stored.getWebhookStatus()).isEqualTo(WebhookStatus.COMPLETED);
            assertThat(stored.getVerificationAttempts()).isEqualTo(1);
            assertThat(stored.getProfileData()).isEqualTo("{\"biography\":\"nope\"}");
        }

        @Test
        @DisplayName("⚠️ A result for a replaced job should not be written")
        void staleSnapshot_NotApplied() {
            SocialAccount account = pending("carol", "s_new", Instant.now());

            assertThat(repository.completeVerified(account.getId(), "s_old", "{}", Instant.now())).isZero();
            assertThat(repository.markJobFailed(account.getId(), "s_old", Instant.now())).isZero();

            SocialAccount stored = reload(account);
            assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.PENDING);
            assertThat(stored.getWebhookStatus()).isEqualTo(WebhookStatus.PENDING);
        }

        @Test
        @DisplayName("✅ markJobFailed should record a provider failure once")
        void markJobFailed_Once() {
            SocialAccount account = pending("dave", "s_3", Instant.now());

            assertThat(repository.markJobFailed(account.getId(), "s_3", Instant.now())).isEqualTo(1);
            assertThat(repository.markJobFailed(account.getId(), "s_3", Instant.now())).isZero();

            SocialAccount stored = reload(account);
            assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.FAILED);
            assertThat(stored.getWebhookStatus()).isEqualTo(WebhookStatus.FAILED);
            assertThat(stored.getVerificationAttempts()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Starting a job")
    class StartJob {

        @Test
        @DisplayName("✅ startJob should move a FAILED account to PENDING on the new job and drop the old payload")
        void startJob_RetryFromFailed() {
            SocialAccount account = pending("erin", "s_old", Instant.now());
            repository.completeFailed(account.getId(), "s_old", "{\"biography\":\"stale\"}", Instant.now());

            assertThat(repository.startJob(account.getId(), "s_new", "IGNORED", Instant.now())).isEqualTo(1);

            SocialAccount stored = reload(account);
            assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.PENDING);
            assertThat(stored.getWebhookStatus()).isEqualTo(WebhookStatus.PENDING);
            assertThat(stored.getSnapshotId()).isEqualTo("s_new");
            assertThat(stored.getProfileData()).isNull();
            assertThat(stored.getVerificationCode()).isEqualTo("Cerin");
        }

        @Test
        @DisplayName("✅ startJob should store the given code when the account has none")
        void startJob_FillsMissingCode() {
            SocialAccount account = repository.save(
                    new SocialAccount(1L, Platform.TIKTOK, "https://www.tiktok.com/@frank", "frank", null));

            assertThat(repository.startJob(account.getId(), "s_1", "NEW123", Instant.now())).isEqualTo(1);

            assertThat(reload(account).getVerificationCode()).isEqualTo("NEW123");
        }

        @Test
        @DisplayName("⚠️ startJob should leave an account that was verified in the meantime untouched")
        void startJob_VerifiedAccountUntouched() {
            SocialAccount account = pending("gina", "s_1", Instant.now());
            repository.completeVerified(account.getId(), "s_1", "{\"biography\":\"Cgina\"}", Instant.now());

            assertThat(repository.startJob(account.getId(), "s_2", "Cgina", Instant.now())).isZero();

            SocialAccount stored = reload(account);
            assertThat(stored.getVerificationStatus()).isEqualTo(VerificationStatus.VERIFIED);
            assertThat(stored.getSnapshotId()).isEqualTo("s_1");
            assertThat(stored.getProfileData()).contains("Cgina");
        }
    }
}
