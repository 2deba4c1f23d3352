package com.example.creatorclaims.listeners;

import com.example.creatorclaims.events.SocialAccountVerifiedEvent;
import com.example.creatorclaims.service.OwnershipResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class OwnershipResolutionListener {

    private static final Logger log = LoggerFactory.getLogger(OwnershipResolutionListener.class);

    private final OwnershipResolver ownershipResolver;

    public OwnershipResolutionListener(OwnershipResolver ownershipResolver) {
        this.ownershipResolver = ownershipResolver;
    }

    /**
     * Resolves video ownership once the VERIFIED transition has committed.
     * Runs off the request thread; a failure here leaves assets pending until the account's
     * next verification or upload touches them.
     *
     * @param event the verified account.
     */
    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleAccountVerified(SocialAccountVerifiedEvent event) {
        try {
            OwnershipResolver.Resolution resolution = ownershipResolver.resolveForAccount(event.getSocialAccountId());
            log.debug("Ownership resolved for account {} (job {}): {}",
                    event.getSocialAccountId(), event.getSnapshotId(), resolution);
        } catch (Exception e) {
            log.error("Ownership resolution failed for account {} (user {}): {}",
                    event.getSocialAccountId(), event.getUserId(), e.getMessage(), e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_ROLLBACK)
    public void handleAccountVerifiedRollback(SocialAccountVerifiedEvent event) {
        log.warn("Transaction rolled back for SocialAccountVerifiedEvent [Account: {}, Job: {}]. Ownership not resolved.",
                event.getSocialAccountId(), event.getSnapshotId());
    }
}
