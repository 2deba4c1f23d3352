package com.example.creatorclaims.events;

import com.example.creatorclaims.domain.Platform;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a social account's verification job resolves to VERIFIED.
 */
public class SocialAccountVerifiedEvent extends ApplicationEvent {

    private final Long socialAccountId;
    private final Long userId;
    private final Platform platform;
    private final String snapshotId;

    /**
     * @param source          the component that published the event.
     * @param socialAccountId the account that was verified.
     * @param userId          the account's owner.
     * @param platform        the account's platform.
     * @param snapshotId      the provider job whose result verified it.
     */
    public SocialAccountVerifiedEvent(Object source, Long socialAccountId, Long userId,
                                      Platform platform, String snapshotId) {
        super(source);
        if (socialAccountId == null || userId == null || platform == null) {
            throw new IllegalArgumentException("Event details (socialAccountId, userId, platform) cannot be null");
        }
        this.socialAccountId = socialAccountId;
        this.userId = userId;
        this.platform = platform;
        this.snapshotId = snapshotId;
    }

    public Long getSocialAccountId() {
        return socialAccountId;
    }

    public Long getUserId() {
        return userId;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getSnapshotId() {
        return snapshotId;
    }
}
