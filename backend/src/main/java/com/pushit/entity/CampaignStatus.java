package com.pushit.entity;

import java.util.EnumSet;
import java.util.Set;

/** Campaign lifecycle with the transitions a brand or admin may trigger. */
public enum CampaignStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public boolean canTransitionTo(CampaignStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isEditable() {
        return this == DRAFT || this == PAUSED;
    }

    private Set<CampaignStatus> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(ACTIVE, CANCELLED);
            case ACTIVE -> EnumSet.of(PAUSED, COMPLETED);
            case PAUSED -> EnumSet.of(ACTIVE, COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(CampaignStatus.class);
        };
    }
}
