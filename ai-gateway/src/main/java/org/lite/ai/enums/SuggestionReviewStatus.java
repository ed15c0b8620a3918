package org.lite.ai.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review lifecycle of a generated suggestion: PENDING_REVIEW, then APPROVED / REJECTED / MODIFIED,
 * then APPLIED for approved or modified ones.
 */
public enum SuggestionReviewStatus {
    PENDING_REVIEW,
    APPROVED,
    REJECTED,
    MODIFIED,
    APPLIED;

    public Set<SuggestionReviewStatus> allowedNext() {
        switch (this) {
            case PENDING_REVIEW:
                return EnumSet.of(APPROVED, REJECTED, MODIFIED);
            case APPROVED:
            case MODIFIED:
                return EnumSet.of(APPLIED);
            default:
                return EnumSet.noneOf(SuggestionReviewStatus.class);
        }
    }
}
