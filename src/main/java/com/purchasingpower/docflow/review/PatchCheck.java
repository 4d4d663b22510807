package com.purchasingpower.docflow.review;

import com.purchasingpower.docflow.model.review.ReviewResponse.ReviewPatch;

/**
 * Structural verdict on one proposed patch.
 */
public record PatchCheck(ReviewPatch patch, boolean valid, String reason) {

    static PatchCheck accepted(ReviewPatch patch) {
        return new PatchCheck(patch, true, null);
    }

    static PatchCheck rejected(ReviewPatch patch, String reason) {
        return new PatchCheck(patch, false, reason);
    }
}
