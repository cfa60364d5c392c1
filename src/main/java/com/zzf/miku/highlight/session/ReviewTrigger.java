package com.zzf.miku.highlight.session;

/**
 * Hook for whatever actually runs the review (an agent loop, a queue consumer).
 * Called while the session is locked: implementations hand the work off and return without waiting on it.
 */
public interface ReviewTrigger {

    void startReview(ReviewSession session);

    default void cancelReview(ReviewSession session) {
    }
}
