package com.example.workflowhub.sync;

/**
 * How a {@code sync:external} post action relates to the transition that triggered it.
 */
public enum SyncPolicy {
    /** Pushed after commit with the notification retry policy; failure never reverts the transition. */
    BEST_EFFORT,
    /** Pushed inside the transition transaction; failure means the transition is not applied. */
    REQUIRED
}
