package com.notegraph.storage.retry;

import java.time.Duration;

/**
 * Observer of the conflict retry loop. Every method defaults to a no-op.
 */
public interface RetryListener {

    default void onAttempt(String path, int attempt) {
    }

    default void onConflict(String path, int attempt, Duration retryAfter) {
    }

    default void onSuccess(String path, int attempt) {
    }

    default void onExhausted(String path, int attempts) {
    }
}
