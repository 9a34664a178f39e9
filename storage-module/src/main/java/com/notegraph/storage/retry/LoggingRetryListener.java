package com.notegraph.storage.retry;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

@Slf4j
public class LoggingRetryListener implements RetryListener {

    @Override
    public void onAttempt(String path, int attempt) {
        log.debug("index_update_attempt path={} attempt={}", path, attempt);
    }

    @Override
    public void onConflict(String path, int attempt, Duration retryAfter) {
        log.info("index_update_conflict path={} attempt={} retryAfterMs={}", path, attempt, retryAfter.toMillis());
    }

    @Override
    public void onSuccess(String path, int attempt) {
        log.debug("index_update_success path={} attempt={}", path, attempt);
    }

    @Override
    public void onExhausted(String path, int attempts) {
        log.warn("index_update_exhausted path={} attempts={}", path, attempts);
    }
}
