package com.notegraph.storage.retry;

import com.notegraph.storage.config.DocumentStoreProperties;
import com.notegraph.storage.exception.OperationDeadlineException;
import com.notegraph.storage.exception.RetryExhaustedException;
import com.notegraph.storage.exception.VersionConflictException;
import com.notegraph.storage.store.DocumentStore;
import com.notegraph.storage.store.Versioned;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Bounded read-mutate-write loop over a single document, the only consistency mechanism the store offers.
 * <p>
 * Each attempt reads the document (or starts from {@link DocumentMapper#empty()} if missing), applies the mutation
 * to a freshly decoded value and writes it back conditioned on the version read in that same attempt.
 * Only {@link VersionConflictException} is retried, after a random backoff between the configured bounds.
 * The mutation may therefore run once per attempt and must not depend on state from earlier attempts.
 */
@Slf4j
@Component
public class ConflictRetryCoordinator {

    private final DocumentStore documentStore;
    private final RetryListener retryListener;
    private final DocumentStoreProperties.Retry settings;
    private final Clock clock;

    public ConflictRetryCoordinator(DocumentStore documentStore,
                                    RetryListener retryListener,
                                    DocumentStoreProperties properties,
                                    Clock clock) {
        this.documentStore = documentStore;
        this.retryListener = retryListener;
        this.settings = properties.getRetry();
        this.clock = clock;
    }

    public <T> Mono<Versioned<T>> update(String path, DocumentMapper<T> mapper, UnaryOperator<T> mutation) {
        return Mono.defer(() -> {
            Instant deadline = clock.instant().plus(settings.getDeadline());
            AtomicInteger attempt = new AtomicInteger();

            return Mono.defer(() -> attemptOnce(path, mapper, mutation, attempt.incrementAndGet(), deadline))
                    .retryWhen(Retry.from(signals -> signals.<Long>concatMap(signal -> {
                        Throwable failure = signal.failure();
                        if (!(failure instanceof VersionConflictException)) {
                            return Mono.error(failure);
                        }
                        int attempts = attempt.get();
                        if (attempts >= settings.getMaxAttempts()) {
                            retryListener.onExhausted(path, attempts);
                            return Mono.error(new RetryExhaustedException(path, attempts, failure));
                        }
                        Duration backoff = nextBackoff();
                        retryListener.onConflict(path, attempts, backoff);
                        return Mono.delay(backoff);
                    })));
        });
    }

    private <T> Mono<Versioned<T>> attemptOnce(String path,
                                               DocumentMapper<T> mapper,
                                               UnaryOperator<T> mutation,
                                               int attempt,
                                               Instant deadline) {
        if (clock.instant().isAfter(deadline)) {
            return Mono.error(new OperationDeadlineException(path, settings.getDeadline(), attempt - 1));
        }
        retryListener.onAttempt(path, attempt);

        return documentStore.get(path)
                .map(document -> new Versioned<>(mapper.decode(path, document.content()), document.version()))
                .switchIfEmpty(Mono.fromSupplier(() -> new Versioned<>(mapper.empty(), null)))
                .flatMap(current -> {
                    T mutated = mutation.apply(current.value());
                    return documentStore.put(path, mapper.encode(mutated), current.version())
                            .map(version -> new Versioned<>(mutated, version));
                })
                .doOnNext(written -> retryListener.onSuccess(path, attempt));
    }

    private Duration nextBackoff() {
        long min = settings.getMinBackoff().toMillis();
        long max = Math.max(min, settings.getMaxBackoff().toMillis());
        return Duration.ofMillis(min + ThreadLocalRandom.current().nextLong(max - min + 1));
    }
}
