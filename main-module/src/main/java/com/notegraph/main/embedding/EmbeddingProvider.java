package com.notegraph.main.embedding;

import reactor.core.publisher.Mono;

/**
 * Turns text into an embedding vector.
 */
public interface EmbeddingProvider {

    /**
     * @return the embedding. Fails with {@link com.notegraph.main.exception.EmbeddingProviderException}
     *         on empty text or upstream failure
     */
    Mono<double[]> embed(String text);

    /** Model name recorded with every embedding. */
    String model();
}
