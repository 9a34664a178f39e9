package com.notegraph.main.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.notegraph.main.exception.EmbeddingProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EmbeddingProvider over the OpenAI embeddings endpoint.
 */
@Slf4j
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final String EMBEDDINGS_PATH = "/embeddings";

    private final WebClient embeddingWebClient;
    private final String model;

    public OpenAiEmbeddingProvider(WebClient embeddingWebClient, String model) {
        this.embeddingWebClient = embeddingWebClient;
        this.model = model;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public Mono<double[]> embed(String text) {
        if (text == null || text.isBlank()) {
            return Mono.error(new EmbeddingProviderException("Cannot embed empty text"));
        }
        log.debug("Requesting {} embedding for {} characters", model, text.length());

        return embeddingWebClient
                .post()
                .uri(EMBEDDINGS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new EmbeddingRequest(text, model))
                .retrieve()
                .bodyToMono(EmbeddingResponse.class)
                .map(this::firstEmbedding)
                .onErrorMap(WebClientResponseException.class, e -> new EmbeddingProviderException(
                        "Embedding request failed (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e))
                .onErrorMap(e -> !(e instanceof EmbeddingProviderException),
                        e -> new EmbeddingProviderException("Embedding request failed: " + e.getMessage(), e))
                .doOnError(error -> log.error("Failed to embed text: {}", error.getMessage()));
    }

    private double[] firstEmbedding(EmbeddingResponse response) {
        if (response.data() == null || response.data().isEmpty() || response.data().get(0).embedding() == null) {
            throw new EmbeddingProviderException("Unexpected embedding response: missing embedding data");
        }
        if (response.data().get(0).embedding().length == 0) {
            throw new EmbeddingProviderException("Unexpected embedding response: empty embedding vector");
        }
        return response.data().get(0).embedding();
    }

    record EmbeddingRequest(String input, String model) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data, String model) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(double[] embedding, int index) {}
}
