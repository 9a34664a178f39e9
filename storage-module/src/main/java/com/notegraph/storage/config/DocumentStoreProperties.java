package com.notegraph.storage.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the remote document store and index update retries.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "document-store")
public class DocumentStoreProperties {

    @NotNull
    private StoreType type = StoreType.GITHUB;

    /**
     * Base URL of the GitHub REST API.
     */
    @NotBlank
    private String apiBase = "https://api.github.com";

    /**
     * Repository owner and name holding notes and indexes.
     */
    private String owner;
    private String repo;

    /**
     * Access token sent as a bearer token. May be empty for public repositories.
     */
    private String token;

    /**
     * Branch to read and commit to. Repository default branch when empty.
     */
    private String branch;

    @NotBlank
    private String notesDir = "notes";

    @NotBlank
    private String indexDir = "index";

    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(10);

    @Min(1024)
    private int maxInMemorySize = 16 * 1024 * 1024;

    @Valid
    @NotNull
    private Retry retry = new Retry();

    public String indexPath(String fileName) {
        return indexDir + "/" + fileName;
    }

    public enum StoreType {
        GITHUB,
        IN_MEMORY
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration minBackoff = Duration.ofMillis(50);

        @NotNull
        private Duration maxBackoff = Duration.ofMillis(150);

        /**
         * Upper bound for one update call, checked before every attempt.
         */
        @NotNull
        private Duration deadline = Duration.ofSeconds(30);
    }
}
