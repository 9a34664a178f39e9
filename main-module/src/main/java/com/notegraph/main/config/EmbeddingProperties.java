package com.notegraph.main.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingProperties {

    @NotBlank
    private String apiBase = "https://api.openai.com/v1";

    private String apiKey;

    @NotBlank
    private String model = "text-embedding-3-large";

    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
}
