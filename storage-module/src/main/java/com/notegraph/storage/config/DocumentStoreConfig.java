package com.notegraph.storage.config;

import com.notegraph.common.serialization.IndexDocumentCodec;
import com.notegraph.common.serialization.NoteMarkdownDeserializer;
import com.notegraph.common.serialization.NoteMarkdownSerializer;
import com.notegraph.storage.retry.LoggingRetryListener;
import com.notegraph.storage.retry.RetryListener;
import com.notegraph.storage.store.DocumentStore;
import com.notegraph.storage.store.GitHubDocumentStore;
import com.notegraph.storage.store.InMemoryDocumentStore;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
@EnableConfigurationProperties(DocumentStoreProperties.class)
public class DocumentStoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IndexDocumentCodec indexDocumentCodec() {
        return new IndexDocumentCodec();
    }

    @Bean
    public NoteMarkdownSerializer noteMarkdownSerializer() {
        return new NoteMarkdownSerializer();
    }

    @Bean
    public NoteMarkdownDeserializer noteMarkdownDeserializer() {
        return new NoteMarkdownDeserializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryListener retryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnProperty(name = "document-store.type", havingValue = "github", matchIfMissing = true)
    public DocumentStore gitHubDocumentStore(DocumentStoreProperties properties) {
        if (isBlank(properties.getOwner()) || isBlank(properties.getRepo())) {
            throw new IllegalStateException("document-store.owner and document-store.repo are required for the github store");
        }
        log.info("Using GitHub document store {}/{}", properties.getOwner(), properties.getRepo());
        return new GitHubDocumentStore(gitHubWebClient(properties), properties.getOwner(),
                properties.getRepo(), properties.getBranch());
    }

    @Bean
    @ConditionalOnProperty(name = "document-store.type", havingValue = "in-memory")
    public DocumentStore inMemoryDocumentStore() {
        log.info("Using in-memory document store");
        return new InMemoryDocumentStore();
    }

    private WebClient gitHubWebClient(DocumentStoreProperties properties) {
        long readTimeoutMillis = properties.getReadTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.toIntExact(properties.getConnectionTimeout().toMillis()))
                .responseTimeout(properties.getReadTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(readTimeoutMillis, TimeUnit.MILLISECONDS)));

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(properties.getApiBase())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(properties.getMaxInMemorySize()));
        if (!isBlank(properties.getToken())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken());
        }
        return builder.build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
