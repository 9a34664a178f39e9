package com.notegraph.storage.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.notegraph.storage.exception.DocumentStoreException;
import com.notegraph.storage.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * DocumentStore backed by the GitHub Contents API. The blob sha is the version token.
 */
@Slf4j
public class GitHubDocumentStore implements DocumentStore {

    private static final String CONTENTS_PATH = "/repos/{owner}/{repo}/contents/";
    private static final String GITHUB_JSON = "application/vnd.github+json";

    private final WebClient gitHubWebClient;
    private final String owner;
    private final String repo;
    private final String branch;

    public GitHubDocumentStore(WebClient gitHubWebClient, String owner, String repo, String branch) {
        this.gitHubWebClient = gitHubWebClient;
        this.owner = owner;
        this.repo = repo;
        this.branch = branch == null || branch.isBlank() ? null : branch;
    }

    @Override
    public Mono<StoredDocument> get(String path) {
        log.debug("Reading {} from {}/{}", path, owner, repo);

        String uri = branch == null ? CONTENTS_PATH + path : CONTENTS_PATH + path + "?ref={ref}";

        return gitHubWebClient
                .get()
                .uri(uri, owner, repo, branch)
                .accept(MediaType.parseMediaType(GITHUB_JSON))
                .retrieve()
                .bodyToMono(ContentResponse.class)
                .map(response -> toStoredDocument(path, response))
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("Document {} not found", path);
                    return Mono.empty();
                })
                .onErrorMap(e -> translate(path, e, null));
    }

    @Override
    public Mono<String> put(String path, String content, String expectedVersion) {
        log.debug("Writing {} to {}/{} (expected version {})", path, owner, repo, expectedVersion);

        String encoded = Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
        String message = (expectedVersion == null ? "Create " : "Update ") + path;
        PutRequest request = new PutRequest(message, encoded, expectedVersion, branch);

        return gitHubWebClient
                .put()
                .uri(CONTENTS_PATH + path, owner, repo)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.parseMediaType(GITHUB_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(PutResponse.class)
                .map(response -> {
                    if (response.content() == null || response.content().sha() == null) {
                        throw new DocumentStoreException(path, null, "Write response for " + path + " has no content sha");
                    }
                    return response.content().sha();
                })
                .doOnSuccess(version -> log.debug("Wrote {} at version {}", path, version))
                .onErrorMap(e -> translate(path, e, expectedVersion));
    }

    private StoredDocument toStoredDocument(String path, ContentResponse response) {
        if (response.content() == null || response.sha() == null) {
            throw new DocumentStoreException(path, null, "Content response for " + path + " has no content or sha");
        }
        // GitHub wraps base64 content at 60 columns
        byte[] decoded = Base64.getMimeDecoder().decode(response.content());
        return new StoredDocument(new String(decoded, StandardCharsets.UTF_8), response.sha());
    }

    private Throwable translate(String path, Throwable error, String expectedVersion) {
        if (error instanceof DocumentStoreException) {
            return error;
        }
        if (error instanceof WebClientResponseException responseError) {
            int status = responseError.getStatusCode().value();
            if (status == HttpStatus.CONFLICT.value()) {
                return new VersionConflictException(path, status, expectedVersion, error);
            }
            // create race: someone else created the file first
            if (status == HttpStatus.UNPROCESSABLE_ENTITY.value() && expectedVersion == null) {
                return new VersionConflictException(path, status, null, error);
            }
            log.error("GitHub request for {} failed with status {}: {}", path, status, responseError.getMessage());
            return new DocumentStoreException(path, status, "GitHub request for " + path + " failed with status " + status, error);
        }
        log.error("GitHub request for {} failed: {}", path, error.getMessage());
        return new DocumentStoreException(path, null, "GitHub request for " + path + " failed: " + error.getMessage(), error);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentResponse(String content, String sha, String encoding) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PutRequest(String message, String content, String sha, String branch) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PutResponse(ContentRef content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContentRef(String sha) {}
}
