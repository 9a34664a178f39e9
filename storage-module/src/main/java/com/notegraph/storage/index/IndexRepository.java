package com.notegraph.storage.index;

import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.DecayIndex;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.common.model.ExplorationsIndex;
import com.notegraph.common.model.GraphSnapshot;
import com.notegraph.common.model.RefinementsIndex;
import com.notegraph.common.model.RelationsIndex;
import com.notegraph.common.model.SnapshotsIndex;
import com.notegraph.common.model.TensionsIndex;
import com.notegraph.common.serialization.IndexDocumentCodec;
import com.notegraph.storage.config.DocumentStoreProperties;
import com.notegraph.storage.retry.ConflictRetryCoordinator;
import com.notegraph.storage.retry.DocumentMapper;
import com.notegraph.storage.store.DocumentStore;
import com.notegraph.storage.store.Versioned;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.function.UnaryOperator;

/**
 * Typed access to the index documents. Reads never cache; every mutation goes through the
 * {@link ConflictRetryCoordinator}, including wholesale replacement.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class IndexRepository {

    private final DocumentStore documentStore;
    private final ConflictRetryCoordinator retryCoordinator;
    private final IndexDocumentCodec codec;
    private final DocumentStoreProperties properties;

    public String pathOf(IndexDocument<?> document) {
        return properties.indexPath(document.fileName());
    }

    /**
     * Reads an index, returning its empty value if the document does not exist.
     */
    public <T> Mono<T> read(IndexDocument<T> document) {
        return readVersioned(document).map(Versioned::value);
    }

    public <T> Mono<Versioned<T>> readVersioned(IndexDocument<T> document) {
        String path = pathOf(document);
        return documentStore.get(path)
                .map(stored -> new Versioned<>(codec.decode(path, stored.content(), document.type()), stored.version()))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Index {} does not exist yet, using empty value", path);
                    return new Versioned<>(document.empty(), null);
                }));
    }

    /**
     * Applies a mutation under optimistic concurrency. The mutation receives a fresh value on each attempt.
     */
    public <T> Mono<T> update(IndexDocument<T> document, UnaryOperator<T> mutation) {
        return retryCoordinator.update(pathOf(document), mapperFor(document), mutation)
                .map(Versioned::value);
    }

    /**
     * Replaces the whole document with a freshly computed value, regardless of its current content.
     */
    public <T> Mono<T> replace(IndexDocument<T> document, T value) {
        return update(document, current -> value);
    }

    public Mono<EmbeddingsIndex> readEmbeddings() {
        return read(IndexDocument.EMBEDDINGS);
    }

    public Mono<BacklinksIndex> readBacklinks() {
        return read(IndexDocument.BACKLINKS);
    }

    public Mono<ClustersIndex> readClusters() {
        return read(IndexDocument.CLUSTERS);
    }

    public Mono<TensionsIndex> readTensions() {
        return read(IndexDocument.TENSIONS);
    }

    public Mono<DecayIndex> readDecay() {
        return read(IndexDocument.DECAY);
    }

    public Mono<RelationsIndex> readRelations() {
        return read(IndexDocument.RELATIONS);
    }

    public Mono<RefinementsIndex> readRefinements() {
        return read(IndexDocument.REFINEMENTS);
    }

    public Mono<ExplorationsIndex> readExplorations() {
        return read(IndexDocument.EXPLORATIONS);
    }

    public Mono<SnapshotsIndex> readSnapshots() {
        return read(IndexDocument.SNAPSHOTS);
    }

    public Mono<EmbeddingsIndex> upsertEmbedding(EmbeddingRecord record) {
        return update(IndexDocument.EMBEDDINGS, index -> index.upsert(record));
    }

    public Mono<SnapshotsIndex> appendSnapshot(GraphSnapshot snapshot) {
        return update(IndexDocument.SNAPSHOTS, index -> index.append(snapshot));
    }

    private <T> DocumentMapper<T> mapperFor(IndexDocument<T> document) {
        return new DocumentMapper<>() {
            @Override
            public T decode(String path, String content) {
                return codec.decode(path, content, document.type());
            }

            @Override
            public T empty() {
                return document.empty();
            }

            @Override
            public String encode(T value) {
                return codec.encode(value);
            }
        };
    }
}
