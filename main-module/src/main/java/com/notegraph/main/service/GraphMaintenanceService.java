package com.notegraph.main.service;

import com.notegraph.common.exception.ValidationException;
import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.BacklinksIndex;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.EmbeddingRecord;
import com.notegraph.common.model.EmbeddingsIndex;
import com.notegraph.common.model.ExplorationSuggestion;
import com.notegraph.common.model.ExplorationsIndex;
import com.notegraph.common.model.GraphSnapshot;
import com.notegraph.common.model.NoteIds;
import com.notegraph.common.model.RefinementSuggestion;
import com.notegraph.common.model.RefinementType;
import com.notegraph.common.model.RelationType;
import com.notegraph.common.model.TensionsIndex;
import com.notegraph.main.cluster.ClusteringEngine;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.main.decay.DecayScorer;
import com.notegraph.main.dto.AnalyticsResult;
import com.notegraph.main.dto.ClusterPassResult;
import com.notegraph.main.dto.DecayPassResult;
import com.notegraph.main.dto.ExplorationPassResult;
import com.notegraph.main.dto.LinkPassResult;
import com.notegraph.main.dto.RefinementsUpdateResult;
import com.notegraph.main.dto.RelationsUpdateResult;
import com.notegraph.main.dto.TensionPassResult;
import com.notegraph.main.exploration.GapDetector;
import com.notegraph.main.graph.GraphMaintainer;
import com.notegraph.main.graph.LinkPair;
import com.notegraph.main.refinement.RefinementSubmission;
import com.notegraph.main.relation.RelationRegistry;
import com.notegraph.main.relation.RelationSubmission;
import com.notegraph.main.similarity.SimilarityEngine;
import com.notegraph.main.similarity.SimilarityMatch;
import com.notegraph.main.snapshot.SnapshotCalculator;
import com.notegraph.main.snapshot.SnapshotTimeline;
import com.notegraph.main.tension.TensionDetector;
import com.notegraph.storage.index.IndexDocument;
import com.notegraph.storage.index.IndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Graph-wide passes that recompute derived indexes, plus agent submissions and snapshots.
 * Every write goes through the index repository's retry-coordinated update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphMaintenanceService {

    private final IndexRepository indexRepository;
    private final SimilarityEngine similarityEngine;
    private final ClusteringEngine clusteringEngine;
    private final GraphMaintainer graphMaintainer;
    private final DecayScorer decayScorer;
    private final TensionDetector tensionDetector;
    private final GapDetector gapDetector;
    private final RelationRegistry relationRegistry;
    private final SnapshotCalculator snapshotCalculator;
    private final SnapshotTimeline snapshotTimeline;
    private final NoteContentFetcher noteContentFetcher;
    private final GraphProperties properties;
    private final Clock clock;

    /**
     * Recomputes every link from the embeddings and replaces the backlinks index.
     * This is also the repair path for notes whose links or embeddings were only partly written.
     */
    public Mono<LinkPassResult> linkPass() {
        return indexRepository.readEmbeddings().flatMap(embeddings -> {
            if (embeddings.size() == 0) {
                log.info("Link pass skipped: no notes");
                return Mono.just(new LinkPassResult(0, 0));
            }

            List<LinkPair> pairs = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Map.Entry<String, EmbeddingRecord> entry : embeddings.embeddings().entrySet()) {
                String noteId = entry.getKey();
                List<SimilarityMatch> matches = similarityEngine.findMatches(entry.getValue().vector(), embeddings,
                        properties.getSimilarityThreshold(), Set.of(noteId));
                for (SimilarityMatch match : matches) {
                    if (seen.add(NoteIds.canonicalKey(noteId, match.noteId()))) {
                        pairs.add(new LinkPair(noteId, match.noteId(), match.similarity()));
                    }
                }
            }

            BacklinksIndex rebuilt = graphMaintainer.rebuildBacklinks(pairs);
            return indexRepository.replace(IndexDocument.BACKLINKS, rebuilt)
                    .thenReturn(new LinkPassResult(embeddings.size(), pairs.size()))
                    .doOnSuccess(result -> log.info("Link pass complete: {} notes, {} links",
                            result.notesProcessed(), result.totalLinks()));
        });
    }

    /**
     * @param requestedK explicit cluster count (at least 2), or null to choose automatically
     */
    public Mono<ClusterPassResult> clusterPass(Integer requestedK) {
        if (requestedK != null && requestedK < 2) {
            return Mono.error(new ValidationException("Optional 'k' must be an integer >= 2"));
        }

        return indexRepository.readEmbeddings().flatMap(embeddings -> {
            int noteCount = embeddings.size();
            if (noteCount < properties.getMinNotesForClustering()) {
                log.info("Cluster pass skipped: have {} notes, need {}", noteCount, properties.getMinNotesForClustering());
                return Mono.just(new ClusterPassResult(noteCount, 0, List.of()));
            }

            ClustersIndex clusters = clusteringEngine.clusterEmbeddings(embeddings, requestedK, null);
            List<ClusterPassResult.ClusterSummary> summaries = clusters.clusters().values().stream()
                    .map(ClusterPassResult.ClusterSummary::of)
                    .toList();
            return indexRepository.replace(IndexDocument.CLUSTERS, clusters)
                    .thenReturn(new ClusterPassResult(noteCount, summaries.size(), summaries));
        });
    }

    public Mono<TensionPassResult> tensionPass() {
        return Mono.zip(indexRepository.readEmbeddings(), indexRepository.readClusters())
                .flatMap(tuple -> {
                    EmbeddingsIndex embeddings = tuple.getT1();
                    ClustersIndex clusters = tuple.getT2();
                    int noteCount = embeddings.size();
                    int clusterCount = clusters.clusters().size();

                    if (noteCount < properties.getMinNotesForTension()) {
                        log.info("Tension pass skipped: have {} notes, need {}", noteCount, properties.getMinNotesForTension());
                        return Mono.just(new TensionPassResult(noteCount, clusterCount, 0, List.of()));
                    }
                    if (clusters.isEmpty()) {
                        return Mono.error(new ValidationException("No clusters found. Run the cluster pass first."));
                    }

                    TensionsIndex tensions = tensionDetector.detectTensions(embeddings, clusters);
                    return indexRepository.replace(IndexDocument.TENSIONS, tensions)
                            .thenReturn(new TensionPassResult(noteCount, clusterCount, tensions.tensions().size(),
                                    List.copyOf(tensions.tensions().values())));
                });
    }

    public Mono<DecayPassResult> decayPass() {
        return Mono.zip(indexRepository.readEmbeddings(), indexRepository.readBacklinks(), indexRepository.readClusters())
                .flatMap(tuple -> {
                    var decay = decayScorer.computeDecay(tuple.getT1(), tuple.getT2(), tuple.getT3());
                    return indexRepository.replace(IndexDocument.DECAY, decay)
                            .thenReturn(new DecayPassResult(tuple.getT1().size(), decay.records().size(),
                                    List.copyOf(decay.records().values())));
                })
                .doOnSuccess(result -> log.info("Decay pass complete: {} of {} notes stale",
                        result.staleCount(), result.noteCount()));
    }

    /**
     * Detects structural gaps. Meta notes are identified by reading every clustered note's document.
     */
    public Mono<ExplorationPassResult> explorationPass() {
        return Mono.zip(indexRepository.readEmbeddings(), indexRepository.readBacklinks(),
                        indexRepository.readClusters(), indexRepository.readRelations())
                .flatMap(tuple -> {
                    ClustersIndex clusters = tuple.getT3();
                    List<String> clusteredIds = clusters.clusters().values().stream()
                            .flatMap(cluster -> cluster.noteIds().stream())
                            .distinct()
                            .toList();

                    return noteContentFetcher.fetch(clusteredIds).flatMap(notes -> {
                        Set<String> metaNoteIds = notes.entrySet().stream()
                                .filter(entry -> entry.getValue().isMeta())
                                .map(Map.Entry::getKey)
                                .collect(Collectors.toSet());

                        ExplorationsIndex explorations = gapDetector.detectGaps(tuple.getT1(), tuple.getT2(),
                                clusters, tuple.getT4(), metaNoteIds);
                        Map<String, Integer> byType = new TreeMap<>();
                        for (ExplorationSuggestion suggestion : explorations.suggestions()) {
                            byType.merge(suggestion.type(), 1, Integer::sum);
                        }

                        return indexRepository.replace(IndexDocument.EXPLORATIONS, explorations)
                                .thenReturn(new ExplorationPassResult(explorations.suggestions().size(), byType,
                                        List.copyOf(explorations.suggestions())));
                    });
                });
    }

    /**
     * Records agent classifications. Every pair must already be linked; its similarity is copied from backlinks.
     * All relations are upserted in one update.
     */
    public Mono<RelationsUpdateResult> submitRelations(List<RelationSubmission> submissions) {
        return Mono.fromCallable(() -> validate(submissions))
                .flatMap(types -> indexRepository.readBacklinks().flatMap(backlinks -> {
                    Map<String, Double> similarityByPair = new HashMap<>();
                    for (Map.Entry<String, List<BacklinkEntry>> entry : backlinks.links().entrySet()) {
                        for (BacklinkEntry link : entry.getValue()) {
                            similarityByPair.putIfAbsent(NoteIds.canonicalKey(entry.getKey(), link.targetId()), link.similarity());
                        }
                    }
                    for (int i = 0; i < submissions.size(); i++) {
                        RelationSubmission submission = submissions.get(i);
                        if (!similarityByPair.containsKey(NoteIds.canonicalKey(submission.noteA(), submission.noteB()))) {
                            return Mono.error(new ValidationException("relations[" + i + "]: pair (" + submission.noteA()
                                    + ", " + submission.noteB() + ") not found in backlinks index"));
                        }
                    }

                    Instant classifiedAt = clock.instant();
                    return indexRepository.update(IndexDocument.RELATIONS, relations -> {
                        var updated = relations;
                        for (int i = 0; i < submissions.size(); i++) {
                            RelationSubmission submission = submissions.get(i);
                            double similarity = similarityByPair.get(NoteIds.canonicalKey(submission.noteA(), submission.noteB()));
                            updated = relationRegistry.upsert(updated, submission.noteA(), submission.noteB(),
                                    types.get(i), submission.reason(), similarity, classifiedAt);
                        }
                        return updated;
                    }).map(relations -> new RelationsUpdateResult(submissions.size(), relations.relations().size()));
                }));
    }

    /**
     * Stores advisory suggestions from a refinement agent. Notes themselves are never modified.
     * A suggestion replaces the previous one with the same note and type.
     */
    public Mono<RefinementsUpdateResult> submitRefinements(List<RefinementSubmission> submissions) {
        return Mono.fromCallable(() -> validateRefinements(submissions))
                .flatMap(types -> {
                    Instant generatedAt = clock.instant();
                    return indexRepository.update(IndexDocument.REFINEMENTS, refinements -> {
                        for (int i = 0; i < submissions.size(); i++) {
                            RefinementSubmission submission = submissions.get(i);
                            refinements.upsert(RefinementSuggestion.of(submission.noteId(), types.get(i),
                                    submission.suggestion(), submission.reason(), submission.relatedNoteIds(),
                                    generatedAt));
                        }
                        return refinements.withUpdatedAt(generatedAt);
                    });
                })
                .map(refinements -> new RefinementsUpdateResult(submissions.size(), refinements.suggestions().size()))
                .doOnSuccess(result -> log.info("Stored {} refinement suggestions, {} in total",
                        result.updated(), result.total()));
    }

    public Mono<GraphSnapshot> captureSnapshot() {
        return Mono.zip(indexRepository.readEmbeddings(), indexRepository.readBacklinks(),
                        indexRepository.readClusters(), indexRepository.readTensions(), indexRepository.readDecay())
                .map(tuple -> snapshotCalculator.capture(tuple.getT1(), tuple.getT2(), tuple.getT3(),
                        tuple.getT4(), tuple.getT5()))
                .flatMap(snapshot -> indexRepository.appendSnapshot(snapshot).thenReturn(snapshot))
                .doOnSuccess(snapshot -> log.info("Captured snapshot {}", snapshot.id()));
    }

    /**
     * @param since keep snapshots captured at or after this instant; null for the whole series
     */
    public Mono<AnalyticsResult> analytics(Instant since) {
        return indexRepository.readSnapshots()
                .map(snapshots -> snapshotTimeline.timeline(snapshots, since))
                .map(entries -> new AnalyticsResult(entries, entries.size(), since));
    }

    private List<RelationType> validate(List<RelationSubmission> submissions) {
        if (submissions == null || submissions.isEmpty()) {
            throw new ValidationException("relations must not be empty");
        }
        List<RelationType> types = new ArrayList<>(submissions.size());
        for (int i = 0; i < submissions.size(); i++) {
            RelationSubmission submission = submissions.get(i);
            String prefix = "relations[" + i + "]";
            if (submission == null) {
                throw new ValidationException(prefix + " is missing");
            }
            if (isBlank(submission.noteA())) {
                throw new ValidationException(prefix + ".noteA must be a non-empty string");
            }
            if (isBlank(submission.noteB())) {
                throw new ValidationException(prefix + ".noteB must be a non-empty string");
            }
            if (submission.noteA().equals(submission.noteB())) {
                throw new ValidationException(prefix + ": noteA and noteB must be different");
            }
            RelationType type = submission.relationType() == null ? null
                    : RelationType.find(submission.relationType()).orElse(null);
            if (type == null) {
                throw new ValidationException(prefix + ".relationType \"" + submission.relationType()
                        + "\" is not a valid relation type");
            }
            if (isBlank(submission.reason())) {
                throw new ValidationException(prefix + ".reason must be a non-empty string");
            }
            types.add(type);
        }
        return types;
    }

    private List<RefinementType> validateRefinements(List<RefinementSubmission> submissions) {
        if (submissions == null || submissions.isEmpty()) {
            throw new ValidationException("suggestions must not be empty");
        }
        List<RefinementType> types = new ArrayList<>(submissions.size());
        for (int i = 0; i < submissions.size(); i++) {
            RefinementSubmission submission = submissions.get(i);
            String prefix = "suggestions[" + i + "]";
            if (submission == null) {
                throw new ValidationException(prefix + " is missing");
            }
            if (isBlank(submission.noteId())) {
                throw new ValidationException(prefix + ".noteId must be a non-empty string");
            }
            RefinementType type = submission.type() == null ? null
                    : RefinementType.find(submission.type()).orElse(null);
            if (type == null) {
                throw new ValidationException(prefix + ".type \"" + submission.type()
                        + "\" is not a valid refinement type");
            }
            if (isBlank(submission.suggestion())) {
                throw new ValidationException(prefix + ".suggestion must be a non-empty string");
            }
            if (isBlank(submission.reason())) {
                throw new ValidationException(prefix + ".reason must be a non-empty string");
            }
            List<String> related = submission.relatedNoteIds();
            if (related != null && related.stream().anyMatch(GraphMaintenanceService::isBlank)) {
                throw new ValidationException(prefix + ".relatedNoteIds must contain non-empty strings");
            }
            types.add(type);
        }
        return types;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
