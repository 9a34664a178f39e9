package com.notegraph.main.service;

import com.notegraph.common.model.BacklinkEntry;
import com.notegraph.common.model.Cluster;
import com.notegraph.common.model.ClustersIndex;
import com.notegraph.common.model.DecayRecord;
import com.notegraph.common.model.NoteIds;
import com.notegraph.common.model.ParsedNote;
import com.notegraph.common.model.Tension;
import com.notegraph.main.dto.HypothesisFeed;
import com.notegraph.main.dto.LinkFeed;
import com.notegraph.main.dto.RefinementFeed;
import com.notegraph.main.dto.ThemeFeed;
import com.notegraph.main.relation.RelationRegistry;
import com.notegraph.storage.index.IndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only views of the graph with note contents attached, consumed by classification and synthesis agents.
 * A missing note document yields null content.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AgentFeedService {

    private final IndexRepository indexRepository;
    private final RelationRegistry relationRegistry;
    private final NoteContentFetcher noteContentFetcher;
    private final Clock clock;

    /**
     * @param unclassifiedOnly keep only pairs without a recorded relation
     */
    public Mono<LinkFeed> linkData(boolean unclassifiedOnly) {
        return Mono.zip(indexRepository.readBacklinks(), indexRepository.readRelations())
                .flatMap(tuple -> {
                    var relations = tuple.getT2();
                    List<LinkFeed.Pair> pairs = new ArrayList<>();
                    Set<String> seen = new HashSet<>();
                    int classifiedCount = 0;
                    for (Map.Entry<String, List<BacklinkEntry>> entry : tuple.getT1().links().entrySet()) {
                        String noteId = entry.getKey();
                        for (BacklinkEntry link : entry.getValue()) {
                            if (noteId.equals(link.targetId())
                                    || !seen.add(NoteIds.canonicalKey(noteId, link.targetId()))) {
                                continue;
                            }
                            String noteA = NoteIds.first(noteId, link.targetId());
                            String noteB = NoteIds.second(noteId, link.targetId());
                            var relation = relationRegistry.find(relations, noteA, noteB);
                            if (relation != null) {
                                classifiedCount++;
                                if (unclassifiedOnly) {
                                    continue;
                                }
                            }
                            pairs.add(new LinkFeed.Pair(noteA, noteB, link.similarity(), null, null, relation));
                        }
                    }

                    Set<String> noteIds = new LinkedHashSet<>();
                    pairs.forEach(pair -> {
                        noteIds.add(pair.noteA());
                        noteIds.add(pair.noteB());
                    });
                    int classified = classifiedCount;
                    return noteContentFetcher.fetch(noteIds).map(notes -> {
                        List<LinkFeed.Pair> withContent = pairs.stream()
                                .map(pair -> new LinkFeed.Pair(pair.noteA(), pair.noteB(), pair.similarity(),
                                        notes.get(pair.noteA()), notes.get(pair.noteB()), pair.relation()))
                                .toList();
                        return new LinkFeed(withContent, withContent.size(), classified, clock.instant());
                    });
                });
    }

    /**
     * @param clusterId restrict to one cluster, or null for all. An unknown id yields an empty feed
     */
    public Mono<ThemeFeed> themeData(String clusterId) {
        return Mono.zip(indexRepository.readClusters(), indexRepository.readTensions())
                .flatMap(tuple -> {
                    List<Cluster> clusters = selectClusters(tuple.getT1(), clusterId);
                    List<Tension> tensions = tuple.getT2().tensions().values().stream()
                            .filter(tension -> clusterId == null || clusterId.equals(tension.clusterId()))
                            .toList();

                    List<String> memberIds = clusters.stream()
                            .flatMap(cluster -> cluster.noteIds().stream())
                            .distinct()
                            .toList();
                    return noteContentFetcher.fetch(memberIds).map(notes -> {
                        List<ThemeFeed.ClusterNotes> result = clusters.stream()
                                .map(cluster -> new ThemeFeed.ClusterNotes(cluster.id(), cluster.noteIds(),
                                        contentsOf(cluster.noteIds(), notes)))
                                .toList();
                        return new ThemeFeed(result, tensions, result.size(), memberIds.size(), tensions.size(),
                                clock.instant());
                    });
                });
    }

    /**
     * @param clusterId restrict to tensions inside one cluster, or null for all
     */
    public Mono<HypothesisFeed> hypothesisData(String clusterId) {
        return Mono.zip(indexRepository.readTensions(), indexRepository.readClusters())
                .flatMap(tuple -> {
                    List<Tension> tensions = tuple.getT1().tensions().values().stream()
                            .filter(tension -> clusterId == null || clusterId.equals(tension.clusterId()))
                            .toList();
                    Map<String, Cluster> clusters = tuple.getT2().clusters();

                    Set<String> noteIds = new LinkedHashSet<>();
                    for (Tension tension : tensions) {
                        noteIds.add(tension.noteA());
                        noteIds.add(tension.noteB());
                        Cluster cluster = clusters.get(tension.clusterId());
                        if (cluster != null) {
                            noteIds.addAll(cluster.noteIds());
                        }
                    }

                    return noteContentFetcher.fetch(noteIds).map(notes -> {
                        List<HypothesisFeed.TensionNotes> result = tensions.stream()
                                .map(tension -> new HypothesisFeed.TensionNotes(tension.id(), tension.noteA(),
                                        tension.noteB(), tension.similarity(), tension.clusterId(),
                                        notes.get(tension.noteA()), notes.get(tension.noteB()),
                                        siblingContents(clusters.get(tension.clusterId()), tension, notes)))
                                .toList();
                        return new HypothesisFeed(result, result.size(), clock.instant());
                    });
                });
    }

    /**
     * Clusters with member contents and their decay records, for refinement agents.
     *
     * @param clusterId restrict to one cluster, or null for all. An unknown id yields an empty feed
     */
    public Mono<RefinementFeed> refinementData(String clusterId) {
        return Mono.zip(indexRepository.readClusters(), indexRepository.readDecay())
                .flatMap(tuple -> {
                    List<Cluster> clusters = selectClusters(tuple.getT1(), clusterId);
                    Map<String, DecayRecord> decay = tuple.getT2().records();
                    List<String> memberIds = clusters.stream()
                            .flatMap(cluster -> cluster.noteIds().stream())
                            .distinct()
                            .toList();

                    return noteContentFetcher.fetch(memberIds).map(notes -> {
                        List<RefinementFeed.ClusterNotes> result = new ArrayList<>(clusters.size());
                        for (Cluster cluster : clusters) {
                            Map<String, RefinementFeed.NoteWithDecay> members = new LinkedHashMap<>();
                            contentsOf(cluster.noteIds(), notes).forEach((noteId, note) ->
                                    members.put(noteId, new RefinementFeed.NoteWithDecay(note, decay.get(noteId))));
                            result.add(new RefinementFeed.ClusterNotes(cluster.id(), cluster.noteIds().size(), members));
                        }
                        return new RefinementFeed(result, result.size(), memberIds.size(), tuple.getT1().computedAt());
                    });
                });
    }

    private static List<Cluster> selectClusters(ClustersIndex index, String clusterId) {
        if (clusterId == null) {
            return List.copyOf(index.clusters().values());
        }
        Cluster cluster = index.clusters().get(clusterId);
        if (cluster == null) {
            log.debug("Cluster {} not found", clusterId);
            return List.of();
        }
        return List.of(cluster);
    }

    private static Map<String, ParsedNote> contentsOf(List<String> noteIds, Map<String, ParsedNote> notes) {
        Map<String, ParsedNote> contents = new LinkedHashMap<>();
        for (String noteId : noteIds) {
            ParsedNote note = notes.get(noteId);
            if (note != null) {
                contents.put(noteId, note);
            }
        }
        return contents;
    }

    // Cluster members other than the two notes in tension
    private static Map<String, ParsedNote> siblingContents(Cluster cluster, Tension tension, Map<String, ParsedNote> notes) {
        if (cluster == null) {
            return Map.of();
        }
        List<String> siblings = cluster.noteIds().stream()
                .filter(id -> !id.equals(tension.noteA()) && !id.equals(tension.noteB()))
                .toList();
        return contentsOf(siblings, notes);
    }
}
