package com.notegraph.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * A structural gap in the graph, tagged by {@code type} in the persisted document.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExplorationSuggestion.OrphanNote.class, name = ExplorationSuggestion.ORPHAN_NOTE),
        @JsonSubTypes.Type(value = ExplorationSuggestion.CloseClusters.class, name = ExplorationSuggestion.CLOSE_CLUSTERS),
        @JsonSubTypes.Type(value = ExplorationSuggestion.StructuralHole.class, name = ExplorationSuggestion.STRUCTURAL_HOLE),
        @JsonSubTypes.Type(value = ExplorationSuggestion.MetaNoteMissing.class, name = ExplorationSuggestion.META_NOTE_MISSING)
})
public sealed interface ExplorationSuggestion {

    String ORPHAN_NOTE = "orphan-note";
    String CLOSE_CLUSTERS = "close-clusters";
    String STRUCTURAL_HOLE = "structural-hole";
    String META_NOTE_MISSING = "meta-note-missing";

    String id();

    Instant detectedAt();

    /** The type tag, matching the persisted {@code type} property. */
    String type();

    record OrphanNote(
        @JsonProperty("id") String id,
        @JsonProperty("noteId") String noteId,
        @JsonProperty("detectedAt") Instant detectedAt
    ) implements ExplorationSuggestion {
        @JsonCreator
        public OrphanNote {
        }

        @Override
        public String type() {
            return ORPHAN_NOTE;
        }
    }

    /** {@code clusterA < clusterB} */
    record CloseClusters(
        @JsonProperty("id") String id,
        @JsonProperty("clusterA") String clusterA,
        @JsonProperty("clusterB") String clusterB,
        @JsonProperty("similarity") double similarity,
        @JsonProperty("detectedAt") Instant detectedAt
    ) implements ExplorationSuggestion {
        @JsonCreator
        public CloseClusters {
        }

        @Override
        public String type() {
            return CLOSE_CLUSTERS;
        }
    }

    record StructuralHole(
        @JsonProperty("id") String id,
        @JsonProperty("clusterId") String clusterId,
        @JsonProperty("detectedAt") Instant detectedAt
    ) implements ExplorationSuggestion {
        @JsonCreator
        public StructuralHole {
        }

        @Override
        public String type() {
            return STRUCTURAL_HOLE;
        }
    }

    record MetaNoteMissing(
        @JsonProperty("id") String id,
        @JsonProperty("clusterId") String clusterId,
        @JsonProperty("detectedAt") Instant detectedAt
    ) implements ExplorationSuggestion {
        @JsonCreator
        public MetaNoteMissing {
        }

        @Override
        public String type() {
            return META_NOTE_MISSING;
        }
    }
}
