package com.notegraph.main.pipeline;

import com.notegraph.common.model.NoteType;
import com.notegraph.main.similarity.SimilarityMatch;

import java.util.List;

/**
 * @param type        assigned note type, null for a plain note
 * @param linkedNotes outbound links of the new note, most similar first
 */
public record IngestionResult(String noteId, NoteType type, List<SimilarityMatch> linkedNotes) {
}
