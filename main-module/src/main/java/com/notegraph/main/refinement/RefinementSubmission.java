package com.notegraph.main.refinement;

import java.util.List;

/**
 * One advisory suggestion submitted by an agent. {@code type} is the wire label, validated on submit.
 *
 * @param relatedNoteIds other notes the suggestion refers to, may be null
 */
public record RefinementSubmission(String noteId, String type, String suggestion, String reason,
                                   List<String> relatedNoteIds) {
}
