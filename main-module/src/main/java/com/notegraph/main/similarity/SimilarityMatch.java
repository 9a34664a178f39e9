package com.notegraph.main.similarity;

import com.notegraph.common.model.BacklinkEntry;

public record SimilarityMatch(String noteId, double similarity) {

    public BacklinkEntry toLink() {
        return new BacklinkEntry(noteId, similarity);
    }
}
