package com.notegraph.main.relation;

import com.notegraph.common.model.NoteIds;
import com.notegraph.common.model.RelationType;
import com.notegraph.common.model.RelationsIndex;
import com.notegraph.common.model.TypedRelation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Canonical-key upserts and lookups over the relations index.
 */
@Component
public class RelationRegistry {

    /**
     * Stores the relation under the pair's canonical key, overwriting any earlier classification.
     *
     * @return the index with {@code updatedAt} refreshed
     */
    public RelationsIndex upsert(RelationsIndex index,
                                 String noteA,
                                 String noteB,
                                 RelationType relationType,
                                 String reason,
                                 double similarity,
                                 Instant classifiedAt) {
        TypedRelation relation = new TypedRelation(NoteIds.first(noteA, noteB), NoteIds.second(noteA, noteB),
                relationType, reason, similarity, classifiedAt);
        index.relations().put(relation.key(), relation);
        return index.withUpdatedAt(classifiedAt);
    }

    public List<TypedRelation> relationsForNote(RelationsIndex index, String noteId) {
        return index.relations().values().stream()
                .filter(relation -> relation.involves(noteId))
                .toList();
    }

    public TypedRelation find(RelationsIndex index, String noteA, String noteB) {
        return index.relations().get(NoteIds.canonicalKey(noteA, noteB));
    }
}
