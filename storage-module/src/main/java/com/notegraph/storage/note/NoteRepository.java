package com.notegraph.storage.note;

import com.notegraph.common.model.Note;
import com.notegraph.common.model.ParsedNote;
import com.notegraph.common.serialization.NoteMarkdownDeserializer;
import com.notegraph.common.serialization.NoteMarkdownSerializer;
import com.notegraph.storage.config.DocumentStoreProperties;
import com.notegraph.storage.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Note documents, one markdown file per note id. Notes are create-only.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class NoteRepository {

    private final DocumentStore documentStore;
    private final NoteMarkdownSerializer serializer;
    private final NoteMarkdownDeserializer deserializer;
    private final DocumentStoreProperties properties;

    public String pathOf(String noteId) {
        return serializer.notePath(properties.getNotesDir(), noteId);
    }

    /**
     * Creates the note document. A note path is new by construction, so no version is sent.
     */
    public Mono<String> create(Note note) {
        String path = pathOf(note.id());
        log.debug("Creating note document {}", path);
        return documentStore.put(path, serializer.serialize(note), null);
    }

    /**
     * @return the parsed note, or an empty Mono if the document does not exist
     */
    public Mono<ParsedNote> find(String noteId) {
        return documentStore.get(pathOf(noteId))
                .map(document -> deserializer.deserialize(document.content()));
    }
}
