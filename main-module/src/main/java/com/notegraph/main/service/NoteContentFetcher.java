package com.notegraph.main.service;

import com.notegraph.common.model.ParsedNote;
import com.notegraph.main.config.GraphProperties;
import com.notegraph.storage.note.NoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Reads many note documents with bounded concurrency.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NoteContentFetcher {

    private final NoteRepository noteRepository;
    private final GraphProperties properties;

    /**
     * @return parsed notes by id. Notes whose document is missing are left out
     */
    public Mono<Map<String, ParsedNote>> fetch(Collection<String> noteIds) {
        return Flux.fromIterable(new LinkedHashSet<>(noteIds))
                .flatMap(noteId -> noteRepository.find(noteId)
                                .map(parsed -> Map.entry(noteId, parsed))
                                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Note document {} is missing", noteId))),
                        properties.getNoteFetchConcurrency())
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }
}
