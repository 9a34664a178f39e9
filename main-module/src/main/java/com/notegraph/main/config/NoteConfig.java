package com.notegraph.main.config;

import com.notegraph.main.note.NoteIdGenerator;
import com.notegraph.main.note.TimestampHashNoteIdGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NoteConfig {

    @Bean
    public NoteIdGenerator noteIdGenerator() {
        return new TimestampHashNoteIdGenerator();
    }
}
