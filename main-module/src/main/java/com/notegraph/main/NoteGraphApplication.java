package com.notegraph.main;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.notegraph")
public class NoteGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(NoteGraphApplication.class, args);
    }
}
