package org.example.webverse.model;

public record Panel(
        int panel,
        String description,
        String focus
) {
}
