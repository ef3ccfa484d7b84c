package org.example.webverse.model;

public record Choice(
        String id,
        String label
) {
}
