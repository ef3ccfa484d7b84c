package org.example.webverse.model;

public record Dialogue(
        String character,
        String line
) {
}
