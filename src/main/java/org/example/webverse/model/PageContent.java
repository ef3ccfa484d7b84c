package org.example.webverse.model;

import java.util.List;

/**
 * The narrative part of a page, before page number, history and seed are stamped on.
 */
public record PageContent(
        String story,
        List<Dialogue> dialogues,
        List<Choice> choices
) {
    public PageContent {
        dialogues = dialogues == null ? List.of() : List.copyOf(dialogues);
        choices = choices == null ? List.of() : List.copyOf(choices);
    }
}
