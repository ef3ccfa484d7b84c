package org.example.webverse.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One generated comic page together with the history that led to it.
 * Pages produced by the writer always carry two choices and a seed; pages
 * decoded from an external caller may be incomplete.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Page(
        @JsonProperty("page") int pageNumber,
        String story,
        List<Dialogue> dialogues,
        List<Choice> choices,
        List<HistoryEntry> history,
        Long seed,
        String previousChoice
) {
    public Page {
        story = story == null ? "" : story;
        dialogues = dialogues == null ? List.of() : List.copyOf(dialogues);
        choices = choices == null ? List.of() : List.copyOf(choices);
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static Page empty() {
        return new Page(0, "", List.of(), List.of(), List.of(), null, null);
    }

    public boolean hasStory() {
        return !story.isBlank();
    }
}
