package org.example.webverse.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IllustrationPlan(
        List<Panel> panels,
        String artDirection,
        String colorPalette,
        String lighting,
        String imagePrompt,
        List<String> soundEffects
) {
    public IllustrationPlan {
        panels = panels == null ? List.of() : List.copyOf(panels);
        soundEffects = soundEffects == null ? List.of() : List.copyOf(soundEffects);
    }

    /**
     * Plan with no content, used when a caller sends a page without illustration data.
     */
    public static IllustrationPlan empty() {
        return new IllustrationPlan(List.of(), null, null, null, null, List.of());
    }
}
