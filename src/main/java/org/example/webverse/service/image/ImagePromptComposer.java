package org.example.webverse.service.image;

import org.example.webverse.model.Choice;
import org.example.webverse.model.IllustrationPlan;
import org.example.webverse.model.Page;
import org.example.webverse.model.Panel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the rendering prompt from a page and its illustration plan. The output
 * depends only on the inputs; absent fields fall back to fixed phrases.
 */
@Component
public class ImagePromptComposer {

    static final String FRAMING = "Spider-Man comic page concept art.";
    static final String STYLE =
            "Style: dynamic Marvel comic illustration, crisp inks, expressive action, cinematic perspective.";

    static final String DEFAULT_STORY = "Spider-Man faces an unexpected threat in New York City.";
    static final String DEFAULT_ART_DIRECTION = "Dynamic comic book action from Spider-Man's perspective.";
    static final String DEFAULT_COLOR_PALETTE = "Bold reds and blues with high-contrast highlights.";
    static final String DEFAULT_LIGHTING = "City twilight glow with dramatic shadows.";
    static final String DEFAULT_FOCUS = "Spider-Man swings through Manhattan as energy crackles around him.";

    private static final int MAX_PANELS = 5;
    private static final int MAX_CHOICES = 2;

    public String compose(Page page, IllustrationPlan plan) {
        Page source = page == null ? Page.empty() : page;
        IllustrationPlan illustration = plan == null ? IllustrationPlan.empty() : plan;

        List<String> sections = new ArrayList<>();
        sections.add(FRAMING);
        sections.add("Story beat: " + orDefault(source.story(), DEFAULT_STORY));
        sections.add("Art direction: " + orDefault(illustration.artDirection(), DEFAULT_ART_DIRECTION));
        sections.add("Color palette: " + orDefault(illustration.colorPalette(), DEFAULT_COLOR_PALETTE));
        sections.add("Lighting: " + orDefault(illustration.lighting(), DEFAULT_LIGHTING));
        sections.add("Primary focus: " + orDefault(illustration.imagePrompt(), DEFAULT_FOCUS));

        List<String> panelLines = new ArrayList<>();
        for (Panel panel : illustration.panels()) {
            if (panelLines.size() == MAX_PANELS) {
                break;
            }
            if (panel.description() == null || panel.description().isBlank()) {
                continue;
            }
            int number = panel.panel() > 0 ? panel.panel() : panelLines.size() + 1;
            String focus = panel.focus() == null || panel.focus().isBlank() ? "Spider-Man" : panel.focus().trim();
            panelLines.add("Panel " + number + ": " + panel.description().trim() + " (focus: " + focus + ")");
        }
        if (!panelLines.isEmpty()) {
            sections.add("Panel breakdown:\n" + String.join("\n", panelLines));
        }

        List<String> labels = new ArrayList<>();
        for (Choice choice : source.choices()) {
            if (labels.size() == MAX_CHOICES) {
                break;
            }
            if (choice.label() != null && !choice.label().isBlank()) {
                labels.add(choice.label().trim());
            }
        }
        if (!labels.isEmpty()) {
            sections.add("Choices presented: " + String.join(" | ", labels));
        }

        sections.add(STYLE);
        return String.join("\n", sections);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
