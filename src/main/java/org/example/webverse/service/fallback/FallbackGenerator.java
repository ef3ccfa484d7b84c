package org.example.webverse.service.fallback;

import org.example.webverse.model.Choice;
import org.example.webverse.model.Dialogue;
import org.example.webverse.model.HistoryEntry;
import org.example.webverse.model.IllustrationPlan;
import org.example.webverse.model.Page;
import org.example.webverse.model.PageContent;
import org.example.webverse.model.Panel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Seed-driven stand-in content for when the generative service is unusable.
 * Each call builds its own {@link SeededRandom}; draws always happen in the order
 * villain, location, complication, palette, lighting, so the same seed yields
 * the same villain on the page and in its illustration.
 */
@Component
public class FallbackGenerator {

    static final List<String> VILLAINS = List.of(
            "the Lizard",
            "Doctor Octopus",
            "Electro",
            "the Green Goblin",
            "Mysterio",
            "the Vulture"
    );

    static final List<String> LOCATIONS = List.of(
            "Times Square",
            "the Brooklyn Bridge",
            "Queens rooftops",
            "a S.H.I.E.L.D. safehouse in Hell's Kitchen",
            "Grand Central Terminal",
            "the New York Public Library"
    );

    static final List<String> COMPLICATIONS = List.of(
            "a collapsing hovercraft",
            "an unstable quantum rift",
            "civilians caught in a gravity storm",
            "a swarm of rogue spider-bots",
            "an EMP pulse knocking out city power",
            "dimensional echoes tearing open the sky"
    );

    static final List<String> PALETTES = List.of(
            "vibrant reds, electric blues, neon greens",
            "noir shadows with crimson highlights",
            "sunset oranges with stormy purples"
    );

    static final List<String> LIGHTING = List.of(
            "Dynamic rim lighting with sparks of energy",
            "Nocturnal city glow with reflective webs",
            "Backlit skyline with dramatic spotlight on Spider-Man"
    );

    static final List<Choice> PAGE_CHOICES = List.of(
            new Choice("dive-straight-in", "Dive straight into the fray and confront the villain."),
            new Choice("secure-civilians", "Secure the civilians before taking on the threat.")
    );

    static final List<String> SOUND_EFFECTS = List.of("THWIP!", "KRAKOOM!", "VRRRMMM!");

    static final String ART_DIRECTION =
            "Lean into kinetic motion, tilted angles, and close-ups that heighten tension.";

    private static final List<String> FILLER_SENTENCES = List.of(
            "Spider-Man surveys the chaos below.",
            "A looming threat crackles with energy."
    );

    /**
     * Build a complete page narrative. Depends only on the seed and on how many
     * pages came before.
     */
    public PageContent fallbackPage(List<HistoryEntry> priorHistory, long seed) {
        SeededRandom random = new SeededRandom(seed);
        String villain = random.pick(VILLAINS);
        String location = random.pick(LOCATIONS);
        String complication = random.pick(COMPLICATIONS);

        int pageNumber = (priorHistory == null ? 0 : priorHistory.size()) + 1;
        String opener = pageNumber > 1
                ? "Page " + pageNumber + ": still catching his breath from the last clash, Spider-Man"
                : "Spider-Man";

        String story = opener + " swings above " + location + " when he spots " + villain
                + " orchestrating " + complication + ". With sirens blaring below, Spidey cracks a joke"
                + " to calm the nerves, even his own, before he dives into danger.";

        List<Dialogue> dialogues = List.of(
                new Dialogue("Spider-Man", "Okay, bad guy roll call. Who ordered the reality meltdown combo?"),
                new Dialogue(titleCase(villain), "Spider-Man, you're just in time to watch New York unravel!")
        );

        return new PageContent(story, dialogues, PAGE_CHOICES);
    }

    /**
     * Build a complete illustration plan for {@code page}.
     */
    public IllustrationPlan fallbackIllustration(Page page, long seed) {
        SeededRandom random = new SeededRandom(seed);
        String villain = random.pick(VILLAINS);
        String location = random.pick(LOCATIONS);
        String complication = random.pick(COMPLICATIONS);
        String palette = random.pick(PALETTES);
        String lighting = random.pick(LIGHTING);

        String story = page == null || !page.hasStory()
                ? "Spider-Man springs into action above " + location + " as " + villain
                        + " unleashes " + complication + "."
                : page.story().trim();

        List<String> sentences = new ArrayList<>(Arrays.stream(story.split("(?<=[.!?])\\s+"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList());
        if (sentences.size() < 3) {
            sentences.addAll(FILLER_SENTENCES);
        }

        List<Panel> panels = new ArrayList<>();
        for (int i = 0; i < 3 && i < sentences.size(); i++) {
            String line = sentences.get(i);
            panels.add(new Panel(i + 1, line, line.contains("Spider") ? "Spider-Man" : "Scene action"));
        }

        return new IllustrationPlan(
                panels,
                ART_DIRECTION,
                palette,
                lighting,
                "Comic book illustration of Spider-Man in action: " + truncate(story, 220),
                SOUND_EFFECTS
        );
    }

    private static String titleCase(String value) {
        StringBuilder result = new StringBuilder(value.length());
        for (String word : value.split(" ")) {
            if (result.length() > 0) {
                result.append(' ');
            }
            if (!word.isEmpty()) {
                result.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
            }
        }
        return result.toString();
    }

    private static String truncate(String value, int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
