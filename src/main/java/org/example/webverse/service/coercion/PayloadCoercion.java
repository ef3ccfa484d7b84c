package org.example.webverse.service.coercion;

import com.fasterxml.jackson.databind.JsonNode;
import org.example.webverse.model.Choice;
import org.example.webverse.model.Dialogue;
import org.example.webverse.model.HistoryEntry;
import org.example.webverse.model.IllustrationPlan;
import org.example.webverse.model.Page;
import org.example.webverse.model.Panel;
import org.example.webverse.service.fallback.SeededRandom;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Best-effort normalization of loosely shaped JSON into the strict page and
 * illustration records. Nothing here throws: unusable input turns into an empty
 * result or a small synthesized default, depending on the field.
 */
public final class PayloadCoercion {

    public static final int MAX_DIALOGUES = 8;
    public static final int MAX_PANELS = 5;
    public static final int MAX_SOUND_EFFECTS = 4;
    public static final int MAX_SOUND_EFFECT_LENGTH = 18;
    public static final int MAX_CHOICE_ID_LENGTH = 64;
    public static final String DEFAULT_FOCUS = "Spider-Man";
    public static final String NARRATOR = "Narrator";

    static final List<Choice> CHOICE_POOL = List.of(
            new Choice("swing-right-into-chaos", "Swing toward the source of the disturbance."),
            new Choice("shadow-trail", "Stay hidden and trail the villain through the shadows."),
            new Choice("shield-civilians", "Web up a barrier and protect the civilians first."),
            new Choice("tech-diagnosis", "Scan the strange device with your suit's sensors.")
    );

    static final List<String> DEFAULT_SOUND_EFFECTS = List.of("THWIP!", "WHOOOSH!");

    static final Panel DEFAULT_PANEL =
            new Panel(1, "Spider-Man leaps into action across the city skyline.", DEFAULT_FOCUS);

    private PayloadCoercion() {
    }

    /**
     * @return up to eight dialogue lines; empty when nothing usable was found
     */
    public static List<Dialogue> coerceDialogues(JsonNode raw) {
        List<Dialogue> dialogues = new ArrayList<>();
        if (raw == null) {
            return dialogues;
        }

        if (raw.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String line = text(field.getValue());
                if (!line.isEmpty()) {
                    String character = field.getKey().trim();
                    dialogues.add(new Dialogue(character.isEmpty() ? NARRATOR : character, line));
                }
            }
        } else if (raw.isArray()) {
            for (JsonNode item : raw) {
                if (item.isObject()) {
                    String character = firstText(item, "character", "speaker");
                    String line = firstText(item, "line", "dialogue", "text");
                    if (!line.isEmpty()) {
                        dialogues.add(new Dialogue(character.isEmpty() ? NARRATOR : character, line));
                    }
                } else if (item.isTextual()) {
                    String line = item.asText().trim();
                    if (!line.isEmpty()) {
                        dialogues.add(new Dialogue(NARRATOR, line));
                    }
                }
            }
        }

        return dialogues.size() > MAX_DIALOGUES
                ? new ArrayList<>(dialogues.subList(0, MAX_DIALOGUES))
                : dialogues;
    }

    /**
     * Usable choices found in {@code raw}, at most two, without any backfill.
     */
    public static List<Choice> extractChoices(JsonNode raw) {
        List<Choice> choices = new ArrayList<>();
        if (raw == null || !raw.isArray()) {
            return choices;
        }
        for (JsonNode item : raw) {
            String label;
            String id = "";
            if (item.isObject()) {
                label = firstText(item, "label", "text", "choice");
                id = firstText(item, "id", "slug");
            } else if (item.isTextual()) {
                label = item.asText().trim();
            } else {
                continue;
            }
            if (label.isEmpty()) {
                continue;
            }
            if (id.isEmpty()) {
                id = slugify(label);
            }
            addIfDistinct(choices, new Choice(truncate(id, MAX_CHOICE_ID_LENGTH), label));
            if (choices.size() == 2) {
                break;
            }
        }
        return choices;
    }

    /**
     * Exactly two choices with distinct ids and labels. Gaps are filled from a
     * fixed pool shuffled by {@code seed}, so equal seeds fill equal gaps.
     */
    public static List<Choice> coerceChoices(JsonNode raw, long seed) {
        List<Choice> choices = extractChoices(raw);
        if (choices.size() >= 2) {
            return List.copyOf(choices);
        }

        List<Choice> pool = new ArrayList<>(CHOICE_POOL);
        new SeededRandom(seed).shuffle(pool);
        while (choices.size() < 2 && !pool.isEmpty()) {
            addIfDistinct(choices, pool.remove(pool.size() - 1));
        }
        return List.copyOf(choices);
    }

    /**
     * Usable panels found in {@code raw}, at most five; empty when none.
     */
    public static List<Panel> extractPanels(JsonNode raw) {
        List<Panel> panels = new ArrayList<>();
        if (raw == null || !raw.isArray()) {
            return panels;
        }
        for (JsonNode entry : raw) {
            if (panels.size() == MAX_PANELS) {
                break;
            }
            int position = panels.size() + 1;
            if (entry.isObject()) {
                String description = firstText(entry, "description", "scene");
                if (description.isEmpty()) {
                    continue;
                }
                String focus = firstText(entry, "focus", "characters");
                Integer number = integer(entry.get("panel"));
                panels.add(new Panel(
                        number == null || number < 1 ? position : number,
                        description,
                        focus.isEmpty() ? DEFAULT_FOCUS : focus));
            } else if (entry.isTextual() && !entry.asText().isBlank()) {
                panels.add(new Panel(position, entry.asText().trim(), DEFAULT_FOCUS));
            }
        }
        return panels;
    }

    /**
     * Between one and five panels; a single stock panel when nothing is usable.
     */
    public static List<Panel> coercePanels(JsonNode raw) {
        List<Panel> panels = extractPanels(raw);
        return panels.isEmpty() ? List.of(DEFAULT_PANEL) : List.copyOf(panels);
    }

    /**
     * One to four upper-cased effects of at most 18 characters each.
     */
    public static List<String> coerceSoundEffects(JsonNode raw) {
        List<String> effects = extractSoundEffects(raw);
        return effects.isEmpty() ? DEFAULT_SOUND_EFFECTS : List.copyOf(effects);
    }

    static List<String> extractSoundEffects(JsonNode raw) {
        List<String> effects = new ArrayList<>();
        if (raw == null) {
            return effects;
        }
        if (raw.isTextual()) {
            addSoundEffect(effects, raw.asText());
        } else if (raw.isArray()) {
            for (JsonNode item : raw) {
                if (effects.size() == MAX_SOUND_EFFECTS) {
                    break;
                }
                if (item.isValueNode()) {
                    addSoundEffect(effects, item.asText());
                }
            }
        }
        return effects;
    }

    public static List<HistoryEntry> coerceHistory(JsonNode raw) {
        List<HistoryEntry> history = new ArrayList<>();
        if (raw == null || !raw.isArray()) {
            return history;
        }
        for (JsonNode item : raw) {
            int position = history.size() + 1;
            if (item.isObject()) {
                Integer page = integer(item.get("page"));
                String choice = text(item.get("choice"));
                history.add(new HistoryEntry(
                        page == null ? position : page,
                        choice.isEmpty() ? null : choice,
                        text(item.get("story"))));
            } else if (item.isValueNode() && !item.isNull()) {
                history.add(new HistoryEntry(position, null, item.asText().trim()));
            } else {
                // unreadable entries still count toward the page number
                history.add(new HistoryEntry(position, null, ""));
            }
        }
        return history;
    }

    /**
     * Decode a page sent by the writer or by an external caller. Missing parts
     * stay empty; choices are not backfilled here.
     */
    public static Page coercePage(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return Page.empty();
        }
        Integer pageNumber = integer(first(raw, "page", "pageNumber"));
        String previousChoice = firstText(raw, "previousChoice", "previous_choice");
        return new Page(
                pageNumber == null ? 0 : pageNumber,
                text(raw.get("story")),
                coerceDialogues(raw.get("dialogues")),
                extractChoices(raw.get("choices")),
                coerceHistory(raw.get("history")),
                seed(raw.get("seed")),
                previousChoice.isEmpty() ? null : previousChoice);
    }

    /**
     * Decode an illustration plan sent to the image stage. Blank text fields
     * become null so the prompt composer can substitute its own phrases.
     */
    public static IllustrationPlan coercePlan(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return IllustrationPlan.empty();
        }
        return new IllustrationPlan(
                extractPanels(first(raw, "panels", "panel_layout")),
                blankToNull(firstText(raw, "artDirection", "art_direction")),
                blankToNull(firstText(raw, "colorPalette", "color_palette")),
                blankToNull(firstText(raw, "lighting")),
                blankToNull(firstText(raw, "imagePrompt", "image_prompt")),
                extractSoundEffects(first(raw, "soundEffects", "sound_effects")));
    }

    /**
     * Trimmed text of a scalar node; empty for missing, null and container nodes.
     */
    public static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return "";
        }
        return node.asText().trim();
    }

    /**
     * First field among {@code names} that is present and not JSON null.
     */
    public static JsonNode first(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    /**
     * Text of the first field among {@code names} with non-blank text.
     */
    public static String firstText(JsonNode node, String... names) {
        for (String name : names) {
            String value = text(node.get(name));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    public static String slugify(String label) {
        return label.toLowerCase(Locale.ROOT).replace(" ", "-").replace("'", "");
    }

    public static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    private static void addSoundEffect(List<String> effects, String value) {
        String effect = value == null ? "" : value.trim();
        if (!effect.isEmpty()) {
            effects.add(truncate(effect.toUpperCase(Locale.ROOT), MAX_SOUND_EFFECT_LENGTH));
        }
    }

    private static void addIfDistinct(List<Choice> choices, Choice candidate) {
        if (candidate.id().isBlank() || candidate.label().isBlank()) {
            return;
        }
        for (Choice existing : choices) {
            if (existing.id().equals(candidate.id())
                    || existing.label().equalsIgnoreCase(candidate.label())) {
                return;
            }
        }
        choices.add(candidate);
    }

    private static Integer integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isNumber()) {
            return (int) node.doubleValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Long seed(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue() & 0xFFFFFFFFL;
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim()) & 0xFFFFFFFFL;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
