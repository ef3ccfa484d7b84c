package org.example.webverse.service.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.webverse.config.WebverseProperties;
import org.example.webverse.model.Choice;
import org.example.webverse.model.Dialogue;
import org.example.webverse.model.HistoryEntry;
import org.example.webverse.model.Page;
import org.example.webverse.model.PageContent;
import org.example.webverse.service.coercion.ModelOutputParser;
import org.example.webverse.service.coercion.PayloadCoercion;
import org.example.webverse.service.fallback.FallbackGenerator;
import org.example.webverse.service.fallback.SeedSource;
import org.example.webverse.service.host.InboundPayloadReader;
import org.example.webverse.service.host.Stage;
import org.example.webverse.service.host.StageInbound;
import org.example.webverse.service.host.StageOutbound;
import org.example.webverse.service.llm.LlmOptions;
import org.example.webverse.service.llm.LlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces the next narrative page from the reader's history and latest choice.
 * Always returns a complete page: failed or malformed generations are replaced
 * by seed-driven fallback content, whole or field by field.
 */
@Component
public class WriterStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(WriterStage.class);

    public static final String NAME = "writer";

    static final String SYSTEM_PROMPT = """
            You are the narrative director for a choose-your-own-adventure Spider-Man comic. \
            Always answer with a single JSON object with these keys: \
            'story': string describing the cinematic scene in 3-5 sentences, \
            'dialogues': list of objects with keys 'character' and 'line', and \
            'choices': list of exactly two objects with keys 'id' (kebab-case) and 'label'. \
            Set the tone to upbeat heroism with quips and high stakes. Keep every dialogue \
            line under 25 words. Never include markdown fencing or commentary outside the JSON object.""";

    static final String INTRO_INSTRUCTIONS = """
            Start a brand-new Spider-Man adventure with a surprising inciting incident in New York City. \
            Invent an original villain motivation or anomaly. End with a sharp cliffhanger that naturally \
            leads into both choices.""";

    static final String CONTINUATION_INSTRUCTIONS = """
            Continue the serialized story using the provided history and the player's latest choice. \
            Reference the most recent events, keep continuity tight, and escalate stakes. Close with \
            a new cliffhanger that matches both next-step choices.""";

    private final LlmProvider llmProvider;
    private final ModelOutputParser outputParser;
    private final FallbackGenerator fallbackGenerator;
    private final SeedSource seedSource;
    private final ResponseSchemas responseSchemas;
    private final InboundPayloadReader payloadReader;
    private final WebverseProperties properties;
    private final ObjectMapper objectMapper;

    public WriterStage(
            @Qualifier("writerLlmProvider") LlmProvider llmProvider,
            ModelOutputParser outputParser,
            FallbackGenerator fallbackGenerator,
            SeedSource seedSource,
            ResponseSchemas responseSchemas,
            InboundPayloadReader payloadReader,
            WebverseProperties properties,
            ObjectMapper objectMapper) {
        this.llmProvider = llmProvider;
        this.outputParser = outputParser;
        this.fallbackGenerator = fallbackGenerator;
        this.seedSource = seedSource;
        this.responseSchemas = responseSchemas;
        this.payloadReader = payloadReader;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StageInbound inbound, StageOutbound outbound) {
        ObjectNode payload = payloadReader.read(inbound);
        List<HistoryEntry> history = PayloadCoercion.coerceHistory(payload.get("history"));
        JsonNode choiceNode = payload.get("choice");
        String choice = choiceNode == null || choiceNode.isNull() || choiceNode.isContainerNode()
                ? null
                : choiceNode.asText();

        Page page = produceNextPage(history, choice);
        outbound.emit(objectMapper.valueToTree(page));
    }

    /**
     * Generate the page that follows {@code history} after the reader picked
     * {@code choice}. Never throws.
     *
     * @param history prior pages, oldest first; may be empty
     * @param choice the branch the reader took, or null at the start of a story
     */
    public Page produceNextPage(List<HistoryEntry> history, String choice) {
        List<HistoryEntry> prior = history == null ? List.of() : history;
        long seed = seedSource.nextSeed();
        int pageNumber = prior.size() + 1;
        log.info("Writing page {} ({})", pageNumber, prior.isEmpty() ? "intro" : "continuation");

        PageContent content = generateContent(prior, choice, seed);

        List<HistoryEntry> updatedHistory = new ArrayList<>(prior);
        updatedHistory.add(new HistoryEntry(pageNumber, choice, content.story()));

        return new Page(
                pageNumber,
                content.story(),
                content.dialogues(),
                content.choices(),
                updatedHistory,
                seed,
                choice == null || choice.isBlank() ? null : choice);
    }

    private PageContent generateContent(List<HistoryEntry> prior, String choice, long seed) {
        String raw;
        try {
            String prompt = buildPrompt(prior, choice, seed);
            LlmOptions options = LlmOptions.structured(
                    properties.getWriter().getTemperature(), responseSchemas.page(), SYSTEM_PROMPT);
            raw = llmProvider.generate(prompt, options);
        } catch (RuntimeException e) {
            log.error("Writer generation via {} failed; using fallback page", llmProvider.getProviderName(), e);
            return fallbackGenerator.fallbackPage(prior, seed);
        }

        Optional<ObjectNode> parsed = outputParser.parseObject(raw);
        if (parsed.isEmpty()) {
            log.warn("Falling back due to unparseable writer output ({} chars)", raw == null ? 0 : raw.length());
            return fallbackGenerator.fallbackPage(prior, seed);
        }
        return coerceContent(parsed.get(), prior, seed);
    }

    private PageContent coerceContent(ObjectNode parsed, List<HistoryEntry> prior, long seed) {
        PageContent fallback = null;

        String story = PayloadCoercion.text(parsed.get("story"));
        if (story.isEmpty()) {
            log.info("Model omitted story text; using fallback narrative");
            fallback = fallbackGenerator.fallbackPage(prior, seed);
            story = fallback.story();
        }

        List<Dialogue> dialogues = PayloadCoercion.coerceDialogues(parsed.get("dialogues"));
        if (dialogues.isEmpty()) {
            log.info("Model omitted dialogues; using fallback dialogues");
            if (fallback == null) {
                fallback = fallbackGenerator.fallbackPage(prior, seed);
            }
            dialogues = fallback.dialogues();
        }

        List<Choice> choices = PayloadCoercion.coerceChoices(parsed.get("choices"), seed);
        return new PageContent(story, dialogues, choices);
    }

    String buildPrompt(List<HistoryEntry> prior, String choice, long seed) {
        int window = Math.max(0, properties.getWriter().getHistoryWindow());
        List<HistoryEntry> recent = prior.subList(Math.max(0, prior.size() - window), prior.size());

        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("random_seed", seed);
        frame.set("history", objectMapper.valueToTree(recent));
        frame.put("latest_choice", choice);
        frame.put("request_type", prior.isEmpty() ? "intro" : "continuation");

        String frameJson;
        try {
            frameJson = objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize writer context", e);
        }

        return "Guidance: " + (prior.isEmpty() ? INTRO_INSTRUCTIONS : CONTINUATION_INSTRUCTIONS) + "\n"
                + "Use the JSON below as your context and craft the next page.\n"
                + "Context:" + frameJson;
    }
}
