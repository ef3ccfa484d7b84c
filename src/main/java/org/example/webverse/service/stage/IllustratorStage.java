package org.example.webverse.service.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.webverse.config.WebverseProperties;
import org.example.webverse.model.HistoryEntry;
import org.example.webverse.model.IllustratedPage;
import org.example.webverse.model.IllustrationPlan;
import org.example.webverse.model.Page;
import org.example.webverse.model.Panel;
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

import java.util.List;
import java.util.Optional;

/**
 * Turns a narrative page into a panel layout and art direction for the image stage.
 */
@Component
public class IllustratorStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(IllustratorStage.class);

    public static final String NAME = "illustrator";

    static final String SYSTEM_PROMPT = """
            You are the cinematic art director for a Spider-Man comic. \
            Given story context, respond with the illustration of a comic page. \
            Generate a panel layout of up to 3 panels, each with a 'panel' number, description, and focus. \
            Next give an art direction that guides composition and perspective. \
            Also provide a color palette that defines the dominant colors and mood lighting. \
            Generate an image prompt that is a concise description of the entire page for an image generator. \
            Finally, suggest up to 4 sound effects (stylized SFX strings). \
            Keep everything faithful to Spider-Man's tone.""";

    static final String DEFAULT_ART_DIRECTION = "Cinematic motion with heroic staging.";
    static final String DEFAULT_COLOR_PALETTE = "Rich reds and deep blues with energy highlights.";
    static final String DEFAULT_LIGHTING = "High-contrast with streaked city lights.";

    private final LlmProvider llmProvider;
    private final ModelOutputParser outputParser;
    private final FallbackGenerator fallbackGenerator;
    private final SeedSource seedSource;
    private final ResponseSchemas responseSchemas;
    private final InboundPayloadReader payloadReader;
    private final WebverseProperties properties;
    private final ObjectMapper objectMapper;

    public IllustratorStage(
            @Qualifier("illustratorLlmProvider") LlmProvider llmProvider,
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
        JsonNode wrapped = payload.get("page");
        Page page = PayloadCoercion.coercePage(wrapped != null && wrapped.isObject() ? wrapped : payload);

        IllustrationPlan plan = producePlan(page);
        outbound.emit(objectMapper.valueToTree(new IllustratedPage(page, plan)));
    }

    /**
     * Plan the illustration for {@code page}. Uses the page's seed for any
     * fallback content when it has one. Never throws.
     */
    public IllustrationPlan producePlan(Page page) {
        Page source = page == null ? Page.empty() : page;
        long seed = source.seed() != null ? source.seed() : seedSource.nextSeed();

        if (!source.hasStory()) {
            log.error("Illustrator received a page without story; responding with fallback");
            return fallbackGenerator.fallbackIllustration(source, seed);
        }

        log.info("Planning illustration for page {}", source.pageNumber());
        String raw;
        try {
            LlmOptions options = LlmOptions.structured(
                    properties.getIllustrator().getTemperature(), responseSchemas.illustration(), SYSTEM_PROMPT);
            raw = llmProvider.generate(buildPrompt(source), options);
        } catch (RuntimeException e) {
            log.error("Illustrator generation via {} failed; using fallback illustration",
                    llmProvider.getProviderName(), e);
            return fallbackGenerator.fallbackIllustration(source, seed);
        }

        Optional<ObjectNode> parsed = outputParser.parseObject(raw);
        if (parsed.isEmpty()) {
            log.warn("Illustrator model output parsing failed; using fallback illustration");
            return fallbackGenerator.fallbackIllustration(source, seed);
        }
        return coercePlan(parsed.get(), source, seed);
    }

    private IllustrationPlan coercePlan(ObjectNode parsed, Page page, long seed) {
        IllustrationPlan decoded = PayloadCoercion.coercePlan(parsed);
        IllustrationPlan fallback = null;

        List<Panel> panels = decoded.panels();
        if (panels.isEmpty()) {
            log.info("Illustrator model missing panel layout; using fallback panels");
            fallback = fallbackGenerator.fallbackIllustration(page, seed);
            panels = fallback.panels();
        }

        String imagePrompt = decoded.imagePrompt();
        if (imagePrompt == null) {
            if (fallback == null) {
                fallback = fallbackGenerator.fallbackIllustration(page, seed);
            }
            imagePrompt = fallback.imagePrompt();
        }

        return new IllustrationPlan(
                panels,
                orDefault(decoded.artDirection(), DEFAULT_ART_DIRECTION),
                orDefault(decoded.colorPalette(), DEFAULT_COLOR_PALETTE),
                orDefault(decoded.lighting(), DEFAULT_LIGHTING),
                imagePrompt,
                PayloadCoercion.coerceSoundEffects(PayloadCoercion.first(parsed, "soundEffects", "sound_effects")));
    }

    String buildPrompt(Page page) {
        int window = Math.max(0, properties.getIllustrator().getHistoryWindow());
        List<HistoryEntry> history = page.history();
        List<HistoryEntry> recent = history.subList(Math.max(0, history.size() - window), history.size());

        ObjectNode context = objectMapper.createObjectNode();
        context.put("page", page.pageNumber());
        context.put("story", page.story());
        context.set("dialogues", objectMapper.valueToTree(page.dialogues()));
        context.set("choices", objectMapper.valueToTree(page.choices()));
        context.put("previous_choice", page.previousChoice());
        context.set("recent_history", objectMapper.valueToTree(recent));

        try {
            return "Context:" + objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize illustrator context", e);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
