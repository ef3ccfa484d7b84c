package org.example.webverse.service.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.webverse.model.IllustrationPlan;
import org.example.webverse.model.ImageMimeType;
import org.example.webverse.model.Page;
import org.example.webverse.model.RenderedImage;
import org.example.webverse.service.coercion.PayloadCoercion;
import org.example.webverse.service.host.InboundPayloadReader;
import org.example.webverse.service.host.Stage;
import org.example.webverse.service.host.StageInbound;
import org.example.webverse.service.host.StageOutbound;
import org.example.webverse.service.image.ExtractedImage;
import org.example.webverse.service.image.ImagePromptComposer;
import org.example.webverse.service.image.InlineImageExtractor;
import org.example.webverse.service.image.MetadataSanitizer;
import org.example.webverse.service.llm.ImageRenderProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the comic page image. When the renderer fails or returns no inline
 * image, a 1x1 placeholder PNG is served and flagged in the metadata.
 */
@Component
public class ImageStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(ImageStage.class);

    public static final String NAME = "image-generator";

    private static final byte[] PLACEHOLDER_PNG = Base64.getDecoder().decode(
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAYAAAAfFcSJAAAADUlEQVR4nGMAAQAABQABDQottAAAAABJRU5ErkJggg==");

    private static final int MAX_SUMMARY_STORY_LENGTH = 280;

    private final ImageRenderProvider renderProvider;
    private final ImagePromptComposer promptComposer;
    private final InlineImageExtractor imageExtractor;
    private final MetadataSanitizer metadataSanitizer;
    private final InboundPayloadReader payloadReader;

    public ImageStage(
            ImageRenderProvider renderProvider,
            ImagePromptComposer promptComposer,
            InlineImageExtractor imageExtractor,
            MetadataSanitizer metadataSanitizer,
            InboundPayloadReader payloadReader) {
        this.renderProvider = renderProvider;
        this.promptComposer = promptComposer;
        this.imageExtractor = imageExtractor;
        this.metadataSanitizer = metadataSanitizer;
        this.payloadReader = payloadReader;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void handle(StageInbound inbound, StageOutbound outbound) {
        ObjectNode payload = payloadReader.read(inbound);
        JsonNode pageNode = payload.get("page");
        Page page = PayloadCoercion.coercePage(pageNode != null && pageNode.isObject() ? pageNode : payload);

        JsonNode illustrationNode = payload.get("illustration");
        IllustrationPlan plan;
        if (illustrationNode != null && illustrationNode.isObject() && !illustrationNode.isEmpty()) {
            plan = PayloadCoercion.coercePlan(illustrationNode);
        } else {
            log.error("Image generator received payload without illustration data");
            plan = IllustrationPlan.empty();
        }

        RenderedImage image = renderImage(page, plan);
        outbound.emitBinary(image.bytes(), image.mimeType().value(), image.metadata());
    }

    /**
     * Render {@code page} according to {@code plan}. Never throws.
     */
    public RenderedImage renderImage(Page page, IllustrationPlan plan) {
        Page source = page == null ? Page.empty() : page;
        IllustrationPlan illustration = plan == null ? IllustrationPlan.empty() : plan;
        String prompt = promptComposer.compose(source, illustration);

        JsonNode response;
        try {
            response = renderProvider.render(prompt);
        } catch (RuntimeException e) {
            log.error("Image generation failed; serving placeholder image", e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("error", e.getMessage());
            metadata.put("prompt", prompt);
            metadata.put("fallback", true);
            metadata.put("page", pageSummary(source));
            metadata.put("illustration", illustration);
            return new RenderedImage(placeholder(), ImageMimeType.PNG, metadataSanitizer.sanitize(metadata), true);
        }

        Optional<ExtractedImage> extracted = imageExtractor.extract(response);
        if (extracted.isEmpty()) {
            log.warn("Image response missing inline image data; using placeholder image");
        }
        boolean fallbackUsed = extracted.isEmpty();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("prompt", prompt);
        metadata.put("model", renderProvider.getModelName());
        metadata.put("page", pageSummary(source));
        metadata.put("illustration", illustration);
        metadata.put("fallback", fallbackUsed);

        return extracted
                .map(image -> new RenderedImage(image.bytes(), image.mimeType(),
                        metadataSanitizer.sanitize(metadata), false))
                .orElseGet(() -> new RenderedImage(placeholder(), ImageMimeType.PNG,
                        metadataSanitizer.sanitize(metadata), true));
    }

    /**
     * The page as it travels in metadata: history is left out so the header
     * stays bounded no matter how long the reader's path has been.
     */
    static Map<String, Object> pageSummary(Page page) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("page", page.pageNumber());
        summary.put("story", PayloadCoercion.truncate(page.story(), MAX_SUMMARY_STORY_LENGTH));
        summary.put("choices", page.choices());
        if (page.previousChoice() != null) {
            summary.put("previousChoice", page.previousChoice());
        }
        if (page.seed() != null) {
            summary.put("seed", page.seed());
        }
        return summary;
    }

    static byte[] placeholder() {
        return PLACEHOLDER_PNG.clone();
    }
}
