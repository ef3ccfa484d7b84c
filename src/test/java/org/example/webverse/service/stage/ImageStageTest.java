package org.example.webverse.service.stage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.webverse.model.Choice;
import org.example.webverse.model.HistoryEntry;
import org.example.webverse.model.IllustratedPage;
import org.example.webverse.model.IllustrationPlan;
import org.example.webverse.model.ImageMimeType;
import org.example.webverse.model.Page;
import org.example.webverse.model.Panel;
import org.example.webverse.model.RenderedImage;
import org.example.webverse.service.host.CapturingStageOutbound;
import org.example.webverse.service.host.InboundPayloadReader;
import org.example.webverse.service.host.JsonStageInbound;
import org.example.webverse.service.host.StageEmission;
import org.example.webverse.service.image.ImagePromptComposer;
import org.example.webverse.service.image.InlineImageExtractor;
import org.example.webverse.service.image.MetadataSanitizer;
import org.example.webverse.service.llm.GenerationException;
import org.example.webverse.service.llm.ImageRenderProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageStageTest {

    private static final String MODEL = "gemini-2.5-flash-image";

    @Mock
    private ImageRenderProvider renderProvider;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ImageStage imageStage;

    @BeforeEach
    void setUp() {
        imageStage = new ImageStage(
                renderProvider,
                new ImagePromptComposer(),
                new InlineImageExtractor(),
                new MetadataSanitizer(objectMapper),
                new InboundPayloadReader(objectMapper)
        );
    }

    @Test
    void renderImage_inlineImage_returnsDecodedBytesAndMimeType() throws Exception {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.readTree("""
                {"candidates": [{"content": {"parts": [
                  {"text": "Here you go"},
                  {"inlineData": {"mimeType": "image/jpeg", "data": "/9j/4A=="}}
                ]}}]}
                """));
        when(renderProvider.getModelName()).thenReturn(MODEL);

        RenderedImage image = imageStage.renderImage(samplePage(), samplePlan());

        assertArrayEquals(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0}, image.bytes());
        assertEquals(ImageMimeType.JPEG, image.mimeType());
        assertFalse(image.fallbackUsed());
        assertEquals("false", image.metadata().get("fallback"));
        assertEquals(MODEL, image.metadata().get("model"));
    }

    @Test
    void renderImage_noExtractableBinary_servesPlaceholder() throws Exception {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.readTree("""
                {"candidates": [{"content": {"parts": [{"text": "I cannot draw that."}]}}]}
                """));
        when(renderProvider.getModelName()).thenReturn(MODEL);

        RenderedImage image = imageStage.renderImage(samplePage(), samplePlan());

        assertTrue(image.fallbackUsed());
        assertArrayEquals(ImageStage.placeholder(), image.bytes());
        assertEquals(ImageMimeType.PNG, image.mimeType());
        assertEquals("true", image.metadata().get("fallback"));
    }

    @Test
    void renderImage_providerFails_servesPlaceholderWithError() {
        when(renderProvider.render(anyString())).thenThrow(new GenerationException("gemini", "quota exceeded"));

        RenderedImage image = imageStage.renderImage(samplePage(), samplePlan());

        assertTrue(image.fallbackUsed());
        assertEquals("quota exceeded", image.metadata().get("error"));
        assertEquals("true", image.metadata().get("fallback"));
        assertFalse(image.metadata().containsKey("model"));
    }

    @Test
    void renderImage_metadataValuesAreSingleLine() throws Exception {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.createObjectNode());
        when(renderProvider.getModelName()).thenReturn(MODEL);

        RenderedImage image = imageStage.renderImage(samplePage(), samplePlan());

        image.metadata().values().forEach(value -> {
            assertFalse(value.contains("\n"));
            assertFalse(value.contains("\r"));
        });
        JsonNode page = objectMapper.readTree(image.metadata().get("page"));
        assertEquals(2, page.get("page").asInt());
        JsonNode illustration = objectMapper.readTree(image.metadata().get("illustration"));
        assertEquals("Low angle", illustration.get("artDirection").asText());
    }

    @Test
    void renderImage_longHistory_keepsEncodedMetadataWithinHeaderLimit() throws Exception {
        when(renderProvider.render(anyString())).thenThrow(new GenerationException("gemini", "quota exceeded"));
        List<HistoryEntry> history = new ArrayList<>();
        for (int i = 1; i <= 40; i++) {
            history.add(new HistoryEntry(i, "choice-" + i, "Spider-Man swings past block " + i + ". ".repeat(60)));
        }
        Page page = new Page(41, "Spider-Man faces the Goblin at last. ".repeat(40), List.of(),
                List.of(new Choice("chase", "Chase the glider"), new Choice("help", "Help the injured")),
                history, 3L, "choice-40");

        RenderedImage image = imageStage.renderImage(page, samplePlan());

        JsonNode summary = objectMapper.readTree(image.metadata().get("page"));
        assertEquals(41, summary.get("page").asInt());
        assertFalse(summary.has("history"));
        assertEquals("choice-40", summary.get("previousChoice").asText());
        String encoded = Base64.getEncoder().encodeToString(
                objectMapper.writeValueAsBytes(image.metadata()));
        assertTrue(encoded.length() < 8192, "encoded metadata was " + encoded.length() + " chars");
    }

    @Test
    void renderImage_unsupportedMimeType_servesPlaceholder() throws Exception {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.readTree("""
                {"candidates": [{"content": {"parts": [
                  {"inlineData": {"mimeType": "image/gif", "data": "R0lGODlh"}}
                ]}}]}
                """));
        when(renderProvider.getModelName()).thenReturn(MODEL);

        RenderedImage image = imageStage.renderImage(samplePage(), samplePlan());

        assertTrue(image.fallbackUsed());
        assertEquals(ImageMimeType.PNG, image.mimeType());
        assertArrayEquals(ImageStage.placeholder(), image.bytes());
        assertEquals("true", image.metadata().get("fallback"));
    }

    @Test
    void renderImage_sameInputs_sendSamePrompt() {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.createObjectNode());
        when(renderProvider.getModelName()).thenReturn(MODEL);

        imageStage.renderImage(samplePage(), samplePlan());
        imageStage.renderImage(samplePage(), samplePlan());

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(renderProvider, times(2)).render(prompts.capture());
        assertEquals(prompts.getAllValues().get(0), prompts.getAllValues().get(1));
    }

    @Test
    void handle_pageAndIllustrationPayload_emitsBinaryWithMetadata() throws Exception {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.createObjectNode());
        when(renderProvider.getModelName()).thenReturn(MODEL);
        JsonNode payload = objectMapper.valueToTree(
                new IllustratedPage(samplePage(), samplePlan()));
        CapturingStageOutbound outbound = new CapturingStageOutbound();

        imageStage.handle(new JsonStageInbound(payload, objectMapper), outbound);

        StageEmission emission = outbound.emission().orElseThrow();
        assertTrue(emission.isBinary());
        assertEquals("image/png", emission.contentType());
        assertTrue(emission.metadata().get("prompt").contains("Art direction: Low angle"));
        assertTrue(emission.metadata().get("prompt").contains("Story beat: Spider-Man dodges a pumpkin bomb."));
    }

    @Test
    void handle_bareEmptyPayload_stillRendersWithDefaultPhrases() {
        when(renderProvider.render(anyString())).thenReturn(objectMapper.createObjectNode());
        when(renderProvider.getModelName()).thenReturn(MODEL);
        CapturingStageOutbound outbound = new CapturingStageOutbound();

        imageStage.handle(new JsonStageInbound(objectMapper.createObjectNode(), objectMapper), outbound);

        StageEmission emission = outbound.emission().orElseThrow();
        assertTrue(emission.metadata().get("prompt").contains("Story beat: " + "Spider-Man faces an unexpected threat"));
        assertEquals("true", emission.metadata().get("fallback"));
    }

    private Page samplePage() {
        return new Page(2, "Spider-Man dodges a pumpkin bomb.", List.of(),
                List.of(new Choice("chase", "Chase the glider"), new Choice("help", "Help the injured")),
                List.of(), 3L, "dive-straight-in");
    }

    private IllustrationPlan samplePlan() {
        return new IllustrationPlan(
                List.of(new Panel(1, "Explosion behind Spidey", "Spider-Man")),
                "Low angle",
                "Orange and green",
                "Firelight",
                "Spider-Man flips over a fireball",
                List.of("KABOOM!"));
    }
}
