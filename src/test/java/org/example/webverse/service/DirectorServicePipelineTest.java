package org.example.webverse.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.webverse.config.WebverseProperties;
import org.example.webverse.model.PipelineReport;
import org.example.webverse.service.coercion.ModelOutputParser;
import org.example.webverse.service.fallback.FallbackGenerator;
import org.example.webverse.service.host.InboundPayloadReader;
import org.example.webverse.service.host.LocalStageInvoker;
import org.example.webverse.service.host.StageRegistry;
import org.example.webverse.service.image.ImagePromptComposer;
import org.example.webverse.service.image.InlineImageExtractor;
import org.example.webverse.service.image.MetadataSanitizer;
import org.example.webverse.service.llm.GenerationException;
import org.example.webverse.service.llm.ImageRenderProvider;
import org.example.webverse.service.llm.LlmOptions;
import org.example.webverse.service.llm.LlmProvider;
import org.example.webverse.service.stage.IllustratorStage;
import org.example.webverse.service.stage.ImageStage;
import org.example.webverse.service.stage.ResponseSchemas;
import org.example.webverse.service.stage.WriterStage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs the director against the real stages, with only the model clients mocked.
 */
@ExtendWith(MockitoExtension.class)
class DirectorServicePipelineTest {

    private static final String MODEL_PAGE = """
            {"story": "Spider-Man lands on a water tower.",
             "dialogues": [{"character": "Spider-Man", "line": "Nice view."}],
             "choices": [{"id": "jump", "label": "Jump down"}, {"id": "wait", "label": "Wait and watch"}]}
            """;

    @Mock
    private LlmProvider writerProvider;

    @Mock
    private LlmProvider illustratorProvider;

    @Mock
    private ImageRenderProvider renderProvider;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DirectorService directorService;

    @BeforeEach
    void setUp() {
        WebverseProperties properties = new WebverseProperties();
        ModelOutputParser parser = new ModelOutputParser(objectMapper);
        FallbackGenerator fallbackGenerator = new FallbackGenerator();
        ResponseSchemas schemas = new ResponseSchemas(objectMapper);
        InboundPayloadReader payloadReader = new InboundPayloadReader(objectMapper);

        WriterStage writer = new WriterStage(writerProvider, parser, fallbackGenerator, () -> 11L,
                schemas, payloadReader, properties, objectMapper);
        IllustratorStage illustrator = new IllustratorStage(illustratorProvider, parser, fallbackGenerator, () -> 12L,
                schemas, payloadReader, properties, objectMapper);
        ImageStage image = new ImageStage(renderProvider, new ImagePromptComposer(), new InlineImageExtractor(),
                new MetadataSanitizer(objectMapper), payloadReader);

        LocalStageInvoker invoker = new LocalStageInvoker(
                new StageRegistry(List.of(writer, illustrator, image)), objectMapper);
        directorService = new DirectorService(invoker, objectMapper, properties);
    }

    @AfterEach
    void tearDown() {
        directorService.shutdown();
    }

    @Test
    void run_illustratorModelDown_stillSucceedsWithFallbackPlanAndPlaceholder() {
        when(writerProvider.generate(anyString(), any(LlmOptions.class))).thenReturn(MODEL_PAGE);
        when(illustratorProvider.generate(anyString(), any(LlmOptions.class)))
                .thenThrow(new GenerationException("gemini", "connection refused"));
        when(renderProvider.render(anyString())).thenReturn(objectMapper.createObjectNode());
        when(renderProvider.getModelName()).thenReturn("gemini-2.5-flash-image");

        PipelineReport report = directorService.run(
                objectMapper.createObjectNode().put("choice", "dive-straight-in"));

        assertTrue(report.isSuccess());
        assertNull(report.error());

        assertEquals("Spider-Man lands on a water tower.", report.writer().body().get("story").asText());

        JsonNode illustration = report.illustrator().body().get("illustration");
        assertFalse(illustration.get("panels").isEmpty());
        assertFalse(illustration.get("soundEffects").isEmpty());
        assertEquals(1, report.illustrator().body().get("page").get("page").asInt());

        assertNotNull(report.image());
        assertEquals("image/png", report.image().contentType());
        assertEquals("true", report.image().metadata().get("fallback"));
        assertEquals("base64", report.image().body().get("encoding").asText());
    }

    @Test
    void runAsync_allModelsDown_completesWithFallbackContent() throws Exception {
        when(writerProvider.generate(anyString(), any(LlmOptions.class)))
                .thenThrow(new GenerationException("gemini", "connection refused"));
        when(illustratorProvider.generate(anyString(), any(LlmOptions.class)))
                .thenThrow(new GenerationException("gemini", "connection refused"));
        when(renderProvider.render(anyString())).thenThrow(new GenerationException("gemini", "quota exceeded"));

        PipelineReport report = directorService.runAsync(objectMapper.createObjectNode(), () -> false).get();

        assertTrue(report.isSuccess());
        assertEquals(2, report.writer().body().get("choices").size());
        assertEquals("quota exceeded", report.image().metadata().get("error"));
    }
}
