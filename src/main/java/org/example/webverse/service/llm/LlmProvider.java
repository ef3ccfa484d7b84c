package org.example.webverse.service.llm;

/**
 * A text-generation backend used by the writer and illustrator stages.
 * Implementations are Gemini, Ollama and xAI.
 */
public interface LlmProvider {

    /**
     * Send one prompt and return the model's raw text. Stages parse and coerce
     * the text themselves, so a schema in {@code options} is a hint only.
     *
     * @throws GenerationException when the call fails, times out or is refused
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Whether the provider is configured well enough to try a call.
     */
    boolean isAvailable();

    /**
     * Short provider name such as {@code gemini}, used in logs and health output.
     */
    String getProviderName();
}
