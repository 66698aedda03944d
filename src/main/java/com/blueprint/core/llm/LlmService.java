package com.blueprint.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} to produce typed or plain-text output from LLM calls.
 * <p>
 * Structured calls use {@link BeanOutputConverter} to append a JSON schema derived from
 * the target record to the user prompt, then deserialize the reply. Replies the converter
 * rejects get a second, lenient pass through Jackson (markdown fences stripped, unknown
 * properties ignored).
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private static final ObjectMapper LENIENT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private final ChatClient chatClient;
    private final LlmProperties properties;

    public LlmService(ChatClient.Builder builder, LlmProperties properties) {
        this.chatClient = builder.build();
        this.properties = properties;
        log.info("LlmService initialized, provider: {}, model: {}",
                properties.getProvider(), properties.getModel().isBlank() ? "(default)" : properties.getModel());
    }

    /**
     * Sends a system + user prompt and deserializes the reply into {@code outputType}.
     *
     * @throws LlmEmptyResponseException if the model returns no content
     * @throws LlmParseException         if the reply is not valid JSON for {@code outputType}
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        var converter = new BeanOutputConverter<>(outputType);
        String response = call(systemPrompt, userPrompt + "\n\n" + converter.getFormat(),
                outputType.getSimpleName());
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter rejected LLM response for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseLeniently(response, outputType);
        }
    }

    /**
     * Sends a system + user prompt and returns the trimmed text reply.
     *
     * @throws LlmEmptyResponseException if the model returns no content
     */
    public String textCall(String systemPrompt, String userPrompt) {
        return call(systemPrompt, userPrompt, "text").trim();
    }

    private String call(String systemPrompt, String userPrompt, String label) {
        String prompt = truncate(userPrompt);
        log.info("LLM call started → {}", label);
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(prompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete → {} ({}s)", label, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + label);
        }
        return response;
    }

    private String truncate(String prompt) {
        int max = properties.getMaxPromptChars();
        if (max <= 0 || prompt.length() <= max) {
            return prompt;
        }
        log.warn("User prompt truncated from {} to {} chars", prompt.length(), max);
        return prompt.substring(0, max);
    }

    <T> T parseLeniently(String json, Class<T> outputType) {
        String cleaned = stripCodeFence(json);
        try {
            T result = LENIENT_MAPPER.readValue(cleaned, outputType);
            log.info("Lenient parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Lenient parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFence(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
