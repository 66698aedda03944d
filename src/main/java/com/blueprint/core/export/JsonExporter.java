package com.blueprint.core.export;

import com.blueprint.core.model.BreakdownSession;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a breakdown as a pretty-printed JSON document for programmatic consumers.
 * The session is written with the application's Jackson configuration, wrapped with
 * the idea summary and export metadata.
 */
@Component
public class JsonExporter implements BlueprintExporter {

    static final String DOCUMENT_VERSION = "1.0.0";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonExporter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public String render(BreakdownSession session, String ideaSummary) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exported_at", clock.instant().toString());
        metadata.put("version", DOCUMENT_VERSION);
        metadata.put("format", "json");

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("idea_id", session.ideaId());
        if (ideaSummary != null && !ideaSummary.isBlank()) {
            document.put("summary", ideaSummary.trim());
        }
        document.put("blueprint", session);
        document.put("metadata", metadata);

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize breakdown " + session.id(), e);
        }
    }
}
