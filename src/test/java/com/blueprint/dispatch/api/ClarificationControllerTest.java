package com.blueprint.dispatch.api;

import com.blueprint.core.clarifier.ClarifierAgent;
import com.blueprint.core.error.ConflictException;
import com.blueprint.core.error.GenerationException;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.error.ValidationException;
import com.blueprint.core.model.ClarificationSession;
import com.blueprint.core.model.ClarificationStatus;
import com.blueprint.core.model.Question;
import com.blueprint.core.model.QuestionType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ClarificationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ClarificationControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ClarifierAgent clarifierAgent;

    private static ClarificationSession session(Map<String, String> answers, ClarificationStatus status) {
        return new ClarificationSession("idea-1", "A garden tool sharing app",
                List.of(new Question("audience", "Who is the target audience?", QuestionType.OPEN, null, true,
                        answers.containsKey("audience"))),
                answers, status, answers.isEmpty() ? 0.3 : 0.9, null, NOW, NOW);
    }

    // ── POST /api/v1/clarifications ─────────────────────────────────

    @Test
    @DisplayName("POST /clarifications returns 201 with the new session")
    void start() throws Exception {
        when(clarifierAgent.startClarification("idea-1", "A garden tool sharing app"))
                .thenReturn(session(Map.of(), ClarificationStatus.CLARIFYING));

        mockMvc.perform(post("/api/v1/clarifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new StartClarificationRequest("idea-1", "A garden tool sharing app"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ideaId").value("idea-1"))
                .andExpect(jsonPath("$.status").value("CLARIFYING"))
                .andExpect(jsonPath("$.questions[0].id").value("audience"))
                .andExpect(jsonPath("$.confidence").value(0.3));
    }

    @Test
    @DisplayName("POST /clarifications maps validation errors to 400")
    void startInvalid() throws Exception {
        when(clarifierAgent.startClarification("idea-1", "short"))
                .thenThrow(new ValidationException("ideaText", "must be at least 10 characters"));

        mockMvc.perform(post("/api/v1/clarifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"idea_id\":\"idea-1\",\"idea\":\"short\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("POST /clarifications maps generator failures to 502, retryable")
    void startGenerationFailure() throws Exception {
        when(clarifierAgent.startClarification("idea-1", "A garden tool sharing app"))
                .thenThrow(new GenerationException("generate-questions", "model unavailable"));

        mockMvc.perform(post("/api/v1/clarifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"idea_id\":\"idea-1\",\"idea\":\"A garden tool sharing app\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("GENERATION_ERROR"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    @DisplayName("POST /clarifications rejects a malformed body with 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/clarifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    // ── GET /api/v1/clarifications/{ideaId} ─────────────────────────

    @Test
    @DisplayName("GET /clarifications/{id} returns the session")
    void getSession() throws Exception {
        when(clarifierAgent.getSession("idea-1"))
                .thenReturn(Optional.of(session(Map.of(), ClarificationStatus.CLARIFYING)));

        mockMvc.perform(get("/api/v1/clarifications/idea-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ideaText").value("A garden tool sharing app"));
    }

    @Test
    @DisplayName("GET /clarifications/{id} returns 404 for an unknown idea")
    void getUnknown() throws Exception {
        when(clarifierAgent.getSession("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/clarifications/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    // ── POST /api/v1/clarifications/{ideaId}/answers ────────────────

    @Test
    @DisplayName("POST /answers records the answer")
    void answer() throws Exception {
        when(clarifierAgent.submitAnswer("idea-1", "audience", "Neighbours"))
                .thenReturn(session(Map.of("audience", "Neighbours"), ClarificationStatus.COMPLETE));

        mockMvc.perform(post("/api/v1/clarifications/idea-1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new AnswerRequest("audience", "Neighbours"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answers.audience").value("Neighbours"))
                .andExpect(jsonPath("$.questions[0].answered").value(true))
                .andExpect(jsonPath("$.status").value("COMPLETE"));
    }

    @Test
    @DisplayName("POST /answers maps unknown ideas to 404 and conflicts to 409")
    void answerErrors() throws Exception {
        when(clarifierAgent.submitAnswer("nope", "audience", "x"))
                .thenThrow(NotFoundException.clarificationSession("nope"));
        when(clarifierAgent.submitAnswer("idea-1", "audience", "x"))
                .thenThrow(new ConflictException("Clarification session for idea idea-1 was modified concurrently"));

        mockMvc.perform(post("/api/v1/clarifications/nope/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question_id\":\"audience\",\"answer\":\"x\"}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/v1/clarifications/idea-1/answers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question_id\":\"audience\",\"answer\":\"x\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    // ── POST /api/v1/clarifications/{ideaId}/complete ───────────────

    @Test
    @DisplayName("POST /complete returns the completed session")
    void complete() throws Exception {
        var completed = session(Map.of("audience", "Neighbours"), ClarificationStatus.CLARIFYING)
                .completed("A tool sharing app for neighbours", 0.9, NOW);
        when(clarifierAgent.completeClarification("idea-1")).thenReturn(completed);

        mockMvc.perform(post("/api/v1/clarifications/idea-1/complete"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETE"))
                .andExpect(jsonPath("$.refinedIdea").value("A tool sharing app for neighbours"));
    }
}
