package com.blueprint.dispatch.api;

import com.blueprint.core.clarifier.ClarifierAgent;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.model.ClarificationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the clarification dialogue of an idea.
 */
@RestController
@RequestMapping("/api/v1/clarifications")
public class ClarificationController {

    private static final Logger log = LoggerFactory.getLogger(ClarificationController.class);

    private final ClarifierAgent clarifierAgent;

    public ClarificationController(ClarifierAgent clarifierAgent) {
        this.clarifierAgent = clarifierAgent;
    }

    /**
     * POST /api/v1/clarifications: start clarifying an idea, or fetch the session already started.
     */
    @PostMapping
    public ResponseEntity<ClarificationSession> start(@RequestBody StartClarificationRequest request) {
        log.info("Clarification requested for idea {}", request.ideaId());
        ClarificationSession session = clarifierAgent.startClarification(request.ideaId(), request.idea());
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    @GetMapping("/{ideaId}")
    public ClarificationSession get(@PathVariable String ideaId) {
        return clarifierAgent.getSession(ideaId)
                .orElseThrow(() -> NotFoundException.clarificationSession(ideaId));
    }

    /**
     * POST /api/v1/clarifications/{ideaId}/answers: record one answer.
     */
    @PostMapping("/{ideaId}/answers")
    public ClarificationSession answer(@PathVariable String ideaId, @RequestBody AnswerRequest request) {
        return clarifierAgent.submitAnswer(ideaId, request.questionId(), request.answer());
    }

    /**
     * POST /api/v1/clarifications/{ideaId}/complete: finish the dialogue and refine the idea.
     */
    @PostMapping("/{ideaId}/complete")
    public ClarificationSession complete(@PathVariable String ideaId) {
        return clarifierAgent.completeClarification(ideaId);
    }
}
