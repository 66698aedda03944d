package com.blueprint.dispatch.api;

import com.blueprint.core.breakdown.BreakdownEngine;
import com.blueprint.core.clarifier.ClarifierAgent;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.export.BlueprintExport;
import com.blueprint.core.export.ExportFormat;
import com.blueprint.core.export.ExportService;
import com.blueprint.core.model.BreakdownSession;
import com.blueprint.core.model.ClarificationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * REST controller for breaking ideas down into plans.
 */
@RestController
@RequestMapping("/api/v1/breakdowns")
public class BreakdownController {

    private static final Logger log = LoggerFactory.getLogger(BreakdownController.class);

    private final BreakdownEngine breakdownEngine;
    private final ClarifierAgent clarifierAgent;
    private final ExportService exportService;

    public BreakdownController(BreakdownEngine breakdownEngine, ClarifierAgent clarifierAgent,
                               ExportService exportService) {
        this.breakdownEngine = breakdownEngine;
        this.clarifierAgent = clarifierAgent;
        this.exportService = exportService;
    }

    /**
     * POST /api/v1/breakdowns: run the breakdown pipeline synchronously.
     * Without {@code refined_idea} the idea text and answers come from the idea's
     * clarification session.
     */
    @PostMapping
    public BreakdownSession create(@RequestBody BreakdownRequest request) {
        String idea = request.refinedIdea();
        Map<String, String> responses = request.userResponses();
        if (idea == null || idea.isBlank()) {
            Optional<ClarificationSession> clarification = clarifierAgent.getSession(request.ideaId());
            if (clarification.isPresent()) {
                log.info("Using clarification session of idea {} as breakdown input", request.ideaId());
                idea = clarification.get().refinedIdeaOrSummary();
                if (responses == null) {
                    responses = clarification.get().answers();
                }
            }
        }
        return breakdownEngine.startBreakdown(request.ideaId(), idea, responses, request.toOptions());
    }

    @GetMapping("/{ideaId}")
    public BreakdownSession get(@PathVariable String ideaId) {
        return breakdownEngine.getBreakdownSession(ideaId)
                .orElseThrow(() -> NotFoundException.breakdownSession(ideaId));
    }

    /**
     * GET /api/v1/breakdowns/{ideaId}/export?format=markdown|json: the stored breakdown as a document.
     */
    @GetMapping("/{ideaId}/export")
    public ResponseEntity<String> export(@PathVariable String ideaId,
                                         @RequestParam(name = "format", required = false) String format) {
        BlueprintExport export = exportService.export(ideaId, ExportFormat.from(format));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(export.format().mediaType() + ";charset=UTF-8"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + export.fileName() + "\"")
                .body(export.content());
    }
}
