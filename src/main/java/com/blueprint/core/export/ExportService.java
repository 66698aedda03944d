package com.blueprint.core.export;

import com.blueprint.core.breakdown.BreakdownEngine;
import com.blueprint.core.clarifier.ClarifierAgent;
import com.blueprint.core.error.NotFoundException;
import com.blueprint.core.model.BreakdownSession;
import com.blueprint.core.model.ClarificationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Exports stored breakdowns through the registered {@link BlueprintExporter}s.
 * The idea summary comes from the idea's clarification session when there is one.
 */
@Service
public class ExportService {

    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    private final BreakdownEngine breakdownEngine;
    private final ClarifierAgent clarifierAgent;
    private final Map<ExportFormat, BlueprintExporter> exporters = new EnumMap<>(ExportFormat.class);

    public ExportService(BreakdownEngine breakdownEngine, ClarifierAgent clarifierAgent,
                         List<BlueprintExporter> exporters) {
        this.breakdownEngine = breakdownEngine;
        this.clarifierAgent = clarifierAgent;
        for (BlueprintExporter exporter : exporters) {
            this.exporters.put(exporter.format(), exporter);
        }
    }

    /**
     * @throws NotFoundException if the idea has no stored breakdown
     */
    public BlueprintExport export(String ideaId, ExportFormat format) {
        BreakdownSession session = breakdownEngine.getBreakdownSession(ideaId)
                .orElseThrow(() -> NotFoundException.breakdownSession(ideaId));
        String summary = clarifierAgent.getSession(ideaId)
                .map(ClarificationSession::refinedIdeaOrSummary)
                .orElse(null);
        return render(session, summary, format);
    }

    public BlueprintExport render(BreakdownSession session, String ideaSummary, ExportFormat format) {
        BlueprintExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new IllegalStateException("No exporter registered for " + format);
        }
        String content = exporter.render(session, ideaSummary);
        log.info("Exported breakdown {} of idea {} as {} ({} chars)",
                session.id(), session.ideaId(), format, content.length());
        return new BlueprintExport(session.ideaId(), format, content);
    }
}
