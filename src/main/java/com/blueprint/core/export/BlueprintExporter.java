package com.blueprint.core.export;

import com.blueprint.core.model.BreakdownSession;

/**
 * Renders a breakdown into one document format.
 */
public interface BlueprintExporter {

    ExportFormat format();

    /**
     * @param session     the breakdown to render
     * @param ideaSummary the idea as the user described or refined it; may be null
     */
    String render(BreakdownSession session, String ideaSummary);
}
