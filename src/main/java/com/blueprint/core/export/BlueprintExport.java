package com.blueprint.core.export;

/**
 * A rendered breakdown document.
 *
 * @param ideaId  the idea the breakdown belongs to
 * @param format  format of {@code content}
 * @param content the document text
 */
public record BlueprintExport(String ideaId, ExportFormat format, String content) {

    public String fileName() {
        return "blueprint-" + ideaId + "." + format.extension();
    }
}
