package com.blueprint.core.export;

import com.blueprint.core.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Document formats a finished breakdown can be exported to.
 */
public enum ExportFormat {
    MARKDOWN("text/markdown", "md"),
    JSON("application/json", "json");

    private final String mediaType;
    private final String extension;

    ExportFormat(String mediaType, String extension) {
        this.mediaType = mediaType;
        this.extension = extension;
    }

    public String mediaType() {
        return mediaType;
    }

    public String extension() {
        return extension;
    }

    /**
     * Parses "markdown", "md" or "json", ignoring case. Blank means {@link #MARKDOWN}.
     *
     * @throws ValidationException for any other value
     */
    public static ExportFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return MARKDOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.name().toLowerCase(Locale.ROOT).equals(normalized) || format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new ValidationException("format", "must be one of " + Arrays.stream(values())
                .map(f -> f.name().toLowerCase(Locale.ROOT))
                .toList() + " (was '" + raw + "')");
    }
}
