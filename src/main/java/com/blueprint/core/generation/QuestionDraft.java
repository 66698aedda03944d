package com.blueprint.core.generation;

import java.util.List;

/**
 * Question as returned by the generator, before validation.
 */
public record QuestionDraft(
    String id,
    String question,
    String type,
    List<String> options,
    Boolean required
) {

    public record Batch(List<QuestionDraft> questions) {}
}
