package com.blueprint.core.generation;

import java.util.List;

/**
 * Task as returned by the generator, before ids are assigned and references resolved.
 *
 * @param id             generator-local id; may be blank
 * @param dependencies   references to other drafts by local id or title, or to already assigned task ids
 */
public record TaskDraft(
    String id,
    String title,
    String description,
    Double estimatedHours,
    Integer complexity,
    List<String> requiredSkills,
    List<String> dependencies
) {

    public record Batch(List<TaskDraft> tasks) {}
}
