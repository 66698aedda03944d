package com.blueprint.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A clarifying question asked about an idea.
 *
 * @param id       question identifier, unique within its session (e.g. "q_1")
 * @param text     the question shown to the user
 * @param type     answer shape the question expects
 * @param options  suggested answers for multiple-choice questions; empty otherwise
 * @param required whether the question must be answered before explicit completion
 * @param answered whether the session holds an answer for this question
 */
public record Question(
    String id,
    String text,
    QuestionType type,
    List<String> options,
    boolean required,
    boolean answered
) implements Serializable {

    public Question {
        options = options != null ? List.copyOf(options) : List.of();
        type = type != null ? type : QuestionType.OPEN;
    }

    public Question withAnswered(boolean answered) {
        return new Question(id, text, type, options, required, answered);
    }
}
