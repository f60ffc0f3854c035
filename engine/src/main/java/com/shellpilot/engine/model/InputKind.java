package com.shellpilot.engine.model;

/**
 * The routing decision made for one line of user input.
 *
 * Produced by {@link com.shellpilot.engine.classify.InputClassifier} from the
 * text alone; carries no payload beyond the tag.
 */
public enum InputKind {
    EMPTY,
    COMMENT,
    SHELL_COMMAND,
    NATURAL_LANGUAGE,
    ASSISTANT_REQUEST
}
