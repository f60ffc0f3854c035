package com.shellpilot.engine.model;

/** Where a {@link ContextBlock} was extracted from. */
public enum ContextSource {
    FILE,
    CLIPBOARD,
    STDIN
}
