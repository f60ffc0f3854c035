package com.shellpilot.engine.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Default routing for input whose classification is natural language.
 *
 * <pre>
 *   shell → run it as a command anyway
 *   nl    → translate it (default)
 *   ai    → hand it to the assistant
 * </pre>
 */
public enum SessionMode {
    SHELL("shell", "$"),
    NATURAL_LANGUAGE("nl", "$", "natural-language"),
    ASSISTANT("ai", "ai >", "assistant");

    private final String key;
    private final String indicator;
    private final List<String> aliases;

    SessionMode(String key, String indicator, String... aliases) {
        this.key       = key;
        this.indicator = indicator;
        this.aliases   = List.of(aliases);
    }

    /** Lowercase name shown to the user and stored in the session. */
    public String key() { return key; }

    /** Prompt suffix for this mode. */
    public String indicator() { return indicator; }

    /** Case-insensitive lookup by key or alias. */
    public static Optional<SessionMode> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.key.equals(normalized) || m.aliases.contains(normalized))
                .findFirst();
    }

    /** "shell, nl, ai" */
    public static String validNames() {
        return String.join(", ", Arrays.stream(values()).map(SessionMode::key).toList());
    }
}
