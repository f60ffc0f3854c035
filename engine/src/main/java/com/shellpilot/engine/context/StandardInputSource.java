package com.shellpilot.engine.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reads piped standard input once, on first use, and caches it.
 *
 * Only used in one-shot mode; during an interactive session standard input
 * carries the typed lines and {@link PipedInput#none()} is wired instead.
 */
public class StandardInputSource implements PipedInput {

    private static final Logger log = LoggerFactory.getLogger(StandardInputSource.class);

    private final InputStream in;
    private final boolean     interactiveTerminal;

    private Optional<String> cached;

    public StandardInputSource(InputStream in, boolean interactiveTerminal) {
        this.in                  = in;
        this.interactiveTerminal = interactiveTerminal;
    }

    /** Standard input of this JVM; a terminal is detected through {@link System#console()}. */
    public static StandardInputSource system() {
        return new StandardInputSource(System.in, System.console() != null);
    }

    @Override
    public Optional<String> read() {
        if (cached == null) {
            cached = interactiveTerminal ? Optional.empty() : readOnce();
        }
        return cached;
    }

    private Optional<String> readOnce() {
        try {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return content.isEmpty() ? Optional.empty() : Optional.of(content);
        } catch (IOException e) {
            log.warn("Could not read piped standard input: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
