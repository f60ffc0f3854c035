package com.shellpilot.engine.context;

import java.util.Optional;

/**
 * Content piped into the program's standard input, when it is not a terminal.
 *
 * Implementations read the stream at most once and return the same content
 * on every later call.
 */
public interface PipedInput {

    Optional<String> read();

    /** No piped input, e.g. when standard input carries the interactive session. */
    static PipedInput none() {
        return Optional::empty;
    }
}
