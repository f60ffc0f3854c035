package com.shellpilot.engine.translate;

import com.shellpilot.engine.model.ContextBundle;
import com.shellpilot.engine.session.SessionState;

import java.util.List;

/**
 * What the translator is told about the session besides the request itself.
 *
 * @param workingDirectory absolute working directory
 * @param recentCommands   recent history, oldest first
 * @param contextBlocks    rendered file/clipboard/stdin blocks
 * @param lastCommand      previous command, empty if none
 * @param lastExitCode     its exit code
 * @param lastStdout       tail of its stdout
 * @param lastStderr       tail of its stderr
 * @param platform         OS name, e.g. "Linux"
 * @param shell            the user's shell ($SHELL or %ComSpec%), may be null
 */
public record TranslationContext(
        String       workingDirectory,
        List<String> recentCommands,
        List<String> contextBlocks,
        String       lastCommand,
        int          lastExitCode,
        String       lastStdout,
        String       lastStderr,
        String       platform,
        String       shell) {

    /** Only the last this-many characters of previous output are sent. */
    public static final int OUTPUT_TAIL_CHARS = 2000;

    public TranslationContext {
        recentCommands = List.copyOf(recentCommands);
        contextBlocks  = List.copyOf(contextBlocks);
        lastCommand    = lastCommand == null ? "" : lastCommand;
        lastStdout     = lastStdout == null ? "" : lastStdout;
        lastStderr     = lastStderr == null ? "" : lastStderr;
    }

    public static TranslationContext of(SessionState state, ContextBundle bundle, int recentLimit) {
        return new TranslationContext(
                state.workingDirectory().toString(),
                state.recentHistory(recentLimit),
                bundle.renderedBlocks(),
                state.lastCommand(),
                state.lastExitCode(),
                tail(state.lastStdout()),
                tail(state.lastStderr()),
                System.getProperty("os.name", "unknown"),
                state.getEnvVar("SHELL").or(() -> state.getEnvVar("ComSpec")).orElse(null));
    }

    static String tail(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= OUTPUT_TAIL_CHARS ? text : text.substring(text.length() - OUTPUT_TAIL_CHARS);
    }
}
