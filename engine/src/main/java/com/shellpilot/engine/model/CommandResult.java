package com.shellpilot.engine.model;

import com.shellpilot.engine.session.ShellException;

/**
 * Outcome of executing one command, built-in or external.
 *
 * @param command   the command text that produced this result
 * @param exitCode  0 iff the command's own semantics define success
 * @param stdout    captured standard output
 * @param stderr    captured standard error (all pipeline stages, in stage order)
 * @param errorKind set when the engine itself reports the failure
 *                  (timeout, launch failure, bad directory...), otherwise null
 */
public record CommandResult(
        String           command,
        int              exitCode,
        String           stdout,
        String           stderr,
        ShellException.Kind errorKind) {

    /** Conventional exit code for a command killed by the timeout. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    /** Conventional exit code for a command cancelled by an interrupt (128 + SIGINT). */
    public static final int INTERRUPTED_EXIT_CODE = 130;

    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static CommandResult success(String command, String stdout) {
        return new CommandResult(command, 0, stdout, "", null);
    }

    /** Zero-exit result with no output, used for no-op input. */
    public static CommandResult empty(String command) {
        return new CommandResult(command, 0, "", "", null);
    }

    public static CommandResult failure(String command, int exitCode, String stderr) {
        return new CommandResult(command, exitCode, "", stderr, null);
    }

    /** Failure reported by the engine rather than by the command itself. */
    public static CommandResult failure(String command, int exitCode, ShellException e) {
        return new CommandResult(command, exitCode, "", withNewline(e.getDetail()), e.getKind());
    }

    public boolean success() {
        return exitCode == 0;
    }

    private static String withNewline(String message) {
        return message.endsWith("\n") ? message : message + "\n";
    }
}
