package com.shellpilot.engine.session;

/**
 * Raised by session-state operations and engine internals for failures the
 * user should see as an ordinary failed command.
 *
 * Unchecked so that callers only catch it where they turn it into a
 * {@link com.shellpilot.engine.model.CommandResult}; none of these kinds is
 * allowed to end the resolution loop.
 */
public class ShellException extends RuntimeException {

    public enum Kind {
        DIRECTORY_NOT_FOUND,
        INVALID_MODE_NAME,
        INVALID_VARIABLE_NAME,
        COMMAND_TIMEOUT,
        PROCESS_LAUNCH_FAILURE,
        FILE_REFERENCE_NOT_FOUND,
        FILE_REFERENCE_UNREADABLE,
        CLIPBOARD_UNAVAILABLE,
        INTERRUPTED
    }

    private final Kind   kind;
    private final String detail;

    public ShellException(Kind kind, String detail) {
        super("[" + kind + "] " + detail);
        this.kind   = kind;
        this.detail = detail;
    }

    public ShellException(Kind kind, String detail, Throwable cause) {
        super("[" + kind + "] " + detail, cause);
        this.kind   = kind;
        this.detail = detail;
    }

    public Kind getKind() { return kind; }

    /** The user-facing message, without the kind prefix. */
    public String getDetail() { return detail; }
}
