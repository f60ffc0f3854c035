package com.shellpilot.engine.model;

import com.shellpilot.engine.session.ShellException;

/**
 * One unit of reference content attached to a resolved input.
 *
 * @param source  file, clipboard or stdin
 * @param label   display name: the file path relative to the working
 *                directory, or the source name for clipboard/stdin
 * @param content the text read, or the notice message for a failed reference
 * @param notice  null for a content block; otherwise why the reference
 *                produced no content ({@code FILE_REFERENCE_NOT_FOUND} or
 *                {@code FILE_REFERENCE_UNREADABLE})
 */
public record ContextBlock(ContextSource source, String label, String content, ShellException.Kind notice) {

    public static ContextBlock file(String label, String content) {
        return new ContextBlock(ContextSource.FILE, label, content, null);
    }

    public static ContextBlock fileNotice(String label, ShellException.Kind kind, String message) {
        return new ContextBlock(ContextSource.FILE, label, message, kind);
    }

    public static ContextBlock clipboard(String content) {
        return new ContextBlock(ContextSource.CLIPBOARD, "clipboard", content, null);
    }

    public static ContextBlock stdin(String content) {
        return new ContextBlock(ContextSource.STDIN, "stdin", content, null);
    }

    public boolean isNotice() {
        return notice != null;
    }

    /**
     * Render the block the way it is fed to the translator:
     * <pre>
     *   # File: src/App.java
     *   ...content...
     * </pre>
     */
    public String render() {
        if (isNotice()) {
            return "# Error: " + content + "\n";
        }
        String header = switch (source) {
            case FILE      -> "# File: " + label;
            case CLIPBOARD -> "# Clipboard:";
            case STDIN     -> "# Stdin:";
        };
        return header + "\n" + content + (content.endsWith("\n") ? "" : "\n");
    }
}
