package com.shellpilot.engine.context;

/**
 * Read-only access to the system clipboard.
 *
 * Clipboard access is best effort: hosts without a clipboard mechanism are
 * normal, and callers treat a failure as "no clipboard content".
 */
public interface ClipboardReader {

    /**
     * @return the current clipboard text, possibly empty
     * @throws com.shellpilot.engine.session.ShellException {@code CLIPBOARD_UNAVAILABLE}
     *         when the clipboard cannot be read on this host
     */
    String read();
}
