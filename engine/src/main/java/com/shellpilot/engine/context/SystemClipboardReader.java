package com.shellpilot.engine.context;

import com.shellpilot.engine.session.ShellException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.awt.datatransfer.DataFlavor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Clipboard reader for the host platform.
 *
 * Uses the AWT system clipboard when a display is available, otherwise the
 * platform's paste utility:
 * <pre>
 *   macOS    pbpaste
 *   Linux    xclip -selection clipboard -o   (then wl-paste)
 *   Windows  powershell Get-Clipboard
 * </pre>
 */
@Component
public class SystemClipboardReader implements ClipboardReader {

    private static final Logger log = LoggerFactory.getLogger(SystemClipboardReader.class);

    private static final long PASTE_TIMEOUT_SEC = 5;

    @Override
    public String read() {
        if (!GraphicsEnvironment.isHeadless()) {
            try {
                Object data = Toolkit.getDefaultToolkit().getSystemClipboard().getData(DataFlavor.stringFlavor);
                return data == null ? "" : data.toString();
            } catch (Exception e) {
                log.debug("AWT clipboard unavailable, trying paste utilities: {}", e.getMessage());
            }
        }

        ShellException last = null;
        for (List<String> command : pasteCommands()) {
            try {
                return runPasteCommand(command);
            } catch (ShellException e) {
                last = e;
            }
        }
        throw last != null ? last : new ShellException(ShellException.Kind.CLIPBOARD_UNAVAILABLE,
                "No clipboard mechanism on this platform");
    }

    private static List<List<String>> pasteCommands() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("mac")) {
            return List.of(List.of("pbpaste"));
        }
        if (os.startsWith("windows")) {
            return List.of(List.of("powershell", "-NoProfile", "-Command", "Get-Clipboard"));
        }
        return List.of(
                List.of("xclip", "-selection", "clipboard", "-o"),
                List.of("wl-paste", "--no-newline"));
    }

    private static String runPasteCommand(List<String> command) {
        try {
            Process process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            process.getOutputStream().close();
            byte[] out = process.getInputStream().readAllBytes();
            if (!process.waitFor(PASTE_TIMEOUT_SEC, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ShellException(ShellException.Kind.CLIPBOARD_UNAVAILABLE,
                        command.get(0) + " timed out");
            }
            if (process.exitValue() != 0) {
                throw new ShellException(ShellException.Kind.CLIPBOARD_UNAVAILABLE,
                        command.get(0) + " exited with " + process.exitValue());
            }
            return new String(out, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ShellException(ShellException.Kind.CLIPBOARD_UNAVAILABLE,
                    command.get(0) + " is not available", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ShellException(ShellException.Kind.CLIPBOARD_UNAVAILABLE,
                    "Interrupted while reading the clipboard", e);
        }
    }
}
