package com.shellpilot.engine.loop;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Terminal line reader backed by JLine: line editing and in-memory history.
 *
 * Ctrl-C at the prompt surfaces as {@link InterruptedIOException}, which the
 * loop answers with a hint; Ctrl-D on an empty line is end of input.
 */
public class ConsoleLineSource implements LineSource {

    private final LineReader reader;

    public ConsoleLineSource(LineReader reader) {
        this.reader = reader;
    }

    @Override
    public String readLine(String prompt) throws IOException {
        try {
            return reader.readLine(prompt);
        } catch (UserInterruptException e) {
            InterruptedIOException interrupted = new InterruptedIOException("interrupted at prompt");
            interrupted.initCause(e);
            throw interrupted;
        } catch (EndOfFileException e) {
            return null;
        }
    }
}
