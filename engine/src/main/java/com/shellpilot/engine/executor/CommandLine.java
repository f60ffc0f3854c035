package com.shellpilot.engine.executor;

import java.util.ArrayList;
import java.util.List;

/**
 * Just enough command-line lexing for built-ins, command lists and pipelines.
 *
 * Full shell grammar is left to the OS shell that runs external commands;
 * this class only needs to know where words and top-level operators are.
 */
public final class CommandLine {

    private enum State { PLAIN, ESCAPE, SINGLE, DOUBLE, DOUBLE_ESCAPE }

    private CommandLine() {}

    /**
     * Split into words, honouring single quotes, double quotes and backslash
     * escapes. Quotes are removed from the resulting words. An unterminated
     * quote runs to the end of the input.
     */
    public static List<String> tokenize(String line) {
        List<String> words = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        State state = State.PLAIN;
        boolean inWord = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            switch (state) {
                case PLAIN -> {
                    if (Character.isWhitespace(c)) {
                        if (inWord) {
                            words.add(cur.toString());
                            cur.setLength(0);
                            inWord = false;
                        }
                    } else {
                        inWord = true;
                        switch (c) {
                            case '\\' -> state = State.ESCAPE;
                            case '\'' -> state = State.SINGLE;
                            case '"'  -> state = State.DOUBLE;
                            default   -> cur.append(c);
                        }
                    }
                }
                case ESCAPE -> {
                    cur.append(c);
                    state = State.PLAIN;
                }
                case SINGLE -> {
                    if (c == '\'') state = State.PLAIN;
                    else cur.append(c);
                }
                case DOUBLE -> {
                    if (c == '"') state = State.PLAIN;
                    else if (c == '\\') state = State.DOUBLE_ESCAPE;
                    else cur.append(c);
                }
                case DOUBLE_ESCAPE -> {
                    if (c != '\\' && c != '"' && c != '$' && c != '`') {
                        cur.append('\\');
                    }
                    cur.append(c);
                    state = State.DOUBLE;
                }
            }
        }
        if (inWord) {
            words.add(cur.toString());
        }
        return words;
    }

    /** One command of a {@code ;}, {@code &&} or {@code ||} list, with the operator that precedes it. */
    public record ListItem(String separator, String text) {

        /** Whether this item runs after a previous item exited with {@code previousStatus}. */
        public boolean runsAfter(int previousStatus) {
            return switch (separator) {
                case "&&" -> previousStatus == 0;
                case "||" -> previousStatus != 0;
                default   -> true;
            };
        }
    }

    /**
     * Split raw command text into its top-level command list.
     *
     * Separators are {@code ;}, {@code &&} and {@code ||} outside quotes,
     * escapes, parentheses and backticks. The first item has an empty
     * separator. A trailing {@code ;} is dropped. Returns a single item holding
     * the whole stripped line when there is no separator, or when any other
     * item would be empty (the shell reports that error).
     */
    public static List<ListItem> splitList(String line) {
        boolean[] top = topLevel(line);
        List<ListItem> items = new ArrayList<>();
        String separator = "";
        int start = 0;

        for (int i = 0; i < line.length(); i++) {
            if (!top[i]) {
                continue;
            }
            char c = line.charAt(i);
            String found = null;
            if (c == ';' && i + 1 < line.length() && line.charAt(i + 1) == ';') {
                // ";;" ends a case branch
                i++;
                continue;
            } else if (c == ';') {
                found = ";";
            } else if ((c == '&' || c == '|') && i + 1 < line.length() && line.charAt(i + 1) == c && top[i + 1]) {
                found = c == '&' ? "&&" : "||";
            }
            if (found != null) {
                items.add(new ListItem(separator, line.substring(start, i).strip()));
                separator = found;
                start = i + found.length();
                i = start - 1;
            }
        }
        String rest = line.substring(start).strip();
        if (!rest.isEmpty() || !";".equals(separator)) {
            items.add(new ListItem(separator, rest));
        }

        if (items.size() > 1 && items.stream().anyMatch(item -> item.text().isEmpty())) {
            return List.of(new ListItem("", line.strip()));
        }
        return items.isEmpty() ? List.of(new ListItem("", line.strip())) : items;
    }

    /**
     * Split raw command text on top-level pipe characters.
     *
     * A '|' inside quotes, after a backslash, inside {@code $(...)} or
     * backticks, or doubled as {@code ||}, is not a split point. Stages are
     * returned trimmed but otherwise verbatim so the OS shell sees the
     * original quoting. Returns a single element when there is no top-level
     * pipe, or when any stage would be empty (the shell reports that error).
     *
     * <p>Callers pass a single list item: in {@code a; b | c} the pipe binds to
     * {@code b} only, so lines with {@code ;}, {@code &&} or {@code ||} must go
     * through {@link #splitList} first.
     */
    public static List<String> splitPipeline(String line) {
        boolean[] top = topLevel(line);
        List<String> stages = new ArrayList<>();
        int start = 0;

        for (int i = 0; i < line.length(); i++) {
            if (!top[i] || line.charAt(i) != '|' || isClobber(line, i)) {
                continue;
            }
            if (i + 1 < line.length() && line.charAt(i + 1) == '|') {
                i++;
            } else {
                stages.add(line.substring(start, i).strip());
                start = i + 1;
            }
        }
        stages.add(line.substring(start).strip());

        if (stages.size() > 1 && stages.stream().anyMatch(String::isEmpty)) {
            return List.of(line.strip());
        }
        return stages;
    }

    /** True when the text has a top-level pipe or redirection ({@code |}, {@code <}, {@code >}). */
    public static boolean hasPipeOrRedirect(String line) {
        boolean[] top = topLevel(line);
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (top[i] && (c == '|' || c == '<' || c == '>')) {
                return true;
            }
        }
        return false;
    }

    /**
     * Marks the characters the shell would see as operators: outside quotes,
     * not escaped, and not inside {@code $(...)}, a {@code (...)} subshell or
     * backticks. Quote and escape
     * characters themselves are never marked.
     */
    private static boolean[] topLevel(String line) {
        boolean[] top = new boolean[line.length()];
        State state = State.PLAIN;
        int parenDepth = 0;
        boolean backtick = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            switch (state) {
                case PLAIN -> {
                    if (c == '\\') {
                        state = State.ESCAPE;
                    } else if (c == '\'') {
                        state = State.SINGLE;
                    } else if (c == '"') {
                        state = State.DOUBLE;
                    } else if (c == '`') {
                        backtick = !backtick;
                    } else if (c == '$' && i + 1 < line.length() && line.charAt(i + 1) == '(') {
                        parenDepth++;
                        i++;
                    } else if (c == '(') {
                        parenDepth++;
                    } else if (c == ')' && parenDepth > 0) {
                        parenDepth--;
                    } else {
                        top[i] = parenDepth == 0 && !backtick;
                    }
                }
                case ESCAPE -> state = State.PLAIN;
                case SINGLE -> {
                    if (c == '\'') state = State.PLAIN;
                }
                case DOUBLE -> {
                    if (c == '"') state = State.PLAIN;
                    else if (c == '\\') state = State.DOUBLE_ESCAPE;
                }
                case DOUBLE_ESCAPE -> state = State.DOUBLE;
            }
        }
        return top;
    }

    /** {@code >|} forces an overwrite redirection; it is not a pipe. */
    private static boolean isClobber(String line, int pipeIndex) {
        return pipeIndex > 0 && line.charAt(pipeIndex - 1) == '>';
    }
}
