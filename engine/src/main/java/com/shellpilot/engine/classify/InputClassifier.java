package com.shellpilot.engine.classify;

import com.shellpilot.engine.model.InputKind;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides how a line of input is handled: run as a shell command, translated
 * from natural language, handed to the assistant, or ignored.
 *
 * Pure and total: the result depends only on the text passed in, never on
 * session state, so routing can be tested without a session. Rules are
 * checked in order and the first match wins:
 * <ol>
 *   <li>blank → EMPTY</li>
 *   <li>starts with '#' → COMMENT</li>
 *   <li>starts with "ai:" (any case) → ASSISTANT_REQUEST</li>
 *   <li>known command word, shell operator, path-like first word, or a
 *       NAME=VALUE first word → SHELL_COMMAND</li>
 *   <li>anything else → NATURAL_LANGUAGE</li>
 * </ol>
 */
public final class InputClassifier {

    public static final String ASSISTANT_PREFIX = "ai:";

    /** First words that always mean "this is a command". */
    static final Set<String> KNOWN_COMMANDS = Set.of(
            "ls", "cd", "pwd", "cat", "echo", "grep", "find", "git",
            "python", "node", "npm", "pip", "docker", "kubectl",
            "mkdir", "rm", "cp", "mv", "touch", "chmod", "chown",
            "ps", "kill", "top", "df", "du", "tar", "gzip", "curl", "wget",
            "export", "mode", "exit", "history", "alias", "unalias");

    static final Set<String> WINDOWS_COMMANDS = Set.of("dir", "type", "cls", "copy", "del");

    private static final List<String> SHELL_OPERATORS = List.of("|", ">", "<", "&&", "||", ";", ">>");

    private static final Pattern ASSIGNMENT = Pattern.compile("[^=\\s]+=\\S*");

    private static final boolean WINDOWS =
            System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");

    private InputClassifier() {}

    public static InputKind classify(String text) {
        String stripped = text == null ? "" : text.strip();

        if (stripped.isEmpty()) {
            return InputKind.EMPTY;
        }
        if (stripped.startsWith("#")) {
            return InputKind.COMMENT;
        }
        if (stripped.toLowerCase(Locale.ROOT).startsWith(ASSISTANT_PREFIX)) {
            return InputKind.ASSISTANT_REQUEST;
        }
        if (looksLikeShellCommand(stripped)) {
            return InputKind.SHELL_COMMAND;
        }
        return InputKind.NATURAL_LANGUAGE;
    }

    /**
     * The request text after the "ai:" prefix, trimmed.
     * Input without the prefix is returned trimmed and otherwise unchanged.
     */
    public static String extractAssistantRequest(String text) {
        String stripped = text == null ? "" : text.strip();
        if (stripped.toLowerCase(Locale.ROOT).startsWith(ASSISTANT_PREFIX)) {
            return stripped.substring(ASSISTANT_PREFIX.length()).strip();
        }
        return stripped;
    }

    private static boolean looksLikeShellCommand(String text) {
        String firstWord = text.split("\\s+", 2)[0];

        if (KNOWN_COMMANDS.contains(firstWord) || (WINDOWS && WINDOWS_COMMANDS.contains(firstWord))) {
            return true;
        }
        for (String op : SHELL_OPERATORS) {
            if (text.contains(op)) {
                return true;
            }
        }
        if (firstWord.startsWith("./") || firstWord.startsWith("/")) {
            return true;
        }
        return ASSIGNMENT.matcher(firstWord).matches();
    }
}
