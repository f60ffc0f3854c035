package com.shellpilot.engine.translate;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses translator replies into something the executor can run.
 *
 * The translator is asked for plain commands with '#' comments, but replies
 * sometimes come wrapped in a markdown code fence:
 * <pre>
 *   ```bash
 *   # Listing Python files
 *   ls *.py
 *   ```
 * </pre>
 */
public final class TranslationParser {

    // First fenced block; group 1 is a language label or the first word of a one-line block
    private static final Pattern CODE_FENCE = Pattern.compile("```([A-Za-z0-9_-]*)(.*?)```", Pattern.DOTALL);

    private static final Pattern LEADING_NEWLINE = Pattern.compile("^[ \\t]*\\r?\\n");

    private TranslationParser() {}

    /**
     * Strip code-fence wrapping. Returns the content of the first fenced block
     * (without its language label) or, when there is no fence, the whole reply.
     * Always trimmed.
     */
    public static String stripFences(String reply) {
        if (reply == null) {
            return "";
        }
        Matcher m = CODE_FENCE.matcher(reply);
        if (!m.find()) {
            return reply.strip();
        }
        String word = m.group(1);
        String body = m.group(2);
        // a word directly followed by a line break is a label such as "bash"
        return (LEADING_NEWLINE.matcher(body).find() ? body : word + body).strip();
    }

    /** Non-empty, non-comment lines of the cleaned reply, trimmed, in order. */
    public static List<String> executableLines(String reply) {
        return stripFences(reply).lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
    }

    /** Comment lines of the cleaned reply, trimmed, in order. */
    public static List<String> commentLines(String reply) {
        return stripFences(reply).lines()
                .map(String::strip)
                .filter(line -> line.startsWith("#"))
                .toList();
    }
}
