package com.shellpilot.engine.context;

import com.shellpilot.engine.model.ContextBlock;
import com.shellpilot.engine.model.ContextBundle;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Pulls reference content out of raw input so it can travel with the
 * command to the translator.
 *
 * Recognized markers:
 * <ul>
 *   <li>{@code @path}: a whitespace-delimited token naming a file relative to
 *       the working directory; {@code *}, {@code ?} and {@code [..]} expand as a
 *       glob, {@code **} recursively. Matches are read in lexicographic order.</li>
 *   <li>{@code {clipboard}} / {@code {clip}}: one read of the system clipboard,
 *       however many markers appear.</li>
 *   <li>piped standard input, when present.</li>
 * </ul>
 *
 * Every scan looks at the original text; marker spans are then removed in a
 * single pass. Each file reference yields at least one block: the content, or
 * a notice when nothing readable was found. Assembling the same text twice
 * against the same filesystem gives the same bundle.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private static final Pattern FILE_REFERENCE = Pattern.compile("(?<!\\S)@(\\S+)");

    static final List<String> CLIPBOARD_MARKERS = List.of("{clipboard}", "{clip}");

    private final ClipboardReader clipboard;
    private final PipedInput      pipedInput;

    public ContextAssembler(ClipboardReader clipboard, PipedInput pipedInput) {
        this.clipboard  = clipboard;
        this.pipedInput = pipedInput;
    }

    public ContextBundle assemble(String text, SessionState state) {
        String input = text == null ? "" : text;
        Path cwd = state.workingDirectory();

        List<ContextBlock> blocks = new ArrayList<>();
        List<Path>         files  = new ArrayList<>();
        List<int[]>        spans  = new ArrayList<>();

        pipedInput.read().ifPresent(content -> blocks.add(ContextBlock.stdin(content)));

        Matcher m = FILE_REFERENCE.matcher(input);
        while (m.find()) {
            spans.add(new int[] {m.start(), m.end()});
            resolveFileReference(m.group(1), cwd, blocks, files);
        }

        boolean clipboardReferenced = false;
        for (String marker : CLIPBOARD_MARKERS) {
            for (int i = input.indexOf(marker); i >= 0; i = input.indexOf(marker, i + marker.length())) {
                spans.add(new int[] {i, i + marker.length()});
                clipboardReferenced = true;
            }
        }
        if (clipboardReferenced) {
            readClipboard(blocks);
        }

        return new ContextBundle(removeSpans(input, spans).strip(), blocks, files);
    }

    // ------------------------------------------------------------------
    // File references
    // ------------------------------------------------------------------

    private void resolveFileReference(String ref, Path cwd, List<ContextBlock> blocks, List<Path> files) {
        if (!isGlob(ref)) {
            Path path;
            try {
                path = cwd.resolve(ref).normalize();
            } catch (InvalidPathException e) {
                blocks.add(notFound(ref));
                return;
            }
            if (!Files.isRegularFile(path)) {
                blocks.add(notFound(ref));
                return;
            }
            readFile(path, cwd, blocks, files);
            return;
        }

        List<Path> matches;
        try {
            matches = expandGlob(ref, cwd);
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            // IllegalArgumentException covers bad paths and malformed patterns such as "notes[1"
            String reason = e instanceof PatternSyntaxException
                    ? "invalid pattern (" + ((PatternSyntaxException) e).getDescription() + ")"
                    : e.getMessage();
            log.warn("Could not expand file reference {}: {}", ref, reason);
            blocks.add(ContextBlock.fileNotice(ref, ShellException.Kind.FILE_REFERENCE_UNREADABLE,
                    "Could not expand " + ref + ": " + reason));
            return;
        }
        if (matches.isEmpty()) {
            blocks.add(ContextBlock.fileNotice(ref, ShellException.Kind.FILE_REFERENCE_NOT_FOUND,
                    "File not found: no files match " + ref));
            return;
        }
        for (Path match : matches) {
            readFile(match, cwd, blocks, files);
        }
    }

    private static ContextBlock notFound(String ref) {
        return ContextBlock.fileNotice(ref, ShellException.Kind.FILE_REFERENCE_NOT_FOUND, "File not found: " + ref);
    }

    private void readFile(Path path, Path cwd, List<ContextBlock> blocks, List<Path> files) {
        String label = label(path, cwd);
        try {
            // new String(bytes, UTF_8) substitutes malformed sequences
            String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            blocks.add(ContextBlock.file(label, content));
            files.add(path);
        } catch (IOException e) {
            log.warn("Could not read file reference {}: {}", path, e.getMessage());
            blocks.add(ContextBlock.fileNotice(label, ShellException.Kind.FILE_REFERENCE_UNREADABLE,
                    "Could not read " + label + ": " + e.getMessage()));
        }
    }

    private static String label(Path path, Path cwd) {
        try {
            return cwd.relativize(path).toString();
        } catch (IllegalArgumentException e) {
            return path.toString();
        }
    }

    static boolean isGlob(String ref) {
        return ref.indexOf('*') >= 0 || ref.indexOf('?') >= 0 || ref.indexOf('[') >= 0;
    }

    /**
     * Expand a glob relative to {@code cwd}. The literal directory prefix of the
     * pattern is walked; the rest is matched against paths relative to it.
     * A leading {@code **}/ also matches files directly in that directory.
     */
    static List<Path> expandGlob(String pattern, Path cwd) throws IOException {
        int wildcard = firstWildcard(pattern);
        int slash = pattern.lastIndexOf('/', wildcard);
        String dirPart  = slash < 0 ? "" : pattern.substring(0, slash + 1);
        String globPart = pattern.substring(slash + 1);

        Path base = (dirPart.isEmpty() ? cwd : cwd.resolve(dirPart)).normalize();
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        FileSystem fs = base.getFileSystem();
        PathMatcher matcher = fs.getPathMatcher("glob:" + globPart);
        PathMatcher topLevel = globPart.startsWith("**/")
                ? fs.getPathMatcher("glob:" + globPart.substring(3))
                : null;
        int depth = globPart.contains("**")
                ? Integer.MAX_VALUE
                : (int) globPart.chars().filter(c -> c == '/').count() + 1;

        try (Stream<Path> walk = Files.walk(base, depth)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        Path relative = base.relativize(p);
                        return matcher.matches(relative) || (topLevel != null && topLevel.matches(relative));
                    })
                    .sorted()
                    .toList();
        }
    }

    private static int firstWildcard(String pattern) {
        int first = pattern.length();
        for (char c : new char[] {'*', '?', '['}) {
            int i = pattern.indexOf(c);
            if (i >= 0 && i < first) {
                first = i;
            }
        }
        return first;
    }

    // ------------------------------------------------------------------
    // Clipboard
    // ------------------------------------------------------------------

    private void readClipboard(List<ContextBlock> blocks) {
        try {
            String content = clipboard.read();
            if (content != null && !content.isEmpty()) {
                blocks.add(ContextBlock.clipboard(content));
            }
        } catch (ShellException e) {
            log.warn("Clipboard unavailable: {}", e.getDetail());
        }
    }

    // ------------------------------------------------------------------
    // Cleanup
    // ------------------------------------------------------------------

    private static String removeSpans(String text, List<int[]> spans) {
        boolean[] removed = new boolean[text.length()];
        for (int[] span : spans) {
            for (int i = span[0]; i < span[1]; i++) {
                removed[i] = true;
            }
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            if (!removed[i]) {
                sb.append(text.charAt(i));
            }
        }
        return sb.toString();
    }
}
