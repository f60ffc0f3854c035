package com.shellpilot.engine.context;

import com.shellpilot.engine.model.ContextBlock;
import com.shellpilot.engine.model.ContextBundle;
import com.shellpilot.engine.model.ContextSource;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextAssemblerTest {

    @TempDir
    Path cwd;

    @Mock
    ClipboardReader clipboard;

    SessionState state;
    ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        state = new SessionState(Map.of(), cwd, cwd);
        assembler = new ContextAssembler(clipboard, PipedInput.none());
    }

    // ------------------------------------------------------------------
    // File references
    // ------------------------------------------------------------------

    @Test
    void assemble_plainText_passesThroughUntouched() {
        ContextBundle bundle = assembler.assemble("  list the files  ", state);

        assertThat(bundle.command()).isEqualTo("list the files");
        assertThat(bundle.hasContext()).isFalse();
        verify(clipboard, never()).read();
    }

    @Test
    void assemble_fileReference_readRelativeToWorkingDirectory() throws IOException {
        Files.createDirectories(cwd.resolve("src"));
        Files.writeString(cwd.resolve("src/notes.txt"), "alpha\nbeta\n");

        ContextBundle bundle = assembler.assemble("summarize @src/notes.txt", state);

        assertThat(bundle.command()).isEqualTo("summarize");
        assertThat(bundle.blocks()).containsExactly(ContextBlock.file("src/notes.txt", "alpha\nbeta\n"));
        assertThat(bundle.files()).containsExactly(cwd.resolve("src/notes.txt").normalize());
        assertThat(bundle.renderedBlocks()).containsExactly("# File: src/notes.txt\nalpha\nbeta\n");
    }

    @Test
    void assemble_missingFile_noticeInsteadOfFailure() {
        ContextBundle bundle = assembler.assemble("explain @missing.txt", state);

        assertThat(bundle.command()).isEqualTo("explain");
        assertThat(bundle.blocks()).hasSize(1);
        ContextBlock block = bundle.blocks().get(0);
        assertThat(block.notice()).isEqualTo(ShellException.Kind.FILE_REFERENCE_NOT_FOUND);
        assertThat(block.render()).isEqualTo("# Error: File not found: missing.txt\n");
        assertThat(bundle.files()).isEmpty();
    }

    @Test
    void assemble_missingFileAlone_leavesEmptyCommand() {
        ContextBundle bundle = assembler.assemble("@nothing-here", state);

        assertThat(bundle.command()).isEmpty();
        assertThat(bundle.blocks()).singleElement().satisfies(b -> assertThat(b.isNotice()).isTrue());
    }

    @Test
    void assemble_directoryReference_isNotAFile() throws IOException {
        Files.createDirectory(cwd.resolve("dir"));

        ContextBundle bundle = assembler.assemble("look at @dir", state);

        assertThat(bundle.blocks().get(0).notice()).isEqualTo(ShellException.Kind.FILE_REFERENCE_NOT_FOUND);
    }

    @Test
    void assemble_emailAddress_isNotAReference() {
        ContextBundle bundle = assembler.assemble("mail bob@example.com the report", state);

        assertThat(bundle.command()).isEqualTo("mail bob@example.com the report");
        assertThat(bundle.blocks()).isEmpty();
    }

    @Test
    void assemble_multipleReferences_keptInOrderOfAppearance() throws IOException {
        Files.writeString(cwd.resolve("b.txt"), "B");
        Files.writeString(cwd.resolve("a.txt"), "A");

        ContextBundle bundle = assembler.assemble("diff @b.txt @a.txt", state);

        assertThat(bundle.blocks()).extracting(ContextBlock::label).containsExactly("b.txt", "a.txt");
    }

    @Test
    void assemble_invalidUtf8_isDecodedWithReplacement() throws IOException {
        Files.write(cwd.resolve("bin.dat"), new byte[] {'o', 'k', (byte) 0xC3});

        ContextBundle bundle = assembler.assemble("@bin.dat", state);

        assertThat(bundle.blocks().get(0).content()).startsWith("ok").contains("\uFFFD");
    }

    // ------------------------------------------------------------------
    // Globs
    // ------------------------------------------------------------------

    @Test
    void assemble_glob_expandsSorted() throws IOException {
        Files.writeString(cwd.resolve("z.log"), "z");
        Files.writeString(cwd.resolve("a.log"), "a");
        Files.writeString(cwd.resolve("skip.txt"), "s");

        ContextBundle bundle = assembler.assemble("check @*.log", state);

        assertThat(bundle.command()).isEqualTo("check");
        assertThat(bundle.blocks()).extracting(ContextBlock::label).containsExactly("a.log", "z.log");
    }

    @Test
    void assemble_recursiveGlob_includesTopLevelAndNested() throws IOException {
        Files.createDirectories(cwd.resolve("pkg/sub"));
        Files.writeString(cwd.resolve("Top.java"), "t");
        Files.writeString(cwd.resolve("pkg/sub/Deep.java"), "d");
        Files.writeString(cwd.resolve("pkg/readme.md"), "r");

        ContextBundle bundle = assembler.assemble("review @**/*.java", state);

        assertThat(bundle.blocks()).extracting(ContextBlock::label)
                .containsExactlyInAnyOrder("Top.java", "pkg/sub/Deep.java");
    }

    @Test
    void assemble_globInSubdirectory() throws IOException {
        Files.createDirectories(cwd.resolve("logs"));
        Files.writeString(cwd.resolve("logs/app.log"), "x");
        Files.writeString(cwd.resolve("root.log"), "y");

        ContextBundle bundle = assembler.assemble("@logs/*.log", state);

        assertThat(bundle.blocks()).extracting(ContextBlock::label).containsExactly("logs/app.log");
    }

    @Test
    void assemble_globWithoutMatches_notFoundNotice() {
        ContextBundle bundle = assembler.assemble("@*.nothing", state);

        assertThat(bundle.blocks()).singleElement()
                .satisfies(b -> {
                    assertThat(b.notice()).isEqualTo(ShellException.Kind.FILE_REFERENCE_NOT_FOUND);
                    assertThat(b.content()).isEqualTo("File not found: no files match *.nothing");
                });
    }

    @Test
    void assemble_malformedGlob_unreadableNoticeKeepsInput() {
        ContextBundle bundle = assembler.assemble("explain @notes[1", state);

        assertThat(bundle.command()).isEqualTo("explain");
        assertThat(bundle.blocks()).singleElement()
                .satisfies(b -> {
                    assertThat(b.notice()).isEqualTo(ShellException.Kind.FILE_REFERENCE_UNREADABLE);
                    assertThat(b.content()).startsWith("Could not expand notes[1: invalid pattern");
                });
    }

    @Test
    void assemble_unclosedBraceGlob_unreadableNoticeAndOtherRefsStillRead() throws IOException {
        Files.writeString(cwd.resolve("ok.txt"), "fine");

        ContextBundle bundle = assembler.assemble("compare @*.{java @ok.txt", state);

        assertThat(bundle.command()).isEqualTo("compare");
        assertThat(bundle.blocks()).extracting(ContextBlock::notice)
                .containsExactly(ShellException.Kind.FILE_REFERENCE_UNREADABLE, null);
        assertThat(bundle.blocks().get(1).content()).isEqualTo("fine");
    }

    // ------------------------------------------------------------------
    // Clipboard
    // ------------------------------------------------------------------

    @Test
    void assemble_clipboardMarkers_readOnceAndRemoved() {
        when(clipboard.read()).thenReturn("copied text");

        ContextBundle bundle = assembler.assemble("explain {clipboard} and {clip}", state);

        verify(clipboard, times(1)).read();
        assertThat(bundle.command()).isEqualTo("explain  and");
        assertThat(bundle.blocks()).containsExactly(ContextBlock.clipboard("copied text"));
        assertThat(bundle.renderedBlocks()).containsExactly("# Clipboard:\ncopied text\n");
    }

    @Test
    void assemble_clipboardUnavailable_isNotFatal() {
        when(clipboard.read()).thenThrow(
                new ShellException(ShellException.Kind.CLIPBOARD_UNAVAILABLE, "no clipboard tool"));

        ContextBundle bundle = assembler.assemble("paste {clip}", state);

        assertThat(bundle.command()).isEqualTo("paste");
        assertThat(bundle.blocks()).isEmpty();
    }

    @Test
    void assemble_emptyClipboard_addsNoBlock() {
        when(clipboard.read()).thenReturn("");

        assertThat(assembler.assemble("{clip}", state).blocks()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Stdin and ordering
    // ------------------------------------------------------------------

    @Test
    void assemble_stdinFirstThenFilesThenClipboard() throws IOException {
        Files.writeString(cwd.resolve("f.txt"), "F");
        when(clipboard.read()).thenReturn("C");
        ContextAssembler withStdin = new ContextAssembler(clipboard, () -> Optional.of("piped"));

        ContextBundle bundle = withStdin.assemble("{clip} explain @f.txt", state);

        assertThat(bundle.command()).isEqualTo("explain");
        assertThat(bundle.blocks()).extracting(ContextBlock::source)
                .containsExactly(ContextSource.STDIN, ContextSource.FILE, ContextSource.CLIPBOARD);
    }

    @Test
    void assemble_isRepeatableForSameInput() throws IOException {
        Files.writeString(cwd.resolve("f.txt"), "F");

        ContextBundle first  = assembler.assemble("read @f.txt", state);
        ContextBundle second = assembler.assemble("read @f.txt", state);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void standardInputSource_readsOnceAndSkipsTerminal() {
        StandardInputSource piped = new StandardInputSource(
                new ByteArrayInputStream("data\n".getBytes(StandardCharsets.UTF_8)), false);
        assertThat(piped.read()).contains("data\n");
        assertThat(piped.read()).contains("data\n");

        StandardInputSource terminal = new StandardInputSource(
                new ByteArrayInputStream("typed".getBytes(StandardCharsets.UTF_8)), true);
        assertThat(terminal.read()).isEmpty();
    }
}
