package com.shellpilot.engine.loop;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.builtin.BuiltinRegistry;
import com.shellpilot.engine.builtin.impl.*;
import com.shellpilot.engine.context.ClipboardReader;
import com.shellpilot.engine.context.ContextAssembler;
import com.shellpilot.engine.context.PipedInput;
import com.shellpilot.engine.executor.CommandExecutor;
import com.shellpilot.engine.model.ContextBundle;
import com.shellpilot.engine.model.InputKind;
import com.shellpilot.engine.model.SessionMode;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.translate.TranslationContext;
import com.shellpilot.engine.translate.TranslationException;
import com.shellpilot.engine.translate.TranslationGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * The loop end to end with real built-ins and processes; translator and
 * assistant are mocked. No Spring context.
 */
@ExtendWith(MockitoExtension.class)
@DisabledOnOs(OS.WINDOWS)
class ResolutionLoopTest {

    @TempDir
    Path cwd;

    @Mock
    TranslationGateway translator;

    @Mock
    AssistantGateway assistant;

    @Mock
    ClipboardReader clipboard;

    SessionState state;
    CommandExecutor executor;
    ByteArrayOutputStream out;
    ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        List<Builtin> all = List.of(
                new CdBuiltin(), new PwdBuiltin(), new ExportBuiltin(), new ModeBuiltin(),
                new ExitBuiltin(), new HistoryBuiltin(), new AliasBuiltin(), new UnaliasBuiltin());
        executor = new CommandExecutor(new BuiltinRegistry(all, meters), meters, 10, "");
        state = new SessionState(System.getenv(), cwd, cwd);
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private ResolutionLoop loop(boolean confirmRisky) {
        ShellConsole console = new ShellConsole(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return new ResolutionLoop(state, new ContextAssembler(clipboard, PipedInput.none()), executor,
                translator, assistant, console, "tester", 5, confirmRisky);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    /** Feeds fixed lines, then end of input. */
    private static LineSource lines(String... input) {
        Deque<String> queue = new ArrayDeque<>(List.of(input));
        return prompt -> queue.pollFirst();
    }

    // ------------------------------------------------------------------
    // Shell commands
    // ------------------------------------------------------------------

    @Test
    void handle_shellCommand_runsWithoutTranslation() {
        loop(false).handle("echo hello");

        assertThat(stdout()).isEqualTo("hello\n");
        assertThat(state.history()).containsExactly("echo hello");
        verifyNoInteractions(translator);
    }

    @Test
    void handle_failingCommand_isStillRecordedInHistory() {
        loop(false).handle("cd /nonexistent-path-xyz");

        assertThat(stderr()).contains("No such directory");
        assertThat(state.lastExitCode()).isEqualTo(1);
        assertThat(state.history()).containsExactly("cd /nonexistent-path-xyz");
    }

    @Test
    void handle_blankAndComment_ignored() {
        ResolutionLoop loop = loop(false);
        loop.handle("   ");
        loop.handle("# remember to push");

        assertThat(state.history()).isEmpty();
        assertThat(stdout()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Natural language
    // ------------------------------------------------------------------

    @Test
    void handle_naturalLanguage_translatesAndRunsEachLine() {
        when(translator.translate(eq("greet the world twice"), any()))
                .thenReturn("```bash\n# Greeting\necho hello\necho world\n```");

        loop(false).handle("greet the world twice");

        assertThat(stdout()).contains("# Greeting\n")
                .contains("tester ~ $ echo hello\nhello\n")
                .contains("tester ~ $ echo world\nworld\n");
        assertThat(state.pendingCommands()).isEmpty();
        assertThat(state.lastCommand()).isEqualTo("echo world");
        assertThat(state.history()).containsExactly("greet the world twice");
    }

    @Test
    void handle_naturalLanguage_passesContextToTranslator() throws IOException {
        Files.writeString(cwd.resolve("notes.txt"), "remember the milk");
        state.appendHistory("ls");
        when(translator.translate(anyString(), any())).thenReturn("# nothing to run");

        loop(false).handle("summarize @notes.txt");

        ArgumentCaptor<TranslationContext> ctx = ArgumentCaptor.forClass(TranslationContext.class);
        verify(translator).translate(eq("summarize"), ctx.capture());
        assertThat(ctx.getValue().workingDirectory()).isEqualTo(state.workingDirectory().toString());
        assertThat(ctx.getValue().recentCommands()).containsExactly("ls");
        assertThat(ctx.getValue().contextBlocks()).containsExactly("# File: notes.txt\nremember the milk\n");
        assertThat(stdout()).contains("# nothing to run").contains("No commands to run.");
    }

    @Test
    void handle_translationFailure_reportedAndLoopContinues() {
        when(translator.translate(anyString(), any())).thenThrow(new TranslationException("service down"));
        ResolutionLoop loop = loop(false);

        loop.handle("list big files");
        loop.handle("echo still alive");

        assertThat(stderr()).contains("Translation error: service down");
        assertThat(stdout()).contains("still alive");
        assertThat(state.history()).containsExactly("list big files", "echo still alive");
    }

    @Test
    void handle_confirmRisky_stagesRiskyCommandUntilRunIt() throws IOException {
        Files.writeString(cwd.resolve("junk.tmp"), "x");
        when(translator.translate(anyString(), any())).thenReturn("echo before\nrm junk.tmp");
        ResolutionLoop loop = loop(true);

        loop.handle("clean up the temp file");

        assertThat(stdout()).contains("before\n").contains("[prepared command]");
        assertThat(state.pendingCommands()).containsExactly("rm junk.tmp");
        assertThat(cwd.resolve("junk.tmp")).exists();

        loop.handle("run it");

        assertThat(cwd.resolve("junk.tmp")).doesNotExist();
        assertThat(state.pendingCommands()).isEmpty();
    }

    @Test
    void handle_typingPendingHead_runsItAndResumesQueue() throws IOException {
        Files.writeString(cwd.resolve("a.tmp"), "x");
        when(translator.translate(anyString(), any())).thenReturn("rm a.tmp\necho done");
        ResolutionLoop loop = loop(true);

        loop.handle("remove a.tmp then say done");
        assertThat(state.pendingCommands()).containsExactly("rm a.tmp", "echo done");

        loop.handle("rm a.tmp");

        assertThat(cwd.resolve("a.tmp")).doesNotExist();
        assertThat(stdout()).contains("done\n");
        assertThat(state.pendingCommands()).isEmpty();
    }

    @Test
    void handle_runItWithEmptyQueue_saysSo() {
        loop(false).handle("run it");

        assertThat(stdout()).contains("Nothing queued to run.");
        verifyNoInteractions(translator);
    }

    // ------------------------------------------------------------------
    // Modes
    // ------------------------------------------------------------------

    @Test
    void handle_shellMode_runsNaturalLanguageAsCommand() {
        state.setMode(SessionMode.SHELL);

        loop(false).handle("printf shell-mode");

        assertThat(stdout()).isEqualTo("shell-mode");
        verifyNoInteractions(translator);
    }

    @Test
    void handle_assistantMode_routesNaturalLanguageToAssistant() {
        state.setMode(SessionMode.ASSISTANT);
        when(assistant.handle(eq("refactor the parser"), any(ContextBundle.class))).thenReturn("working on it");

        loop(false).handle("refactor the parser");

        assertThat(stdout()).contains("working on it");
        verifyNoInteractions(translator);
    }

    @Test
    void handle_assistantMode_stillRunsExplicitShellCommands() {
        state.setMode(SessionMode.ASSISTANT);

        loop(false).handle("echo explicit");

        assertThat(stdout()).isEqualTo("explicit\n");
        verifyNoInteractions(assistant);
    }

    @Test
    void handle_aiPrefix_goesToAssistantInAnyMode() {
        when(assistant.handle(eq("write tests"), any(ContextBundle.class))).thenReturn("ok");

        loop(false).handle("ai: write tests");

        verify(assistant).handle(eq("write tests"), any(ContextBundle.class));
        verifyNoInteractions(translator);
    }

    @Test
    void handle_bareAiPrefix_switchesToAssistantMode() {
        loop(false).handle("ai:");

        assertThat(state.mode()).isEqualTo(SessionMode.ASSISTANT);
        verify(assistant, never()).handle(anyString(), any());
    }

    @Test
    void route_onlyOverridesNaturalLanguage() {
        ResolutionLoop loop = loop(false);
        state.setMode(SessionMode.SHELL);

        assertThat(loop.route(InputKind.NATURAL_LANGUAGE))
                .isEqualTo(InputKind.SHELL_COMMAND);
        assertThat(loop.route(InputKind.ASSISTANT_REQUEST))
                .isEqualTo(InputKind.ASSISTANT_REQUEST);
    }

    // ------------------------------------------------------------------
    // Session lifecycle
    // ------------------------------------------------------------------

    @Test
    void run_exitBuiltin_endsWithStatusAndGoodbye() {
        int status = loop(false).run(lines("echo one", "exit 3", "echo never"));

        assertThat(status).isEqualTo(3);
        assertThat(stdout()).startsWith("ShellPilot").contains("one\n").endsWith("Goodbye!\n");
        assertThat(stdout()).doesNotContain("never");
        assertThat(state.history()).containsExactly("echo one", "exit 3");
    }

    @Test
    void run_endOfInput_endsWithZero() {
        int status = loop(false).run(lines("echo last"));

        assertThat(status).isZero();
        assertThat(stdout()).endsWith("Goodbye!\n");
    }

    @Test
    void run_inputStreamError_endsCleanly() {
        int status = loop(false).run(prompt -> {
            throw new IOException("stream closed");
        });

        assertThat(status).isZero();
        assertThat(stderr()).contains("Input error: stream closed");
        assertThat(stdout()).endsWith("Goodbye!\n");
    }

    @Test
    void run_interruptAtPrompt_printsHintAndKeepsReading() {
        Deque<String> queue = new ArrayDeque<>(List.of("echo after"));
        AtomicBoolean interrupted = new AtomicBoolean();

        int status = loop(false).run(prompt -> {
            if (interrupted.compareAndSet(false, true)) {
                throw new InterruptedIOException("interrupted at prompt");
            }
            return queue.pollFirst();
        });

        assertThat(status).isZero();
        assertThat(stdout()).contains("Use 'exit' to quit").contains("after\n").endsWith("Goodbye!\n");
    }

    @Test
    void handle_interruptedCommand_dropsRestOfQueue() throws Exception {
        when(translator.translate(eq("wait a while"), any()))
                .thenReturn("```bash\necho $$ > pid; exec sleep 30\necho never\n```");
        Path pidFile = cwd.resolve("pid");
        Thread interrupter = new Thread(() -> {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            try {
                while (!pidWritten(pidFile) && System.nanoTime() < deadline) {
                    Thread.sleep(20);
                }
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
            executor.interruptRunning();
        });
        interrupter.start();

        loop(false).handle("wait a while");
        interrupter.join();

        assertThat(stderr()).contains("Interrupted");
        assertThat(stdout()).doesNotContain("never");
        assertThat(state.pendingCommands()).isEmpty();
        assertThat(state.lastExitCode()).isEqualTo(130);
    }

    private static boolean pidWritten(Path pidFile) throws IOException {
        return Files.exists(pidFile) && !Files.readString(pidFile).isBlank();
    }

    @Test
    void runOnce_returnsLastExitCode() {
        assertThat(loop(false).runOnce("echo hi; exit 4")).isEqualTo(4);
        assertThat(loop(false).runOnce("echo fine")).isZero();
    }
}
