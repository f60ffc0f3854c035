package com.shellpilot.engine.executor;

import com.shellpilot.engine.builtin.BuiltinRegistry;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one command line: a built-in, a single external command, a pipeline,
 * or a {@code ;}/{@code &&}/{@code ||} list.
 *
 * <p>A list that starts with a built-in is run item by item here, so that
 * {@code cd src && make} runs make in src. Any other list is passed whole to
 * the OS shell, which keeps the usual precedence ({@code |} binds tighter than
 * {@code ;}, {@code &&} and {@code ||}).
 *
 * <p>External commands go through the OS command interpreter
 * ({@code /bin/sh -c} by default) with the session's working directory and a
 * snapshot of its environment. A pipeline is split on top-level '|' and each
 * stage becomes its own interpreter process; the JDK connects stage
 * <i>i</i>'s stdout to stage <i>i+1</i>'s stdin with OS pipes, so data between
 * stages never passes through this JVM. All stages start before any output is
 * read. The result carries the last stage's exit code and stdout, and the
 * stderr of every stage in stage order.
 *
 * <p>The timeout covers the whole pipeline. On timeout or interrupt every
 * stage and its descendants are killed, and every stage is reaped before
 * {@link #execute} returns. Failures to launch are reported as results,
 * never thrown.
 */
@Component
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    /** Bare interpreter names that translators sometimes emit on their own line. */
    static final Set<String> SHELL_INTERPRETERS = Set.of("cmd", "bash", "sh", "zsh", "powershell", "pwsh");

    // How long to wait for stream readers after the processes are gone.
    private static final long DRAIN_GRACE_MS = 2000;

    private final BuiltinRegistry builtins;
    private final MeterRegistry   meterRegistry;
    private final Duration        timeout;
    private final List<String>    interpreter;

    private final Set<Process>    inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean   cancelRequested = new AtomicBoolean();
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(daemonThreads());

    public CommandExecutor(BuiltinRegistry builtins,
                           MeterRegistry meterRegistry,
                           @Value("${shellpilot.executor.timeout-seconds:300}") long timeoutSeconds,
                           @Value("${shellpilot.executor.shell:}") String shell) {
        this.builtins      = builtins;
        this.meterRegistry = meterRegistry;
        this.timeout       = Duration.ofSeconds(timeoutSeconds);
        this.interpreter   = interpreterFor(shell);
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Execute {@code commandText} against {@code state}.
     *
     * Blank and comment-only input returns an empty success without touching
     * the session. Everything else records its result on the session.
     */
    public CommandResult execute(String commandText, SessionState state) {
        String command = commandText == null ? "" : commandText.strip();
        if (command.isEmpty() || command.startsWith("#")) {
            return CommandResult.empty(command);
        }
        if (SHELL_INTERPRETERS.contains(command.toLowerCase(Locale.ROOT))) {
            log.debug("Skipping bare interpreter invocation '{}'", command);
            return CommandResult.empty(command);
        }

        String expanded = expandAlias(command, state);
        List<CommandLine.ListItem> items = CommandLine.splitList(expanded);

        CommandResult result;
        if (items.size() == 1) {
            result = runSimple(command, expanded, state);
        } else if (startsWithBuiltin(items.get(0).text())) {
            result = runList(command, items, state);
        } else {
            // nothing for the session to do itself: the OS shell runs the list with its own precedence
            result = spawn(command, List.of(expanded), state);
        }

        state.recordResult(result);
        return result;
    }

    /**
     * Cancel the command running right now, if any. Its processes are killed
     * and it reports {@link CommandResult#INTERRUPTED_EXIT_CODE}. Called from
     * the terminal's interrupt handler, not from the loop thread.
     */
    public void interruptRunning() {
        if (inFlight.isEmpty()) {
            return;
        }
        log.info("Interrupting {} running process(es)", inFlight.size());
        cancelRequested.set(true);
        cancelAll();
    }

    /** Kill every child process currently running; used on JVM shutdown. */
    public void cancelAll() {
        for (Process p : List.copyOf(inFlight)) {
            destroyTree(p);
        }
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        streamReaders.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Built-ins and command lists
    // ------------------------------------------------------------------

    /**
     * One command or pipeline without list operators. A built-in that is piped
     * or redirected goes to the OS shell instead, which runs its own version
     * in a subshell; as in any POSIX shell, state changes made there do not
     * reach the session.
     */
    private CommandResult runSimple(String command, String text, SessionState state) {
        List<String> words = CommandLine.tokenize(text);
        if (!words.isEmpty() && builtins.isBuiltin(words.get(0)) && !CommandLine.hasPipeOrRedirect(text)) {
            return builtins.execute(words.get(0), command, words.subList(1, words.size()), state);
        }
        return spawn(command, CommandLine.splitPipeline(text), state);
    }

    /**
     * A list whose first command is a built-in, e.g. {@code cd src && make}.
     * Items run one at a time so later items see the session changes of earlier
     * ones; {@code &&} and {@code ||} test the exit code of the last item that
     * ran. Output is concatenated. Stops after {@code exit}, a timeout or an
     * interrupt.
     */
    private CommandResult runList(String command, List<CommandLine.ListItem> items, SessionState state) {
        StringBuilder out = new StringBuilder();
        StringBuilder err = new StringBuilder();
        CommandResult last = null;
        int status = 0;

        for (int i = 0; i < items.size(); i++) {
            CommandLine.ListItem item = items.get(i);
            if (!item.runsAfter(status)) {
                continue;
            }
            // the first item was expanded with the whole line
            String text = i == 0 ? item.text() : expandAlias(item.text(), state);
            last = runSimple(item.text(), text, state);
            status = last.exitCode();
            out.append(last.stdout());
            err.append(last.stderr());

            if (state.exitRequested()
                    || last.errorKind() == ShellException.Kind.COMMAND_TIMEOUT
                    || last.errorKind() == ShellException.Kind.INTERRUPTED) {
                break;
            }
        }
        return new CommandResult(command, status, out.toString(), err.toString(),
                last == null ? null : last.errorKind());
    }

    private boolean startsWithBuiltin(String text) {
        List<String> words = CommandLine.tokenize(text);
        return !words.isEmpty() && builtins.isBuiltin(words.get(0));
    }

    // ------------------------------------------------------------------
    // External processes
    // ------------------------------------------------------------------

    private CommandResult spawn(String command, List<String> stages, SessionState state) {
        String kind = stages.size() > 1 ? "pipeline" : "single";
        List<ProcessBuilder> builders = new ArrayList<>(stages.size());
        for (String stage : stages) {
            builders.add(builderFor(stage, state));
        }

        List<Process> processes;
        cancelRequested.set(false);
        try {
            processes = ProcessBuilder.startPipeline(builders);
        } catch (IOException | RuntimeException e) {
            ShellException failure = new ShellException(ShellException.Kind.PROCESS_LAUNCH_FAILURE,
                    "Execution error: " + e.getMessage(), e);
            log.warn("Could not launch '{}': {}", command, e.getMessage());
            count(kind, "launch_failure");
            return CommandResult.failure(command, 1, failure);
        }
        log.debug("Started {} process(es) for '{}' in {}", processes.size(), command, state.workingDirectory());

        inFlight.addAll(processes);
        try {
            return await(command, kind, processes);
        } finally {
            inFlight.removeAll(processes);
        }
    }

    private CommandResult await(String command, String kind, List<Process> processes) {
        Process last = processes.get(processes.size() - 1);
        List<StreamCollector> stderr = new ArrayList<>(processes.size());
        StreamCollector stdout;
        try {
            // the first stage reads from an empty stdin
            processes.get(0).getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of '{}': {}", command, e.getMessage());
        }
        for (Process p : processes) {
            stderr.add(StreamCollector.start(p.getErrorStream(), streamReaders));
        }
        stdout = StreamCollector.start(last.getInputStream(), streamReaders);

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!waitForAll(processes, deadline)) {
                destroyAll(processes);
                drain(stdout, stderr, DRAIN_GRACE_MS);
                log.warn("Command timed out after {}s: {}", timeout.toSeconds(), command);
                count(kind, "timeout");
                return new CommandResult(command, CommandResult.TIMEOUT_EXIT_CODE, stdout.text(),
                        joined(stderr) + "Command timed out after " + timeout.toSeconds() + " seconds\n",
                        ShellException.Kind.COMMAND_TIMEOUT);
            }
            // a background grandchild may still hold a pipe open; don't wait past the deadline for it
            long remainingMs = Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
            drain(stdout, stderr, Math.min(remainingMs, DRAIN_GRACE_MS));

            if (cancelRequested.getAndSet(false)) {
                log.info("Command interrupted: {}", command);
                count(kind, "interrupted");
                return interrupted(command, stdout, stderr);
            }

            int exitCode = last.exitValue();
            count(kind, exitCode == 0 ? "success" : "failure");
            return new CommandResult(command, exitCode, stdout.text(), joined(stderr), null);
        } catch (InterruptedException e) {
            destroyAll(processes);
            Thread.currentThread().interrupt();
            count(kind, "interrupted");
            return interrupted(command, stdout, stderr);
        }
    }

    private static CommandResult interrupted(String command, StreamCollector stdout, List<StreamCollector> stderr) {
        return new CommandResult(command, CommandResult.INTERRUPTED_EXIT_CODE, stdout.text(),
                joined(stderr) + "Interrupted\n", ShellException.Kind.INTERRUPTED);
    }

    private static boolean waitForAll(List<Process> processes, long deadline) throws InterruptedException {
        for (Process p : processes) {
            long remaining = deadline - System.nanoTime();
            if (!p.waitFor(Math.max(0, remaining), TimeUnit.NANOSECONDS)) {
                return false;
            }
        }
        return true;
    }

    /** Kill every stage with its descendants, then reap each stage. */
    private static void destroyAll(List<Process> processes) {
        for (Process p : processes) {
            destroyTree(p);
        }
        for (Process p : processes) {
            boolean interrupted = false;
            while (true) {
                try {
                    p.waitFor();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void destroyTree(Process p) {
        // descendants first: once the parent dies they are reparented and unreachable
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
    }

    private static void drain(StreamCollector stdout, List<StreamCollector> stderr, long graceMs) {
        long until = System.currentTimeMillis() + graceMs;
        try {
            stdout.await(until - System.currentTimeMillis());
            for (StreamCollector c : stderr) {
                c.await(until - System.currentTimeMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String joined(List<StreamCollector> collectors) {
        StringBuilder sb = new StringBuilder();
        for (StreamCollector c : collectors) {
            sb.append(c.text());
        }
        return sb.toString();
    }

    private ProcessBuilder builderFor(String stage, SessionState state) {
        List<String> argv = new ArrayList<>(interpreter);
        argv.add(stage);
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.directory(state.workingDirectory().toFile());
        pb.environment().clear();
        pb.environment().putAll(state.environment());
        return pb;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Replace the first word with its alias, one level deep. */
    private static String expandAlias(String command, SessionState state) {
        String[] parts = command.split("\\s+", 2);
        return state.getAlias(parts[0])
                .map(value -> parts.length > 1 ? value + " " + parts[1] : value)
                .orElse(command);
    }

    private void count(String kind, String status) {
        meterRegistry.counter("shellpilot.command.calls", "kind", kind, "status", status).increment();
    }

    static List<String> interpreterFor(String shell) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
        if (shell == null || shell.isBlank()) {
            return windows ? List.of("cmd.exe", "/c") : List.of("/bin/sh", "-c");
        }
        String name = shell.toLowerCase(Locale.ROOT);
        if (name.endsWith("cmd.exe") || name.endsWith("cmd")) {
            return List.of(shell, "/c");
        }
        if (name.contains("powershell") || name.contains("pwsh")) {
            return List.of(shell, "-NoProfile", "-Command");
        }
        return List.of(shell, "-c");
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "shellpilot-stream-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
