package com.shellpilot.engine.loop;

import com.shellpilot.engine.classify.InputClassifier;
import com.shellpilot.engine.context.ContextAssembler;
import com.shellpilot.engine.executor.CommandExecutor;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.model.ContextBundle;
import com.shellpilot.engine.model.InputKind;
import com.shellpilot.engine.model.SessionMode;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import com.shellpilot.engine.translate.TranslationContext;
import com.shellpilot.engine.translate.TranslationException;
import com.shellpilot.engine.translate.TranslationGateway;
import com.shellpilot.engine.translate.TranslationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The per-input control cycle: assemble context, classify, translate if
 * needed, execute.
 *
 * <p>Single-threaded: one input is fully handled before the next line is
 * read, and this thread is the only one that touches {@link SessionState}.
 * Errors from any step are reported and the loop carries on; only the
 * {@code exit} built-in or end of input ends the session.
 *
 * <p>Each input is appended to the history after it has been handled,
 * including when handling failed.
 */
@Component
public class ResolutionLoop {

    private static final Logger log = LoggerFactory.getLogger(ResolutionLoop.class);

    private static final Set<String> RERUN_PHRASES = Set.of(
            "run it", "run that", "execute it", "do it", "go ahead",
            "please run it", "run the command", "run those");

    private final SessionState       state;
    private final ContextAssembler   assembler;
    private final CommandExecutor    executor;
    private final TranslationGateway translator;
    private final AssistantGateway   assistant;
    private final ShellConsole       console;
    private final String             user;
    private final int                recentLimit;
    private final boolean            confirmRisky;

    private final AtomicLong inputCounter = new AtomicLong();

    public ResolutionLoop(SessionState state,
                          ContextAssembler assembler,
                          CommandExecutor executor,
                          TranslationGateway translator,
                          AssistantGateway assistant,
                          ShellConsole console,
                          @Value("${user.name:user}") String user,
                          @Value("${shellpilot.history.recent-limit:5}") int recentLimit,
                          @Value("${shellpilot.translator.confirm-risky:false}") boolean confirmRisky) {
        this.state        = state;
        this.assembler    = assembler;
        this.executor     = executor;
        this.translator   = translator;
        this.assistant    = assistant;
        this.console      = console;
        this.user         = user;
        this.recentLimit  = recentLimit;
        this.confirmRisky = confirmRisky;
    }

    // ------------------------------------------------------------------
    // Session
    // ------------------------------------------------------------------

    /**
     * Read and handle lines until {@code exit} or end of input.
     *
     * @return the process exit status: the {@code exit} argument, or 0 at end of input
     */
    public int run(LineSource lines) {
        console.welcome();
        log.info("Session started in {} (mode {})", state.workingDirectory(), state.mode().key());
        try {
            while (!state.exitRequested()) {
                String line;
                try {
                    line = lines.readLine(state.prompt(user));
                } catch (InterruptedIOException e) {
                    Thread.interrupted();
                    console.info("\nUse 'exit' to quit");
                    continue;
                }
                if (line == null) {
                    break;
                }
                handle(line);
            }
        } catch (IOException e) {
            log.error("Input stream failed: {}", e.getMessage(), e);
            console.error("Input error: " + e.getMessage());
        }
        console.goodbye();
        int status = state.exitRequested() ? state.exitStatus() : 0;
        log.info("Session ended with status {}", status);
        return status;
    }

    /**
     * Handle a single input outside the interactive loop.
     *
     * @return the {@code exit} argument if one was given, else the last exit code
     */
    public int runOnce(String input) {
        handle(input);
        return state.exitRequested() ? state.exitStatus() : state.lastExitCode();
    }

    // ------------------------------------------------------------------
    // One input
    // ------------------------------------------------------------------

    public void handle(String rawInput) {
        MDC.put("inputId", String.valueOf(inputCounter.incrementAndGet()));
        boolean accepted = rawInput != null && !rawInput.isBlank();
        try {
            if (!accepted) {
                return;
            }
            ContextBundle bundle = assembler.assemble(rawInput, state);
            InputKind kind = route(InputClassifier.classify(bundle.command()));
            MDC.put("kind", kind.name());
            log.debug("Input classified as {} ({} context block(s))", kind, bundle.blocks().size());

            switch (kind) {
                case EMPTY, COMMENT    -> accepted = false;
                case SHELL_COMMAND     -> runShellCommand(bundle.command());
                case NATURAL_LANGUAGE  -> runNaturalLanguage(bundle);
                case ASSISTANT_REQUEST -> runAssistant(bundle);
            }
        } catch (TranslationException e) {
            log.warn("Translation failed: {}", e.getMessage());
            console.error("Translation error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled error for input: {}", e.getMessage(), e);
            console.error("Error: " + e.getMessage());
        } finally {
            if (accepted) {
                state.appendHistory(rawInput);
            }
            // a cancelled command must not leak its interrupt into the next prompt
            Thread.interrupted();
            MDC.clear();
        }
    }

    /**
     * Natural language falls back to the session mode; every other kind is
     * explicit and kept as classified.
     */
    InputKind route(InputKind kind) {
        if (kind != InputKind.NATURAL_LANGUAGE) {
            return kind;
        }
        return switch (state.mode()) {
            case SHELL            -> InputKind.SHELL_COMMAND;
            case ASSISTANT        -> InputKind.ASSISTANT_REQUEST;
            case NATURAL_LANGUAGE -> InputKind.NATURAL_LANGUAGE;
        };
    }

    // ------------------------------------------------------------------
    // Shell commands
    // ------------------------------------------------------------------

    private void runShellCommand(String command) {
        CommandResult result = executor.execute(command, state);
        console.print(result);

        // typing the head of the pending queue confirms it and resumes the rest
        Optional<String> pending = state.nextPendingCommand();
        if (pending.isPresent() && pending.get().equals(command)) {
            state.removeNextPendingCommand();
            runQueued();
        }
    }

    // ------------------------------------------------------------------
    // Natural language
    // ------------------------------------------------------------------

    private void runNaturalLanguage(ContextBundle bundle) {
        String request = bundle.command();
        if (RERUN_PHRASES.contains(request.strip().toLowerCase(Locale.ROOT))) {
            runAllPending();
            return;
        }

        TranslationContext context = TranslationContext.of(state, bundle, recentLimit);
        String reply = translator.translate(request, context);

        TranslationParser.commentLines(reply).forEach(console::comment);
        List<String> commands = TranslationParser.executableLines(reply);
        if (commands.isEmpty()) {
            console.info("No commands to run.");
            return;
        }
        log.info("Translation produced {} command(s)", commands.size());
        state.stagePendingCommands(commands);
        runQueued();
    }

    /**
     * Run pending commands in order. With confirmation switched on, stop at the
     * first command that is not safe to run unattended and leave it queued.
     * An interrupted command drops the rest of the queue.
     */
    private void runQueued() {
        Optional<String> next;
        while ((next = state.nextPendingCommand()).isPresent()) {
            if (state.exitRequested() || Thread.currentThread().isInterrupted()) {
                state.clearPendingCommands();
                return;
            }
            String command = next.get();
            if (confirmRisky && !AutorunPolicy.shouldAutorun(command, state.workingDirectory())) {
                console.staged(state.prompt(user), command);
                console.info("Type 'run it' to run the prepared command(s), or enter the command yourself.");
                return;
            }
            state.removeNextPendingCommand();
            console.echoCommand(state.prompt(user), command);
            CommandResult result = executor.execute(command, state);
            console.print(result);
            if (result.errorKind() == ShellException.Kind.INTERRUPTED) {
                state.clearPendingCommands();
                return;
            }
        }
    }

    private void runAllPending() {
        if (state.pendingCommands().isEmpty()) {
            console.info("Nothing queued to run.");
            return;
        }
        Optional<String> next;
        while ((next = state.nextPendingCommand()).isPresent()
                && !state.exitRequested() && !Thread.currentThread().isInterrupted()) {
            state.removeNextPendingCommand();
            console.echoCommand(state.prompt(user), next.get());
            CommandResult result = executor.execute(next.get(), state);
            console.print(result);
            if (result.errorKind() == ShellException.Kind.INTERRUPTED) {
                break;
            }
        }
        state.clearPendingCommands();
    }

    // ------------------------------------------------------------------
    // Assistant
    // ------------------------------------------------------------------

    private void runAssistant(ContextBundle bundle) {
        String request = InputClassifier.extractAssistantRequest(bundle.command());
        if (request.isEmpty()) {
            state.setMode(SessionMode.ASSISTANT);
            console.info("Switched to " + SessionMode.ASSISTANT.key() + " mode");
            return;
        }
        console.info(assistant.handle(request, bundle));
    }
}
