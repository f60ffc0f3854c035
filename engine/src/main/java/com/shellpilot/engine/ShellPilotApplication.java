package com.shellpilot.engine;

import com.shellpilot.engine.context.PipedInput;
import com.shellpilot.engine.context.StandardInputSource;
import com.shellpilot.engine.executor.CommandExecutor;
import com.shellpilot.engine.loop.ConsoleLineSource;
import com.shellpilot.engine.loop.LineSource;
import com.shellpilot.engine.loop.ShellConsole;
import com.shellpilot.engine.session.SessionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Lazy;

import java.io.IOException;

@SpringBootApplication
public class ShellPilotApplication {

    /**
     * Runs the shell and exits with the session's status.
     *
     * <pre>
     *   java -jar engine.jar                      # interactive
     *   java -jar engine.jar list large files     # one input, then exit
     *   git diff | java -jar engine.jar explain   # piped stdin becomes context
     * </pre>
     */
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ShellPilotApplication.class, args)));
    }

    /** One state per process; the resolution loop is its only writer. */
    @Bean
    SessionState sessionState() {
        return SessionState.fromProcess();
    }

    /** No actuator here, so counters and timers are kept in memory. */
    @Bean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Standard input is only context in one-shot mode. Interactively it
     * carries the user's lines and must not be consumed here.
     */
    @Bean
    PipedInput pipedInput(ApplicationArguments arguments) {
        return arguments.getNonOptionArgs().isEmpty() ? PipedInput.none() : StandardInputSource.system();
    }

    @Bean
    ShellConsole shellConsole() {
        return new ShellConsole(System.out, System.err);
    }

    /** Only created when the interactive loop asks for it. */
    @Bean(destroyMethod = "close")
    @Lazy
    Terminal terminal() throws IOException {
        return TerminalBuilder.builder()
                .system(true)
                .encoding("UTF-8")
                .build();
    }

    /**
     * Ctrl-C while a command runs kills that command; at the prompt JLine
     * reports it to the reader instead.
     */
    @Bean
    @Lazy
    LineSource lineSource(Terminal terminal, CommandExecutor executor) {
        terminal.handle(Terminal.Signal.INT, signal -> executor.interruptRunning());
        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("shellpilot")
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .build();
        return new ConsoleLineSource(reader);
    }
}
