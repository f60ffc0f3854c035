package com.shellpilot.engine.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the shell once the context is up.
 *
 * <p>With non-option arguments they are joined into a single input, handled,
 * and the application exits with that input's status. Without, the
 * interactive loop runs until {@code exit} or end of input.
 *
 * <p>Disabled with {@code shellpilot.interactive.enabled=false} so tests can
 * start the context without blocking on standard input.
 */
@Component
@ConditionalOnProperty(name = "shellpilot.interactive.enabled", havingValue = "true", matchIfMissing = true)
public class ShellRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ShellRunner.class);

    private final ResolutionLoop             loop;
    private final ObjectProvider<LineSource> lines;

    private volatile int exitCode;

    public ShellRunner(ResolutionLoop loop, ObjectProvider<LineSource> lines) {
        this.loop  = loop;
        this.lines = lines;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.getNonOptionArgs().isEmpty()) {
            // the terminal is opened here, so one-shot runs never touch it
            exitCode = loop.run(lines.getObject());
        } else {
            String input = String.join(" ", args.getNonOptionArgs());
            log.info("One-shot input: {}", input);
            exitCode = loop.runOnce(input);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
