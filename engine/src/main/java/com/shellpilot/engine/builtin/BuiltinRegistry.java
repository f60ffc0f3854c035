package com.shellpilot.engine.builtin;

import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static name → handler table for built-in commands.
 *
 * Spring passes every {@link Builtin} bean to the constructor; declaring a new
 * built-in as a {@code @Component} is all it takes to register it. Dispatch is
 * a plain map lookup, no reflection.
 *
 * <p>Every call is timed and counted:
 * <pre>
 *   shellpilot.builtin.calls{builtin, status="success|failure"}
 *   shellpilot.builtin.duration{builtin}
 * </pre>
 */
@Component
public class BuiltinRegistry {

    private static final Logger log = LoggerFactory.getLogger(BuiltinRegistry.class);

    private final Map<String, Builtin> builtins = new LinkedHashMap<>();
    private final MeterRegistry meterRegistry;

    public BuiltinRegistry(List<Builtin> allBuiltins, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        allBuiltins.stream()
                .sorted(Comparator.comparing(Builtin::name))
                .forEach(b -> {
                    builtins.put(b.name(), b);
                    log.info("Registered built-in '{}'", b.name());
                });
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public boolean isBuiltin(String name) {
        return builtins.containsKey(name);
    }

    public Builtin get(String name) {
        Builtin builtin = builtins.get(name);
        if (builtin == null) {
            throw new BuiltinNotFoundException(name);
        }
        return builtin;
    }

    /** Registered names, sorted. */
    public List<String> names() {
        return List.copyOf(builtins.keySet());
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Dispatch to a built-in. A {@link ShellException} raised by the handler
     * becomes a result with exit code 1 and the message on standard error.
     *
     * @param command the full command text as typed, recorded on the result
     * @throws BuiltinNotFoundException if {@code name} is not registered
     */
    public CommandResult execute(String name, String command, List<String> args, SessionState state) {
        Builtin builtin = get(name);

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            CommandResult result = builtin.execute(args, state);
            if (!result.success()) {
                status = "failure";
            }
            return new CommandResult(command, result.exitCode(), result.stdout(), result.stderr(), result.errorKind());
        } catch (ShellException e) {
            status = "failure";
            log.debug("Built-in '{}' failed: {}", name, e.getMessage());
            return CommandResult.failure(command, 1, e);
        } finally {
            sample.stop(meterRegistry.timer("shellpilot.builtin.duration", "builtin", name));
            meterRegistry.counter("shellpilot.builtin.calls", "builtin", name, "status", status).increment();
        }
    }
}
