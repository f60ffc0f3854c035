package com.shellpilot.engine.builtin;

import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;

import java.util.List;

/**
 * A command implemented inside the engine instead of by an external process.
 *
 * Built-ins are Spring {@code @Component}s; {@link BuiltinRegistry} collects
 * every one at startup and dispatches to it by {@link #name()}. Only a few
 * built-ins mutate the session ({@code cd}, {@code export}, {@code mode},
 * {@code exit}, {@code alias}, {@code unalias}), and only through the
 * session's named operations.
 */
public interface Builtin {

    /** The word that invokes this built-in. */
    String name();

    /** One-line usage, e.g. {@code "cd [dir]"}. */
    String usage();

    /**
     * Run the built-in.
     *
     * @param args  the words after the built-in name, quotes removed
     * @param state the session, passed by reference so the built-in can mutate it
     * @throws com.shellpilot.engine.session.ShellException for user errors;
     *         the registry reports these as exit code 1
     */
    CommandResult execute(List<String> args, SessionState state);

    /** The command line this invocation corresponds to, e.g. {@code "cd /tmp"}. */
    default String commandLine(List<String> args) {
        return args.isEmpty() ? name() : name() + " " + String.join(" ", args);
    }
}
