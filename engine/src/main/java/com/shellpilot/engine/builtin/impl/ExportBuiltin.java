package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code export [NAME=VALUE ...]}
 *
 * Without arguments, lists the environment as {@code NAME=VALUE} lines sorted
 * by name. Each {@code NAME=VALUE} argument sets a variable for the session and
 * for every process started afterwards. Arguments without '=' are ignored.
 */
@Component
public class ExportBuiltin implements Builtin {

    @Override public String name()  { return "export"; }
    @Override public String usage() { return "export [NAME=VALUE ...]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        if (args.isEmpty()) {
            String listing = state.environment().entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue() + "\n")
                    .collect(Collectors.joining());
            return CommandResult.success(commandLine(args), listing);
        }

        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq >= 0) {
                state.setEnvVar(arg.substring(0, eq), arg.substring(eq + 1));
            }
        }
        return CommandResult.empty(commandLine(args));
    }
}
