package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * {@code alias [name[=value] ...]}
 *
 * No arguments lists every alias; {@code name=value} defines one;
 * a bare {@code name} prints it, failing when it is not defined.
 */
@Component
public class AliasBuiltin implements Builtin {

    @Override public String name()  { return "alias"; }
    @Override public String usage() { return "alias [name[=value] ...]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        if (args.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            state.aliases().forEach((name, value) -> sb.append(format(name, value)));
            return CommandResult.success(commandLine(args), sb.toString());
        }

        StringBuilder out = new StringBuilder();
        StringBuilder err = new StringBuilder();
        for (String arg : args) {
            int eq = arg.indexOf('=');
            if (eq > 0) {
                state.setAlias(arg.substring(0, eq), arg.substring(eq + 1));
                continue;
            }
            Optional<String> value = state.getAlias(arg);
            if (value.isPresent()) {
                out.append(format(arg, value.get()));
            } else {
                err.append("alias: ").append(arg).append(": not found\n");
            }
        }
        return new CommandResult(commandLine(args), err.isEmpty() ? 0 : 1, out.toString(), err.toString(), null);
    }

    private static String format(String name, String value) {
        return "alias " + name + "='" + value + "'\n";
    }
}
