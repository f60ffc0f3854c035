package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code cd [dir]}: change the session's working directory.
 *
 * No argument means the home directory; {@code ~} and {@code ~/x} expand to it;
 * {@code -} returns to the previous directory and prints it.
 */
@Component
public class CdBuiltin implements Builtin {

    @Override public String name()  { return "cd"; }
    @Override public String usage() { return "cd [dir | ~ | -]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        if (args.size() > 1) {
            return CommandResult.failure(commandLine(args), 1, "cd: too many arguments\n");
        }
        String target = args.isEmpty() ? "~" : args.get(0);

        if ("-".equals(target)) {
            Path previous = state.previousDirectory().orElseThrow(() ->
                    new ShellException(ShellException.Kind.DIRECTORY_NOT_FOUND, "cd: OLDPWD not set"));
            Path now = state.setWorkingDirectory(previous.toString());
            return CommandResult.success(commandLine(args), now + "\n");
        }

        state.setWorkingDirectory(expandHome(target, state.homeDirectory()));
        return CommandResult.empty(commandLine(args));
    }

    private static String expandHome(String target, Path home) {
        if ("~".equals(target)) {
            return home.toString();
        }
        if (target.startsWith("~/")) {
            return home.resolve(target.substring(2)).toString();
        }
        return target;
    }
}
