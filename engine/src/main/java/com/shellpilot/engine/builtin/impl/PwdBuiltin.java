package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import com.shellpilot.engine.session.ShellException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/** {@code pwd [-L | -P]}: print the working directory, {@code -P} with symlinks resolved. */
@Component
public class PwdBuiltin implements Builtin {

    @Override public String name()  { return "pwd"; }
    @Override public String usage() { return "pwd [-L | -P]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        boolean physical = false;
        for (String arg : args) {
            if ("-P".equals(arg)) {
                physical = true;
            } else if ("-L".equals(arg)) {
                physical = false;
            } else {
                return CommandResult.failure(commandLine(args), 2, "pwd: " + arg + ": invalid option\n");
            }
        }
        if (!physical) {
            return CommandResult.success(commandLine(args), state.workingDirectory() + "\n");
        }
        try {
            return CommandResult.success(commandLine(args), state.workingDirectory().toRealPath() + "\n");
        } catch (IOException e) {
            throw new ShellException(ShellException.Kind.DIRECTORY_NOT_FOUND,
                    "pwd: " + state.workingDirectory() + ": No such directory", e);
        }
    }
}
