package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class UnaliasBuiltin implements Builtin {

    @Override public String name()  { return "unalias"; }
    @Override public String usage() { return "unalias name ..."; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        if (args.isEmpty()) {
            return CommandResult.failure(commandLine(args), 1, "unalias: usage: " + usage() + "\n");
        }
        StringBuilder err = new StringBuilder();
        for (String name : args) {
            if (!state.removeAlias(name)) {
                err.append("unalias: ").append(name).append(": not found\n");
            }
        }
        return new CommandResult(commandLine(args), err.isEmpty() ? 0 : 1, "", err.toString(), null);
    }
}
