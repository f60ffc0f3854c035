package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code history [n]}: list accepted inputs, numbered from 1.
 */
@Component
public class HistoryBuiltin implements Builtin {

    @Override public String name()  { return "history"; }
    @Override public String usage() { return "history [n]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        List<String> history = state.history();
        int from = 0;
        if (!args.isEmpty()) {
            if (!args.get(0).matches("\\d{1,9}")) {
                return CommandResult.failure(commandLine(args), 1,
                        "history: " + args.get(0) + ": numeric argument required\n");
            }
            from = Math.max(0, history.size() - Integer.parseInt(args.get(0)));
        }

        StringBuilder sb = new StringBuilder();
        for (int i = from; i < history.size(); i++) {
            sb.append(String.format("%5d  %s\n", i + 1, history.get(i)));
        }
        return CommandResult.success(commandLine(args), sb.toString());
    }
}
