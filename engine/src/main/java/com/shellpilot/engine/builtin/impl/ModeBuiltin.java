package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.model.SessionMode;
import com.shellpilot.engine.session.SessionState;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@code mode [shell|nl|ai]}: show or switch how natural-language input is routed.
 */
@Component
public class ModeBuiltin implements Builtin {

    @Override public String name()  { return "mode"; }
    @Override public String usage() { return "mode [" + SessionMode.validNames().replace(", ", "|") + "]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        if (args.isEmpty()) {
            return CommandResult.success(commandLine(args),
                    "Current mode: " + state.mode().key() + "\nAvailable: " + SessionMode.validNames() + "\n");
        }
        SessionMode mode = state.setMode(args.get(0));
        return CommandResult.success(commandLine(args), "Switched to " + mode.key() + " mode\n");
    }
}
