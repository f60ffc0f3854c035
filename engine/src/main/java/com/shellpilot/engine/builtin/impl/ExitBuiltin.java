package com.shellpilot.engine.builtin.impl;

import com.shellpilot.engine.builtin.Builtin;
import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.session.SessionState;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * {@code exit [status]}: end the session.
 *
 * The status defaults to 0 and a non-numeric argument counts as absent.
 * Numbers are taken modulo 256, so {@code exit 256} is 0 and {@code exit -1}
 * is 255. The loop sees the request on the session and stops after this input.
 */
@Component
public class ExitBuiltin implements Builtin {

    private static final BigInteger STATUS_RANGE = BigInteger.valueOf(256);

    @Override public String name()  { return "exit"; }
    @Override public String usage() { return "exit [status]"; }

    @Override
    public CommandResult execute(List<String> args, SessionState state) {
        state.requestExit(args.isEmpty() ? 0 : parseStatus(args.get(0)));
        return CommandResult.empty(commandLine(args));
    }

    static int parseStatus(String arg) {
        if (!arg.matches("-?\\d+")) {
            return 0;
        }
        return new BigInteger(arg).mod(STATUS_RANGE).intValue();
    }
}
