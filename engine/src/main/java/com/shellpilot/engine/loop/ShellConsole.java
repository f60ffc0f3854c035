package com.shellpilot.engine.loop;

import com.shellpilot.engine.model.CommandResult;

import java.io.PrintStream;

/**
 * Everything the loop shows the user goes through here.
 * Output is written as-is; no colour or formatting.
 */
public class ShellConsole {

    private final PrintStream out;
    private final PrintStream err;

    public ShellConsole(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public void welcome() {
        out.println("ShellPilot - type 'mode' to switch between shell/nl/ai modes, 'exit' to quit");
        out.flush();
    }

    public void goodbye() {
        out.println();
        out.println("Goodbye!");
        out.flush();
    }

    /** Command output: stdout verbatim, then stderr on the error stream. */
    public void print(CommandResult result) {
        if (!result.stdout().isEmpty()) {
            out.print(result.stdout());
            out.flush();
        }
        if (!result.stderr().isEmpty()) {
            err.print(result.stderr());
            err.flush();
        }
    }

    /** Show a command as if it had been typed at the prompt. */
    public void echoCommand(String prompt, String command) {
        out.println(prompt + command);
        out.flush();
    }

    /** Show a translated command that is waiting for confirmation. */
    public void staged(String prompt, String command) {
        out.println("[prepared command]");
        echoCommand(prompt, command);
    }

    public void comment(String line) {
        out.println(line);
        out.flush();
    }

    public void info(String message) {
        out.print(message.endsWith("\n") ? message : message + "\n");
        out.flush();
    }

    public void error(String message) {
        err.print(message.endsWith("\n") ? message : message + "\n");
        err.flush();
    }
}
