package com.shellpilot.engine.builtin;

public class BuiltinNotFoundException extends RuntimeException {
    public BuiltinNotFoundException(String name) {
        super("No built-in registered with name: '" + name + "'");
    }
}
