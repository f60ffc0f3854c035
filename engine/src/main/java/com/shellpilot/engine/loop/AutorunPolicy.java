package com.shellpilot.engine.loop;

import com.shellpilot.engine.executor.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a translated command may run without the user confirming it.
 * Consulted only when risky-command confirmation is switched on.
 */
public final class AutorunPolicy {

    private static final List<String> SAFE_PREFIXES = List.of(
            "ls", "pwd", "cd", "whoami", "date", "cat", "echo",
            "git status", "git diff", "head", "tail", "dir");

    private static final List<String> RISKY_KEYWORDS = List.of(
            "rm", "mv", "chmod", "chown", "docker", "kubectl",
            "git push", "git commit", "pip install", "npm install",
            "apt", "brew", "systemctl", "shutdown", "reboot");

    private AutorunPolicy() {}

    /**
     * Safe prefixes run; anything with a risky keyword waits; a
     * {@code python script.py} whose script exists in {@code cwd} runs;
     * everything else waits.
     */
    public static boolean shouldAutorun(String command, Path cwd) {
        String lower = command.strip().toLowerCase(Locale.ROOT);

        if (SAFE_PREFIXES.stream().anyMatch(lower::startsWith)) {
            return true;
        }
        if (RISKY_KEYWORDS.stream().anyMatch(lower::contains)) {
            return false;
        }
        if (lower.startsWith("python ") || lower.startsWith("py ")) {
            List<String> words = CommandLine.tokenize(command);
            if (words.size() >= 2 && words.get(1).endsWith(".py")) {
                return Files.isRegularFile(cwd.resolve(words.get(1)));
            }
        }
        return false;
    }
}
