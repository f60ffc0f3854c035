package com.shellpilot.engine.session;

import com.shellpilot.engine.model.CommandResult;
import com.shellpilot.engine.model.SessionMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable state of one interactive session.
 *
 * All mutation goes through the named operations below so every write site
 * can be found by name. The state is owned by the resolution loop thread;
 * nothing here is synchronized and nothing may be called from a spawned
 * process callback.
 *
 * <p>The JVM cannot change its own working directory or environment, so the
 * values held here <em>are</em> the process context for every child: the
 * executor hands {@link #workingDirectory()} and {@link #environment()} to
 * each {@link ProcessBuilder} it starts. Tests construct the state with an
 * in-memory map and a temporary directory instead of the real process values.
 */
public class SessionState {

    private Path workingDirectory;
    private Path previousDirectory;
    private final Path homeDirectory;
    private final Map<String, String> environment;
    private final Map<String, String> aliases = new TreeMap<>();
    private final List<String> history = new ArrayList<>();
    private final Deque<String> pendingCommands = new ArrayDeque<>();

    private SessionMode mode = SessionMode.NATURAL_LANGUAGE;

    private int    lastExitCode;
    private String lastCommand = "";
    private String lastStdout  = "";
    private String lastStderr  = "";

    private boolean exitRequested;
    private int     exitStatus;

    public SessionState(Map<String, String> environment, Path workingDirectory, Path homeDirectory) {
        this.environment      = new TreeMap<>(environment);
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
        this.homeDirectory    = homeDirectory.toAbsolutePath().normalize();
    }

    /** State seeded from the JVM's own environment, working directory and home. */
    public static SessionState fromProcess() {
        return new SessionState(System.getenv(),
                Path.of(System.getProperty("user.dir")),
                Path.of(System.getProperty("user.home")));
    }

    // ------------------------------------------------------------------
    // Working directory
    // ------------------------------------------------------------------

    public Path workingDirectory() { return workingDirectory; }

    public Path homeDirectory() { return homeDirectory; }

    public Optional<Path> previousDirectory() { return Optional.ofNullable(previousDirectory); }

    /**
     * Change the working directory.
     *
     * A relative {@code path} is resolved against the current working
     * directory. The state is left untouched unless the normalized target is
     * an existing directory at the time of the call.
     *
     * @return the new absolute working directory
     * @throws ShellException {@code DIRECTORY_NOT_FOUND} when the target is not a directory
     */
    public Path setWorkingDirectory(String path) {
        Path target = workingDirectory.resolve(path).toAbsolutePath().normalize();
        if (!Files.isDirectory(target)) {
            throw new ShellException(ShellException.Kind.DIRECTORY_NOT_FOUND,
                    "cd: " + path + ": No such directory");
        }
        previousDirectory = workingDirectory;
        workingDirectory  = target;
        environment.put("OLDPWD", previousDirectory.toString());
        environment.put("PWD", workingDirectory.toString());
        return workingDirectory;
    }

    // ------------------------------------------------------------------
    // Environment
    // ------------------------------------------------------------------

    /** Snapshot of the environment, sorted by name. Later changes are not visible through it. */
    public Map<String, String> environment() {
        return Collections.unmodifiableMap(new TreeMap<>(environment));
    }

    public Optional<String> getEnvVar(String name) {
        return Optional.ofNullable(environment.get(name));
    }

    /**
     * Set one environment variable for this session and every child started after it.
     *
     * @throws ShellException {@code INVALID_VARIABLE_NAME} for an empty name or one containing '='
     */
    public void setEnvVar(String name, String value) {
        if (name == null || name.isEmpty() || name.indexOf('=') >= 0) {
            throw new ShellException(ShellException.Kind.INVALID_VARIABLE_NAME,
                    "export: '" + name + "': not a valid identifier");
        }
        environment.put(name, value == null ? "" : value);
    }

    // ------------------------------------------------------------------
    // Mode
    // ------------------------------------------------------------------

    public SessionMode mode() { return mode; }

    public void setMode(SessionMode mode) {
        this.mode = mode;
    }

    /**
     * Switch mode by name; names are matched case-insensitively.
     *
     * @throws ShellException {@code INVALID_MODE_NAME} when the name is not a known mode
     */
    public SessionMode setMode(String name) {
        SessionMode next = SessionMode.fromName(name).orElseThrow(() ->
                new ShellException(ShellException.Kind.INVALID_MODE_NAME,
                        "Invalid mode: " + name + ". Use: " + SessionMode.validNames()));
        this.mode = next;
        return next;
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    public void appendHistory(String rawInput) {
        history.add(rawInput);
    }

    public List<String> history() {
        return Collections.unmodifiableList(history);
    }

    /** The last {@code limit} history entries, oldest first. */
    public List<String> recentHistory(int limit) {
        int from = Math.max(0, history.size() - Math.max(0, limit));
        return List.copyOf(history.subList(from, history.size()));
    }

    // ------------------------------------------------------------------
    // Aliases
    // ------------------------------------------------------------------

    public Map<String, String> aliases() {
        return Collections.unmodifiableMap(aliases);
    }

    public Optional<String> getAlias(String name) {
        return Optional.ofNullable(aliases.get(name));
    }

    public void setAlias(String name, String value) {
        aliases.put(name, value);
    }

    public boolean removeAlias(String name) {
        return aliases.remove(name) != null;
    }

    // ------------------------------------------------------------------
    // Last result
    // ------------------------------------------------------------------

    public int lastExitCode() { return lastExitCode; }
    public String lastCommand() { return lastCommand; }
    public String lastStdout()  { return lastStdout; }
    public String lastStderr()  { return lastStderr; }

    public void setLastExitCode(int exitCode) {
        this.lastExitCode = exitCode;
    }

    /** Remember the outcome of an executed command for the next translation. */
    public void recordResult(CommandResult result) {
        this.lastCommand  = result.command();
        this.lastStdout   = result.stdout();
        this.lastStderr   = result.stderr();
        setLastExitCode(result.exitCode());
    }

    // ------------------------------------------------------------------
    // Pending translated commands
    // ------------------------------------------------------------------

    public List<String> pendingCommands() {
        return List.copyOf(pendingCommands);
    }

    public void stagePendingCommands(List<String> commands) {
        pendingCommands.clear();
        pendingCommands.addAll(commands);
    }

    public Optional<String> nextPendingCommand() {
        return Optional.ofNullable(pendingCommands.peekFirst());
    }

    public void removeNextPendingCommand() {
        pendingCommands.pollFirst();
    }

    public void clearPendingCommands() {
        pendingCommands.clear();
    }

    // ------------------------------------------------------------------
    // Session end
    // ------------------------------------------------------------------

    public void requestExit(int status) {
        this.exitRequested = true;
        this.exitStatus    = status;
    }

    public boolean exitRequested() { return exitRequested; }

    public int exitStatus() { return exitStatus; }

    // ------------------------------------------------------------------
    // Prompt
    // ------------------------------------------------------------------

    /** e.g. {@code alice ~/src/app $ } */
    public String prompt(String user) {
        String dir = workingDirectory.toString();
        if (workingDirectory.startsWith(homeDirectory)) {
            Path relative = homeDirectory.relativize(workingDirectory);
            dir = relative.toString().isEmpty() ? "~" : "~/" + relative;
        }
        return user + " " + dir + " " + mode.indicator() + " ";
    }
}
