package com.shellpilot.engine.translate;

import com.shellpilot.engine.translate.ClaudeClient.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link TranslationGateway} backed by Claude.
 *
 * Builds a single-turn prompt from the fixed instructions, the session
 * context and the request, and returns the raw reply; fence stripping is the
 * caller's job.
 */
@Component
public class ClaudeTranslationGateway implements TranslationGateway {

    private static final Logger log = LoggerFactory.getLogger(ClaudeTranslationGateway.class);

    // Prompt carries at most this many of the recent commands
    private static final int PROMPT_RECENT_COMMANDS = 3;

    private final ClaudeClient claude;
    private final String       model;

    public ClaudeTranslationGateway(ClaudeClient claude,
                                    @Value("${shellpilot.translator.model:claude-sonnet-4-6}") String model) {
        this.claude = claude;
        this.model  = model;
    }

    @Override
    public String translate(String request, TranslationContext context) {
        log.info("Translating request ({} chars, {} context block(s)) with {}",
                request.length(), context.contextBlocks().size(), model);
        String reply = claude.complete(model, TranslationPrompts.SYSTEM,
                List.of(new Message("user", buildPrompt(request, context))));
        log.debug("Translation reply: {}", reply);
        return reply;
    }

    static String buildPrompt(String request, TranslationContext context) {
        StringBuilder sb = new StringBuilder(TranslationPrompts.INSTRUCTIONS);

        if (context.workingDirectory() != null) {
            sb.append("\n\nCurrent directory: ").append(context.workingDirectory());
        }

        List<String> recent = context.recentCommands();
        if (!recent.isEmpty()) {
            List<String> lastFew = recent.subList(Math.max(0, recent.size() - PROMPT_RECENT_COMMANDS), recent.size());
            sb.append("\n\nRecent commands:\n").append(String.join("\n", lastFew));
        }

        sb.append("\n\nEnvironment:\n")
          .append("- Platform: ").append(context.platform() == null ? "unknown" : context.platform()).append('\n')
          .append("- Shell: ").append(context.shell() == null ? "unknown shell" : context.shell()).append('\n');

        if (!context.lastCommand().isEmpty()) {
            sb.append("\n\nPrevious command: ").append(context.lastCommand());
            sb.append("\nExit code: ").append(context.lastExitCode());
            if (!context.lastStdout().isEmpty()) {
                sb.append("\nStdout:\n").append(context.lastStdout());
            }
            if (!context.lastStderr().isEmpty()) {
                sb.append("\nStderr:\n").append(context.lastStderr());
            }
        }

        if (!context.contextBlocks().isEmpty()) {
            sb.append("\n\nFile contents referenced:\n");
            for (String block : context.contextBlocks()) {
                sb.append('\n').append(block).append('\n');
            }
        }

        sb.append("\n\nUser request: ").append(request);
        return sb.toString();
    }
}
