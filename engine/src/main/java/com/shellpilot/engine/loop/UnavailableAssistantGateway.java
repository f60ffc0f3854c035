package com.shellpilot.engine.loop;

import com.shellpilot.engine.model.ContextBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Placeholder until multi-step assistant tasks exist: acknowledges the
 * request and says so.
 */
@Component
public class UnavailableAssistantGateway implements AssistantGateway {

    private static final Logger log = LoggerFactory.getLogger(UnavailableAssistantGateway.class);

    @Override
    public String handle(String request, ContextBundle context) {
        log.info("Assistant request received ({} context block(s)), assistant mode not available",
                context.blocks().size());
        return "AI mode not yet implemented - will support complex multi-step tasks\nRequest: " + request + "\n";
    }
}
