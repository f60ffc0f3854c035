package com.shellpilot.engine.loop;

import com.shellpilot.engine.model.ContextBundle;

/**
 * Receives assistant requests (input that started with "ai:", or any
 * natural-language input while the session is in ai mode).
 *
 * The request arrives with the prefix already removed; the engine does
 * nothing else with it.
 */
public interface AssistantGateway {

    /** @return a message to show the user */
    String handle(String request, ContextBundle context);
}
