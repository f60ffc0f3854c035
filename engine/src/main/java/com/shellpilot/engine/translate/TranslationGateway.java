package com.shellpilot.engine.translate;

/**
 * Turns a natural-language request into shell command text.
 *
 * The reply may contain comment lines starting with '#' and may be wrapped
 * in a code fence; {@link TranslationParser} turns it into executable lines.
 * One call is one blocking unit of work: nothing is observable until it
 * returns or fails.
 */
public interface TranslationGateway {

    /**
     * @throws TranslationException when the translation service cannot be
     *         reached, is not configured, or rejects the request
     */
    String translate(String request, TranslationContext context);
}
