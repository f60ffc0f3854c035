package com.shellpilot.engine.translate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Uses java.net.http directly: the endpoint is one JSON POST, and seeing
 * exactly what goes on the wire makes translation problems easy to debug.
 */
@Component
public class ClaudeClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** One conversation turn; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            if (content == null) {
                throw new TranslationException("Response has no content");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new TranslationException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 1024;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final URI          endpoint;
    private final Duration     requestTimeout;

    public ClaudeClient(@Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        @Value("${anthropic.timeout-seconds:60}") long timeoutSeconds,
                        ObjectMapper objectMapper) {
        this.apiKey         = apiKey;
        this.json           = objectMapper;
        this.endpoint       = URI.create(baseUrl.replaceAll("/+$", "") + "/v1/messages");
        this.requestTimeout = Duration.ofSeconds(timeoutSeconds);
        this.http           = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation and return the assistant's text reply.
     *
     * @param model    e.g. "claude-sonnet-4-6"
     * @param system   system prompt
     * @param messages the conversation so far
     * @throws ClaudeApiException   for a non-200 reply
     * @throws TranslationException when the key is missing or the call fails in transit
     */
    public String complete(String model, String system, List<Message> messages) {
        if (!configured()) {
            throw new TranslationException("ANTHROPIC_API_KEY is not configured");
        }
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", MAX_TOKENS,
                    "system",     system,
                    "messages",   messages
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (TranslationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Translation interrupted", e);
        } catch (Exception e) {
            throw new TranslationException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends TranslationException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
