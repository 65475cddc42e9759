package com.subagent.gateway.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Used for two jobs: the multi-turn grouping conversation at build time
 * (through {@link com.subagent.gateway.completion.ClaudeCompletionProvider})
 * and single-shot sub-agent execution at request time.
 *
 * Raw {@link HttpClient} rather than an SDK: the endpoint is a plain JSON
 * POST and we want to see exactly what goes on the wire.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /**
     * A single message in a conversation.
     * role must be "user" or "assistant"; system text travels separately.
     */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Concatenates every text block of the reply. */
        public String text() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            StringBuilder sb = new StringBuilder();
            content.stream()
                    .filter(b -> "text".equals(b.type()) && b.text() != null)
                    .forEach(b -> sb.append(b.text()));
            if (sb.isEmpty()) {
                throw new IllegalStateException("No text block in response");
            }
            return sb.toString();
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 8192;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       baseUrl;

    public ClaudeClient(@Value("${anthropic.api-key:}") String apiKey,
                        @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                        ObjectMapper objectMapper) {
        this.apiKey  = apiKey;
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     *
     * @param model       e.g. "claude-sonnet-4-5"
     * @param system      system prompt, or null for none
     * @param messages    alternating user/assistant turns, ending with a user turn
     * @param temperature sampling temperature, or null for the API default
     * @return the assistant's text content
     */
    public String complete(String model, String system, List<Message> messages, Double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("anthropic.api-key is not configured");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", MAX_TOKENS);
            if (system != null && !system.isBlank()) body.put("system", system);
            if (temperature != null) body.put("temperature", temperature);
            body.put("messages",   messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/messages"))
                    .timeout(Duration.ofSeconds(180))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            log.debug("Calling Claude model={} messages={}", model, messages.size());
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }
            return json.readValue(response.body(), MessagesResponse.class).text();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
