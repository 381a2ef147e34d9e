package com.bpmnassistant.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Component
@Profile("gemini")
public class GeminiLLMClient implements LLMClient {

    private static final Logger log =
            LoggerFactory.getLogger(GeminiLLMClient.class);

    /** Transport-level retries; independent of the orchestrators' budgets */
    private static final int MAX_RETRIES = 3;
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_JITTER_MS = 250;

    private final WebClient webClient;
    private final Random jitterRandom = new Random();

    @Value("${gemini.api.key}")
    private String apiKey;

    @Value("${gemini.api.model:gemini-1.5-pro}")
    private String model;

    @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${gemini.api.timeout-seconds:60}")
    private long timeoutSeconds;

    public GeminiLLMClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public String generate(List<ChatMessage> messages, OutputMode outputMode, double temperature) {

        log.info("[Gemini] model={} | mode={} | messages={}",
                model, outputMode, messages.size());

        Map<String, Object> body = buildBody(messages, outputMode, temperature);

        int attempt = 0;

        while (true) {
            try {
                attempt++;

                log.debug("[Gemini] Attempt {} sending request", attempt);

                Map<?, ?> response = webClient
                        .post()
                        .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(Map.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block();

                log.info("[Gemini] Call succeeded | retries={}", attempt - 1);

                return extractText(response);

            } catch (RuntimeException ex) {

                if (!isRetryable(ex) || attempt > MAX_RETRIES) {
                    log.error("[Gemini] Final failure | attempts={} | retries={}",
                            attempt, attempt - 1, ex);
                    throw ex;
                }

                long backoff = computeBackoff(attempt);

                log.warn("[Gemini] Transient failure on attempt {}. Retrying after {} ms. Cause: {}",
                        attempt, backoff, rootMessage(ex));

                sleep(backoff);
            }
        }
    }

    private Map<String, Object> buildBody(List<ChatMessage> messages,
                                          OutputMode outputMode,
                                          double temperature) {
        List<Map<String, Object>> contents = new ArrayList<>();
        StringBuilder systemText = new StringBuilder();

        for (ChatMessage message : messages) {
            switch (message.getRole()) {
                case SYSTEM -> systemText.append(message.getContent()).append("\n");
                case USER -> contents.add(content("user", message.getContent()));
                case ASSISTANT -> contents.add(content("model", message.getContent()));
            }
        }

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("temperature", temperature);
        if (outputMode == OutputMode.JSON) {
            generationConfig.put("responseMimeType", "application/json");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("contents", contents);
        body.put("generationConfig", generationConfig);
        if (systemText.length() > 0) {
            body.put("systemInstruction",
                    Map.of("parts", List.of(Map.of("text", systemText.toString().trim()))));
        }
        return body;
    }

    private static Map<String, Object> content(String role, String text) {
        return Map.of(
                "role", role,
                "parts", List.of(Map.of("text", text))
        );
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content = (Map<String, Object>) candidates.get(0).get("content");
            var parts = (List<Map<String, Object>>) content.get("parts");
            Object text = parts.get(0).get("text");
            return text != null ? text.toString() : "";
        } catch (RuntimeException e) {
            log.error("[Gemini] Failed to parse response: {}", response, e);
            throw new IllegalStateException("Malformed Gemini response", e);
        }
    }

    /** Retry only transient failures */
    private boolean isRetryable(Exception ex) {
        return ex instanceof WebClientResponseException.ServiceUnavailable   // 503
            || ex instanceof WebClientResponseException.TooManyRequests      // 429
            || ex.getCause() instanceof IOException;
    }

    /** Exponential backoff with jitter */
    private long computeBackoff(int attempt) {
        long exponential = BASE_BACKOFF_MS * (1L << (attempt - 1));
        long jitter = jitterRandom.nextLong(MAX_JITTER_MS + 1);
        return exponential + jitter;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off", ie);
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
