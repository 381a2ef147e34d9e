package com.bpmnassistant.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OllamaLLMClient: default LLMClient backed by a local Ollama server.
 *
 * Implements only generate(List, OutputMode, double). The convenience
 * generate(String) and getTemperatureFor() come from the interface and
 * must NOT be overridden here.
 *
 * JSON mode maps to Ollama's {@code "format": "json"} switch.
 */
@Component
@Profile("!gemini & !mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    private final RestTemplate restTemplate = new RestTemplate();
    private final ObjectMapper objectMapper  = new ObjectMapper();

    @Override
    public String generate(List<ChatMessage> messages, OutputMode outputMode, double temperature) {
        log.debug("[Ollama] mode={} temperature={} messages={}", outputMode, temperature, messages.size());
        return callOllama(messages, outputMode, temperature);
    }

    private String callOllama(List<ChatMessage> messages, OutputMode outputMode, double temperature) {
        try {
            String url = baseUrl + "/api/chat";

            List<Map<String, String>> wireMessages = new ArrayList<>();
            for (ChatMessage message : messages) {
                wireMessages.add(Map.of(
                        "role",    message.getRole().name().toLowerCase(),
                        "content", message.getContent()
                ));
            }

            Map<String, Object> body = new HashMap<>();
            body.put("model",    model);
            body.put("messages", wireMessages);
            body.put("options",  Map.of("temperature", temperature));
            body.put("stream",   false);
            if (outputMode == OutputMode.JSON) {
                body.put("format", "json");
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());

            String result = root.path("message").path("content").asText("");
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
