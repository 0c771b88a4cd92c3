package com.goormthonuniv.videocheck.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Base64;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class GeminiInferenceProvider implements InferenceProvider {

    private final RestClient rest;
    private final ObjectMapper om;
    private final String apiKey;
    private final String model;
    private final String endpoint;

    public GeminiInferenceProvider(RestClient.Builder builder,
                                   ObjectMapper om,
                                   @Value("${videocheck.ai.gemini.apiKey:}") String apiKey,
                                   @Value("${videocheck.ai.gemini.model:gemini-1.5-pro}") String model,
                                   @Value("${videocheck.ai.gemini.endpoint:https://generativelanguage.googleapis.com/v1beta/models}") String endpoint,
                                   @Value("${videocheck.ai.gemini.connect-timeout-ms:10000}") int connectTimeoutMs,
                                   @Value("${videocheck.ai.gemini.read-timeout-ms:${videocheck.analysis.timeout-ms:30000}}") int readTimeoutMs) {
        // 응답이 멈춘 호출이 추론 스레드를 붙잡지 않도록 소켓 타임아웃을 시도 타임아웃에 맞춘다
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        this.rest = builder.requestFactory(requestFactory).build();
        this.om = om;
        this.apiKey = apiKey;
        this.model = model;
        this.endpoint = endpoint;
    }

    @Override public String name() { return "gemini"; }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String invoke(String prompt, byte[] media, String mimeType) {
        if (!isConfigured()) {
            throw new InferenceException("Gemini API key not configured");
        }
        if (media == null || media.length == 0) {
            throw new InferenceException("Empty media payload");
        }

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(
                                Map.of("inline_data", Map.of(
                                        "mime_type", mimeType,
                                        "data", Base64.getEncoder().encodeToString(media))),
                                Map.of("text", prompt)
                        )
                )),
                "generationConfig", Map.of("temperature", 0.2)
        );

        String raw;
        try {
            raw = rest.post()
                    .uri(endpoint + "/" + model + ":generateContent?key=" + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new InferenceException("Gemini API error: " + e.getMessage(), e);
        }

        return extractText(raw);
    }

    /** candidates[0].content.parts[*].text 를 이어 붙인다 */
    String extractText(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InferenceException("Gemini response empty");
        }
        JsonNode root;
        try {
            root = om.readTree(raw);
        } catch (Exception e) {
            throw new InferenceException("Gemini response malformed: " + e.getMessage(), e);
        }

        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.size() == 0) {
            String blocked = root.path("promptFeedback").path("blockReason").asText("");
            throw new InferenceException(blocked.isBlank()
                    ? "Gemini response has no candidates"
                    : "Gemini prompt blocked: " + blocked);
        }

        StringBuilder sb = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            String t = part.path("text").asText("");
            if (!t.isBlank()) {
                if (sb.length() > 0) sb.append('\n');
                sb.append(t);
            }
        }
        if (sb.length() == 0) {
            throw new InferenceException("Gemini content empty");
        }
        log.debug("Gemini response received: model={}, chars={}", model, sb.length());
        return sb.toString();
    }
}
