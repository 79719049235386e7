package com.yunhwan.loglens.infra.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yunhwan.loglens.common.exception.AnalysisProviderException;
import com.yunhwan.loglens.config.analysis.AnalysisProperties;
import com.yunhwan.loglens.usecase.analysis.port.TextGenerationClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Gemini generateContent REST 어댑터.
 * <p>
 * 408/429/5xx, 연결 오류, 빈 응답은 retryable. 그 외 4xx(잘못된 키/요청)는 즉시 실패.
 * API 키는 쿼리스트링이 아니라 x-goog-api-key 헤더로만 보낸다.
 */
@Slf4j
public class GeminiTextGenerationClient implements TextGenerationClient {

    static final String API_KEY_HEADER = "x-goog-api-key";
    static final String GENERATE_PATH = "/v1beta/models/{model}:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AnalysisProperties props;

    public GeminiTextGenerationClient(RestTemplate restTemplate, ObjectMapper objectMapper, AnalysisProperties props) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public String generate(String systemInstruction, String userContent) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(API_KEY_HEADER, props.getApiKey() == null ? "" : props.getApiKey());

        String body = requestBody(systemInstruction, userContent);

        ResponseEntity<String> res;
        try {
            res = restTemplate.exchange(generateUri(), HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 408 || status == 429 || status >= 500;
            log.warn("[Gemini] generateContent failed. status={}, retryable={}", status, retryable);
            throw new AnalysisProviderException("Model service returned " + status, retryable, e);
        } catch (ResourceAccessException e) {
            log.warn("[Gemini] generateContent I/O error: {}", e.getMessage());
            throw new AnalysisProviderException("Model service unreachable", true, e);
        }

        String text = extractText(res.getBody());
        if (text.isBlank()) {
            // safety 차단/빈 후보. 같은 입력이라도 재시도로 회복되는 경우가 있다
            throw new AnalysisProviderException("Model returned empty response", true);
        }
        return text;
    }

    @Override
    public String modelName() {
        return props.getModel();
    }

    String requestBody(String systemInstruction, String userContent) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("systemInstruction").putArray("parts").addObject().put("text", systemInstruction);

        ObjectNode content = root.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", userContent);

        ObjectNode config = root.putObject("generationConfig");
        config.put("temperature", props.getTemperature());
        config.put("maxOutputTokens", props.getMaxOutputTokens());
        config.put("responseMimeType", MediaType.APPLICATION_JSON_VALUE);

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize generateContent request", e);
        }
    }

    /**
     * candidates[0].content.parts[].text 를 이어붙인다.
     */
    String extractText(String body) {
        if (body == null || body.isBlank()) return "";
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AnalysisProviderException("Model service returned non-JSON envelope", true, e);
        }
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return "";

        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            JsonNode text = part.get("text");
            if (text != null && text.isTextual()) {
                sb.append(text.asText());
            }
        }
        return sb.toString();
    }

    private URI generateUri() {
        String base = props.getBaseUrl();
        if (base != null && base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return UriComponentsBuilder.fromUriString(base + GENERATE_PATH)
                .buildAndExpand(props.getModel())
                .encode()
                .toUri();
    }
}
