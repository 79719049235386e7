package com.yunhwan.loglens.usecase.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.loglens.common.exception.ResponseFormatException;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.analysis.Confidence;
import com.yunhwan.loglens.domain.analysis.ProbableCause;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 모델 응답 PARSE / VALIDATE / REPAIR.
 * <p>
 * 형식 위반은 {@link ResponseFormatException} 으로 끝낸다(모델 재호출 없음).
 * confidence 값이 high/medium/low 가 아니어도 실패시키지 않고 경고만 남긴다.
 */
@Slf4j
@RequiredArgsConstructor
public class AnalysisResponseParser {

    private static final List<String> REQUIRED_FIELDS = List.of("causes", "suggested_response", "logs_summary");
    private static final List<String> CAUSE_FIELDS = List.of("rank", "cause", "explanation", "confidence");
    private static final int LOG_PREVIEW_CHARS = 500;

    private final ObjectMapper objectMapper;

    public JsonNode parse(String content) {
        String body = stripCodeFence(content == null ? "" : content);
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new ResponseFormatException("Model response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            log.error("[AnalysisResponseParser] invalid JSON from model. preview={}", preview(body));
            throw new ResponseFormatException("Invalid JSON in model response: " + e.getOriginalMessage(), e);
        }
    }

    public ModelAnalysis validate(JsonNode root) {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (!root.has(field)) missing.add(field);
        }
        if (!missing.isEmpty()) {
            throw new ResponseFormatException("Missing required fields: " + missing);
        }

        JsonNode causesNode = root.get("causes");
        if (!causesNode.isArray()) {
            throw new ResponseFormatException("'causes' must be an array");
        }

        List<ProbableCause> causes = new ArrayList<>();
        for (int i = 0; i < causesNode.size(); i++) {
            causes.add(toCause(i, causesNode.get(i)));
        }

        String suggested = root.get("suggested_response").asText("");
        if (suggested.isBlank()) {
            throw new ResponseFormatException("'suggested_response' cannot be empty");
        }
        String summary = root.get("logs_summary").asText("");
        if (summary.isBlank()) {
            throw new ResponseFormatException("'logs_summary' cannot be empty");
        }

        return new ModelAnalysis(causes, suggested.trim(), summary.trim());
    }

    /**
     * 3개 초과면 rank 순 상위 3개만, 미만이면 모델 원인은 그대로 두고 명시적인 placeholder 로 채운다.
     */
    public List<ProbableCause> repair(List<ProbableCause> causes) {
        int target = AnalysisResult.CAUSE_COUNT;
        if (causes.size() == target) {
            return causes;
        }
        if (causes.size() > target) {
            log.warn("[AnalysisResponseParser] expected {} causes but got {}. keeping top {} by rank", target, causes.size(), target);
            // 같은 rank 는 응답 순서 유지 (stable sort)
            return causes.stream()
                    .sorted(Comparator.comparingInt(ProbableCause::rank))
                    .limit(target)
                    .toList();
        }

        log.warn("[AnalysisResponseParser] expected {} causes but got {}. filling with placeholders", target, causes.size());
        List<ProbableCause> repaired = new ArrayList<>(causes);
        while (repaired.size() < target) {
            repaired.add(ProbableCause.placeholder(repaired.size() + 1));
        }
        return List.copyOf(repaired);
    }

    private ProbableCause toCause(int i, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ResponseFormatException("Cause " + i + " must be an object");
        }
        List<String> missing = new ArrayList<>();
        for (String field : CAUSE_FIELDS) {
            if (!node.has(field)) missing.add(field);
        }
        if (!missing.isEmpty()) {
            throw new ResponseFormatException("Cause " + i + " missing fields: " + missing);
        }

        String confidence = node.get("confidence").asText("");
        if (!Confidence.isKnown(confidence)) {
            log.warn("[AnalysisResponseParser] invalid confidence level '{}' in cause {}, expected one of high/medium/low",
                    confidence, i);
        }

        return new ProbableCause(
                rankOf(i, node.get("rank")),
                node.get("cause").asText(""),
                node.get("explanation").asText(""),
                confidence
        );
    }

    private int rankOf(int i, JsonNode rank) {
        if (rank.canConvertToInt()) {
            return rank.asInt();
        }
        if (rank.isTextual()) {
            try {
                return Integer.parseInt(rank.asText().trim());
            } catch (NumberFormatException ignore) {
                // fall through
            }
        }
        log.warn("[AnalysisResponseParser] non-numeric rank '{}' in cause {}. using position", rank, i);
        return i + 1;
    }

    /**
     * ```json ... ``` 로 감싼 응답을 벗겨낸다.
     */
    static String stripCodeFence(String content) {
        String s = content.strip();
        if (s.startsWith("```json")) {
            s = s.substring(7);
        } else if (s.startsWith("```")) {
            s = s.substring(3);
        }
        if (s.endsWith("```")) {
            s = s.substring(0, s.length() - 3);
        }
        return s.strip();
    }

    private static String preview(String s) {
        return s.length() <= LOG_PREVIEW_CHARS ? s : s.substring(0, LOG_PREVIEW_CHARS);
    }
}
