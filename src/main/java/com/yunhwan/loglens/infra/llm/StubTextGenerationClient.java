package com.yunhwan.loglens.infra.llm;

import com.yunhwan.loglens.usecase.analysis.port.TextGenerationClient;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * 로컬 실행용 고정 응답. API 키 없이 파이프라인 전체를 돌려볼 때 쓴다.
 */
@Component
@Profile("stub")
public class StubTextGenerationClient implements TextGenerationClient {

    @Override
    public String generate(String systemInstruction, String userContent) {
        boolean hasEvents = !userContent.contains("No events found.");
        String summary = hasEvents
                ? "Error events were found in the requested window."
                : "No error events were found in the requested window.";
        return """
                {
                  "causes": [
                    {"rank": 1, "cause": "Session token expired", "explanation": "Requests were rejected after the token TTL elapsed.", "confidence": "medium"},
                    {"rank": 2, "cause": "Upstream dependency timeout", "explanation": "A downstream call may have exceeded its timeout.", "confidence": "low"},
                    {"rank": 3, "cause": "Client-side validation error", "explanation": "The client may have sent an incomplete payload.", "confidence": "low"}
                  ],
                  "suggested_response": "Thanks for reporting this. We are looking into it and will follow up shortly.",
                  "logs_summary": "%s"
                }
                """.formatted(summary);
    }

    @Override
    public String modelName() {
        return "stub";
    }
}
