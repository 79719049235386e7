package com.yunhwan.loglens.usecase.analysis;

import com.yunhwan.loglens.domain.incident.IncidentReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private final PromptBuilder builder = new PromptBuilder();
    private final IncidentReport report = IncidentReport.of("Checkout button does nothing", "2025-01-19T14:30:00Z", "usr_abc123");

    @Test
    @DisplayName("사용자 입력은 문서 → 이벤트 → 문의 순서의 섹션으로 구성된다")
    void 섹션_순서() {
        String content = builder.userContent(report, "Event 1:\n- Error: TypeError", new KnowledgeDocuments("# WF", "# KE"));

        int workflow = content.indexOf("## Workflow Documentation\n# WF");
        int known = content.indexOf("## Known Error Patterns\n# KE");
        int events = content.indexOf("## Error Events\nEvent 1:");
        int problem = content.indexOf("## Problem Report");

        assertThat(workflow).isGreaterThanOrEqualTo(0);
        assertThat(known).isGreaterThan(workflow);
        assertThat(events).isGreaterThan(known);
        assertThat(problem).isGreaterThan(events);
        assertThat(content).contains(
                "- Description: Checkout button does nothing",
                "- Timestamp: 2025-01-19T14:30:00Z",
                "- Customer ID: usr_abc123",
                "\"suggested_response\"");
    }

    @Test
    @DisplayName("문서가 없으면 placeholder 문구가 들어간다")
    void 문서_없음() {
        String content = builder.userContent(report, "No events found.", KnowledgeDocuments.empty());

        assertThat(content).contains(KnowledgeDocuments.NO_WORKFLOW, KnowledgeDocuments.NO_KNOWN_ERRORS, "No events found.");
    }

    @Test
    @DisplayName("시스템 지시문은 JSON 만 응답하도록 요구한다")
    void 시스템_지시문() {
        assertThat(builder.systemInstruction()).contains("valid JSON only", "Top 3");
    }
}
