package com.yunhwan.loglens.usecase.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.loglens.domain.event.RawEvent;
import com.yunhwan.loglens.domain.evidence.FormattedEvidence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventFormatterTest {

    private static final String TEMPLATE = "https://sentry.test/issues/?query={eventId}";

    private final ObjectMapper om = new ObjectMapper();
    private final EventFormatter formatter = new EventFormatter(TEMPLATE);

    private RawEvent event(String json) throws Exception {
        return RawEvent.of(om.readTree(json));
    }

    @Test
    @DisplayName("이벤트가 없으면 고정 문구와 빈 링크 목록을 돌려준다")
    void 빈_입력() {
        FormattedEvidence evidence = formatter.format(List.of());

        assertThat(evidence.text()).isEqualTo(EventFormatter.NO_EVENTS_TEXT);
        assertThat(evidence.links()).isEmpty();
    }

    @Test
    @DisplayName("메시지/스택/브레드크럼/태그/링크가 정해진 형식으로 나온다")
    void 전체_필드_포맷() throws Exception {
        RawEvent e = event("""
                {
                  "id": "abc123",
                  "dateCreated": "2025-01-19T14:29:10Z",
                  "title": "TypeError: x is undefined",
                  "metadata": {"type": "TypeError", "value": "x is undefined"},
                  "entries": [
                    {"type": "exception", "data": {"values": [{"stacktrace": {"frames": [
                      {"filename": "app.js", "function": "main", "lineNo": 10},
                      {"filename": "cart.js", "function": "checkout", "lineNo": 42,
                       "context": [[41, "const a = 1;"], [42, "total = x.price;"], [43, "return total;"]]}
                    ]}}]}},
                    {"type": "breadcrumbs", "data": {"values": [
                      {"category": "ui.click", "message": "button#pay", "level": "info"},
                      {"category": "xhr", "data": {"method": "POST", "url": "/api/pay", "status_code": 500, "extra": 1}}
                    ]}}
                  ],
                  "tags": [{"key": "browser", "value": "Chrome 120"}, {"key": "user", "value": "u1"}]
                }
                """);

        FormattedEvidence evidence = formatter.format(List.of(e));

        assertThat(evidence.text()).isEqualTo(String.join("\n",
                "Event 1:",
                "- Time: 2025-01-19T14:29:10Z",
                "- Error: TypeError",
                "- Message: \"x is undefined\"",
                "- Stack Trace:",
                "  cart.js:42 in checkout() -> total = x.price;",
                "  app.js:10 in main()",
                "- Breadcrumbs (user actions leading to error):",
                "  [info] ui.click: button#pay",
                "  [info] xhr: method=POST, url=/api/pay, status_code=500",
                "- Context: browser=Chrome 120",
                "- Link: https://sentry.test/issues/?query=abc123"));
        assertThat(evidence.links()).containsExactly("https://sentry.test/issues/?query=abc123");
    }

    @Test
    @DisplayName("선택 필드가 전부 없어도 예외 없이 블록을 만든다")
    void 필드_누락() throws Exception {
        FormattedEvidence evidence = formatter.format(List.of(event("{}"), event("{\"title\": \"Oops\"}")));

        assertThat(evidence.blocks()).hasSize(2);
        assertThat(evidence.blocks().get(0)).isEqualTo("Event 1: (no identifying data)");
        assertThat(evidence.blocks().get(1)).contains("- Time: Unknown", "- Error: Unknown", "- Message: \"Oops\"");
        assertThat(evidence.links()).isEmpty();
    }

    @Test
    @DisplayName("스택 프레임은 최근 5개만 남기고 나머지 개수를 표시한다")
    void 프레임_제한() throws Exception {
        StringBuilder frames = new StringBuilder();
        for (int i = 1; i <= 8; i++) {
            if (i > 1) frames.append(',');
            frames.append("{\"filename\":\"f").append(i).append(".js\",\"function\":\"fn").append(i).append("\",\"lineNo\":").append(i).append('}');
        }
        RawEvent e = event("{\"id\":\"e1\",\"entries\":[{\"type\":\"exception\",\"data\":{\"values\":[{\"stacktrace\":{\"frames\":["
                + frames + "]}}]}}]}");

        String block = formatter.format(List.of(e)).blocks().get(0);

        assertThat(block).contains("  f8.js:8 in fn8()", "  f4.js:4 in fn4()", "  ... (3 more frames)");
        assertThat(block).doesNotContain("f3.js");
    }

    @Test
    @DisplayName("브레드크럼은 마지막 5개만 남긴다")
    void 브레드크럼_제한() throws Exception {
        StringBuilder crumbs = new StringBuilder();
        for (int i = 1; i <= 7; i++) {
            if (i > 1) crumbs.append(',');
            crumbs.append("{\"category\":\"nav\",\"message\":\"step").append(i).append("\"}");
        }
        RawEvent e = event("{\"id\":\"e1\",\"entries\":[{\"type\":\"breadcrumbs\",\"data\":{\"values\":[" + crumbs + "]}}]}");

        String block = formatter.format(List.of(e)).blocks().get(0);

        assertThat(block).contains("nav: step3", "nav: step7").doesNotContain("step2");
    }

    @Test
    @DisplayName("긴 메시지는 잘리고 말줄임표가 붙는다")
    void 메시지_길이_제한() throws Exception {
        String longMessage = "x".repeat(EventFormatter.MAX_MESSAGE_CHARS + 50);
        JsonNode node = om.createObjectNode().put("id", "e1").put("message", longMessage);

        String block = formatter.format(List.of(RawEvent.of(node))).blocks().get(0);

        assertThat(block).contains("x".repeat(EventFormatter.MAX_MESSAGE_CHARS) + "…\"");
    }

    @Test
    @DisplayName("이벤트를 뒤에 덧붙여도 앞쪽 블록은 바뀌지 않는다")
    void 접두_불변() throws Exception {
        RawEvent a = event("{\"id\":\"a\",\"title\":\"A\"}");
        RawEvent b = event("{\"id\":\"b\",\"title\":\"B\"}");

        FormattedEvidence one = formatter.format(List.of(a));
        FormattedEvidence two = formatter.format(List.of(a, b));

        assertThat(two.text()).startsWith(one.text());
        assertThat(two.blocks().get(0)).isEqualTo(one.blocks().get(0));
        assertThat(formatter.format(List.of(a, b))).isEqualTo(two);
    }

    @Test
    @DisplayName("25개를 넘는 이벤트는 블록에서 생략하지만 링크는 모두 만든다")
    void 이벤트_수_제한() {
        List<RawEvent> events = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            events.add(RawEvent.of(om.createObjectNode().put("id", "e" + i).put("title", "t")));
        }

        FormattedEvidence evidence = formatter.format(events);

        assertThat(evidence.blocks()).hasSize(EventFormatter.MAX_EVENTS);
        assertThat(evidence.text()).endsWith("... (5 more events omitted)");
        assertThat(evidence.links()).hasSize(30);
    }

    @Test
    @DisplayName("링크의 이벤트 ID 는 URL 인코딩되고, 템플릿에는 {eventId} 가 있어야 한다")
    void 링크_생성() {
        assertThat(formatter.linkFor("a b/c")).isEqualTo("https://sentry.test/issues/?query=a+b%2Fc");
        assertThatThrownBy(() -> new EventFormatter("https://sentry.test/"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
