package com.yunhwan.loglens.usecase.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.yunhwan.loglens.domain.event.RawEvent;
import com.yunhwan.loglens.domain.evidence.FormattedEvidence;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 이벤트 목록을 모델 입력용 텍스트 + 딥링크로 변환한다.
 * <p>
 * 순수 함수: 같은 입력이면 같은 출력이고, 이벤트를 뒤에 덧붙여도 앞쪽 블록은 그대로다.
 * 선택 필드가 없어도 예외를 던지지 않는다.
 */
public class EventFormatter {

    public static final String EVENT_ID_PLACEHOLDER = "{eventId}";
    public static final String NO_EVENTS_TEXT = "No events found.";

    static final int MAX_FRAMES = 5;
    static final int MAX_BREADCRUMBS = 5;
    static final int MAX_DATA_PAIRS = 3;
    static final int MAX_EVENTS = 25;
    static final int MAX_MESSAGE_CHARS = 500;

    // 클라이언트/플랫폼 맥락으로 쓸 태그만
    private static final Set<String> CONTEXT_TAGS = Set.of("environment", "release", "browser", "os", "platform");

    private final String linkTemplate;

    public EventFormatter(String linkTemplate) {
        if (linkTemplate == null || !linkTemplate.contains(EVENT_ID_PLACEHOLDER)) {
            throw new IllegalArgumentException("linkTemplate must contain " + EVENT_ID_PLACEHOLDER);
        }
        this.linkTemplate = linkTemplate;
    }

    public FormattedEvidence format(List<RawEvent> events) {
        if (events == null || events.isEmpty()) {
            return new FormattedEvidence(NO_EVENTS_TEXT, List.of(), List.of());
        }

        List<String> blocks = new ArrayList<>();
        List<String> links = new ArrayList<>();

        int idx = 0;
        for (RawEvent event : events) {
            idx++;
            Optional<String> link = event.id().map(this::linkFor);
            link.ifPresent(links::add);
            if (idx <= MAX_EVENTS) {
                blocks.add(formatEvent(idx, event, link));
            }
        }

        String text = String.join("\n\n", blocks);
        int omitted = events.size() - blocks.size();
        if (omitted > 0) {
            text = text + "\n\n... (" + omitted + " more events omitted)";
        }
        return new FormattedEvidence(text, blocks, links);
    }

    public String linkFor(String eventId) {
        return linkTemplate.replace(EVENT_ID_PLACEHOLDER, URLEncoder.encode(eventId, StandardCharsets.UTF_8));
    }

    String formatEvent(int idx, RawEvent event, Optional<String> link) {
        if (!event.hasIdentifyingData()) {
            return "Event " + idx + ": (no identifying data)";
        }

        List<String> lines = new ArrayList<>();
        lines.add("Event " + idx + ":");
        lines.add("- Time: " + event.timestamp().orElse("Unknown"));

        String errorType = event.metadataType().or(event::type).orElse("Unknown");
        lines.add("- Error: " + errorType);

        String title = event.title().orElse("");
        String message = event.metadataValue().or(event::message).orElse("");
        if (!message.isEmpty() && !message.equals(title)) {
            lines.add("- Message: \"" + truncate(message) + "\"");
        } else if (!title.isEmpty()) {
            lines.add("- Message: \"" + truncate(title) + "\"");
        }

        List<String> frames = stackFrames(event);
        if (!frames.isEmpty()) {
            lines.add("- Stack Trace:");
            for (int i = 0; i < Math.min(MAX_FRAMES, frames.size()); i++) {
                lines.add("  " + frames.get(i));
            }
            if (frames.size() > MAX_FRAMES) {
                lines.add("  ... (" + (frames.size() - MAX_FRAMES) + " more frames)");
            }
        }

        List<String> crumbs = breadcrumbs(event);
        if (!crumbs.isEmpty()) {
            lines.add("- Breadcrumbs (user actions leading to error):");
            for (String crumb : crumbs.subList(Math.max(0, crumbs.size() - MAX_BREADCRUMBS), crumbs.size())) {
                lines.add("  " + crumb);
            }
        }

        List<String> context = new ArrayList<>();
        for (RawEvent.Tag tag : event.tags()) {
            if (CONTEXT_TAGS.contains(tag.key())) {
                context.add(tag.key() + "=" + tag.value());
            }
        }
        if (!context.isEmpty()) {
            lines.add("- Context: " + String.join(", ", context));
        }

        link.ifPresent(l -> lines.add("- Link: " + l));
        return String.join("\n", lines);
    }

    /**
     * exception entry 의 프레임. 업스트림은 오래된 프레임부터 주므로 뒤집어서 최근 프레임이 먼저 오게 한다.
     */
    private List<String> stackFrames(RawEvent event) {
        List<String> frames = new ArrayList<>();
        for (JsonNode value : event.entryValues("exception")) {
            JsonNode rawFrames = value.path("stacktrace").path("frames");
            if (!rawFrames.isArray()) continue;
            for (JsonNode frame : rawFrames) {
                frames.add(formatFrame(frame));
            }
        }
        Collections.reverse(frames);
        return frames;
    }

    private String formatFrame(JsonNode frame) {
        String file = RawEvent.text(frame, "filename")
                .or(() -> RawEvent.text(frame, "absPath"))
                .or(() -> RawEvent.text(frame, "module"))
                .orElse("unknown");
        String function = RawEvent.text(frame, "function").orElse("unknown");
        String lineNo = RawEvent.text(frame, "lineNo").orElse("?");

        String head = file + ":" + lineNo + " in " + function + "()";
        return sourceLine(frame, lineNo)
                .map(code -> head + " -> " + code)
                .orElse(head);
    }

    /**
     * context 는 [[lineNo, code], ...]. 해당 줄 번호가 있으면 그 줄, 없으면 가운데 줄.
     */
    private Optional<String> sourceLine(JsonNode frame, String lineNo) {
        JsonNode context = frame.path("context");
        if (!context.isArray() || context.isEmpty()) return Optional.empty();

        JsonNode picked = null;
        for (JsonNode line : context) {
            if (line.isArray() && line.size() >= 2 && line.get(0).asText().equals(lineNo)) {
                picked = line;
                break;
            }
        }
        if (picked == null) {
            picked = context.get(context.size() / 2);
        }
        if (!picked.isArray() || picked.size() < 2) return Optional.empty();

        String code = picked.get(1).asText("").trim();
        return code.isEmpty() ? Optional.empty() : Optional.of(code);
    }

    private List<String> breadcrumbs(RawEvent event) {
        List<String> crumbs = new ArrayList<>();
        for (JsonNode crumb : event.entryValues("breadcrumbs")) {
            String level = RawEvent.text(crumb, "level").orElse("info");
            String category = RawEvent.text(crumb, "category").orElse("");
            Optional<String> message = RawEvent.text(crumb, "message");

            String prefix = "[" + level + "] " + category;
            if (message.isPresent()) {
                crumbs.add(prefix + ": " + truncate(message.get()));
                continue;
            }
            String data = dataPairs(crumb.path("data"));
            crumbs.add(data.isEmpty() ? prefix : prefix + ": " + data);
        }
        return crumbs;
    }

    private String dataPairs(JsonNode data) {
        if (!data.isObject()) return "";
        List<String> pairs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = data.fields();
        while (it.hasNext() && pairs.size() < MAX_DATA_PAIRS) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            pairs.add(e.getKey() + "=" + (v.isValueNode() ? v.asText() : v.toString()));
        }
        return String.join(", ", pairs);
    }

    private static String truncate(String s) {
        if (s.length() <= MAX_MESSAGE_CHARS) return s;
        return s.substring(0, MAX_MESSAGE_CHARS) + "…";
    }
}
