package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.analysis.ProbableCause;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AnalysisResult → 슬랙 Block Kit 메시지.
 */
public class SlackMessageRenderer {

    private static final String[] RANK_EMOJI = {":one:", ":two:", ":three:"};

    private final int maxLinks;
    private final int windowMinutes;

    public SlackMessageRenderer(int maxLinks, int windowMinutes) {
        this.maxLinks = maxLinks;
        this.windowMinutes = windowMinutes;
    }

    public ChannelMessage acknowledgement(ParsedCommand command) {
        return ChannelMessage.ephemeral(":hourglass_flowing_sand: Analyzing logs for `" + escape(command.subjectId())
                + "` around " + escape(command.timestamp()) + ". Results will be posted here shortly.");
    }

    public ChannelMessage usage(String message) {
        return error(message, "Use format: " + CommandParser.USAGE + "\nExample: " + CommandParser.EXAMPLE);
    }

    public ChannelMessage error(String message, String suggestion) {
        StringBuilder sb = new StringBuilder(":x: *Error:* ").append(escape(message));
        if (suggestion != null && !suggestion.isBlank()) {
            sb.append("\n\n:bulb: *Suggestion:* ").append(escape(suggestion));
        }
        return ChannelMessage.ephemeral(sb.toString());
    }

    public ChannelMessage render(AnalysisResult result) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        blocks.add(header(":mag: LogLens Analysis"));

        StringBuilder causes = new StringBuilder("*Probable Causes:*\n\n");
        int position = 0;
        for (ProbableCause cause : result.causes()) {
            String number = position < RANK_EMOJI.length ? RANK_EMOJI[position] : "•";
            position++;
            causes.append(number)
                    .append(" *[").append(confidenceLabel(cause.confidence())).append("]* ")
                    .append(escape(cause.cause())).append('\n')
                    .append("   └ ").append(escape(cause.explanation())).append("\n\n");
        }
        blocks.add(section(causes.toString().strip()));
        blocks.add(divider());

        blocks.add(section("*Suggested Response:*\n> " + escape(result.suggestedReply()).replace("\n", "\n> ")));
        blocks.add(divider());

        blocks.add(section(logsLine(result)));

        return new ChannelMessage(ChannelMessage.IN_CHANNEL, fallbackText(result), blocks);
    }

    /**
     * 0건과 조회 실패를 구분할 수 있게, 0건이면 구간 확대 안내를 붙인다.
     */
    String logsLine(AnalysisResult result) {
        int found = result.eventsFound();
        StringBuilder sb = new StringBuilder("*Logs:* Found ").append(found).append(found == 1 ? " event" : " events");
        if (found == 0) {
            sb.append(" within ±").append(windowMinutes).append(" minutes. Consider widening the time window.");
            return sb.toString();
        }

        List<String> links = result.evidenceLinks();
        int shown = Math.min(maxLinks, links.size());
        for (int i = 0; i < shown; i++) {
            sb.append(i == 0 ? "\n" : " | ").append('<').append(links.get(i)).append("|Event ").append(i + 1).append('>');
        }
        if (links.size() > shown) {
            sb.append(" | +").append(links.size() - shown).append(" more");
        }
        return sb.toString();
    }

    private String fallbackText(AnalysisResult result) {
        ProbableCause top = result.causes().get(0);
        return "LogLens Analysis: " + top.cause();
    }

    private static String confidenceLabel(String confidence) {
        if (confidence == null || confidence.isBlank()) return "UNKNOWN";
        return escape(confidence.trim().toUpperCase(Locale.ROOT));
    }

    private static Map<String, Object> header(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "header");
        block.put("text", Map.of("type", "plain_text", "text", text, "emoji", true));
        return block;
    }

    private static Map<String, Object> section(String mrkdwn) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "section");
        block.put("text", Map.of("type", "mrkdwn", "text", mrkdwn));
        return block;
    }

    private static Map<String, Object> divider() {
        return Map.of("type", "divider");
    }

    /**
     * 슬랙 mrkdwn 제어 문자(&, <, >) 이스케이프.
     */
    static String escape(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
