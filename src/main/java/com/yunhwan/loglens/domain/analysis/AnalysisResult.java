package com.yunhwan.loglens.domain.analysis;

import java.util.List;

/**
 * 분석 최종 결과.
 * <p>
 * causes 는 항상 3개(REPAIR 단계에서 보정), evidenceLinks 는 모델이 아니라 포매터가 만든 링크,
 * eventsFound 는 조회된 이벤트 수다.
 */
public record AnalysisResult(
        List<ProbableCause> causes,
        String suggestedReply,
        List<String> evidenceLinks,
        String evidenceSummary,
        int eventsFound
) {
    public static final int CAUSE_COUNT = 3;

    public AnalysisResult {
        causes = List.copyOf(causes);
        evidenceLinks = List.copyOf(evidenceLinks);
        if (causes.size() != CAUSE_COUNT) {
            throw new IllegalArgumentException("causes must have exactly " + CAUSE_COUNT + " entries. size=" + causes.size());
        }
        if (eventsFound < 0) {
            throw new IllegalArgumentException("eventsFound must be >= 0. eventsFound=" + eventsFound);
        }
    }
}
