package com.yunhwan.loglens.usecase.analysis;

import com.yunhwan.loglens.domain.analysis.ProbableCause;

import java.util.List;

/**
 * 검증을 통과한 모델 응답(REPAIR 전). causes 개수는 아직 보정되지 않았다.
 */
public record ModelAnalysis(List<ProbableCause> causes, String suggestedResponse, String logsSummary) {

    public ModelAnalysis {
        causes = List.copyOf(causes);
    }
}
