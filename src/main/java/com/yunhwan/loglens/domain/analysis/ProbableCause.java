package com.yunhwan.loglens.domain.analysis;

/**
 * 원인 후보 하나. confidence 는 모델이 준 값을 그대로 보존한다(알 수 없는 값 포함).
 */
public record ProbableCause(int rank, String cause, String explanation, String confidence) {

    static final String PLACEHOLDER_CAUSE = "No further cause identified";
    static final String PLACEHOLDER_EXPLANATION =
            "The analysis returned fewer than three causes for this report.";

    public static ProbableCause placeholder(int rank) {
        return new ProbableCause(rank, PLACEHOLDER_CAUSE, PLACEHOLDER_EXPLANATION, Confidence.LOW.label());
    }

    public boolean isPlaceholder() {
        return PLACEHOLDER_CAUSE.equals(cause) && PLACEHOLDER_EXPLANATION.equals(explanation);
    }
}
