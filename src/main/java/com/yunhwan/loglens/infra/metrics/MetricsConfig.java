package com.yunhwan.loglens.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    // 진입점/외부 호출 단위 카운터
    public static final String METRIC_ANALYZE = "loglens.analyze";
    public static final String METRIC_EVENT_FETCH = "loglens.event_fetch";
    public static final String METRIC_SLACK_COMMAND = "loglens.slack.command";
    public static final String METRIC_SLACK_DELIVERY = "loglens.slack.delivery";

    // 고카디널리티 금지(고객ID/설명/URL 제외)
    public static final String TAG_RESULT = "result";
    public static final String TAG_KIND = "kind";

    // 고정 결과값(집계 안정성)
    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_ERROR = "error";
    public static final String RESULT_ACCEPTED = "accepted";
    public static final String RESULT_REJECTED = "rejected";

    public static final String KIND_NONE = "none";
}
