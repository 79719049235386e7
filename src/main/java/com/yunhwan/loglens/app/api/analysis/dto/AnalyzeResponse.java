package com.yunhwan.loglens.app.api.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.analysis.ProbableCause;

import java.util.List;

public record AnalyzeResponse(
        boolean success,
        List<Cause> causes,
        @JsonProperty("suggested_reply") String suggestedReply,
        @JsonProperty("evidence_links") List<String> evidenceLinks,
        @JsonProperty("evidence_summary") String evidenceSummary,
        @JsonProperty("events_found") int eventsFound
) {

    public record Cause(int rank, String cause, String explanation, String confidence) {

        static Cause from(ProbableCause c) {
            return new Cause(c.rank(), c.cause(), c.explanation(), c.confidence());
        }
    }

    public static AnalyzeResponse from(AnalysisResult result) {
        return new AnalyzeResponse(
                true,
                result.causes().stream().map(Cause::from).toList(),
                result.suggestedReply(),
                result.evidenceLinks(),
                result.evidenceSummary(),
                result.eventsFound()
        );
    }
}
