package com.yunhwan.loglens.app.api.analysis;

import com.yunhwan.loglens.app.api.analysis.dto.AnalyzeRequest;
import com.yunhwan.loglens.app.api.analysis.dto.AnalyzeResponse;
import com.yunhwan.loglens.common.exception.TriageException;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.incident.IncidentReport;
import com.yunhwan.loglens.infra.metrics.MetricsConfig;
import com.yunhwan.loglens.usecase.triage.TriagePipeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class AnalysisController {

    private final TriagePipeline triagePipeline;
    private final MeterRegistry meterRegistry;

    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest req) {
        try {
            IncidentReport report = IncidentReport.of(req.description(), req.timestamp(), req.customerId());
            AnalysisResult result = triagePipeline.run(report);
            analyzeCounter(MetricsConfig.RESULT_SUCCESS, MetricsConfig.KIND_NONE).increment();
            return ResponseEntity.ok(AnalyzeResponse.from(result));
        } catch (TriageException e) {
            analyzeCounter(MetricsConfig.RESULT_ERROR, e.kind().code()).increment();
            throw e;
        } catch (RuntimeException e) {
            analyzeCounter(MetricsConfig.RESULT_ERROR, "internal").increment();
            throw e;
        }
    }

    private Counter analyzeCounter(String result, String kind) {
        // result+kind 만 사용 (고객ID 등 금지)
        return Counter.builder(MetricsConfig.METRIC_ANALYZE)
                .tag(MetricsConfig.TAG_RESULT, result)
                .tag(MetricsConfig.TAG_KIND, kind)
                .register(meterRegistry);
    }
}
