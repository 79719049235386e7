package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.domain.incident.IncidentReport;

import java.time.Instant;

public record PendingTriage(IncidentReport report, String callbackUrl, Instant acceptedAt) {

    @Override
    public String toString() {
        return "PendingTriage{subjectId=" + report.subjectId() + ", acceptedAt=" + acceptedAt + "}";
    }
}
