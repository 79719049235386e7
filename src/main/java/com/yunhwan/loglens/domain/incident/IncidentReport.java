package com.yunhwan.loglens.domain.incident;

import com.yunhwan.loglens.common.exception.InvalidIncidentReportException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * CS 문의 한 건. 파이프라인 1회 실행 동안만 쓰고 버린다.
 *
 * @param description 고객이 겪은 문제 설명 (trim 된 값)
 * @param occurredAt  문제 발생 시각
 * @param subjectId   텔레메트리와 연결되는 고객 식별자 (trim 된 값)
 */
public record IncidentReport(String description, Instant occurredAt, String subjectId) {

    public IncidentReport {
        if (description == null || description.isBlank()) {
            throw new InvalidIncidentReportException("description", "description cannot be empty");
        }
        if (occurredAt == null) {
            throw new InvalidIncidentReportException("timestamp", "timestamp is required");
        }
        if (subjectId == null || subjectId.isBlank()) {
            throw new InvalidIncidentReportException("customer_id", "customer_id cannot be empty");
        }
        description = description.trim();
        subjectId = subjectId.trim();
    }

    public static IncidentReport of(String description, String timestamp, String subjectId) {
        return new IncidentReport(description, parseTimestamp(timestamp), subjectId);
    }

    /**
     * ISO-8601 파싱. 오프셋이 없는 값은 UTC 로 간주한다.
     */
    public static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new InvalidIncidentReportException("timestamp", "timestamp is required");
        }
        String s = timestamp.trim();
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignore) {
            // fall through: offset 없는 형식 시도
        }
        try {
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidIncidentReportException("timestamp",
                    "timestamp must be a valid ISO 8601 datetime string");
        }
    }
}
