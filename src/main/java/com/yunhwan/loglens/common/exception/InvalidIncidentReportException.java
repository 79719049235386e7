package com.yunhwan.loglens.common.exception;

public class InvalidIncidentReportException extends TriageException {

    private final String field;

    public InvalidIncidentReportException(String field, String message) {
        super(ErrorKind.INVALID_INPUT, "Invalid " + field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    @Override
    public String safeMessage() {
        return getMessage();
    }

    @Override
    public String suggestion() {
        if ("timestamp".equals(field)) {
            return "Timestamp must be in ISO 8601 format (e.g., 2025-01-19T14:30:00Z)";
        }
        if ("customer_id".equals(field)) {
            return "Customer ID must not be empty";
        }
        if ("description".equals(field)) {
            return "Description must not be empty";
        }
        return super.suggestion();
    }
}
