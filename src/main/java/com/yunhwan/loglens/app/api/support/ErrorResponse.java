package com.yunhwan.loglens.app.api.support;

public record ErrorResponse(boolean success, String kind, String error, String suggestion) {

    public static ErrorResponse of(String kind, String error, String suggestion) {
        return new ErrorResponse(false, kind, error, suggestion);
    }
}
