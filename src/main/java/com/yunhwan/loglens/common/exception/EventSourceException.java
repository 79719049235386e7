package com.yunhwan.loglens.common.exception;

/**
 * 이벤트 트래킹 서비스 호출 실패(재시도해도 의미 없는 응답).
 * 예: 400, 405 등 예상하지 못한 4xx
 */
public class EventSourceException extends TriageException {

    public EventSourceException(String message) {
        super(ErrorKind.EVENT_SOURCE_FAILED, message);
    }

    public EventSourceException(String message, Throwable cause) {
        super(ErrorKind.EVENT_SOURCE_FAILED, message, cause);
    }

    protected EventSourceException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
