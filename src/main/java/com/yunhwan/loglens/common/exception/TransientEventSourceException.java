package com.yunhwan.loglens.common.exception;

/**
 * 재시도 가치가 있는(일시 장애) 케이스.
 * 예: 5xx, 타임아웃, 커넥션 오류
 */
public class TransientEventSourceException extends EventSourceException {

    public TransientEventSourceException(String message) {
        super(ErrorKind.EVENT_SOURCE_UNAVAILABLE, message, null);
    }

    public TransientEventSourceException(String message, Throwable cause) {
        super(ErrorKind.EVENT_SOURCE_UNAVAILABLE, message, cause);
    }
}
