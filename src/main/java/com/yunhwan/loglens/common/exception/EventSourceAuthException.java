package com.yunhwan.loglens.common.exception;

/**
 * 401/403. 토큰 문제라 재시도하지 않는다.
 */
public class EventSourceAuthException extends EventSourceException {

    public EventSourceAuthException(int status) {
        super(ErrorKind.EVENT_SOURCE_AUTH, "Event tracking authentication failed. status=" + status, null);
    }
}
