package com.yunhwan.loglens.common.exception;

/**
 * 429. 여기서 재시도하지 않고 호출자에게 "나중에 다시" 안내를 넘긴다.
 * <p>
 * Retry-After 는 초 단위 숫자일 때만 안내 문구에 넣는다. HTTP-date 등 나머지는 기본 메시지만 쓴다.
 */
public class EventSourceRateLimitException extends EventSourceException {

    private final String retryAfter;

    public EventSourceRateLimitException(String retryAfter) {
        super(ErrorKind.EVENT_SOURCE_RATE_LIMITED,
                "Event tracking rate limit exceeded. retryAfter=" + retryAfter, null);
        this.retryAfter = retryAfter;
    }

    public String retryAfter() {
        return retryAfter;
    }

    public boolean hasRetryAfterSeconds() {
        return retryAfter != null && !retryAfter.isEmpty() && retryAfter.length() <= 9
                && retryAfter.chars().allMatch(c -> c >= '0' && c <= '9');
    }

    @Override
    public String safeMessage() {
        if (hasRetryAfterSeconds()) {
            return super.safeMessage() + ". Retry after " + Integer.parseInt(retryAfter) + " seconds.";
        }
        return super.safeMessage();
    }
}
