package com.yunhwan.loglens.common.exception;

/**
 * 파이프라인 전 구간 공통 예외.
 * <p>
 * getMessage() 는 서버 로그용 상세 메시지, {@link ErrorKind} 는 호출자 노출용 분류이다.
 */
public abstract class TriageException extends RuntimeException {

    private final ErrorKind kind;

    protected TriageException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TriageException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * 호출자에게 그대로 보여줄 수 있는 메시지.
     */
    public String safeMessage() {
        return kind.getMessage();
    }

    public String suggestion() {
        return kind.getSuggestion();
    }
}
