package com.yunhwan.loglens.common.exception;

/**
 * 모델 서비스 호출 실패.
 * retryable=true 는 일시 장애/레이트리밋, false 는 즉시 전파해야 하는 오류(잘못된 키, 잘못된 요청 등).
 */
public class AnalysisProviderException extends TriageException {

    private final boolean retryable;

    public AnalysisProviderException(String message, boolean retryable) {
        super(ErrorKind.ANALYSIS_PROVIDER_UNAVAILABLE, message);
        this.retryable = retryable;
    }

    public AnalysisProviderException(String message, boolean retryable, Throwable cause) {
        super(ErrorKind.ANALYSIS_PROVIDER_UNAVAILABLE, message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
