package com.yunhwan.loglens.common.exception;

/**
 * 모델 응답이 JSON 이 아니거나 스키마를 만족하지 못함.
 * 같은 프롬프트로 다시 호출해도 나아진다는 보장이 없으므로 재시도하지 않는다.
 */
public class ResponseFormatException extends TriageException {

    public ResponseFormatException(String message) {
        super(ErrorKind.ANALYSIS_RESPONSE_MALFORMED, message);
    }

    public ResponseFormatException(String message, Throwable cause) {
        super(ErrorKind.ANALYSIS_RESPONSE_MALFORMED, message, cause);
    }
}
