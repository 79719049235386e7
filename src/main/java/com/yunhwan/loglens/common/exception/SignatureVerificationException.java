package com.yunhwan.loglens.common.exception;

/**
 * 웹훅 서명/타임스탬프 검증 실패. 파이프라인 작업 전에 거절한다.
 */
public class SignatureVerificationException extends TriageException {

    public SignatureVerificationException(String message) {
        super(ErrorKind.SIGNATURE_INVALID, message);
    }
}
