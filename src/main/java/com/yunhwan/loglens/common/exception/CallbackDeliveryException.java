package com.yunhwan.loglens.common.exception;

/**
 * 콜백(response_url) 전송 실패. 사용자에게 노출되지 않고 로그/메트릭으로만 남는다.
 */
public class CallbackDeliveryException extends RuntimeException {

    public CallbackDeliveryException(String message) {
        super(message);
    }

    public CallbackDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
