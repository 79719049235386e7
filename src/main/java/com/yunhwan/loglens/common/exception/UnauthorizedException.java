package com.yunhwan.loglens.common.exception;

public class UnauthorizedException extends TriageException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
