package com.yunhwan.loglens.common.exception;

/**
 * 슬래시 커맨드 형식 오류. 스택 없이 사용법 안내만 돌려준다.
 */
public class CommandUsageException extends TriageException {

    public CommandUsageException(String message) {
        super(ErrorKind.COMMAND_USAGE, message);
    }

    @Override
    public String safeMessage() {
        return getMessage();
    }
}
