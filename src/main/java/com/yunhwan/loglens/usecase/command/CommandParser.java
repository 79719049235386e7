package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.common.exception.CommandUsageException;

import java.util.regex.Pattern;

/**
 * "설명 | 시각 | 고객ID" 형식 파싱.
 * <p>
 * 구분자 이스케이프는 지원하지 않는다. 설명 안에 '|' 가 있으면 필드 수가 맞지 않아 사용법 안내로 끝난다.
 */
public class CommandParser {

    public static final String USAGE = "/loglens [description] | [timestamp] | [customer_id]";
    public static final String EXAMPLE = "/loglens User can't checkout | 2025-01-19T14:30:00Z | usr_abc123";

    private static final Pattern DELIMITER = Pattern.compile("\\|");

    public ParsedCommand parse(String commandText) {
        String text = commandText == null ? "" : commandText;
        // limit -1: 끝의 빈 필드도 유지해야 "A | B |" 를 잡아낼 수 있다
        String[] parts = DELIMITER.split(text, -1);

        if (parts.length != 3) {
            throw new CommandUsageException("Invalid command format. Use: " + USAGE);
        }

        String description = parts[0].trim();
        String timestamp = parts[1].trim();
        String subjectId = parts[2].trim();

        if (description.isEmpty()) {
            throw new CommandUsageException("Description cannot be empty");
        }
        if (timestamp.isEmpty()) {
            throw new CommandUsageException("Timestamp cannot be empty");
        }
        if (subjectId.isEmpty()) {
            throw new CommandUsageException("Customer ID cannot be empty");
        }
        return new ParsedCommand(description, timestamp, subjectId);
    }
}
