package com.yunhwan.loglens.usecase.command;

public record ParsedCommand(String description, String timestamp, String subjectId) {}
