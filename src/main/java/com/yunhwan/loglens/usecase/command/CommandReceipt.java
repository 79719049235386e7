package com.yunhwan.loglens.usecase.command;

import java.util.Optional;

/**
 * 웹훅 즉시 응답 + (수락된 경우) 이어서 실행할 작업.
 */
public record CommandReceipt(ChannelMessage response, PendingTriage pending) {

    public static CommandReceipt immediate(ChannelMessage response) {
        return new CommandReceipt(response, null);
    }

    public static CommandReceipt accepted(ChannelMessage ack, PendingTriage pending) {
        return new CommandReceipt(ack, pending);
    }

    public Optional<PendingTriage> pendingTriage() {
        return Optional.ofNullable(pending);
    }
}
