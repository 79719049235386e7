package com.yunhwan.loglens.usecase.command.port;

import com.yunhwan.loglens.usecase.command.ChannelMessage;

/**
 * 지연 결과를 호출자가 준 콜백 URL 로 보낸다. 실패 시 예외를 던진다(재시도는 호출 측 정책).
 */
public interface CallbackDeliverer {

    void deliver(String callbackUrl, ChannelMessage message);
}
