package com.yunhwan.loglens.usecase.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * 슬랙 응답/콜백 payload.
 * ephemeral 은 명령을 입력한 사용자에게만, in_channel 은 채널 전체에 보인다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChannelMessage(
        @JsonProperty("response_type") String responseType,
        String text,
        List<Map<String, Object>> blocks
) {
    public static final String EPHEMERAL = "ephemeral";
    public static final String IN_CHANNEL = "in_channel";

    public static ChannelMessage ephemeral(String text) {
        return new ChannelMessage(EPHEMERAL, text, null);
    }

    public boolean isEphemeral() {
        return EPHEMERAL.equals(responseType);
    }
}
