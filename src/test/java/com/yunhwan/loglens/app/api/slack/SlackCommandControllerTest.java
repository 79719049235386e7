package com.yunhwan.loglens.app.api.slack;

import com.yunhwan.loglens.common.exception.SignatureVerificationException;
import com.yunhwan.loglens.domain.incident.IncidentReport;
import com.yunhwan.loglens.testsupport.WebSliceTestConfig;
import com.yunhwan.loglens.usecase.command.ChannelMessage;
import com.yunhwan.loglens.usecase.command.CommandEnvelope;
import com.yunhwan.loglens.usecase.command.CommandForm;
import com.yunhwan.loglens.usecase.command.CommandReceipt;
import com.yunhwan.loglens.usecase.command.PendingTriage;
import com.yunhwan.loglens.usecase.command.SlackCommandGateway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SlackCommandController.class)
@Import(WebSliceTestConfig.class)
@ActiveProfiles("test")
class SlackCommandControllerTest {

    private static final String BODY =
            "command=%2Floglens&text=Can%27t+checkout+%7C+2025-01-19T14%3A30%3A00Z+%7C+usr_1"
                    + "&response_url=https%3A%2F%2Fhooks.slack.com%2Fcommands%2FT1%2F1%2Fabc";

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    SlackCommandGateway gateway;

    @Test
    @DisplayName("원문 바디와 헤더를 그대로 넘기고, ack 를 응답한 뒤 작업을 dispatch 한다")
    void ack_후_dispatch() throws Exception {
        PendingTriage pending = new PendingTriage(
                IncidentReport.of("Can't checkout", "2025-01-19T14:30:00Z", "usr_1"),
                "https://hooks.slack.com/commands/T1/1/abc",
                Instant.parse("2025-01-19T14:31:00Z"));
        when(gateway.receive(any())).thenReturn(
                CommandReceipt.accepted(ChannelMessage.ephemeral("Analyzing logs..."), pending));

        mockMvc.perform(post("/slack/commands")
                        .header("X-Slack-Request-Timestamp", "1737297060")
                        .header("X-Slack-Signature", "v0=abc")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_type").value("ephemeral"))
                .andExpect(jsonPath("$.text").value("Analyzing logs..."));

        ArgumentCaptor<CommandEnvelope> captor = ArgumentCaptor.forClass(CommandEnvelope.class);
        InOrder order = inOrder(gateway);
        order.verify(gateway).receive(captor.capture());
        order.verify(gateway).dispatch(pending);

        CommandEnvelope envelope = captor.getValue();
        assertThat(envelope.rawBody()).isEqualTo(BODY);
        assertThat(envelope.signature()).isEqualTo("v0=abc");
        assertThat(envelope.timestamp()).isEqualTo("1737297060");
        CommandForm form = CommandForm.decode(envelope.rawBody());
        assertThat(form.text()).isEqualTo("Can't checkout | 2025-01-19T14:30:00Z | usr_1");
        assertThat(form.responseUrl()).isEqualTo("https://hooks.slack.com/commands/T1/1/abc");
    }

    @Test
    @DisplayName("사용법 안내 응답이면 dispatch 하지 않는다")
    void 사용법_안내() throws Exception {
        when(gateway.receive(any())).thenReturn(CommandReceipt.immediate(ChannelMessage.ephemeral(":x: usage")));

        mockMvc.perform(post("/slack/commands")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content("text=A+%7C+B"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response_type").value("ephemeral"));

        verify(gateway, never()).dispatch(any());
    }

    @Test
    @DisplayName("서명 검증 실패는 401 이고 작업을 만들지 않는다")
    void 서명_실패() throws Exception {
        when(gateway.receive(any())).thenThrow(new SignatureVerificationException("Invalid signature"));

        mockMvc.perform(post("/slack/commands")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("signature_invalid"));

        verify(gateway, never()).dispatch(any());
    }

    @Test
    @DisplayName("퍼센트 인코딩이 깨진 바디도 서명 검증 실패면 500 이 아니라 401 이다")
    void 깨진_인코딩_서명_실패() throws Exception {
        when(gateway.receive(any())).thenThrow(new SignatureVerificationException("Invalid signature"));

        mockMvc.perform(post("/slack/commands")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .content("text=%zz&response_url=x"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.kind").value("signature_invalid"));

        verify(gateway, never()).dispatch(any());
    }
}
