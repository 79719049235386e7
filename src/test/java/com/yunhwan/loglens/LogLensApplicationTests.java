package com.yunhwan.loglens;

import com.yunhwan.loglens.app.api.support.AppTokenInterceptor;
import com.yunhwan.loglens.usecase.event.cache.CorrelationCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.client.RestTemplate;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Tag("smoke")
@DisplayName("[Smoke] 컨텍스트 기동 + 고정 응답 모델로 /api/analyze 한 바퀴")
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles({"test", "stub"})
class LogLensApplicationTests {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    @Qualifier("eventTrackingRestTemplate")
    RestTemplate eventTrackingRestTemplate;

    @Autowired
    CorrelationCache correlationCache;

    MockRestServiceServer sentry;

    @BeforeEach
    void setUp() {
        correlationCache.clear();
        sentry = MockRestServiceServer.bindTo(eventTrackingRestTemplate).build();
    }

    @Test
    void contextLoads() {
    }

    @Test
    @DisplayName("이벤트 0건이어도 원인 3개와 함께 성공 응답을 준다")
    void 분석_한_바퀴() throws Exception {
        sentry.expect(requestTo(startsWith("https://sentry.io/api/0/projects/test-org/test-project/events/")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer test-token"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        mockMvc.perform(post("/api/analyze")
                        .header(AppTokenInterceptor.HEADER, "test-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"description": "Can't checkout", "timestamp": "2025-01-19T14:30:00Z", "customer_id": "usr_smoke"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.causes.length()").value(3))
                .andExpect(jsonPath("$.events_found").value(0))
                .andExpect(jsonPath("$.evidence_links.length()").value(0));

        sentry.verify();
    }
}
