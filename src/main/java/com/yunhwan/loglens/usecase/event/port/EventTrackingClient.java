package com.yunhwan.loglens.usecase.event.port;

import com.yunhwan.loglens.domain.event.RawEvent;
import com.yunhwan.loglens.usecase.event.EventWindow;

import java.util.List;

/**
 * 이벤트 트래킹 서비스 조회 포트.
 * <p>
 * 구현체 계약:
 * - 0건/404 는 빈 리스트
 * - 401/403 → EventSourceAuthException, 429 → EventSourceRateLimitException
 * - 5xx/타임아웃/커넥션 오류 → TransientEventSourceException (재시도는 호출 측이 결정)
 */
public interface EventTrackingClient {

    List<RawEvent> query(String subjectId, EventWindow window);

    /**
     * 캐시 키에 들어가는 조회 대상 식별자(예: 프로젝트별 events URL).
     */
    String endpoint();
}
