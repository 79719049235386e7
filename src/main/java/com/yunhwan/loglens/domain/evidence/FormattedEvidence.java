package com.yunhwan.loglens.domain.evidence;

import java.util.List;

/**
 * 모델 입력용으로 정규화된 이벤트 요약.
 *
 * @param text   blocks 를 빈 줄로 이어 붙인 최종 텍스트
 * @param blocks 이벤트별 텍스트 블록 (입력 순서 유지)
 * @param links  id 가 있는 이벤트의 딥링크 (입력 순서 유지)
 */
public record FormattedEvidence(String text, List<String> blocks, List<String> links) {

    public FormattedEvidence {
        blocks = List.copyOf(blocks);
        links = List.copyOf(links);
    }
}
