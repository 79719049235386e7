package com.yunhwan.loglens.usecase.analysis.port;

/**
 * 텍스트 생성 모델 포트.
 * <p>
 * 구현체는 실패를 {@link com.yunhwan.loglens.common.exception.AnalysisProviderException} 으로 던지고,
 * 일시 장애/레이트리밋이면 retryable=true 로 표시한다.
 */
public interface TextGenerationClient {

    String generate(String systemInstruction, String userContent);

    /**
     * 로그용 모델 식별자.
     */
    String modelName();
}
