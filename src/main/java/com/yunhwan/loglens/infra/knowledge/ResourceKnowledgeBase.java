package com.yunhwan.loglens.infra.knowledge;

import com.yunhwan.loglens.config.analysis.KnowledgeProperties;
import com.yunhwan.loglens.usecase.analysis.KnowledgeDocuments;
import com.yunhwan.loglens.usecase.analysis.port.KnowledgeBase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * 워크플로우/알려진 오류 문서를 Resource 로 읽는다.
 * 문서가 없거나 읽지 못하면 분석을 막지 않고 placeholder 로 대체한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResourceKnowledgeBase implements KnowledgeBase {

    private final ResourceLoader resourceLoader;
    private final KnowledgeProperties props;

    @Override
    public KnowledgeDocuments load() {
        return new KnowledgeDocuments(read(props.getWorkflow()), read(props.getKnownErrors()));
    }

    private String read(String location) {
        if (location == null || location.isBlank()) return null;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[KnowledgeBase] document not found. location={}", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[KnowledgeBase] failed to read document. location={}, err={}", location, e.getMessage());
            return null;
        }
    }
}
