package com.yunhwan.loglens.config.analysis;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loglens.knowledge")
public class KnowledgeProperties {

    // Spring Resource 경로 (classpath:, file: 모두 가능)
    private String workflow = "classpath:knowledge/workflow.md";
    private String knownErrors = "classpath:knowledge/known_errors.md";
}
