package com.yunhwan.loglens.config.web;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loglens.auth")
public class AuthProperties {

    /**
     * /api/** 공유 토큰 (X-Auth-Token 헤더). 비어 있으면 /api/** 는 전부 401
     */
    private String appPassword;
}
