package com.yunhwan.loglens.config.web;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loglens.web")
public class WebProperties {

    // /api/** CORS 허용 origin
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
}
