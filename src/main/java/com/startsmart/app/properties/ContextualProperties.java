package com.startsmart.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "contextual")
public class ContextualProperties {
    private String provider = "stub";
    private int timeoutSec = 10;
    private long queueTimeoutMs = 60_000L;
    private String baseUrl = "http://127.0.0.1:11434";
    private String model = "llama3.1:latest";
    private double temperature = 0.3;
}
