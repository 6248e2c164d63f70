package com.tribe.matching.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "matching.advisory")
@Getter
@Setter
public class AdvisoryProperties {

    private boolean enabled = false;
    private String baseUrl = "https://openrouter.ai/api/v1";
    private String apiKey = "";
    private String model = "openai/gpt-4-turbo";
    private double temperature = 0.7;
    private int maxTokens = 300;
    private long timeoutMillis = 2000;
    private float failureRateThreshold = 50f;
    private long openStateSeconds = 30;
    private int slidingWindowSize = 20;
}
