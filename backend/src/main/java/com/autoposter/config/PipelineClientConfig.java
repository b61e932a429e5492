package com.autoposter.config;

import com.autoposter.service.Sleeper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * HTTP clients for the external text and platform APIs, plus the clock and sleeper the
 * scheduler and publisher are driven by.
 */
@Configuration
public class PipelineClientConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineClientConfig.class);

    private final PlatformProperties platformProperties;
    private final PipelineProperties pipelineProperties;

    public PipelineClientConfig(PlatformProperties platformProperties, PipelineProperties pipelineProperties) {
        this.platformProperties = platformProperties;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * Live publishing without a platform token can never succeed, so refuse to start.
     */
    @PostConstruct
    public void validatePlatformCredentials() {
        if (platformProperties.isMock()) {
            log.info("Platform client running in mock mode; no posts will leave this process");
            return;
        }
        if (!StringUtils.hasText(platformProperties.getAccessToken())) {
            throw new IllegalStateException(
                    "autoposter.platform.access-token is required when autoposter.platform.mock=false");
        }
        log.info("Platform client configured for {}", platformProperties.getBaseUrl());
    }

    @Bean
    public RestTemplate textProviderRestTemplate() {
        Duration timeout = pipelineProperties.getContent().getProviderTimeout();
        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return new RestTemplate(factory);
    }

    @Bean
    public RestTemplate platformRestTemplate() {
        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofMillis(platformProperties.getConnectTimeoutMs()));
        factory.setReadTimeout(Duration.ofMillis(platformProperties.getReadTimeoutMs()));
        return new RestTemplate(factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }
}
