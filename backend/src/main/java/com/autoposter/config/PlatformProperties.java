package com.autoposter.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Publishing platform endpoint and credential. The access token is treated as an opaque value.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "autoposter.platform")
public class PlatformProperties {

    /**
     * Use the in-process mock platform instead of the live API.
     */
    private boolean mock = true;
    private String baseUrl = "https://api.twitter.com";
    private String mediaUploadPath = "/2/media/upload";
    private String createPostPath = "/2/tweets";
    private String verifyCredentialsPath = "/2/users/me";
    private String accessToken = "";
    private int connectTimeoutMs = 10_000;
    private int readTimeoutMs = 30_000;
}
