package com.autoposter.provider;

import com.autoposter.config.PlatformProperties;
import com.autoposter.model.ContentDraft;
import com.autoposter.model.FailureReason;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Live platform client speaking the v2 media-upload, create-post and account-lookup endpoints with a bearer token.
 */
@Component
@ConditionalOnProperty(prefix = "autoposter.platform", name = "mock", havingValue = "false")
public class HttpPlatformClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(HttpPlatformClient.class);

    private static final Set<Integer> VALIDATION_STATUSES = Set.of(400, 413, 415, 422);
    private static final Set<Integer> NETWORK_STATUSES = Set.of(502, 503, 504);
    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,9}");

    private final RestTemplate restTemplate;
    private final PlatformProperties properties;
    private final Clock clock;

    public HttpPlatformClient(
            @Qualifier("platformRestTemplate") RestTemplate restTemplate,
            PlatformProperties properties,
            Clock clock) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String uploadMedia(byte[] data, String mimeType) {
        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentType(MediaType.parseMediaType(mimeType));
        ByteArrayResource media = new ByteArrayResource(data) {
            @Override
            public String getFilename() {
                return "post-image";
            }
        };

        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("media", new HttpEntity<>(media, partHeaders));

        HttpHeaders headers = authorizedHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        JsonNode response = exchange(HttpMethod.POST, properties.getMediaUploadPath(), new HttpEntity<>(parts, headers));
        String mediaRef = firstText(response.path("media_id_string"), response.path("data").path("id"), response.path("id"));
        if (mediaRef == null) {
            throw new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR, "Media upload response carried no media id");
        }
        log.debug("Uploaded {} bytes as media {}", data.length, mediaRef);
        return mediaRef;
    }

    @Override
    public String createPost(String text, List<String> hashtags, String mediaRef) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", ContentDraft.compose(text, hashtags));
        if (StringUtils.hasText(mediaRef)) {
            body.put("media", Map.of("media_ids", List.of(mediaRef)));
        }

        HttpHeaders headers = authorizedHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        JsonNode response = exchange(HttpMethod.POST, properties.getCreatePostPath(), new HttpEntity<>(body, headers));
        String postId = firstText(response.path("data").path("id"));
        if (postId == null) {
            throw new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR, "Create post response carried no post id");
        }
        return postId;
    }

    @Override
    public PlatformAccount verifyCredentials() {
        JsonNode response = exchange(HttpMethod.GET, properties.getVerifyCredentialsPath(), new HttpEntity<>(authorizedHeaders()));
        JsonNode user = response.path("data");
        String id = firstText(user.path("id"));
        if (id == null) {
            throw new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR, "Account lookup response carried no user id");
        }
        PlatformAccount account = new PlatformAccount(id, firstText(user.path("username")));
        log.info("Platform credential accepted for account {} (@{})", account.id(), account.username());
        return account;
    }

    private HttpHeaders authorizedHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getAccessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private JsonNode exchange(HttpMethod method, String path, HttpEntity<?> request) {
        String url = properties.getBaseUrl() + path;
        try {
            JsonNode response = restTemplate.exchange(url, method, request, JsonNode.class).getBody();
            if (response == null) {
                throw new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR, "Empty response from " + path);
            }
            return response;
        } catch (RestClientResponseException ex) {
            throw classify(ex);
        } catch (ResourceAccessException ex) {
            throw new PlatformApiException(FailureReason.NETWORK_ERROR, "Platform unreachable: " + ex.getMessage(), null, ex);
        } catch (RestClientException ex) {
            throw new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR, "Platform call failed: " + ex.getMessage(), null, ex);
        }
    }

    PlatformApiException classify(RestClientResponseException ex) {
        int status = ex.getStatusCode().value();
        String message = "Platform returned HTTP " + status;
        if (status == 401 || status == 403) {
            return new PlatformApiException(FailureReason.AUTH_ERROR, message, null, ex);
        }
        if (status == 429) {
            HttpHeaders headers = ex.getResponseHeaders();
            String retryAfter = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
            return new PlatformApiException(FailureReason.RATE_LIMIT_ERROR, message, parseRetryAfter(retryAfter), ex);
        }
        if (VALIDATION_STATUSES.contains(status)) {
            return new PlatformApiException(FailureReason.VALIDATION_ERROR, message, null, ex);
        }
        if (NETWORK_STATUSES.contains(status)) {
            return new PlatformApiException(FailureReason.NETWORK_ERROR, message, null, ex);
        }
        return new PlatformApiException(FailureReason.UNKNOWN_PROVIDER_ERROR, message, null, ex);
    }

    /**
     * Accepts delta-seconds or an RFC 1123 date. Unparseable values yield null.
     */
    Duration parseRetryAfter(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        String trimmed = value.trim();
        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration wait = Duration.between(clock.instant(), at);
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring unparseable Retry-After header '{}'", trimmed);
            return null;
        }
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate != null && (candidate.isTextual() || candidate.isNumber()) && !candidate.asText().isBlank()) {
                return candidate.asText();
            }
        }
        return null;
    }
}
