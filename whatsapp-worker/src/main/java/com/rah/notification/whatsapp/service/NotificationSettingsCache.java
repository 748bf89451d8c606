package com.rah.notification.whatsapp.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rah.notification.whatsapp.model.NotificationSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Notification settings from the CMS, memoized for a fixed TTL.
 *
 * <p>Behavior:
 * <ul>
 *   <li>Within the TTL the cached value is returned without any request</li>
 *   <li>404 or a response without {@code data} means "not configured": empty, nothing cached</li>
 *   <li>Other failures throw {@link SettingsFetchException}; an expired value is never served</li>
 * </ul>
 * Concurrent misses may both fetch; the last response wins.
 */
@Service
@Slf4j
public class NotificationSettingsCache {

    static final String SETTINGS_PATH = "/api/notification-setting";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String apiToken;
    private final Duration ttl;
    private final Duration timeout;

    private volatile CachedSettings cached;

    public NotificationSettingsCache(@Qualifier("settingsWebClient") WebClient webClient,
                                     ObjectMapper objectMapper,
                                     Clock clock,
                                     @Value("${worker.settings.api-token:}") String apiToken,
                                     @Value("${worker.settings.ttl:5m}") Duration ttl,
                                     @Value("${worker.settings.timeout:10s}") Duration timeout) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.apiToken = apiToken;
        this.ttl = ttl;
        this.timeout = timeout;
    }

    public Optional<NotificationSettings> getNotificationSettings() {
        CachedSettings current = cached;
        if (current != null && clock.instant().isBefore(current.expiresAt())) {
            return Optional.of(current.value());
        }

        Optional<NotificationSettings> fetched = fetch();
        fetched.ifPresent(settings -> cached = new CachedSettings(settings, clock.instant().plus(ttl)));
        return fetched;
    }

    public void invalidate() {
        cached = null;
        log.info("Notification settings cache invalidated");
    }

    private Optional<NotificationSettings> fetch() {
        String body;
        try {
            body = webClient.get()
                .uri(SETTINGS_PATH)
                .headers(headers -> {
                    if (apiToken != null && !apiToken.isBlank()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken);
                    }
                })
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.<String>empty());
                    }
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(String.class).defaultIfEmpty("");
                    }
                    return response.createException().flatMap(Mono::<String>error);
                })
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            throw new SettingsFetchException(
                "Failed to fetch notification settings: " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new SettingsFetchException("Failed to fetch notification settings: " + e.getMessage(), e);
        }

        if (body == null) {
            log.info("Notification settings not configured (404)");
            return Optional.empty();
        }
        return parse(body);
    }

    private Optional<NotificationSettings> parse(String body) {
        if (body.isBlank()) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SettingsFetchException("Invalid notification settings response: " + e.getOriginalMessage(), e);
        }

        JsonNode data = root.get("data");
        if (data == null || data.isNull() || !data.isObject()) {
            log.info("Notification settings response has no data");
            return Optional.empty();
        }
        JsonNode attributes = data.has("attributes") && data.get("attributes").isObject()
            ? data.get("attributes")
            : data;

        String reminder = text(attributes, "reminderMessageTemplate");
        return Optional.of(new NotificationSettings(
            textOrEmpty(attributes, "confirmationMessageTemplate"),
            reminder == null || reminder.isBlank() ? null : reminder,
            textOrEmpty(attributes, "businessName"),
            number(attributes, "businessLatitude"),
            number(attributes, "businessLongitude")
        ));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String textOrEmpty(JsonNode node, String field) {
        String value = text(node, field);
        return value != null ? value : "";
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric {} in notification settings: '{}'", field, value.asText());
                return null;
            }
        }
        return null;
    }

    private record CachedSettings(NotificationSettings value, Instant expiresAt) {
    }
}
