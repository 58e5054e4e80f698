package com.my.seatbot.adapter.out.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.seatbot.config.AppConfig;
import com.my.seatbot.domain.exception.TelegramUnavailableException;
import com.my.seatbot.domain.port.out.DelayPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Single egress path to the Bot API. {@link #call} retries up to {@value #MAX_ATTEMPTS} times:
 * HTTP 429 waits for the server's {@code retry_after} hint plus one second, 5xx and other
 * failures wait two seconds. Only the final failure is logged at error level.
 */
@ApplicationScoped
public class ResilientTelegramApi {

    private static final Logger log = Logger.getLogger(ResilientTelegramApi.class);

    static final int MAX_ATTEMPTS = 3;
    static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(5);
    static final Duration RETRY_AFTER_PADDING = Duration.ofSeconds(1);
    static final Duration ERROR_BACKOFF = Duration.ofSeconds(2);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DelayPort delayPort;
    private final String apiBase;
    private final Duration requestTimeout;

    @Inject
    public ResilientTelegramApi(AppConfig appConfig, ObjectMapper objectMapper, DelayPort delayPort) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper,
                delayPort,
                appConfig.telegram().botToken()
                        .filter(token -> !token.isBlank())
                        .map(token -> "https://api.telegram.org/bot" + token)
                        .orElse(""),
                Duration.ofSeconds(appConfig.telegram().requestTimeoutSeconds()));
    }

    ResilientTelegramApi(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         DelayPort delayPort,
                         String apiBase,
                         Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.delayPort = delayPort;
        this.apiBase = apiBase;
        this.requestTimeout = requestTimeout;
    }

    public boolean isConfigured() {
        return !apiBase.isBlank();
    }

    /**
     * @return the decoded response body, or empty once every attempt has failed
     */
    public Optional<JsonNode> call(String method, Map<String, Object> payload) {
        if (!isConfigured()) {
            log.warnf("Bot token is not configured, skipping %s", method);
            return Optional.empty();
        }
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            try {
                HttpResponse<String> response = post(method, payload, requestTimeout);
                int status = response.statusCode();
                if (status == 429) {
                    Duration retryAfter = retryAfter(response.body());
                    log.warnf("Telegram rate limit hit on %s (HTTP 429). Sleeping %ds...", method, retryAfter.toSeconds());
                    delayPort.pause(retryAfter.plus(RETRY_AFTER_PADDING));
                    continue;
                }
                if (status >= 500 && status < 600) {
                    delayPort.pause(ERROR_BACKOFF);
                    continue;
                }
                if (status >= 400) {
                    throw new IOException("HTTP " + status + ": " + response.body());
                }
                return Optional.of(objectMapper.readTree(response.body()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warnf("Telegram %s interrupted", method);
                return Optional.empty();
            } catch (Exception e) {
                if (attempt == MAX_ATTEMPTS - 1) {
                    log.errorf("Telegram error on %s: %s", method, e.getMessage());
                    return Optional.empty();
                }
                delayPort.pause(ERROR_BACKOFF);
            }
        }
        log.errorf("Telegram %s gave up after %d attempts", method, MAX_ATTEMPTS);
        return Optional.empty();
    }

    /**
     * One attempt without retries, for the long-poll feed whose caller owns the backoff.
     *
     * @throws TelegramUnavailableException on any transport failure, error status or {@code ok=false}
     */
    public JsonNode callOnce(String method, Map<String, Object> payload, Duration timeout) {
        if (!isConfigured()) {
            throw new TelegramUnavailableException("Bot token is not configured");
        }
        try {
            HttpResponse<String> response = post(method, payload, timeout);
            if (response.statusCode() >= 400) {
                throw new TelegramUnavailableException("HTTP " + response.statusCode() + " on " + method);
            }
            JsonNode body = objectMapper.readTree(response.body());
            if (!body.path("ok").asBoolean(false)) {
                throw new TelegramUnavailableException(method + " answered ok=false");
            }
            return body;
        } catch (IOException e) {
            throw new TelegramUnavailableException(method + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelegramUnavailableException(method + " interrupted", e);
        }
    }

    private HttpResponse<String> post(String method, Map<String, Object> payload, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/" + method))
                .header("Content-Type", "application/json")
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private Duration retryAfter(String body) {
        try {
            JsonNode retryAfter = objectMapper.readTree(body).path("parameters").path("retry_after");
            if (retryAfter.canConvertToInt() && retryAfter.asInt() > 0) {
                return Duration.ofSeconds(retryAfter.asInt());
            }
        } catch (IOException | RuntimeException e) {
            log.debugf("Unreadable 429 body, using default wait: %s", e.getMessage());
        }
        return DEFAULT_RETRY_AFTER;
    }
}
