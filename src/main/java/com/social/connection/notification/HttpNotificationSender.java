package com.social.connection.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts notifications as JSON to {@code {baseUrl}/notifications}.
 *
 * <p>Requests go out through {@link HttpClient#sendAsync}; the returned future is
 * never awaited. Non-2xx responses and transport errors are logged at WARN.</p>
 *
 * <pre>
 * NotificationSender sender = HttpNotificationSender.builder()
 *     .baseUrl("http://notifications.internal:8080")
 *     .build();
 * </pre>
 */
public class HttpNotificationSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(HttpNotificationSender.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI endpoint;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private HttpNotificationSender(Builder builder) {
        Objects.requireNonNull(builder.baseUrl, "baseUrl is required");
        String base = builder.baseUrl.endsWith("/")
                ? builder.baseUrl.substring(0, builder.baseUrl.length() - 1)
                : builder.baseUrl;
        this.endpoint = URI.create(base + "/notifications");
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    @Override
    public void send(NotificationKind kind, String targetId, NotificationPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("notification.serialize.failed kind={} targetId={}: {}", kind, targetId, e.getMessage());
            return;
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("Posting {} notification for {} to {}", kind, targetId, endpoint);
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .whenComplete((response, error) -> {
                    if (error != null) {
                        log.warn("notification.failed kind={} targetId={}: {}", kind, targetId, error.getMessage());
                    } else if (!isDelivered(response.statusCode())) {
                        log.warn("notification.rejected kind={} targetId={} status={} body={}",
                                kind, targetId, response.statusCode(), response.body());
                    } else {
                        log.debug("notification.sent kind={} targetId={}", kind, targetId);
                    }
                });
    }

    static boolean isDelivered(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public HttpNotificationSender build() {
            return new HttpNotificationSender(this);
        }
    }
}
