package org.realityforge.sqldeploy.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class WebhookNotifier implements Notifier {
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final URI target;
    private final String recipient;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookNotifier(final URI target, final String recipient) {
        this(target, recipient, HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), new ObjectMapper());
    }

    WebhookNotifier(
            final URI target, final String recipient, final HttpClient httpClient, final ObjectMapper objectMapper) {
        this.target = target;
        this.recipient = recipient;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void notify(final Notification notification) {
        final HttpRequest request = HttpRequest.newBuilder(target)
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(payload(notification), StandardCharsets.UTF_8))
                .build();
        final HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (final IOException ioe) {
            throw new NotificationException("Failed to deliver notification to " + target, ioe);
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while delivering notification to " + target, ie);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new NotificationException(
                    "Notification endpoint " + target + " responded with HTTP " + response.statusCode());
        }
    }

    String payload(final Notification notification) {
        try {
            return objectMapper.writeValueAsString(
                    new WebhookPayload(recipient, notification.subject(), notification.body()));
        } catch (final JsonProcessingException jpe) {
            throw new NotificationException("Failed to serialize notification for " + notification.scriptName(), jpe);
        }
    }
}
