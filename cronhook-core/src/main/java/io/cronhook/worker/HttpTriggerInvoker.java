package io.cronhook.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronhook.core.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Issues the HTTP call described by a {@link Trigger}.
 *
 * <p>The payload is sent as JSON for POST, PUT and PATCH only. Trigger headers override the defaults
 * ({@code Content-Type: application/json} when a body is sent, {@code User-Agent}). Headers the JDK client
 * manages itself are dropped.
 */
public class HttpTriggerInvoker {
    private static final Logger log = LoggerFactory.getLogger(HttpTriggerInvoker.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    static final String USER_AGENT = "cronhook-worker";

    private static final Set<String> BODY_METHODS = Set.of("POST", "PUT", "PATCH");
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpTriggerInvoker(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public InvocationOutcome invoke(Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");

        HttpRequest request;
        try {
            request = buildRequest(trigger);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return InvocationOutcome.failed("Invalid request: " + e.getMessage(), 0);
        }

        long startedAt = System.nanoTime();
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return InvocationOutcome.responded(response.statusCode(), elapsedMs(startedAt));
        } catch (HttpConnectTimeoutException e) {
            return InvocationOutcome.failed("connect timeout of " + timeout.toMillis() + "ms exceeded", elapsedMs(startedAt));
        } catch (HttpTimeoutException e) {
            return InvocationOutcome.failed("timeout of " + timeout.toMillis() + "ms exceeded", elapsedMs(startedAt));
        } catch (ConnectException e) {
            return InvocationOutcome.failed("connection failed: " + describe(e), elapsedMs(startedAt));
        } catch (IOException e) {
            return InvocationOutcome.failed(describe(e), elapsedMs(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return InvocationOutcome.failed("interrupted", elapsedMs(startedAt));
        }
    }

    HttpRequest buildRequest(Trigger trigger) throws JsonProcessingException {
        String method = trigger.method().toUpperCase(Locale.ROOT);
        boolean withBody = BODY_METHODS.contains(method) && trigger.payload() != null;

        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.put("User-Agent", USER_AGENT);
        if (withBody) {
            headers.put("Content-Type", "application/json");
        }
        if (trigger.headers() != null) {
            headers.putAll(trigger.headers());
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(trigger.url()))
                .timeout(timeout);

        headers.forEach((name, value) -> {
            if (value == null || RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                log.debug("Dropping header {} for {}", name, trigger.url());
                return;
            }
            builder.header(name, value);
        });

        HttpRequest.BodyPublisher body = withBody
                ? HttpRequest.BodyPublishers.ofString(serialize(trigger.payload()), StandardCharsets.UTF_8)
                : HttpRequest.BodyPublishers.noBody();
        return builder.method(method, body).build();
    }

    private String serialize(Object payload) throws JsonProcessingException {
        if (payload instanceof String s) {
            return s;
        }
        return objectMapper.writeValueAsString(payload);
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) {
            Throwable cause = e.getCause();
            msg = cause != null && cause.getMessage() != null ? cause.getMessage() : e.getClass().getSimpleName();
        }
        return msg;
    }

    private static long elapsedMs(long startedAtNanos) {
        return Duration.ofNanos(System.nanoTime() - startedAtNanos).toMillis();
    }
}
