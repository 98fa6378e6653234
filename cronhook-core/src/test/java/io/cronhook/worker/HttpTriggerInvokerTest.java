package io.cronhook.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.cronhook.core.Trigger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.absent;
import static com.github.tomakehurst.wiremock.client.WireMock.any;
import static com.github.tomakehurst.wiremock.client.WireMock.deleteRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpTriggerInvokerTest {

    @RegisterExtension
    static final WireMockExtension WIREMOCK = WireMockExtension.newInstance()
            .options(WireMockConfiguration.wireMockConfig().dynamicPort())
            .build();

    private final HttpTriggerInvoker invoker = new HttpTriggerInvoker(new ObjectMapper(), Duration.ofMillis(500));

    @Test
    void postShouldSendPayloadAsJsonWithMergedHeaders() {
        WIREMOCK.stubFor(any(urlPathEqualTo("/hook")).willReturn(aResponse().withStatus(202)));

        Trigger trigger = new Trigger("* * * * *", WIREMOCK.baseUrl() + "/hook", "POST",
                Map.of("job", "sync", "count", 3),
                Map.of("X-Api-Key", "secret", "user-agent", "custom-agent"));

        InvocationOutcome outcome = invoker.invoke(trigger);

        assertTrue(outcome.delivered());
        assertEquals(202, outcome.httpStatus());
        assertNull(outcome.error());
        WIREMOCK.verify(postRequestedFor(urlEqualTo("/hook"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("X-Api-Key", equalTo("secret"))
                .withHeader("User-Agent", equalTo("custom-agent"))
                .withRequestBody(equalToJson("{\"job\":\"sync\",\"count\":3}")));
    }

    @Test
    void getShouldNeverCarryBody() {
        WIREMOCK.stubFor(any(urlPathEqualTo("/ping")).willReturn(aResponse().withStatus(200)));

        Trigger trigger = new Trigger("* * * * *", WIREMOCK.baseUrl() + "/ping", "GET", Map.of("ignored", true), null);

        InvocationOutcome outcome = invoker.invoke(trigger);

        assertTrue(outcome.delivered());
        WIREMOCK.verify(getRequestedFor(urlEqualTo("/ping"))
                .withHeader("Content-Type", absent())
                .withHeader("User-Agent", equalTo(HttpTriggerInvoker.USER_AGENT)));
    }

    @Test
    void deleteWithoutPayloadShouldSucceed() {
        WIREMOCK.stubFor(any(urlPathEqualTo("/items/1")).willReturn(aResponse().withStatus(204)));

        InvocationOutcome outcome = invoker.invoke(Trigger.of("* * * * *", WIREMOCK.baseUrl() + "/items/1", "DELETE"));

        assertTrue(outcome.delivered());
        assertEquals(204, outcome.httpStatus());
        WIREMOCK.verify(deleteRequestedFor(urlEqualTo("/items/1")));
    }

    @Test
    void serverErrorShouldStillCountAsDelivered() {
        WIREMOCK.stubFor(any(urlPathEqualTo("/broken")).willReturn(aResponse().withStatus(500)));

        InvocationOutcome outcome = invoker.invoke(Trigger.of("* * * * *", WIREMOCK.baseUrl() + "/broken", "POST"));

        assertTrue(outcome.delivered());
        assertEquals(500, outcome.httpStatus());
    }

    @Test
    void slowTargetShouldTimeOut() {
        WIREMOCK.stubFor(any(urlPathEqualTo("/slow")).willReturn(aResponse().withStatus(200).withFixedDelay(3000)));

        InvocationOutcome outcome = invoker.invoke(Trigger.of("* * * * *", WIREMOCK.baseUrl() + "/slow", "GET"));

        assertFalse(outcome.delivered());
        assertNull(outcome.httpStatus());
        assertEquals("timeout of 500ms exceeded", outcome.error());
        assertTrue(outcome.durationMs() >= 400);
    }

    @Test
    void unreachableTargetShouldFail() {
        InvocationOutcome outcome = invoker.invoke(Trigger.of("* * * * *", "http://127.0.0.1:1/nowhere", "GET"));

        assertFalse(outcome.delivered());
        assertNotNull(outcome.error());
    }

    @Test
    void restrictedHeadersShouldBeDropped() throws Exception {
        Trigger trigger = new Trigger("* * * * *", "https://example.com/x", "post", "raw body",
                Map.of("Host", "evil.example", "Content-Length", "1", "X-Trace", "abc"));

        HttpRequest request = invoker.buildRequest(trigger);

        assertEquals("POST", request.method());
        assertTrue(request.headers().firstValue("Host").isEmpty());
        assertTrue(request.headers().firstValue("Content-Length").isEmpty());
        assertEquals("abc", request.headers().firstValue("X-Trace").orElseThrow());
        assertEquals(Duration.ofMillis(500), request.timeout().orElseThrow());
        assertEquals("raw body".length(), request.bodyPublisher().orElseThrow().contentLength());
    }
}
