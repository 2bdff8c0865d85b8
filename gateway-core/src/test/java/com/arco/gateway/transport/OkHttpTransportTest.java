package com.arco.gateway.transport;

import com.arco.gateway.HttpMethod;
import com.arco.gateway.config.GatewayConfig;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OkHttpTransport Tests")
class OkHttpTransportTest {

    private MockWebServer server;
    private OkHttpTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        Properties props = new Properties();
        props.setProperty("GATEWAY_REQUEST_TIMEOUT_MS", "500");
        transport = new OkHttpTransport(GatewayConfig.forTest(props));
    }

    @AfterEach
    void tearDown() throws IOException {
        transport.close();
        server.shutdown();
    }

    @Test
    @DisplayName("GET sends params as query string with default User-Agent")
    void getWithQueryParams() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true}"));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", "coffee shops");
        params.put("limit", 5);

        TransportResponse response = transport.execute(new TransportRequest(
            HttpMethod.GET, server.url("/search").toString(), params, Map.of("X-Api-Key", "secret")));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("{\"ok\":true}");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getRequestUrl().queryParameter("q")).isEqualTo("coffee shops");
        assertThat(recorded.getRequestUrl().queryParameter("limit")).isEqualTo("5");
        assertThat(recorded.getHeader("User-Agent")).isEqualTo("ARCO-APIService/1.0");
        assertThat(recorded.getHeader("X-Api-Key")).isEqualTo("secret");
    }

    @Test
    @DisplayName("POST sends params as a JSON body")
    void postWithJsonBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setBody("{}"));

        transport.execute(new TransportRequest(
            HttpMethod.POST, server.url("/items").toString(), Map.of("name", "Acme"), Map.of()));

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"name\":\"Acme\"}");
    }

    @Test
    @DisplayName("Non-2xx statuses are returned, not thrown")
    void statusReturned() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

        TransportResponse response = transport.execute(new TransportRequest(
            HttpMethod.GET, server.url("/").toString(), Map.of(), Map.of()));

        assertThat(response.isRateLimited()).isTrue();
        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.body()).isEqualTo("slow down");
    }

    @Test
    @DisplayName("Slow upstream raises a timeout")
    void timeout() {
        server.enqueue(new MockResponse().setBody("late").setHeadersDelay(2, TimeUnit.SECONDS));

        assertThatThrownBy(() -> transport.execute(new TransportRequest(
                HttpMethod.GET, server.url("/slow").toString(), Map.of(), Map.of())))
            .isInstanceOf(InterruptedIOException.class);
    }

    @Test
    @DisplayName("Malformed URL is rejected before any call is made")
    void invalidUrl() {
        TransportRequest request = new TransportRequest(
            HttpMethod.GET, "https://exa mple.com/x", Map.of(), Map.of());

        assertThatThrownBy(() -> transport.checkRequest(request))
            .isInstanceOf(InvalidRequestException.class)
            .hasMessageContaining("Invalid URL");
        assertThatThrownBy(() -> transport.execute(request))
            .isInstanceOf(InvalidRequestException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    @DisplayName("Well-formed request passes the check")
    void validUrlPassesCheck() {
        assertThatCode(() -> transport.checkRequest(new TransportRequest(
                HttpMethod.POST, server.url("/ok").toString(), Map.of("q", "x"), Map.of())))
            .doesNotThrowAnyException();
    }
}
