package com.tenantclient.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tenantclient.config.ClientProperties;
import com.tenantclient.config.HttpClientFactory;
import com.tenantclient.exception.TransportException;
import com.tenantclient.model.ApiResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpMethod;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientTransportTest {

    public static MockWebServer mockWebServer;
    private WebClientTransport transport;

    @BeforeAll
    static void setUpAll() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
    }

    @AfterAll
    static void tearDownAll() throws IOException {
        mockWebServer.shutdown();
    }

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .baseUrl(String.format("http://localhost:%s/api/v1", mockWebServer.getPort()))
                .build();
        transport = new WebClientTransport(webClient, new ObjectMapper());
    }

    @Test
    void execute_sendsHeadersAndJsonBody() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(201)
                .setBody("{\"id\":\"p-1\",\"name\":\"Apollo\"}")
                .addHeader("Content-Type", "application/json"));

        ApiResponse response = transport.execute(HttpMethod.POST, "/projects/",
                Map.of("Authorization", "Bearer abc", "X-Tenant-ID", "acme"),
                Map.of("name", "Apollo")).block();

        assertThat(response).isNotNull();
        assertThat(response.status()).isEqualTo(201);
        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.textField("id")).isEqualTo("p-1");

        RecordedRequest recordedRequest = mockWebServer.takeRequest(5, TimeUnit.SECONDS);
        assertThat(recordedRequest).isNotNull();
        assertThat(recordedRequest.getMethod()).isEqualTo("POST");
        assertThat(recordedRequest.getPath()).isEqualTo("/api/v1/projects/");
        assertThat(recordedRequest.getHeader("Authorization")).isEqualTo("Bearer abc");
        assertThat(recordedRequest.getHeader("X-Tenant-ID")).isEqualTo("acme");
        assertThat(recordedRequest.getBody().readUtf8()).isEqualTo("{\"name\":\"Apollo\"}");
    }

    @Test
    void execute_returnsErrorStatusesAsResponses() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(403)
                .setBody("{\"code\":\"TENANT_SUSPENDED\"}")
                .addHeader("Content-Type", "application/json"));

        StepVerifier.create(transport.execute(HttpMethod.GET, "/projects/", Map.of(), null))
                .assertNext(response -> {
                    assertThat(response.status()).isEqualTo(403);
                    assertThat(response.textField("code")).isEqualTo("TENANT_SUSPENDED");
                })
                .verifyComplete();
        mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void execute_keepsNonJsonBodyAsText() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(502)
                .setBody("<html>Bad Gateway</html>")
                .addHeader("Content-Type", "text/html"));

        ApiResponse response = transport.execute(HttpMethod.GET, "/projects/", Map.of(), null).block();

        assertThat(response).isNotNull();
        assertThat(response.body().isTextual()).isTrue();
        assertThat(response.body().asText()).isEqualTo("<html>Bad Gateway</html>");
        mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void execute_mapsEmptyBodyToNullNode() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(204));

        ApiResponse response = transport.execute(HttpMethod.DELETE, "/projects/p-1/", Map.of(), null).block();

        assertThat(response).isNotNull();
        assertThat(response.status()).isEqualTo(204);
        assertThat(response.body().isNull()).isTrue();
        mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void execute_failsWithTransportExceptionWhenServerIsUnreachable() throws IOException {
        MockWebServer stopped = new MockWebServer();
        stopped.start();
        int port = stopped.getPort();
        stopped.shutdown();

        WebClientTransport unreachable = new WebClientTransport(
                WebClient.builder().baseUrl("http://localhost:" + port).build(), new ObjectMapper());

        StepVerifier.create(unreachable.execute(HttpMethod.GET, "/projects/", Map.of(), null))
                .expectError(TransportException.class)
                .verify();
    }

    @Test
    void execute_failsWithTransportExceptionWhenConnectionDropsMidBody() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"results\":[" + "{\"id\":\"p-1\"},".repeat(2_000) + "{\"id\":\"p-2\"}]}")
                .addHeader("Content-Type", "application/json")
                .setSocketPolicy(SocketPolicy.DISCONNECT_DURING_RESPONSE_BODY));

        StepVerifier.create(transport.execute(HttpMethod.GET, "/projects/", Map.of(), null))
                .expectError(TransportException.class)
                .verify(Duration.ofSeconds(10));
        mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void execute_failsWithTransportExceptionWhenBodyExceedsBufferLimit() throws Exception {
        // the plain builder keeps WebClient's 256 KB default
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("[" + "\"x\",".repeat(100_000) + "\"x\"]")
                .addHeader("Content-Type", "application/json"));

        StepVerifier.create(transport.execute(HttpMethod.GET, "/reports/export/", Map.of(), null))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(TransportException.class)
                        .hasCauseInstanceOf(DataBufferLimitException.class))
                .verify(Duration.ofSeconds(10));
        mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    }

    @Test
    void execute_acceptsBodiesUpToConfiguredMaxResponseSize() throws Exception {
        ClientProperties properties = new ClientProperties();
        properties.setBaseUrl(String.format("http://localhost:%s/api/v1", mockWebServer.getPort()));
        properties.setMaxResponseSize(DataSize.ofMegabytes(1));
        WebClientTransport configured = new WebClientTransport(new HttpClientFactory().webClient(properties), new ObjectMapper());
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("[" + "\"x\",".repeat(100_000) + "\"x\"]")
                .addHeader("Content-Type", "application/json"));

        StepVerifier.create(configured.execute(HttpMethod.GET, "/reports/export/", Map.of(), null))
                .assertNext(response -> assertThat(response.body().size()).isEqualTo(100_001))
                .verifyComplete();
        mockWebServer.takeRequest(5, TimeUnit.SECONDS);
    }
}
