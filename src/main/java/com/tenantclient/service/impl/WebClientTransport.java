package com.tenantclient.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.tenantclient.exception.TransportException;
import com.tenantclient.model.ApiResponse;
import com.tenantclient.service.api.Transport;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * {@link Transport} backed by the shared {@link WebClient}.
 * <p>
 * Every HTTP status is turned into an {@link ApiResponse}. Any other failure of the exchange, whether
 * the request never got an answer or the body could not be read in full, fails with a
 * {@link TransportException}. Bodies are parsed as JSON when possible and kept as text otherwise.
 */
@Service
@Slf4j
public class WebClientTransport implements Transport {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientTransport(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<ApiResponse> execute(HttpMethod method, String url, Map<String, String> headers, Object body) {
        WebClient.RequestBodySpec requestSpec = webClient.method(method)
                .uri(url)
                .headers(httpHeaders -> headers.forEach(httpHeaders::set));

        WebClient.RequestHeadersSpec<?> readySpec;
        if (body != null) {
            readySpec = requestSpec.bodyValue(body);
        } else {
            readySpec = requestSpec;
        }

        log.debug("Sending {} {}", method, url);
        return readySpec
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(raw -> new ApiResponse(
                                response.statusCode().value(),
                                response.headers().asHttpHeaders(),
                                parseBody(raw))))
                .doOnNext(response -> log.debug("{} {} answered {}", method, url, response.status()))
                .onErrorMap(e -> !(e instanceof TransportException), e -> {
                    log.warn("{} {} failed without a usable response: {}", method, url, e.getMessage());
                    return new TransportException(method + " " + url + " failed: " + e.getMessage(), e);
                });
    }

    private JsonNode parseBody(String raw) {
        if (raw.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON, keeping it as text");
            return TextNode.valueOf(raw);
        }
    }
}
