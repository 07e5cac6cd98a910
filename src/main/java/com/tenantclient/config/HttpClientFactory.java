package com.tenantclient.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.netty.channel.ChannelOption;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating and configuring the HTTP client beans.
 * <p>
 * The {@link WebClient} deliberately carries no retry filter: the only retry in this client is the
 * single resend after a token refresh, owned by the retry policy.
 */
@Configuration
@EnableConfigurationProperties(ClientProperties.class)
public class HttpClientFactory {

    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    /**
     * Creates the {@link WebClient} every transport call goes through, bound to the configured base URL.
     * The request timeout is enforced as a Netty response timeout, so a hanging server surfaces as a
     * network error rather than a stuck request. Response bodies are buffered up to the configured
     * maximum response size.
     *
     * @param properties The client settings.
     * @return the configured {@link WebClient}.
     */
    @Bean
    public WebClient webClient(ClientProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .responseTimeout(properties.getRequestTimeout());

        return WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs()
                                .maxInMemorySize(Math.toIntExact(properties.getMaxResponseSize().toBytes())))
                        .build())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Creates the time limiter bounding the token refresh call.
     *
     * @param properties The client settings.
     * @return a {@link TimeLimiter} named {@code token-refresh}.
     */
    @Bean
    public TimeLimiter refreshTimeLimiter(ClientProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getRefreshTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiterRegistry.of(config).timeLimiter("token-refresh");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
