package com.identityguardian.common.azure;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Builds WebClients for Microsoft cloud endpoints with connect / response / read timeouts and
 * outbound request logging. Authorization headers are never logged.
 */
public final class AzureWebClients {

    private static final Logger log = LoggerFactory.getLogger(AzureWebClients.class);

    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    private AzureWebClients() {}

    public static WebClient timed(WebClient.Builder builder, String baseUrl, Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(responseTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        WebClient.Builder configured = builder.clone()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter());
        if (baseUrl != null && !baseUrl.isBlank()) {
            configured.baseUrl(baseUrl);
        }
        return configured.build();
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
