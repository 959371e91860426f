package com.identityguardian.common.azure;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.function.Function;

/**
 * Thin authenticated wrapper over a Microsoft cloud REST API (Graph by default).
 *
 * <p>404 answers complete empty; every other non-2xx answer becomes a
 * {@link GraphApiException}. A 401 drops the cached token so the next call re-authenticates.
 * Collection reads follow {@code @odata.nextLink} until the listing is exhausted.
 */
public class GraphApiClient {

    private static final Logger log = LoggerFactory.getLogger(GraphApiClient.class);

    private final WebClient webClient;
    private final AzureTokenProvider tokenProvider;

    public GraphApiClient(WebClient webClient, AzureTokenProvider tokenProvider) {
        this.webClient     = webClient;
        this.tokenProvider = tokenProvider;
    }

    public Mono<JsonNode> get(Function<UriBuilder, URI> uri) {
        return tokenProvider.getToken().flatMap(token -> webClient.get()
            .uri(uri)
            .headers(h -> h.setBearerAuth(token))
            .exchangeToMono(this::readBody));
    }

    /**
     * Emits every element of the {@code value} array across all pages of a collection.
     */
    public Flux<JsonNode> getCollection(Function<UriBuilder, URI> firstPage) {
        return get(firstPage)
            .expand(page -> {
                String next = page.path("@odata.nextLink").asText("");
                return next.isBlank() ? Mono.empty() : getAbsolute(URI.create(next));
            })
            .flatMapIterable(page -> page.path("value"));
    }

    public Mono<JsonNode> post(Function<UriBuilder, URI> uri, Object body) {
        return send(HttpMethod.POST, uri, body);
    }

    public Mono<JsonNode> patch(Function<UriBuilder, URI> uri, Object body) {
        return send(HttpMethod.PATCH, uri, body);
    }

    public Mono<Void> delete(Function<UriBuilder, URI> uri) {
        return tokenProvider.getToken().flatMap(token -> webClient.delete()
            .uri(uri)
            .headers(h -> h.setBearerAuth(token))
            .exchangeToMono(this::readBody))
            .then();
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<JsonNode> getAbsolute(URI absolute) {
        return tokenProvider.getToken().flatMap(token -> webClient.get()
            .uri(absolute)
            .headers(h -> h.setBearerAuth(token))
            .exchangeToMono(this::readBody));
    }

    private Mono<JsonNode> send(HttpMethod method, Function<UriBuilder, URI> uri, Object body) {
        return tokenProvider.getToken().flatMap(token -> webClient.method(method)
            .uri(uri)
            .headers(h -> h.setBearerAuth(token))
            .bodyValue(body)
            .exchangeToMono(this::readBody));
    }

    private Mono<JsonNode> readBody(ClientResponse response) {
        HttpStatus status = HttpStatus.resolve(response.statusCode().value());
        if (status == HttpStatus.NOT_FOUND) {
            return response.releaseBody().then(Mono.empty());
        }
        if (response.statusCode().isError()) {
            if (status == HttpStatus.UNAUTHORIZED) {
                tokenProvider.invalidate();
            }
            return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    log.warn("Graph call failed. status={} body={}", response.statusCode().value(), body);
                    return Mono.error(new GraphApiException(response.statusCode().value(), body));
                });
        }
        return response.bodyToMono(JsonNode.class);
    }
}
