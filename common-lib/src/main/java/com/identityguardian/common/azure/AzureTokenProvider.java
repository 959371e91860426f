package com.identityguardian.common.azure;

import com.fasterxml.jackson.databind.JsonNode;
import com.identityguardian.common.exception.IdentityGuardianException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * OAuth2 client-credentials token source for one Entra ID audience (Microsoft Graph,
 * Log Analytics, Bot Framework).
 *
 * <p>The token is cached in memory and refreshed {@value #EXPIRY_SKEW_SECONDS} seconds before
 * the expiry reported by the token endpoint, or immediately after {@link #invalidate()}.
 */
public class AzureTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(AzureTokenProvider.class);

    private static final long EXPIRY_SKEW_SECONDS = 60;

    private final WebClient tokenClient;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final String scope;

    private final AtomicReference<String>  cachedToken = new AtomicReference<>();
    private final AtomicReference<Instant> tokenExpiry = new AtomicReference<>(Instant.EPOCH);

    public AzureTokenProvider(WebClient tokenClient, String tokenUrl, String clientId,
                              String clientSecret, String scope) {
        this.tokenClient  = tokenClient;
        this.tokenUrl     = tokenUrl;
        this.clientId     = clientId;
        this.clientSecret = clientSecret;
        this.scope        = scope;
    }

    /** Token endpoint of an Entra ID tenant. */
    public static String tenantTokenUrl(String tenantId) {
        return "https://login.microsoftonline.com/" + tenantId + "/oauth2/v2.0/token";
    }

    public Mono<String> getToken() {
        String token = cachedToken.get();
        if (token != null && Instant.now().isBefore(tokenExpiry.get())) {
            return Mono.just(token);
        }
        return fetch();
    }

    /** Drops the cached token; call after the audience answers 401. */
    public void invalidate() {
        cachedToken.set(null);
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<String> fetch() {
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            return Mono.error(new IdentityGuardianException("auth",
                "Client id and secret must be configured to obtain a token for scope " + scope));
        }
        log.info("Requesting access token. scope={} clientId={}", scope, clientId);
        return tokenClient.post()
            .uri(tokenUrl)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(BodyInserters.fromFormData("grant_type", "client_credentials")
                .with("client_id", clientId)
                .with("client_secret", clientSecret)
                .with("scope", scope))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(this::extractToken)
            .doOnError(e -> log.error("Token request failed. scope={}", scope, e));
    }

    private String extractToken(JsonNode body) {
        String token = body.path("access_token").asText("");
        if (token.isBlank()) {
            throw new IdentityGuardianException("auth",
                "Token endpoint returned no access_token: " + body.path("error").asText("unknown error"));
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        cachedToken.set(token);
        tokenExpiry.set(Instant.now().plusSeconds(Math.max(0, expiresIn - EXPIRY_SKEW_SECONDS)));
        return token;
    }
}
