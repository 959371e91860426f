package com.identityguardian.mitigation.approval;

import com.identityguardian.common.azure.AzureTokenProvider;
import com.identityguardian.common.exception.IdentityGuardianException;
import com.identityguardian.common.model.MitigationAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Posts adaptive cards into Microsoft Teams through the Bot Framework connector.
 *
 * <p>When {@code approval.teams.enabled=false} every card is logged instead of sent and the
 * call completes normally. Investigation cards go to the investigation channel, alerts and
 * restoration notices to the alert channel; both fall back to the main channel.
 */
public class TeamsApprovalChannel implements ApprovalChannel {

    private static final Logger log = LoggerFactory.getLogger(TeamsApprovalChannel.class);

    private final WebClient connectorClient;
    private final AzureTokenProvider botTokenProvider;
    private final AdaptiveCardFactory cards;
    private final boolean enabled;
    private final String botId;
    private final String channelId;
    private final String alertChannelId;
    private final String investigationChannelId;

    public TeamsApprovalChannel(WebClient connectorClient, AzureTokenProvider botTokenProvider,
                                AdaptiveCardFactory cards, boolean enabled, String botId,
                                String channelId, String alertChannelId, String investigationChannelId) {
        this.connectorClient        = connectorClient;
        this.botTokenProvider       = botTokenProvider;
        this.cards                  = cards;
        this.enabled                = enabled;
        this.botId                  = botId;
        this.channelId              = channelId;
        this.alertChannelId         = firstNonBlank(alertChannelId, channelId);
        this.investigationChannelId = firstNonBlank(investigationChannelId, channelId);
    }

    @Override
    public Mono<Void> sendMitigationReview(MitigationAction action) {
        return post("investigation", investigationChannelId, cards.investigationCard(action), action.principalId());
    }

    @Override
    public Mono<Void> sendHighRiskAlert(MitigationAction action) {
        return post("alert", alertChannelId, cards.highRiskAlertCard(action), action.principalId());
    }

    @Override
    public Mono<Void> sendRestorationNotice(String principalId, String outcome) {
        return post("restoration", alertChannelId, cards.restorationCard(principalId, outcome), principalId);
    }

    @Override
    public Mono<Void> sendPrivilegedAccessRequest(PrivilegedAccessRequest request) {
        return post("privileged-access", channelId, cards.privilegedAccessCard(request), request.principalId());
    }

    private Mono<Void> post(String cardType, String conversationId, Map<String, Object> card, String principalId) {
        if (!enabled) {
            log.info("Teams disabled. Logging card instead. cardType={} principalId={} card={}",
                cardType, principalId, card.get("body"));
            return Mono.empty();
        }
        if (conversationId == null || conversationId.isBlank()) {
            return Mono.error(new IdentityGuardianException("teams",
                "No Teams channel configured for " + cardType + " cards"));
        }
        return botTokenProvider.getToken()
            .flatMap(token -> connectorClient.post()
                .uri(b -> b.path("/v3/conversations/{conversationId}/activities").build(conversationId))
                .headers(h -> h.setBearerAuth(token))
                .bodyValue(cards.activity(botId, conversationId, card))
                .retrieve()
                .toBodilessEntity())
            .doOnSuccess(r -> log.info("Teams card sent. cardType={} principalId={} status={}",
                cardType, principalId, r.getStatusCode()))
            .onErrorMap(e -> !(e instanceof IdentityGuardianException),
                e -> new IdentityGuardianException("teams", "Failed to send " + cardType + " card: " + e.getMessage(), e))
            .then();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred == null || preferred.isBlank() ? fallback : preferred;
    }
}
