package com.identityguardian.mitigation.signal.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.identityguardian.common.azure.GraphApiClient;
import com.identityguardian.common.exception.IdentityGuardianException;
import com.identityguardian.common.model.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Microsoft Sentinel backed analytics ({@code analytics.provider=sentinel}).
 *
 * <p>Runs KQL against the workspace through the Log Analytics query API. Each query ends in a
 * single-row {@code summarize}, so the answer is always {@code tables[0].rows[0][0]}.
 * The behaviour baseline is the highest UEBA {@code InvestigationPriority} (0–10) seen in the
 * window, scaled to [0, 1].
 */
public class SentinelAnalyticsProvider implements SecurityAnalyticsProvider, BehaviorBaselineProvider {

    private static final Logger log = LoggerFactory.getLogger(SentinelAnalyticsProvider.class);

    private static final double MAX_INVESTIGATION_PRIORITY = 10.0;

    private final GraphApiClient logAnalytics;
    private final String workspaceId;
    private final Duration baselineWindow;

    public SentinelAnalyticsProvider(GraphApiClient logAnalytics, String workspaceId, Duration baselineWindow) {
        this.logAnalytics   = logAnalytics;
        this.workspaceId    = workspaceId;
        this.baselineWindow = baselineWindow;
    }

    @Override
    public Mono<Long> countRiskySignIns(Principal principal, Duration window) {
        String kql = """
            SigninLogs
            | where TimeGenerated > ago(%dh)
            | where UserPrincipalName =~ "%s"
            | where RiskLevelDuringSignIn != "none" or RiskLevelAggregated != "none"
            | summarize Count = count()
            """.formatted(window.toHours(), escape(principal.userPrincipalName()));
        return query(kql, window).map(JsonNode::asLong);
    }

    @Override
    public Mono<Long> countPrivilegeEscalations(Principal principal, Duration window) {
        String kql = """
            AuditLogs
            | where TimeGenerated > ago(%dh)
            | where tostring(InitiatedBy.user.userPrincipalName) =~ "%s"
            | where OperationName contains "role"
            | summarize Count = count()
            """.formatted(window.toHours(), escape(principal.userPrincipalName()));
        return query(kql, window).map(JsonNode::asLong);
    }

    @Override
    public Mono<Long> countSignIns(Principal principal, Duration window) {
        String kql = """
            SigninLogs
            | where TimeGenerated > ago(%dh)
            | where UserPrincipalName =~ "%s"
            | summarize Count = count()
            """.formatted(window.toHours(), escape(principal.userPrincipalName()));
        return query(kql, window).map(JsonNode::asLong);
    }

    @Override
    public Mono<Double> baselineRiskScore(Principal principal) {
        String kql = """
            BehaviorAnalytics
            | where TimeGenerated > ago(%dh)
            | where UserPrincipalName =~ "%s"
            | summarize MaxPriority = max(InvestigationPriority)
            """.formatted(baselineWindow.toHours(), escape(principal.userPrincipalName()));
        return query(kql, baselineWindow)
            .map(cell -> Math.min(cell.asDouble(0.0) / MAX_INVESTIGATION_PRIORITY, 1.0));
    }

    private Mono<JsonNode> query(String kql, Duration timespan) {
        return logAnalytics.post(b -> b.path("/v1/workspaces/{workspaceId}/query").build(workspaceId),
                Map.of("query", kql, "timespan", timespan.toString()))
            .switchIfEmpty(Mono.error(() -> new IdentityGuardianException("sentinel",
                "Workspace not found: " + workspaceId)))
            .map(body -> {
                JsonNode cell = body.path("tables").path(0).path("rows").path(0).path(0);
                if (cell.isMissingNode()) {
                    throw new IdentityGuardianException("sentinel", "Query returned no rows");
                }
                return cell;
            })
            .doOnError(e -> log.warn("Sentinel query failed. workspaceId={} error={}", workspaceId, e.getMessage()));
    }

    private static String escape(String value) {
        return value == null ? "" : value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
