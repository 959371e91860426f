package com.identityguardian.mitigation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.identityguardian.common.azure.AzureTokenProvider;
import com.identityguardian.common.azure.AzureWebClients;
import com.identityguardian.common.azure.GraphApiClient;
import com.identityguardian.mitigation.approval.AdaptiveCardFactory;
import com.identityguardian.mitigation.approval.ApprovalChannel;
import com.identityguardian.mitigation.approval.TeamsApprovalChannel;
import com.identityguardian.mitigation.signal.provider.GraphIdentityProtectionProvider;
import com.identityguardian.mitigation.signal.provider.IdentityProtectionProvider;
import com.identityguardian.mitigation.signal.provider.InMemoryIdentityProtectionProvider;
import com.identityguardian.mitigation.signal.provider.InMemorySecurityAnalyticsProvider;
import com.identityguardian.mitigation.signal.provider.PolicyComplianceProvider;
import com.identityguardian.mitigation.signal.provider.RulePolicyComplianceProvider;
import com.identityguardian.mitigation.signal.provider.SentinelAnalyticsProvider;
import com.identityguardian.mitigation.store.InMemoryMitigationActionStore;
import com.identityguardian.mitigation.store.MitigationActionRepository;
import com.identityguardian.mitigation.store.MitigationActionStore;
import com.identityguardian.mitigation.store.R2dbcMitigationActionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Set;

/**
 * Wires the mitigation service. Every strategy is chosen once here from configuration:
 *
 * <pre>
 *   mitigation.store      memory (default) | r2dbc
 *   directory.provider    memory (default) | graph    also selects the identity protection source
 *   analytics.provider    memory (default) | sentinel
 * </pre>
 */
@Configuration
@EnableConfigurationProperties(SegregationOfDutiesProperties.class)
public class MitigationConfig {

    private static final Logger log = LoggerFactory.getLogger(MitigationConfig.class);

    private static final String LOG_ANALYTICS_SCOPE = "https://api.loganalytics.io/.default";
    private static final String BOT_FRAMEWORK_SCOPE = "https://api.botframework.com/.default";
    private static final String BOT_FRAMEWORK_TOKEN_URL =
        "https://login.microsoftonline.com/botframework.com/oauth2/v2.0/token";

    @Value("${azure.request-timeout:15s}")
    private Duration requestTimeout;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── mitigation action store ───────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(name = "mitigation.store", havingValue = "memory", matchIfMissing = true)
    public MitigationActionStore inMemoryMitigationActionStore() {
        log.info("Mitigation action store selected. store=memory");
        return new InMemoryMitigationActionStore();
    }

    @Bean
    @ConditionalOnProperty(name = "mitigation.store", havingValue = "r2dbc")
    public MitigationActionStore r2dbcMitigationActionStore(MitigationActionRepository repository) {
        log.info("Mitigation action store selected. store=r2dbc");
        return new R2dbcMitigationActionStore(repository);
    }

    // ── signal providers ──────────────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(name = "directory.provider", havingValue = "memory", matchIfMissing = true)
    public IdentityProtectionProvider inMemoryIdentityProtectionProvider() {
        return InMemoryIdentityProtectionProvider.withSampleLevels();
    }

    @Bean
    @ConditionalOnProperty(name = "directory.provider", havingValue = "graph")
    public IdentityProtectionProvider graphIdentityProtectionProvider(GraphApiClient graphApiClient) {
        return new GraphIdentityProtectionProvider(graphApiClient);
    }

    @Bean
    @ConditionalOnProperty(name = "analytics.provider", havingValue = "memory", matchIfMissing = true)
    public InMemorySecurityAnalyticsProvider inMemorySecurityAnalyticsProvider() {
        log.info("Security analytics provider selected. provider=memory");
        return new InMemorySecurityAnalyticsProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "analytics.provider", havingValue = "sentinel")
    public SentinelAnalyticsProvider sentinelAnalyticsProvider(
            WebClient.Builder builder,
            @Value("${azure.tenant-id}") String tenantId,
            @Value("${azure.client-id}") String clientId,
            @Value("${azure.client-secret}") String clientSecret,
            @Value("${analytics.sentinel.workspace-id}") String workspaceId,
            @Value("${analytics.sentinel.base-url:https://api.loganalytics.io}") String baseUrl,
            @Value("${analytics.sentinel.baseline-window:168h}") Duration baselineWindow) {
        log.info("Security analytics provider selected. provider=sentinel workspaceId={}", workspaceId);
        AzureTokenProvider tokens = new AzureTokenProvider(AzureWebClients.timed(builder, null, requestTimeout),
            AzureTokenProvider.tenantTokenUrl(tenantId), clientId, clientSecret, LOG_ANALYTICS_SCOPE);
        GraphApiClient logAnalytics = new GraphApiClient(AzureWebClients.timed(builder, baseUrl, requestTimeout), tokens);
        return new SentinelAnalyticsProvider(logAnalytics, workspaceId, baselineWindow);
    }

    @Bean
    public PolicyComplianceProvider policyComplianceProvider(
            @Value("${compliance.compensated-controls:}") Set<String> compensatedControls) {
        return new RulePolicyComplianceProvider(compensatedControls);
    }

    // ── approval channel ──────────────────────────────────────────────────────

    @Bean
    public ApprovalChannel approvalChannel(
            WebClient.Builder builder,
            AdaptiveCardFactory cards,
            @Value("${approval.teams.enabled:false}") boolean enabled,
            @Value("${approval.teams.service-url:https://smba.trafficmanager.net/amer}") String serviceUrl,
            @Value("${approval.teams.bot-id:}") String botId,
            @Value("${approval.teams.bot-password:}") String botPassword,
            @Value("${approval.teams.channel-id:}") String channelId,
            @Value("${approval.teams.alert-channel-id:}") String alertChannelId,
            @Value("${approval.teams.investigation-channel-id:}") String investigationChannelId) {
        AzureTokenProvider botTokens = new AzureTokenProvider(AzureWebClients.timed(builder, null, requestTimeout),
            BOT_FRAMEWORK_TOKEN_URL, botId, botPassword, BOT_FRAMEWORK_SCOPE);
        log.info("Approval channel configured. teamsEnabled={}", enabled);
        return new TeamsApprovalChannel(AzureWebClients.timed(builder, serviceUrl, requestTimeout), botTokens,
            cards, enabled, botId, channelId, alertChannelId, investigationChannelId);
    }
}
