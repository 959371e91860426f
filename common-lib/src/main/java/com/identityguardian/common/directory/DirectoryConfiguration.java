package com.identityguardian.common.directory;

import com.identityguardian.common.azure.AzureTokenProvider;
import com.identityguardian.common.azure.AzureWebClients;
import com.identityguardian.common.azure.GraphApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Selects the {@link DirectoryService} strategy once at startup.
 *
 * <pre>
 *   directory.provider=memory   (default) seeded in-process tenant
 *   directory.provider=graph    Microsoft Graph, client-credentials auth
 * </pre>
 */
@Configuration
public class DirectoryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DirectoryConfiguration.class);

    private static final String GRAPH_SCOPE = "https://graph.microsoft.com/.default";

    @Bean
    @ConditionalOnProperty(name = "directory.provider", havingValue = "memory", matchIfMissing = true)
    public DirectoryService inMemoryDirectoryService() {
        log.info("Directory strategy selected. provider=memory");
        return InMemoryDirectoryService.withSampleTenant();
    }

    @Bean
    @ConditionalOnProperty(name = "directory.provider", havingValue = "graph")
    public AzureTokenProvider graphTokenProvider(
            WebClient.Builder builder,
            @Value("${azure.tenant-id}") String tenantId,
            @Value("${azure.client-id}") String clientId,
            @Value("${azure.client-secret}") String clientSecret,
            @Value("${azure.request-timeout:15s}") Duration timeout) {
        return new AzureTokenProvider(AzureWebClients.timed(builder, null, timeout),
            AzureTokenProvider.tenantTokenUrl(tenantId), clientId, clientSecret, GRAPH_SCOPE);
    }

    @Bean
    @ConditionalOnProperty(name = "directory.provider", havingValue = "graph")
    public GraphApiClient graphApiClient(
            WebClient.Builder builder,
            AzureTokenProvider graphTokenProvider,
            @Value("${graph.base-url:https://graph.microsoft.com/v1.0}") String baseUrl,
            @Value("${azure.request-timeout:15s}") Duration timeout) {
        return new GraphApiClient(AzureWebClients.timed(builder, baseUrl, timeout), graphTokenProvider);
    }

    @Bean
    @ConditionalOnProperty(name = "directory.provider", havingValue = "graph")
    public DirectoryService graphDirectoryService(
            GraphApiClient graphApiClient,
            @Value("${graph.conditional-access.policy-prefix:IG-}") String policyPrefix,
            @Value("${graph.conditional-access.template-id:}") String templateId) {
        log.info("Directory strategy selected. provider=graph policyPrefix={} templateConfigured={}",
            policyPrefix, !templateId.isBlank());
        return new GraphDirectoryService(graphApiClient, policyPrefix, templateId);
    }
}
