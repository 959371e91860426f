package com.identityguardian.groupsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Map;
import java.util.Optional;

/**
 * Group naming and role → group mapping ({@code groups.*}).
 *
 * <pre>
 * groups:
 *   prefix: IG-
 *   purge-concurrency: 4
 *   role-group-map:
 *     "[Financial Analyst]": Finance-Analysts
 *     "[financial_records]": Finance-Data-Readers
 * </pre>
 *
 * The map is keyed by job role for lifecycle events and by resource id for access grants.
 */
@ConfigurationProperties(prefix = "groups")
public record GroupSyncProperties(
    @DefaultValue("IG-") String prefix,
    Map<String, String> roleGroupMap,
    @DefaultValue("4") int purgeConcurrency
) {
    public GroupSyncProperties {
        prefix = prefix == null ? "" : prefix;
        roleGroupMap = roleGroupMap == null ? Map.of() : Map.copyOf(roleGroupMap);
        purgeConcurrency = Math.max(1, purgeConcurrency);
    }

    public Optional<String> groupFor(String roleOrResource) {
        if (roleOrResource == null) return Optional.empty();
        return Optional.ofNullable(roleGroupMap.get(roleOrResource.trim()));
    }
}
