package com.identityguardian.mitigation.scan;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.PrincipalFilter;
import com.identityguardian.mitigation.config.SegregationOfDutiesProperties;
import com.identityguardian.mitigation.config.SegregationOfDutiesProperties.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/** Checks every active principal's directory roles against the configured conflicting role sets. */
@Service
public class SegregationOfDutiesScanService {

    private static final Logger log = LoggerFactory.getLogger(SegregationOfDutiesScanService.class);

    static final String SEVERITY = "high";

    private final DirectoryService directory;
    private final List<Policy> policies;

    public SegregationOfDutiesScanService(DirectoryService directory, SegregationOfDutiesProperties properties) {
        this.directory = directory;
        this.policies  = properties.policies();
    }

    public Mono<SodReport> scan() {
        return directory.listPrincipals(PrincipalFilter.activeOnly())
            .collectList()
            .map(principals -> {
                List<SodViolation> violations = new ArrayList<>();
                for (Principal principal : principals) {
                    violations.addAll(violationsOf(principal));
                }
                log.info("Segregation of duties scan complete. scanned={} policies={} violations={}",
                    principals.size(), policies.size(), violations.size());
                return new SodReport(UUID.randomUUID().toString(), Instant.now(), principals.size(),
                    List.copyOf(violations));
            });
    }

    List<SodViolation> violationsOf(Principal principal) {
        Set<String> held = principal.roles().stream()
            .map(SegregationOfDutiesScanService::key)
            .collect(Collectors.toSet());
        List<SodViolation> found = new ArrayList<>();
        for (Policy policy : policies) {
            for (List<String> conflict : policy.conflictingRoles()) {
                // an empty set would match everyone
                if (!conflict.isEmpty() && conflict.stream().map(SegregationOfDutiesScanService::key).allMatch(held::contains)) {
                    found.add(new SodViolation(principal.id(), principal.userPrincipalName(),
                        policy.policyId(), policy.name(), conflict, SEVERITY));
                }
            }
        }
        return found;
    }

    private static String key(String role) {
        return role.trim().toLowerCase(Locale.ROOT);
    }
}
