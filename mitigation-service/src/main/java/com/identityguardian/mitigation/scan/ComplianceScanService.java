package com.identityguardian.mitigation.scan;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.model.PrincipalFilter;
import com.identityguardian.common.model.RiskAssessment;
import com.identityguardian.common.model.RiskLevel;
import com.identityguardian.common.model.SubScore;
import com.identityguardian.mitigation.risk.RiskAggregator;
import com.identityguardian.mitigation.signal.PolicyComplianceSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Assesses every active principal with bounded concurrency ({@code risk.scan-concurrency}) and
 * summarises the results. Read-only: no mitigation is taken. A principal whose assessment fails
 * is listed in the report instead of aborting the scan.
 */
@Service
public class ComplianceScanService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceScanService.class);

    private final DirectoryService directory;
    private final RiskAggregator aggregator;
    private final int concurrency;

    public ComplianceScanService(DirectoryService directory,
                                 RiskAggregator aggregator,
                                 @Value("${risk.scan-concurrency:4}") int concurrency) {
        this.directory   = directory;
        this.aggregator  = aggregator;
        this.concurrency = Math.max(1, concurrency);
    }

    public Mono<ComplianceReport> scan() {
        List<String> failed = Collections.synchronizedList(new ArrayList<>());
        return directory.listPrincipals(PrincipalFilter.activeOnly())
            .flatMap(principal -> aggregator.assess(principal)
                .onErrorResume(e -> {
                    log.warn("Scan skipped principal. principalId={} error={}", principal.id(), e.getMessage());
                    failed.add(principal.id());
                    return Mono.empty();
                }), concurrency)
            .collectList()
            .map(assessments -> summarise(assessments, List.copyOf(failed)));
    }

    private ComplianceReport summarise(List<RiskAssessment> assessments, List<String> failed) {
        Map<RiskLevel, Integer> byLevel = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            byLevel.put(level, 0);
        }
        List<String> highRisk = new ArrayList<>();
        int withViolations = 0;
        int totalViolations = 0;

        for (RiskAssessment assessment : assessments) {
            byLevel.merge(assessment.riskLevel(), 1, Integer::sum);
            if (assessment.riskLevel().isElevated()) {
                highRisk.add(assessment.principalId());
            }
            Optional<SubScore> compliance = assessment.subScore(PolicyComplianceSignal.NAME);
            int violations = compliance.map(SubScore::findings).orElse(0);
            if (violations > 0) {
                withViolations++;
                totalViolations += violations;
            }
        }

        int assessed = assessments.size();
        double rate = assessed == 0 ? 100.0
            : Math.round((assessed - highRisk.size()) * 1000.0 / assessed) / 10.0;
        Collections.sort(highRisk);

        log.info("Compliance scan complete. assessed={} failed={} highRisk={} withViolations={} rate={}",
            assessed, failed.size(), highRisk.size(), withViolations, rate);

        return new ComplianceReport(UUID.randomUUID().toString(), Instant.now(),
            assessed + failed.size(), assessed, failed, byLevel, highRisk,
            withViolations, totalViolations, rate);
    }
}
