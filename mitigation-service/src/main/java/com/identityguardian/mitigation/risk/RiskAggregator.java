package com.identityguardian.mitigation.risk;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.exception.PrincipalNotFoundException;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.RiskAssessment;
import com.identityguardian.common.model.SubScore;
import com.identityguardian.mitigation.signal.BehaviorBaselineSignal;
import com.identityguardian.mitigation.signal.IdentityProtectionSignal;
import com.identityguardian.mitigation.signal.PolicyComplianceSignal;
import com.identityguardian.mitigation.signal.SecurityAnalyticsSignal;
import com.identityguardian.mitigation.signal.SignalReading;
import com.identityguardian.mitigation.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Combines every {@link SignalSource} into one {@link RiskAssessment}.
 *
 * <p>Sources are queried concurrently, each bounded by {@code risk.signal-timeout}. A source
 * that errors, times out or completes empty contributes an unavailable zero sub-score; the
 * assessment itself only fails when the principal cannot be resolved.
 */
@Service
public class RiskAggregator {

    private static final Logger log = LoggerFactory.getLogger(RiskAggregator.class);

    private final DirectoryService directory;
    private final List<SignalSource> sources;
    private final Duration signalTimeout;

    public RiskAggregator(DirectoryService directory,
                          List<SignalSource> sources,
                          @Value("${risk.signal-timeout:5s}") Duration signalTimeout) {
        this.directory     = directory;
        this.sources       = List.copyOf(sources);
        this.signalTimeout = signalTimeout;
    }

    public Mono<RiskAssessment> assess(String principalId) {
        return directory.getPrincipal(principalId)
            .switchIfEmpty(Mono.error(() -> new PrincipalNotFoundException(principalId)))
            .flatMap(this::assess);
    }

    public Mono<RiskAssessment> assess(Principal principal) {
        return Flux.range(0, sources.size())
            .flatMap(i -> readSoftly(sources.get(i), principal)
                .map(reading -> Tuples.of(i, reading.toSubScore(sources.get(i).name()))))
            .collectList()
            .map(indexed -> {
                List<SubScore> ordered = indexed.stream()
                    .sorted(Comparator.comparing(Tuple2::getT1))
                    .map(Tuple2::getT2)
                    .toList();
                RiskAssessment assessment = RiskAssessment.assemble(principal.id(), ordered,
                    remediationSteps(ordered), Instant.now());
                log.info("Risk assessed. principalId={} composite={} level={}",
                    principal.id(), assessment.compositeScore(), assessment.riskLevel());
                return assessment;
            });
    }

    private Mono<SignalReading> readSoftly(SignalSource source, Principal principal) {
        return Mono.defer(() -> source.read(principal))
            .timeout(signalTimeout)
            .defaultIfEmpty(SignalReading.unavailable("no reading"))
            .onErrorResume(e -> {
                String reason = e instanceof TimeoutException
                    ? "timed out after " + signalTimeout.toMillis() + "ms"
                    : e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.warn("Signal source unavailable. source={} principalId={} reason={}",
                    source.name(), principal.id(), reason);
                return Mono.just(SignalReading.unavailable(reason));
            });
    }

    private static List<String> remediationSteps(List<SubScore> subScores) {
        List<String> steps = new ArrayList<>();
        if (contributes(subScores, IdentityProtectionSignal.NAME)) {
            steps.add("Confirm or dismiss the identity protection risk and require a password reset");
        }
        if (contributes(subScores, SecurityAnalyticsSignal.NAME)) {
            steps.add("Review risky sign-ins and recent role changes in the security analytics workspace");
        }
        if (contributes(subScores, BehaviorBaselineSignal.NAME)) {
            steps.add("Investigate recent user activity for anomalies");
        }
        if (contributes(subScores, PolicyComplianceSignal.NAME)) {
            steps.add("Review and remediate policy violations immediately");
        }
        if (subScores.stream().anyMatch(s -> !s.available())) {
            steps.add("Re-assess once unavailable signal sources recover");
        }
        steps.add("Schedule access review with user's manager");
        return steps;
    }

    private static boolean contributes(List<SubScore> subScores, String source) {
        return subScores.stream().anyMatch(s -> s.source().equals(source) && s.points() > 0);
    }
}
