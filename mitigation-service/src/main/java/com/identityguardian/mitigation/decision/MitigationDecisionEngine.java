package com.identityguardian.mitigation.decision;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.MitigationKind;
import com.identityguardian.common.model.NotificationStatus;
import com.identityguardian.common.model.RiskAssessment;
import com.identityguardian.common.model.SubScore;
import com.identityguardian.mitigation.approval.ApprovalChannel;
import com.identityguardian.mitigation.logger.MitigationFlowLogger;
import com.identityguardian.mitigation.risk.RiskAggregator;
import com.identityguardian.mitigation.store.MitigationActionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Turns a risk assessment into a mitigation action.
 *
 * <pre>
 *   composite &lt; threshold  → MONITOR / APPLIED, no directory call
 *   composite ≥ threshold  → existing pending action, if any, returned unchanged
 *                            else conditional access block
 *                                 on failure → disable principal
 *                            → PENDING_REVIEW + investigation card + high-risk alert
 * </pre>
 *
 * <p>A failed block and failed fallback still open a pending review so a reviewer is alerted.
 * A notification failure is recorded as {@link NotificationStatus#FAILED} and never undoes the
 * directory action. Concurrent evaluations of one principal share a single in-flight pipeline.
 */
@Service
public class MitigationDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(MitigationDecisionEngine.class);

    private final RiskAggregator aggregator;
    private final DirectoryService directory;
    private final MitigationActionStore store;
    private final ApprovalChannel approvalChannel;
    private final MitigationFlowLogger flowLogger;
    private final int autoThreshold;

    private final Map<String, Mono<MitigationAction>> inFlight = new ConcurrentHashMap<>();

    public MitigationDecisionEngine(RiskAggregator aggregator,
                                    DirectoryService directory,
                                    MitigationActionStore store,
                                    ApprovalChannel approvalChannel,
                                    MitigationFlowLogger flowLogger,
                                    @Value("${mitigation.auto-threshold:90}") int autoThreshold) {
        this.aggregator      = aggregator;
        this.directory       = directory;
        this.store           = store;
        this.approvalChannel = approvalChannel;
        this.flowLogger      = flowLogger;
        this.autoThreshold   = autoThreshold;
    }

    public Mono<MitigationAction> evaluate(String principalId) {
        return Mono.defer(() -> {
            AtomicReference<Mono<MitigationAction>> self = new AtomicReference<>();
            Mono<MitigationAction> pipeline = decide(principalId)
                .doFinally(signal -> inFlight.remove(principalId, self.get()))
                .cache();
            self.set(pipeline);
            Mono<MitigationAction> running = inFlight.putIfAbsent(principalId, pipeline);
            if (running != null) {
                log.info("Evaluation already in flight, joining. principalId={}", principalId);
                return running;
            }
            return pipeline;
        });
    }

    public int autoThreshold() {
        return autoThreshold;
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<MitigationAction> decide(String principalId) {
        return aggregator.assess(principalId)
            .doOnEach(flowLogger.stage(MitigationFlowLogger.RISK_ASSESSED))
            .flatMap(assessment -> assessment.compositeScore() < autoThreshold
                ? monitor(assessment)
                : store.findPendingByPrincipal(principalId)
                    .doOnEach(flowLogger.action(MitigationFlowLogger.PENDING_REUSED))
                    .switchIfEmpty(Mono.defer(() -> mitigate(assessment))));
    }

    private Mono<MitigationAction> monitor(RiskAssessment assessment) {
        String reason = "Risk " + assessment.compositeScore() + " below auto-mitigation threshold "
            + autoThreshold + " " + breakdown(assessment);
        return store.save(MitigationAction.monitor(assessment.principalId(), assessment.compositeScore(),
                reason, Instant.now()))
            .doOnEach(flowLogger.action(MitigationFlowLogger.ACTION_RECORDED));
    }

    private Mono<MitigationAction> mitigate(RiskAssessment assessment) {
        String principalId = assessment.principalId();
        String reason = "Auto-mitigation: Risk " + assessment.compositeScore() + " " + breakdown(assessment);

        return applyDirectoryAction(principalId, reason)
            .doOnEach(flowLogger.stage(MitigationFlowLogger.DIRECTORY_ACTED))
            .map(outcome -> MitigationAction.pendingReview(principalId, outcome.kind(),
                assessment.compositeScore(), reason, outcome.succeeded(), outcome.message(), Instant.now()))
            .flatMap(candidate -> store.insertPending(candidate)
                .flatMap(stored -> stored.correlationToken().equals(candidate.correlationToken())
                    ? notifyReviewers(stored)
                    : Mono.just(stored)))
            .doOnEach(flowLogger.action(MitigationFlowLogger.ACTION_RECORDED));
    }

    /** Conditional access block first; disable as the substitute mechanism on any failure. */
    private Mono<DirectoryOutcome> applyDirectoryAction(String principalId, String reason) {
        return directory.conditionalAccessBlock(principalId, reason)
            .map(message -> new DirectoryOutcome(MitigationKind.CONDITIONAL_ACCESS_BLOCK, true, message))
            .onErrorResume(blockError -> {
                log.warn("Conditional access block failed, falling back to disable. principalId={} error={}",
                    principalId, blockError.getMessage());
                String blockFailure = "Conditional access block failed: " + blockError.getMessage() + ". ";
                return directory.disablePrincipal(principalId, reason)
                    .map(message -> new DirectoryOutcome(MitigationKind.DISABLE, true, blockFailure + message))
                    .onErrorResume(disableError -> {
                        log.error("Fallback disable failed. principalId={} error={}",
                            principalId, disableError.getMessage());
                        return Mono.just(new DirectoryOutcome(MitigationKind.DISABLE, false,
                            blockFailure + "Disable failed: " + disableError.getMessage()));
                    });
            });
    }

    private Mono<MitigationAction> notifyReviewers(MitigationAction action) {
        Mono<Void> alert = approvalChannel.sendHighRiskAlert(action)
            .onErrorResume(e -> {
                log.warn("High-risk alert failed. principalId={} error={}", action.principalId(), e.getMessage());
                return Mono.empty();
            });

        return approvalChannel.sendMitigationReview(action)
            .thenReturn(NotificationStatus.SENT)
            .onErrorResume(e -> {
                log.warn("Approval card dispatch failed; action stays pending. principalId={} token={} error={}",
                    action.principalId(), action.correlationToken(), e.getMessage());
                return Mono.just(NotificationStatus.FAILED);
            })
            .flatMap(status -> alert.then(store.updateNotificationStatus(action.correlationToken(), status)))
            .defaultIfEmpty(action)
            .doOnEach(flowLogger.action(MitigationFlowLogger.REVIEWER_NOTIFIED));
    }

    private static String breakdown(RiskAssessment assessment) {
        return assessment.subScores().stream()
            .map(MitigationDecisionEngine::describe)
            .collect(Collectors.joining(", ", "(", ")"));
    }

    private static String describe(SubScore subScore) {
        return subScore.available()
            ? subScore.source() + ": " + subScore.points()
            : subScore.source() + ": unavailable";
    }
}
