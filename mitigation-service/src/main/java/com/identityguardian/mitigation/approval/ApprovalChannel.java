package com.identityguardian.mitigation.approval;

import com.identityguardian.common.model.MitigationAction;
import reactor.core.publisher.Mono;

/**
 * Outbound side of the human approval loop. Every method completes empty on delivery and
 * signals an error when the channel could not be reached; callers decide whether that matters.
 */
public interface ApprovalChannel {

    /** Investigation card with re-enable / keep-blocked responses correlated by token. */
    Mono<Void> sendMitigationReview(MitigationAction action);

    Mono<Void> sendHighRiskAlert(MitigationAction action);

    Mono<Void> sendRestorationNotice(String principalId, String outcome);

    /** Approve / reject card for a privileged elevation request, correlated by request id. */
    Mono<Void> sendPrivilegedAccessRequest(PrivilegedAccessRequest request);
}
