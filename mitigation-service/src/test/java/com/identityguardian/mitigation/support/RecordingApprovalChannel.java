package com.identityguardian.mitigation.support;

import com.identityguardian.common.exception.IdentityGuardianException;
import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.mitigation.approval.ApprovalChannel;
import com.identityguardian.mitigation.approval.PrivilegedAccessRequest;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Records every card instead of sending it; can be switched to fail like an unreachable channel. */
public class RecordingApprovalChannel implements ApprovalChannel {

    public final List<MitigationAction> reviews = new CopyOnWriteArrayList<>();
    public final List<MitigationAction> alerts = new CopyOnWriteArrayList<>();
    public final List<String> restorations = new CopyOnWriteArrayList<>();
    public final List<PrivilegedAccessRequest> privilegedRequests = new CopyOnWriteArrayList<>();

    private volatile boolean unreachable;

    public void setUnreachable(boolean unreachable) {
        this.unreachable = unreachable;
    }

    @Override
    public Mono<Void> sendMitigationReview(MitigationAction action) {
        return record(() -> reviews.add(action));
    }

    @Override
    public Mono<Void> sendHighRiskAlert(MitigationAction action) {
        return record(() -> alerts.add(action));
    }

    @Override
    public Mono<Void> sendRestorationNotice(String principalId, String outcome) {
        return record(() -> restorations.add(principalId));
    }

    @Override
    public Mono<Void> sendPrivilegedAccessRequest(PrivilegedAccessRequest request) {
        return record(() -> privilegedRequests.add(request));
    }

    private Mono<Void> record(Runnable sink) {
        if (unreachable) {
            return Mono.error(new IdentityGuardianException("teams", "channel unreachable"));
        }
        return Mono.fromRunnable(sink);
    }
}
