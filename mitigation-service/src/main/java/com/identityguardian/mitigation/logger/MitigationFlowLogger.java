package com.identityguardian.mitigation.logger;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a mitigation's lifecycle without touching pipeline behaviour.
 *
 * <ol>
 *   <li>{@link #RISK_ASSESSED}         composite score computed</li>
 *   <li>{@link #PENDING_REUSED}        principal already has a pending review</li>
 *   <li>{@link #DIRECTORY_ACTED}       block or fallback disable attempted</li>
 *   <li>{@link #ACTION_RECORDED}       action stored</li>
 *   <li>{@link #REVIEWER_NOTIFIED}     approval card dispatch finished (sent or failed)</li>
 *   <li>{@link #CALLBACK_RESOLVED}     reviewer decision applied</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(MitigationFlowLogger.RISK_ASSESSED))
 * </pre>
 */
@Component
public class MitigationFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(MitigationFlowLogger.class);

    public static final String RISK_ASSESSED     = "RISK_ASSESSED";
    public static final String PENDING_REUSED    = "PENDING_REUSED";
    public static final String DIRECTORY_ACTED   = "DIRECTORY_ACTED";
    public static final String ACTION_RECORDED   = "ACTION_RECORDED";
    public static final String REVIEWER_NOTIFIED = "REVIEWER_NOTIFIED";
    public static final String CALLBACK_RESOLVED = "CALLBACK_RESOLVED";

    /**
     * {@code doOnEach} consumer that logs the stage on {@code onNext} only. The traceId is read
     * from the Reactor Context and bridged to MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[MitigationFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** {@code doOnEach} consumer that also logs the action's principal, kind and state. */
    public Consumer<Signal<MitigationAction>> action(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            MitigationAction action = signal.get();
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[MitigationFlow] stage={} principalId={} kind={} state={} token={} "
                         + "notification={} traceId={}",
                         stageName, action.principalId(), action.kind(), action.state(),
                         action.correlationToken(), action.notificationStatus(), traceId)
            );
        };
    }
}
