package com.identityguardian.mitigation.signal;

import com.identityguardian.common.model.Principal;
import reactor.core.publisher.Mono;

/**
 * One independently queryable provider of risk indicators.
 *
 * <p>Implementations may signal errors freely; the aggregator bounds each call with a timeout
 * and converts any failure into {@link SignalReading#unavailable(String)}. Sub-scores are
 * reported in bean order ({@link org.springframework.core.annotation.Order}).
 */
public interface SignalSource {

    /** Stable source name carried on the sub-score, e.g. {@code identity_protection}. */
    String name();

    Mono<SignalReading> read(Principal principal);
}
