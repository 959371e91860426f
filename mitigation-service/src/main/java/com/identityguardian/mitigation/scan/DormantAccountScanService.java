package com.identityguardian.mitigation.scan;

import com.identityguardian.common.directory.DirectoryService;
import com.identityguardian.common.model.Principal;
import com.identityguardian.common.model.PrincipalFilter;
import com.identityguardian.mitigation.signal.provider.SecurityAnalyticsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finds active principals that have not signed in for {@code inactiveDays}. Sign-in counts come
 * from the analytics workspace, one query per principal with bounded concurrency. A principal
 * whose query fails is listed as failed, never as dormant.
 */
@Service
public class DormantAccountScanService {

    private static final Logger log = LoggerFactory.getLogger(DormantAccountScanService.class);

    static final String RECOMMENDATION = "Disable account";

    private final DirectoryService directory;
    private final SecurityAnalyticsProvider analytics;
    private final int concurrency;
    private final int defaultInactiveDays;

    public DormantAccountScanService(DirectoryService directory,
                                     SecurityAnalyticsProvider analytics,
                                     @Value("${risk.scan-concurrency:4}") int concurrency,
                                     @Value("${scan.dormant.inactive-days:90}") int defaultInactiveDays) {
        this.directory           = directory;
        this.analytics           = analytics;
        this.concurrency         = Math.max(1, concurrency);
        this.defaultInactiveDays = defaultInactiveDays;
    }

    public Mono<DormantAccountReport> scan() {
        return scan(defaultInactiveDays);
    }

    public Mono<DormantAccountReport> scan(int inactiveDays) {
        if (inactiveDays < 1) {
            return Mono.error(new IllegalArgumentException("inactiveDays must be at least 1"));
        }
        Duration window = Duration.ofDays(inactiveDays);
        List<String> failed = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger scanned = new AtomicInteger();

        return directory.listPrincipals(PrincipalFilter.activeOnly())
            .doOnNext(p -> scanned.incrementAndGet())
            .flatMap(principal -> analytics.countSignIns(principal, window)
                .map(count -> count == 0 ? Optional.of(dormant(principal, inactiveDays)) : Optional.<DormantAccount>empty())
                .onErrorResume(e -> {
                    log.warn("Dormancy check skipped principal. principalId={} error={}", principal.id(), e.getMessage());
                    failed.add(principal.id());
                    return Mono.just(Optional.<DormantAccount>empty());
                }), concurrency)
            .filter(Optional::isPresent)
            .map(Optional::get)
            .sort(Comparator.comparing(DormantAccount::principalId))
            .collectList()
            .map(accounts -> {
                List<String> failedSorted = failed.stream().sorted().toList();
                if (!accounts.isEmpty()) {
                    log.warn("Dormant accounts found. count={} inactiveDays={}", accounts.size(), inactiveDays);
                }
                log.info("Dormant account scan complete. scanned={} dormant={} failed={}",
                    scanned.get(), accounts.size(), failedSorted.size());
                return new DormantAccountReport(UUID.randomUUID().toString(), Instant.now(), inactiveDays,
                    scanned.get(), accounts, failedSorted);
            });
    }

    private static DormantAccount dormant(Principal principal, int inactiveDays) {
        return new DormantAccount(principal.id(), principal.userPrincipalName(), principal.department(),
            "None in last " + inactiveDays + " days", RECOMMENDATION);
    }
}
