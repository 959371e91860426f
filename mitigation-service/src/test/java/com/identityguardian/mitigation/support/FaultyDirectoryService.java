package com.identityguardian.mitigation.support;

import com.identityguardian.common.directory.DirectoryException;
import com.identityguardian.common.directory.InMemoryDirectoryService;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sample tenant that counts mutating calls and can be told to fail them.
 */
public class FaultyDirectoryService extends InMemoryDirectoryService {

    public final AtomicInteger blockCalls = new AtomicInteger();
    public final AtomicInteger disableCalls = new AtomicInteger();
    public final AtomicInteger removeBlockCalls = new AtomicInteger();
    public final AtomicInteger enableCalls = new AtomicInteger();

    public volatile boolean failBlock;
    public volatile boolean failDisable;
    public volatile boolean failRemoveBlock;
    public volatile Duration removeBlockDelay = Duration.ZERO;

    public static FaultyDirectoryService sampleTenant() {
        FaultyDirectoryService directory = new FaultyDirectoryService();
        directory.seedSampleTenant();
        return directory;
    }

    public int mutationCount() {
        return blockCalls.get() + disableCalls.get() + removeBlockCalls.get() + enableCalls.get();
    }

    @Override
    public Mono<String> conditionalAccessBlock(String principalId, String reason) {
        blockCalls.incrementAndGet();
        return failBlock
            ? Mono.error(new DirectoryException("Conditional access is not licensed for this tenant"))
            : super.conditionalAccessBlock(principalId, reason);
    }

    @Override
    public Mono<String> disablePrincipal(String principalId, String reason) {
        disableCalls.incrementAndGet();
        return failDisable
            ? Mono.error(new DirectoryException("Insufficient privileges to disable " + principalId))
            : super.disablePrincipal(principalId, reason);
    }

    @Override
    public Mono<String> removeConditionalAccessBlock(String principalId) {
        removeBlockCalls.incrementAndGet();
        Mono<String> call = failRemoveBlock
            ? Mono.error(new DirectoryException("Policy deletion rejected"))
            : super.removeConditionalAccessBlock(principalId);
        return removeBlockDelay.isZero() ? call : Mono.delay(removeBlockDelay).then(call);
    }

    @Override
    public Mono<String> enablePrincipal(String principalId) {
        enableCalls.incrementAndGet();
        return super.enablePrincipal(principalId);
    }
}
