package com.identityguardian.groupsync.reconciler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of stripping one principal from every group. {@code failed} lists groups whose
 * removal call errored; {@code listingError} is set when the group enumeration itself broke
 * off, in which case later groups were never seen.
 */
public record PurgeResult(
    @JsonProperty("principalId") String principalId,
    @JsonProperty("removedFrom") List<String> removedFrom,
    @JsonProperty("failed") List<String> failed,
    @JsonProperty("listingError") String listingError
) {
    public PurgeResult {
        removedFrom = List.copyOf(removedFrom);
        failed = List.copyOf(failed);
    }

    @JsonProperty("removedCount")
    public int removedCount() {
        return removedFrom.size();
    }

    @JsonIgnore
    public boolean complete() {
        return failed.isEmpty() && listingError == null;
    }
}
