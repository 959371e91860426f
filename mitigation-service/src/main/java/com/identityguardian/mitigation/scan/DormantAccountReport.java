package com.identityguardian.mitigation.scan;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Active principals with no sign-in in the last {@code inactiveDays}, sorted by principal id. */
public record DormantAccountReport(
    @JsonProperty("reportId") String reportId,
    @JsonProperty("generatedAt") Instant generatedAt,
    @JsonProperty("inactiveDays") int inactiveDays,
    @JsonProperty("totalPrincipalsScanned") int totalPrincipalsScanned,
    @JsonProperty("dormantAccounts") List<DormantAccount> dormantAccounts,
    @JsonProperty("failedPrincipals") List<String> failedPrincipals
) {
    @JsonProperty("dormantAccountsFound")
    public int dormantAccountsFound() {
        return dormantAccounts.size();
    }
}
