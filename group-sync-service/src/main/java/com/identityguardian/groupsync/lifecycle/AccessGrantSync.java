package com.identityguardian.groupsync.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Group mirrored for an access grant. {@code status} is member_added, unmapped or error. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessGrantSync(
    @JsonProperty("displayName") String displayName,
    @JsonProperty("groupId") String groupId,
    @JsonProperty("status") String status,
    @JsonProperty("detail") String detail
) {
    public static final String MEMBER_ADDED = "member_added";
    public static final String UNMAPPED     = "unmapped";
    public static final String ERROR        = "error";
}
