package com.identityguardian.mitigation.approval;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Text acknowledgement returned to the approval channel, rendered back to the reviewer. */
public record CallbackResponse(@JsonProperty("text") String text) {

    public static CallbackResponse ignored() {
        return new CallbackResponse("Ignored.");
    }
}
