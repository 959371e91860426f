package com.identityguardian.mitigation.decision;

import com.identityguardian.common.model.MitigationKind;

/** What the directory did for one mitigation: the mechanism used and whether it took effect. */
record DirectoryOutcome(MitigationKind kind, boolean succeeded, String message) {}
