package com.identityguardian.mitigation.signal;

import com.identityguardian.common.model.SubScore;

/**
 * Tagged result of a signal source: either a reading ({@code available=true}) or an
 * unavailable marker carrying the reason. Unavailable readings contribute zero points.
 */
public record SignalReading(boolean available, int points, String evidence, int findings) {

    public static SignalReading ok(int points, String evidence, int findings) {
        return new SignalReading(true, points, evidence, findings);
    }

    public static SignalReading unavailable(String reason) {
        return new SignalReading(false, 0, "unavailable: " + reason, 0);
    }

    public SubScore toSubScore(String source) {
        return new SubScore(source, points, evidence, available, findings);
    }
}
