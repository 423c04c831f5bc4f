package com.tidewatch.guard;

import org.json.JSONObject;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of the real-time reconfirmation of a provisional entry.
 */
public final class GuardVerdict {
    public static final String REASON_PASS = "pass";
    public static final String REASON_DATA_UNAVAILABLE = "data_unavailable";

    public final Verdict verdict;
    public final String reason;
    public final Instant checkedAt;

    public GuardVerdict(Verdict verdict, String reason, Instant checkedAt) {
        this.verdict = Objects.requireNonNull(verdict, "verdict");
        this.reason = reason == null ? "" : reason;
        this.checkedAt = Objects.requireNonNull(checkedAt, "checkedAt");
    }

    public static GuardVerdict pass(Instant at) {
        return new GuardVerdict(Verdict.PASS, REASON_PASS, at);
    }

    public static GuardVerdict block(String reason, Instant at) {
        return new GuardVerdict(Verdict.BLOCK, reason, at);
    }

    public static GuardVerdict downgrade(String reason, Instant at) {
        return new GuardVerdict(Verdict.DOWNGRADE, reason, at);
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("verdict", verdict.code());
        out.put("reason", reason);
        out.put("checked_at", checkedAt.toString());
        return out;
    }

    @Override
    public String toString() {
        return verdict.code() + "(" + reason + ")";
    }
}
