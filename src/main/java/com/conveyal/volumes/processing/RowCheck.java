package com.conveyal.volumes.processing;

/**
 * Outcome of validating a single input row: either it passed, or it failed for a stated reason.
 */
public final class RowCheck {

    private static final RowCheck PASS = new RowCheck(true, null);

    public final boolean passed;

    public final String reason;

    private RowCheck (boolean passed, String reason) {
        this.passed = passed;
        this.reason = reason;
    }

    public static RowCheck pass () {
        return PASS;
    }

    public static RowCheck fail (String format, Object... args) {
        return new RowCheck(false, String.format(format, args));
    }

    @Override
    public String toString () {
        return passed ? "PASS" : "FAIL: " + reason;
    }
}
