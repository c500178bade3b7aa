package org.realityforge.sqldeploy.script;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

public final class AgePolicy {
    public static final String TOO_OLD_REASON = "Older than allowed threshold";

    public enum Verdict {
        IN_WINDOW,
        TOO_OLD
    }

    private final int maxMonths;
    private final Clock clock;

    public AgePolicy(final int maxMonths, final Clock clock) {
        if (maxMonths < 0) {
            throw new IllegalArgumentException("maxMonths must not be negative but was " + maxMonths);
        }
        this.maxMonths = maxMonths;
        this.clock = clock;
    }

    // A "month" is a 30 day block, not a calendar month.
    public Instant cutoff() {
        return clock.instant().minus(Duration.ofDays(30L * maxMonths));
    }

    public Verdict check(final LocalDate scriptDate) {
        final Instant scriptInstant = scriptDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        return scriptInstant.isBefore(cutoff()) ? Verdict.TOO_OLD : Verdict.IN_WINDOW;
    }
}
