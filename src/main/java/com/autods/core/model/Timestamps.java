package com.autods.core.model;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * UTC timestamps in the ISO-8601 form used by artifacts and the memory file.
 */
public final class Timestamps {

    private Timestamps() {}

    public static String nowIso() {
        return nowIso(Clock.systemUTC());
    }

    public static String nowIso(Clock clock) {
        return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
