package com.geodash.model;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

public final class TimeSupport {

    private TimeSupport() {
    }

    /**
     * Current time in UTC at the precision PostgreSQL stores, so values survive a round trip unchanged.
     */
    public static OffsetDateTime utcNow() {
        return OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
