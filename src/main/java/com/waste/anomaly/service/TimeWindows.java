package com.waste.anomaly.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Calendar arithmetic in the configured civil zone.
 */
final class TimeWindows {

    private TimeWindows() {}

    static Instant startOfDay(Instant instant, ZoneId zone) {
        return LocalDate.ofInstant(instant, zone).atStartOfDay(zone).toInstant();
    }

    static Instant startOfNextDay(Instant instant, ZoneId zone) {
        return LocalDate.ofInstant(instant, zone).plusDays(1).atStartOfDay(zone).toInstant();
    }

    static Instant daysBefore(Instant instant, int days, ZoneId zone) {
        return instant.atZone(zone).minusDays(days).toInstant();
    }
}
