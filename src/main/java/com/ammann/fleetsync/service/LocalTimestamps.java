/* (C)2026 */
package com.ammann.fleetsync.service;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/** Converts daemon-reported timestamps to local wall-clock time. */
final class LocalTimestamps {

    /** Docker reports this instant for "never", e.g. the finish time of a running container. */
    static final String ZERO_TIME_PREFIX = "0001-01-01";

    private LocalTimestamps() {}

    /**
     * Parses an ISO-8601 timestamp and shifts it into {@code zone}, dropping the zone.
     *
     * <p>Values without an offset are taken to be local already.
     *
     * @param value the reported timestamp, may be {@code null}
     * @param zone  the local zone
     * @return the local date-time, or {@code null} for blank, zero or unparseable values
     */
    static LocalDateTime toLocal(String value, ZoneId zone) {
        if (value == null || value.isBlank() || value.startsWith(ZERO_TIME_PREFIX)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).atZoneSameInstant(zone).toLocalDateTime();
        } catch (DateTimeParseException withoutOffset) {
            try {
                return LocalDateTime.parse(value);
            } catch (DateTimeParseException unparseable) {
                return null;
            }
        }
    }
}
