/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.utils;

import org.opensearch.common.time.DateFormatter;
import org.opensearch.common.time.DateFormatters;
import org.opensearch.common.time.FormatNames;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Conversions between {@link Instant} and the timestamp encodings used by the analytic backend.
 *
 * <p>The backend accepts ISO-8601 dates in requests and returns bucket timestamps either as
 * ISO-8601 strings or as {@code yyyy-MM-dd HH:mm:ss} strings. Timestamps without an offset are UTC.</p>
 */
public final class Time {

    private static final String BACKEND_DATE_FORMAT_PATTERN = FormatNames.STRICT_DATE_OPTIONAL_TIME.getSnakeCaseName()
        + "||uuuu-MM-dd HH:mm:ss";

    private static final DateFormatter BACKEND_DATE_FORMATTER = DateFormatter.forPattern(BACKEND_DATE_FORMAT_PATTERN);

    private static final DateFormatter REQUEST_DATE_FORMATTER = DateFormatter.forPattern(FormatNames.STRICT_DATE_TIME.getSnakeCaseName());

    private Time() {}

    /**
     * Parses a backend timestamp into epoch seconds.
     *
     * @param value a timestamp string, or a number already holding epoch seconds
     * @return epoch seconds, sub-second precision is truncated
     * @throws IllegalArgumentException if the value is not a number or a timestamp string in one of the backend formats
     */
    public static long toEpochSeconds(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String string) {
            try {
                return DateFormatters.from(BACKEND_DATE_FORMATTER.parse(string)).toInstant().getEpochSecond();
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Failed to parse timestamp [" + string + "]", e);
            }
        }
        throw new IllegalArgumentException("Unsupported timestamp value: " + value);
    }

    /**
     * Formats an instant as an ISO-8601 UTC date time with at least millisecond precision, e.g. {@code 2024-01-01T00:00:00.000Z}.
     */
    public static String toIsoString(Instant instant) {
        return REQUEST_DATE_FORMATTER.format(instant.atZone(ZoneOffset.UTC));
    }

    /**
     * Floors an instant to the start of its bucket.
     *
     * @param instant the instant to floor
     * @param rollupSeconds bucket width in seconds
     * @return bucket start in epoch seconds
     */
    public static long floorToRollup(Instant instant, long rollupSeconds) {
        if (rollupSeconds <= 0) {
            throw new IllegalArgumentException("Rollup must be positive");
        }
        long epochSeconds = instant.getEpochSecond();
        return Math.floorDiv(epochSeconds, rollupSeconds) * rollupSeconds;
    }
}
