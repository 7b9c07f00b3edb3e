/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.config;

import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * The time bucket widths a TSDB can be read at, finest first.
 */
public final class RollupConfig {

    private static final String SEPARATOR = ":";

    private final List<Rollup> rollups;

    private RollupConfig(List<Rollup> rollups) {
        if (rollups.isEmpty()) {
            throw new IllegalArgumentException("At least one rollup must be configured");
        }
        List<Rollup> sorted = new ArrayList<>(rollups);
        sorted.sort(Comparator.comparingLong(Rollup::seconds));
        this.rollups = Collections.unmodifiableList(sorted);
    }

    public static RollupConfig fromSettings(Settings settings) {
        return parse(AnalyticsTSDBSettings.ROLLUPS.get(settings));
    }

    /**
     * Parse rollups from {@code <bucket width>:<retained buckets>} strings, e.g. {@code ["10s:360", "1h:168"]}.
     */
    public static RollupConfig parse(List<String> values) {
        List<Rollup> rollups = new ArrayList<>(values.size());
        for (String value : values) {
            rollups.add(Rollup.parse(value));
        }
        return new RollupConfig(rollups);
    }

    /**
     * Configured rollups, finest first.
     */
    public List<Rollup> getRollups() {
        return rollups;
    }

    /**
     * The finest configured rollup in seconds.
     */
    public long finest() {
        return rollups.get(0).seconds();
    }

    /**
     * A bucket width and the number of buckets retained at that width.
     *
     * @param seconds bucket width in seconds
     * @param samples number of buckets retained
     */
    public record Rollup(long seconds, int samples) {

        public Rollup {
            if (seconds <= 0) {
                throw new IllegalArgumentException("Rollup must be positive, got: " + seconds);
            }
            if (samples <= 0) {
                throw new IllegalArgumentException("Rollup samples must be positive, got: " + samples);
            }
        }

        /**
         * Retention covered by this rollup in seconds.
         */
        public long retentionSeconds() {
            return seconds * samples;
        }

        static Rollup parse(String value) {
            int separator = value.indexOf(SEPARATOR);
            if (separator < 0) {
                throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "Invalid rollup [%s], expected <bucket width>:<retained buckets>", value)
                );
            }
            String width = value.substring(0, separator).trim();
            String samples = value.substring(separator + 1).trim();
            TimeValue bucket = TimeValue.parseTimeValue(width, "rollup");
            try {
                return new Rollup(bucket.getSeconds(), Integer.parseInt(samples));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid rollup samples [" + samples + "] in [" + value + "]", e);
            }
        }
    }
}
