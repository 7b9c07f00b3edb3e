/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.model;

import java.util.Comparator;

/**
 * A single bucket of a series.
 *
 * @param timestamp bucket start in epoch seconds
 * @param value the bucket's value
 * @param <V> value type, a count or a per-value breakdown
 */
public record TimeSeriesPoint<V>(long timestamp, V value) {

    /**
     * Orders points by ascending timestamp.
     */
    public static <V> Comparator<TimeSeriesPoint<V>> byTimestamp() {
        return Comparator.comparingLong(TimeSeriesPoint::timestamp);
    }
}
