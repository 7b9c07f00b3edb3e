/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event counts of a frequency read.
 *
 * <p>Models with an aggregate column break the count down per value of that column
 * ({@link ByValue}); models without one only have a plain event count ({@link Total}).</p>
 */
public sealed interface Frequencies permits Frequencies.Total, Frequencies.ByValue {

    /**
     * Event count across all values.
     */
    long total();

    static Frequencies count(long count) {
        return new Total(count);
    }

    static Frequencies byValue(Map<?, Long> counts) {
        return new ByValue(Collections.unmodifiableMap(new LinkedHashMap<Object, Long>(counts)));
    }

    /**
     * A plain event count.
     */
    record Total(long count) implements Frequencies {
        @Override
        public long total() {
            return count;
        }
    }

    /**
     * Event counts keyed by value of the model's aggregate column, in backend order.
     */
    record ByValue(Map<Object, Long> counts) implements Frequencies {
        @Override
        public long total() {
            long sum = 0;
            for (long count : counts.values()) {
                sum += count;
            }
            return sum;
        }
    }
}
