/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Aggregation functions supported by the analytic backend.
 *
 * @param kind the aggregation kind
 * @param limit number of values returned by {@link Kind#TOP_K}, 0 for other kinds
 */
public record AggregationFunction(Kind kind, int limit) {

    private static final Pattern TOP_K_PATTERN = Pattern.compile("topK\\((\\d+)\\)");

    public static final AggregationFunction COUNT = new AggregationFunction(Kind.COUNT, 0);
    public static final AggregationFunction UNIQ = new AggregationFunction(Kind.UNIQ, 0);

    /**
     * Aggregation kinds.
     */
    public enum Kind {
        /** Number of rows. */
        COUNT,
        /** Number of distinct values of the aggregate column. */
        UNIQ,
        /** Most frequent values of the aggregate column, most frequent first. */
        TOP_K
    }

    public AggregationFunction {
        if (kind == Kind.TOP_K && limit <= 0) {
            throw new IllegalArgumentException("topK limit must be positive, got: " + limit);
        }
        if (kind != Kind.TOP_K && limit != 0) {
            throw new IllegalArgumentException("Only topK takes a limit");
        }
    }

    public static AggregationFunction topK(int limit) {
        return new AggregationFunction(Kind.TOP_K, limit);
    }

    public boolean isCount() {
        return kind == Kind.COUNT;
    }

    /**
     * Parse an aggregation from its backend name, e.g. {@code count}, {@code uniq} or {@code topK(10)}.
     */
    public static AggregationFunction fromString(String name) {
        Matcher matcher = TOP_K_PATTERN.matcher(name);
        if (matcher.matches()) {
            return topK(Integer.parseInt(matcher.group(1)));
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "count" -> COUNT;
            case "uniq" -> UNIQ;
            default -> throw new IllegalArgumentException("Unknown aggregation: " + name);
        };
    }

    /**
     * The function name as sent to the backend.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case COUNT -> "count";
            case UNIQ -> "uniq";
            case TOP_K -> "topK(" + limit + ")";
        };
    }
}
