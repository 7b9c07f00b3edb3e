/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query.response;

import org.opensearch.analyticstsdb.core.mapping.Constants.Columns;
import org.opensearch.analyticstsdb.core.utils.Identifiers;
import org.opensearch.analyticstsdb.core.utils.Time;
import org.opensearch.analyticstsdb.transport.BackendQueryException;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates the shape of a backend response and normalizes its rows.
 *
 * <p>After scrubbing every row satisfies:</p>
 * <ul>
 *   <li>{@code time}, when present, is a {@link Long} of epoch seconds</li>
 *   <li>{@code aggregate} is present and never null, missing values become {@code 0}</li>
 *   <li>integral values are {@link Long}s, unless they exceed the {@code long} range</li>
 * </ul>
 */
public final class ResponseScrubber {

    private ResponseScrubber() {}

    /**
     * Validate and scrub a response.
     *
     * @param response the backend response
     * @param groupBy the group-by columns of the request
     * @return the scrubbed rows
     * @throws IllegalStateException if the backend returned a column that was not requested
     */
    public static List<Map<String, Object>> scrub(AnalyticsQueryResponse response, List<String> groupBy) {
        Set<String> expectedColumns = new HashSet<>(groupBy);
        expectedColumns.add(Columns.AGGREGATE);
        for (String column : response.columns()) {
            if (expectedColumns.contains(column) == false) {
                throw new IllegalStateException(
                    String.format(Locale.ROOT, "Backend returned unexpected column [%s], expected one of %s", column, expectedColumns)
                );
            }
        }

        List<Map<String, Object>> rows = response.rows();
        for (Map<String, Object> row : rows) {
            for (Map.Entry<String, Object> entry : row.entrySet()) {
                entry.setValue(Identifiers.normalize(entry.getValue()));
            }
            if (row.containsKey(Columns.TIME)) {
                row.put(Columns.TIME, parseTime(row.get(Columns.TIME)));
            }
            if (row.get(Columns.AGGREGATE) == null) {
                row.put(Columns.AGGREGATE, 0L);
            }
        }
        return rows;
    }

    private static long parseTime(Object value) {
        try {
            return Time.toEpochSeconds(value);
        } catch (IllegalArgumentException e) {
            throw new BackendQueryException("Malformed time bucket in backend response: " + value, e);
        }
    }
}
