/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query.response;

import org.opensearch.analyticstsdb.core.mapping.Constants.Columns;
import org.opensearch.common.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds flat result rows into a nested mapping.
 *
 * <p>Each group-by column adds one level of nesting, in the order the columns were requested, and
 * the leaf is the row's aggregate. Keys at each level keep the order in which they first occur in
 * the rows. For rows grouped by {@code [issue, time]}:</p>
 * <pre>{@code
 * [{issue: 1, time: 10, aggregate: 5}, {issue: 1, time: 20, aggregate: 3}, {issue: 2, time: 10, aggregate: 1}]
 *   => {1: {10: 5, 20: 3}, 2: {10: 1}}
 * }</pre>
 */
public final class ResultNester {

    private ResultNester() {}

    /**
     * Build the nested mapping.
     *
     * @param rows scrubbed result rows
     * @param groups group-by columns, outermost first
     * @return a {@code Map} when {@code groups} is non-empty; otherwise the first row's aggregate,
     *         or null when there are no rows
     */
    @Nullable
    public static Object nest(List<Map<String, Object>> rows, List<String> groups) {
        if (groups.isEmpty()) {
            return rows.isEmpty() ? null : rows.get(0).get(Columns.AGGREGATE);
        }
        String group = groups.get(0);
        List<String> rest = groups.subList(1, groups.size());

        Map<Object, List<Map<String, Object>>> partitions = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            partitions.computeIfAbsent(row.get(group), k -> new ArrayList<>()).add(row);
        }

        Map<Object, Object> nested = new LinkedHashMap<>();
        for (Map.Entry<Object, List<Map<String, Object>>> partition : partitions.entrySet()) {
            nested.put(partition.getKey(), nest(partition.getValue(), rest));
        }
        return nested;
    }
}
