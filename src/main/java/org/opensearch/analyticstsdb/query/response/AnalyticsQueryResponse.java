/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query.response;

import org.opensearch.analyticstsdb.core.mapping.Constants.Wire;
import org.opensearch.analyticstsdb.transport.BackendQueryException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response of the backend's query endpoint.
 *
 * <h2>Response Structure:</h2>
 * <pre>{@code
 * {
 *   "meta": [{"name": "issue"}, {"name": "time"}, {"name": "aggregate"}],
 *   "data": [
 *     {"issue": 101, "time": "2024-01-01T00:00:00Z", "aggregate": 5}
 *   ]
 * }
 * }</pre>
 *
 * @param columns names of the returned columns, in the order of {@code meta}
 * @param rows result rows keyed by column name
 */
public record AnalyticsQueryResponse(List<String> columns, List<Map<String, Object>> rows) {

    /**
     * Reads a response from its parsed JSON body.
     *
     * @param body the parsed response body
     * @return the response, with rows copied so they can be scrubbed in place
     * @throws BackendQueryException if {@code meta} or {@code data} are missing or malformed
     */
    public static AnalyticsQueryResponse fromMap(Map<String, Object> body) {
        List<?> meta = requireList(body, Wire.META);
        List<String> columns = new ArrayList<>(meta.size());
        for (Object descriptor : meta) {
            if (descriptor instanceof Map<?, ?> map && map.get(Wire.NAME) instanceof String name) {
                columns.add(name);
            } else {
                throw new BackendQueryException("Malformed column descriptor in backend response: " + descriptor);
            }
        }

        List<?> data = requireList(body, Wire.DATA);
        List<Map<String, Object>> rows = new ArrayList<>(data.size());
        for (Object row : data) {
            if (row instanceof Map<?, ?> map) {
                Map<String, Object> copy = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    copy.put(String.valueOf(entry.getKey()), entry.getValue());
                }
                rows.add(copy);
            } else {
                throw new BackendQueryException("Malformed row in backend response: " + row);
            }
        }
        return new AnalyticsQueryResponse(columns, rows);
    }

    private static List<?> requireList(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value instanceof List<?> list) {
            return list;
        }
        throw new BackendQueryException("Backend response is missing the [" + field + "] list");
    }
}
