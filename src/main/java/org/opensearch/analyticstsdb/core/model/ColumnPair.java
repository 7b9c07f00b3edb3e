/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.model;

import org.opensearch.common.Nullable;

import java.util.Optional;

/**
 * The backend columns used to answer queries about a {@link TSDBModel}.
 *
 * @param groupColumn column the model is naturally grouped by, null when the model has no grouping dimension
 * @param aggregateColumn secondary column aggregated over, null when the aggregation is a plain count
 */
public record ColumnPair(@Nullable String groupColumn, @Nullable String aggregateColumn) {

    public Optional<String> group() {
        return Optional.ofNullable(groupColumn);
    }

    public Optional<String> aggregate() {
        return Optional.ofNullable(aggregateColumn);
    }
}
