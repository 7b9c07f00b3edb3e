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
import java.util.Set;

/**
 * Keys split by level: the keys of the model's group column and the keys of its aggregate column.
 *
 * @param topKeys keys for the group column, null when no filter applies
 * @param secondKeys keys for the aggregate column, null when no filter applies
 */
public record NormalizedKeys(@Nullable Set<Object> topKeys, @Nullable Set<Object> secondKeys) {

    static final NormalizedKeys NONE = new NormalizedKeys(null, null);

    public Optional<Set<Object>> top() {
        return Optional.ofNullable(topKeys);
    }

    public Optional<Set<Object>> second() {
        return Optional.ofNullable(secondKeys);
    }
}
