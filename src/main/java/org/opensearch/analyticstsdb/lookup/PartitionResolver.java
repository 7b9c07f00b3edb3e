/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.lookup;

import java.util.Collection;
import java.util.Set;

/**
 * Maps ids of an entity that belongs to a project back to their owning projects.
 */
@FunctionalInterface
public interface PartitionResolver {

    /**
     * A resolver that knows no mappings.
     */
    PartitionResolver NONE = (column, ids) -> Set.of();

    /**
     * Get the project ids owning the given entities.
     *
     * @param column the backend column the ids belong to, e.g. {@code issue}
     * @param ids the entity ids
     * @return the owning project ids, or an empty set if no mapping is known for this column
     */
    Set<Long> partitionsFor(String column, Collection<Object> ids);
}
