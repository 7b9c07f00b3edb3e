/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.analyticstsdb.core.mapping.Constants.Columns;
import org.opensearch.analyticstsdb.core.utils.Identifiers;
import org.opensearch.analyticstsdb.lookup.PartitionResolver;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Determines the set of projects a query must be scoped to.
 *
 * <p>Projects are either referenced directly, as keys of the {@code project_id} column, or
 * indirectly, e.g. the projects owning a set of issues. Every column that implies a project set
 * narrows the scope; columns that imply nothing are ignored. When no column implies a project set
 * the scope is empty and the backend decides what an unscoped query means.</p>
 */
public class PartitionScopeResolver {

    private static final Logger logger = LogManager.getLogger(PartitionScopeResolver.class);

    private final PartitionResolver partitionResolver;

    public PartitionScopeResolver(PartitionResolver partitionResolver) {
        this.partitionResolver = Objects.requireNonNull(partitionResolver, "partitionResolver cannot be null");
    }

    /**
     * Resolve the project scope implied by the keys of each column.
     *
     * @param keysMap keys by column, null keys or columns contribute nothing
     * @return the intersection of all non-empty implied project sets, empty if none was implied
     */
    public Set<Long> resolve(Map<String, ? extends Collection<Object>> keysMap) {
        Set<Long> scope = null;
        for (Map.Entry<String, ? extends Collection<Object>> entry : keysMap.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            Set<Long> implied = projectsFor(entry.getKey(), entry.getValue());
            if (implied.isEmpty()) {
                continue;
            }
            if (scope == null) {
                scope = new LinkedHashSet<>(implied);
            } else {
                scope.retainAll(implied);
            }
        }
        if (scope == null) {
            logger.debug("No column of {} implies a project scope", keysMap.keySet());
            return Set.of();
        }
        return scope;
    }

    private Set<Long> projectsFor(String column, Collection<Object> ids) {
        if (Columns.PROJECT_ID.equals(column)) {
            Set<Long> projects = new LinkedHashSet<>();
            for (Object id : ids) {
                projects.add(Identifiers.toPartitionId(id));
            }
            return projects;
        }
        Set<Long> projects = partitionResolver.partitionsFor(column, ids);
        return projects == null ? Set.of() : projects;
    }
}
