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
import org.opensearch.analyticstsdb.core.model.ColumnPair;
import org.opensearch.analyticstsdb.core.model.KeySet;
import org.opensearch.analyticstsdb.core.model.NormalizedKeys;
import org.opensearch.analyticstsdb.core.model.TSDBModel;
import org.opensearch.analyticstsdb.lookup.EnvironmentResolver;
import org.opensearch.analyticstsdb.lookup.IssueResolver;
import org.opensearch.common.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Translates a TSDB read (model, keys, time range, aggregation) into a backend query request.
 *
 * <p>Translation flow:
 * <ol>
 *   <li>Resolve the model's (group, aggregate) columns; unsupported models produce no request</li>
 *   <li>Normalize the keys into {@code IN} conditions on those columns</li>
 *   <li>Build the group-by columns from the grouping flags</li>
 *   <li>Rewrite {@code COUNT(aggregate)} into {@code COUNT() GROUP BY aggregate}</li>
 *   <li>Add the environment filter</li>
 *   <li>Resolve the project scope from the keys</li>
 *   <li>Attach the issue to fingerprint mapping when the issue column is referenced</li>
 *   <li>Assemble the request</li>
 * </ol>
 */
public class AnalyticsQueryBuilder {

    private static final Logger logger = LogManager.getLogger(AnalyticsQueryBuilder.class);

    private final EnvironmentResolver environmentResolver;
    private final IssueResolver issueResolver;
    private final PartitionScopeResolver partitionScopeResolver;

    public AnalyticsQueryBuilder(
        EnvironmentResolver environmentResolver,
        IssueResolver issueResolver,
        PartitionScopeResolver partitionScopeResolver
    ) {
        this.environmentResolver = Objects.requireNonNull(environmentResolver, "environmentResolver cannot be null");
        this.issueResolver = Objects.requireNonNull(issueResolver, "issueResolver cannot be null");
        this.partitionScopeResolver = Objects.requireNonNull(partitionScopeResolver, "partitionScopeResolver cannot be null");
    }

    /**
     * Builds the backend request for a read.
     *
     * @param model the model to read
     * @param keys the keys to read
     * @param params time range, rollup and environment of the read
     * @param aggregation the aggregation to compute
     * @param groupOnModel whether to group by the model's group column
     * @param groupOnTime whether to group by time bucket
     * @return the request, or empty if the model is not supported by the backend
     */
    public Optional<AnalyticsQueryRequest> build(
        TSDBModel model,
        KeySet keys,
        Params params,
        AggregationFunction aggregation,
        boolean groupOnModel,
        boolean groupOnTime
    ) {
        // 1. Resolve model columns
        Optional<ColumnPair> modelColumns = model.columns();
        if (modelColumns.isEmpty()) {
            logger.debug("Model [{}] is not supported by the analytic backend", model);
            return Optional.empty();
        }
        String modelGroup = modelColumns.get().groupColumn();
        String modelAggregate = modelColumns.get().aggregateColumn();

        // 2. Key conditions
        NormalizedKeys normalized = keys.normalize();
        Map<String, Set<Object>> keysMap = new LinkedHashMap<>();
        putIfPresent(keysMap, modelGroup, normalized.top());
        putIfPresent(keysMap, modelAggregate, normalized.second());

        List<QueryCondition> conditions = new ArrayList<>();
        for (Map.Entry<String, Set<Object>> entry : keysMap.entrySet()) {
            conditions.add(QueryCondition.in(entry.getKey(), entry.getValue()));
        }

        // 3. Group-by columns
        List<String> groupBy = new ArrayList<>();
        if (groupOnModel && modelGroup != null) {
            groupBy.add(modelGroup);
        }
        if (groupOnTime) {
            groupBy.add(Columns.TIME);
        }

        // 4. Count has different semantics: COUNT(aggregate) becomes COUNT() GROUP BY aggregate
        if (aggregation.isCount() && modelAggregate != null) {
            groupBy.add(modelAggregate);
            modelAggregate = null;
        }

        // 5. Environment filter
        if (params.environmentId() != null) {
            conditions.add(QueryCondition.equalTo(Columns.ENVIRONMENT, environmentResolver.nameFor(params.environmentId())));
        }

        // 6. Projects referenced directly as keys or indirectly through related entities
        Set<Long> projects = partitionScopeResolver.resolve(keysMap);

        // 7. Issue definitions are needed whenever the issue column is referenced.
        // TODO: narrow the mapping to the issues referenced by the keys instead of every issue of the scope
        Map<Long, List<String>> issues = null;
        if (referencesIssues(groupBy, modelAggregate, conditions)) {
            issues = issueResolver.fingerprintsFor(projects);
        }

        // 8. Assemble
        AnalyticsQueryRequest request = AnalyticsQueryRequest.builder(params.start(), params.end())
            .conditions(conditions)
            .groupBy(groupBy)
            .projects(projects)
            .aggregation(aggregation)
            .aggregateBy(Optional.ofNullable(modelAggregate))
            .granularity(Optional.ofNullable(params.rollup()))
            .issues(Optional.ofNullable(issues))
            .build();
        logger.debug("Built request for model [{}]: {}", model, request);
        return Optional.of(request);
    }

    private static void putIfPresent(Map<String, Set<Object>> keysMap, @Nullable String column, Optional<Set<Object>> keys) {
        if (column != null && keys.isPresent()) {
            keysMap.put(column, keys.get());
        }
    }

    private static boolean referencesIssues(Collection<String> groupBy, @Nullable String aggregateBy, List<QueryCondition> conditions) {
        if (groupBy.contains(Columns.ISSUE) || Columns.ISSUE.equals(aggregateBy)) {
            return true;
        }
        for (QueryCondition condition : conditions) {
            if (Columns.ISSUE.equals(condition.column())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Time range and scope of a read.
     *
     * @param start inclusive start of the range
     * @param end exclusive end of the range
     * @param rollup bucket width in seconds, null to let the backend decide
     * @param environmentId environment to restrict the read to, null for all environments
     */
    public record Params(Instant start, Instant end, @Nullable Long rollup, @Nullable Long environmentId) {

        /**
         * Validation for params.
         */
        public Params {
            Objects.requireNonNull(start, "start cannot be null");
            Objects.requireNonNull(end, "end cannot be null");
            if (start.isBefore(end) == false) {
                throw new IllegalArgumentException("Start time must be before end time");
            }
            if (rollup != null && rollup <= 0) {
                throw new IllegalArgumentException("Rollup must be positive");
            }
        }

        public Params(Instant start, Instant end) {
            this(start, end, null, null);
        }
    }
}
