/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query;

import org.opensearch.analyticstsdb.core.mapping.Constants.Wire;
import org.opensearch.analyticstsdb.core.utils.Time;
import org.opensearch.core.xcontent.ToXContentObject;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Request payload of the backend's query endpoint.
 *
 * <p>The time range, conditions, group-by columns, project scope and aggregation are always sent.
 * The aggregate column, granularity and issue mapping are optional and omitted from the payload when absent.</p>
 *
 * <h2>Payload Structure:</h2>
 * <pre>{@code
 * {
 *   "from_date": "2024-01-01T00:00:00.000Z",
 *   "to_date": "2024-01-02T00:00:00.000Z",
 *   "conditions": [["issue", "IN", [101, 102]], ["environment", "=", "production"]],
 *   "groupby": ["issue", "time"],
 *   "project": [1],
 *   "aggregation": "count",
 *   "aggregateby": "user_id",
 *   "granularity": 3600,
 *   "issues": [[101, ["a1b2c3"]], [102, ["d4e5f6"]]]
 * }
 * }</pre>
 */
public final class AnalyticsQueryRequest implements ToXContentObject {

    private final Instant fromDate;
    private final Instant toDate;
    private final List<QueryCondition> conditions;
    private final List<String> groupBy;
    private final Set<Long> projects;
    private final AggregationFunction aggregation;
    private final Optional<String> aggregateBy;
    private final Optional<Long> granularity;
    private final Optional<Map<Long, List<String>>> issues;

    private AnalyticsQueryRequest(Builder builder) {
        this.fromDate = Objects.requireNonNull(builder.fromDate, "fromDate cannot be null");
        this.toDate = Objects.requireNonNull(builder.toDate, "toDate cannot be null");
        this.conditions = Collections.unmodifiableList(new ArrayList<>(builder.conditions));
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(builder.groupBy));
        this.projects = Collections.unmodifiableSet(new LinkedHashSet<>(builder.projects));
        this.aggregation = Objects.requireNonNull(builder.aggregation, "aggregation cannot be null");
        this.aggregateBy = Optional.ofNullable(builder.aggregateBy);
        this.granularity = Optional.ofNullable(builder.granularity);
        this.issues = Optional.ofNullable(builder.issues).map(m -> Collections.unmodifiableMap(new LinkedHashMap<>(m)));
    }

    public static Builder builder(Instant fromDate, Instant toDate) {
        return new Builder(fromDate, toDate);
    }

    public Instant getFromDate() {
        return fromDate;
    }

    public Instant getToDate() {
        return toDate;
    }

    public List<QueryCondition> getConditions() {
        return conditions;
    }

    /**
     * Group-by columns, in nesting order.
     */
    public List<String> getGroupBy() {
        return groupBy;
    }

    public Set<Long> getProjects() {
        return projects;
    }

    public AggregationFunction getAggregation() {
        return aggregation;
    }

    public Optional<String> getAggregateBy() {
        return aggregateBy;
    }

    public Optional<Long> getGranularity() {
        return granularity;
    }

    public Optional<Map<Long, List<String>>> getIssues() {
        return issues;
    }

    @Override
    public XContentBuilder toXContent(XContentBuilder builder, Params params) throws IOException {
        builder.startObject();
        builder.field(Wire.FROM_DATE, Time.toIsoString(fromDate));
        builder.field(Wire.TO_DATE, Time.toIsoString(toDate));
        builder.startArray(Wire.CONDITIONS);
        for (QueryCondition condition : conditions) {
            condition.toXContent(builder, params);
        }
        builder.endArray();
        builder.field(Wire.GROUPBY, groupBy);
        builder.field(Wire.PROJECT, projects);
        builder.field(Wire.AGGREGATION, aggregation.toString());
        if (aggregateBy.isPresent()) {
            builder.field(Wire.AGGREGATEBY, aggregateBy.get());
        }
        if (granularity.isPresent()) {
            builder.field(Wire.GRANULARITY, granularity.get());
        }
        if (issues.isPresent()) {
            builder.startArray(Wire.ISSUES);
            for (Map.Entry<Long, List<String>> issue : issues.get().entrySet()) {
                builder.startArray();
                builder.value(issue.getKey());
                builder.value(issue.getValue());
                builder.endArray();
            }
            builder.endArray();
        }
        builder.endObject();
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnalyticsQueryRequest that = (AnalyticsQueryRequest) o;
        return fromDate.equals(that.fromDate)
            && toDate.equals(that.toDate)
            && conditions.equals(that.conditions)
            && groupBy.equals(that.groupBy)
            && projects.equals(that.projects)
            && aggregation.equals(that.aggregation)
            && aggregateBy.equals(that.aggregateBy)
            && granularity.equals(that.granularity)
            && issues.equals(that.issues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromDate, toDate, conditions, groupBy, projects, aggregation, aggregateBy, granularity, issues);
    }

    @Override
    public String toString() {
        return "AnalyticsQueryRequest{"
            + "fromDate="
            + fromDate
            + ", toDate="
            + toDate
            + ", conditions="
            + conditions
            + ", groupBy="
            + groupBy
            + ", projects="
            + projects
            + ", aggregation="
            + aggregation
            + ", aggregateBy="
            + aggregateBy
            + ", granularity="
            + granularity
            + ", issues="
            + issues.map(Map::size).map(size -> size + " issues").orElse("none")
            + '}';
    }

    /**
     * Builder for {@link AnalyticsQueryRequest}.
     */
    public static final class Builder {
        private final Instant fromDate;
        private final Instant toDate;
        private final List<QueryCondition> conditions = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private final Set<Long> projects = new LinkedHashSet<>();
        private AggregationFunction aggregation = AggregationFunction.COUNT;
        private String aggregateBy;
        private Long granularity;
        private Map<Long, List<String>> issues;

        private Builder(Instant fromDate, Instant toDate) {
            this.fromDate = fromDate;
            this.toDate = toDate;
        }

        public Builder conditions(List<QueryCondition> conditions) {
            this.conditions.addAll(conditions);
            return this;
        }

        public Builder groupBy(List<String> groupBy) {
            this.groupBy.addAll(groupBy);
            return this;
        }

        public Builder projects(Set<Long> projects) {
            this.projects.addAll(projects);
            return this;
        }

        public Builder aggregation(AggregationFunction aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder aggregateBy(Optional<String> aggregateBy) {
            this.aggregateBy = aggregateBy.orElse(null);
            return this;
        }

        public Builder granularity(Optional<Long> granularity) {
            this.granularity = granularity.orElse(null);
            return this;
        }

        public Builder issues(Optional<Map<Long, List<String>>> issues) {
            this.issues = issues.orElse(null);
            return this;
        }

        public AnalyticsQueryRequest build() {
            return new AnalyticsQueryRequest(this);
        }
    }
}
