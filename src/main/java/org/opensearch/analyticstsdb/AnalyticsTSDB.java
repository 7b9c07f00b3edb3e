/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.analyticstsdb.config.AnalyticsTSDBSettings;
import org.opensearch.analyticstsdb.config.RollupConfig;
import org.opensearch.analyticstsdb.core.model.Frequencies;
import org.opensearch.analyticstsdb.core.model.KeySet;
import org.opensearch.analyticstsdb.core.model.ScoredValue;
import org.opensearch.analyticstsdb.core.model.TSDBModel;
import org.opensearch.analyticstsdb.core.model.TimeSeriesPoint;
import org.opensearch.analyticstsdb.core.utils.Time;
import org.opensearch.analyticstsdb.lookup.EnvironmentResolver;
import org.opensearch.analyticstsdb.lookup.IssueResolver;
import org.opensearch.analyticstsdb.lookup.PartitionResolver;
import org.opensearch.analyticstsdb.query.AggregationFunction;
import org.opensearch.analyticstsdb.query.AnalyticsQueryBuilder;
import org.opensearch.analyticstsdb.query.AnalyticsQueryRequest;
import org.opensearch.analyticstsdb.query.PartitionScopeResolver;
import org.opensearch.analyticstsdb.query.response.AnalyticsQueryResponse;
import org.opensearch.analyticstsdb.query.response.ResponseScrubber;
import org.opensearch.analyticstsdb.query.response.ResultNester;
import org.opensearch.analyticstsdb.transport.AnalyticsTransport;
import org.opensearch.analyticstsdb.transport.BackendQueryException;
import org.opensearch.common.Nullable;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.xcontent.ToXContent;
import org.opensearch.core.xcontent.XContentBuilder;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A read-only time series interface to the analytic query backend.
 *
 * <p>Write operations are not supported, as the raw data the time series are computed from is
 * assumed to already exist in the backend. Read operations are supported only for models based on
 * event data (see {@link TSDBModel#columns()}) and return empty results for other models. Frequency
 * reads on event models without an aggregate column return plain counts (see {@link Frequencies}).</p>
 *
 * <p>Every read issues exactly one synchronous request to the backend. Instances hold no mutable
 * state and can be shared between threads.</p>
 */
public class AnalyticsTSDB {

    private static final Logger logger = LogManager.getLogger(AnalyticsTSDB.class);

    /** Number of values returned by top-K reads when the caller gives no limit. */
    public static final int DEFAULT_TOP_K_LIMIT = 10;

    private final AnalyticsTransport transport;
    private final String queryPath;
    private final RollupConfig rollupConfig;
    private final AnalyticsQueryBuilder queryBuilder;

    public AnalyticsTSDB(
        Settings settings,
        AnalyticsTransport transport,
        EnvironmentResolver environmentResolver,
        IssueResolver issueResolver,
        PartitionResolver partitionResolver
    ) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.queryPath = AnalyticsTSDBSettings.QUERY_PATH.get(settings);
        this.rollupConfig = RollupConfig.fromSettings(settings);
        this.queryBuilder = new AnalyticsQueryBuilder(environmentResolver, issueResolver, new PartitionScopeResolver(partitionResolver));
    }

    /**
     * Event counts per key and time bucket.
     *
     * @return {@code {key: [(timestamp, count), ...]}} with points sorted by timestamp
     */
    public Map<Object, List<TimeSeriesPoint<Long>>> getRange(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Object result = getData(model, keys, params(start, end, rollup, environmentId), AggregationFunction.COUNT, true, true);
        return toSortedSeries(asMap(result));
    }

    /**
     * Total event count per key over the range.
     */
    public Map<Object, Long> getSums(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Map<Object, Long> sums = new LinkedHashMap<>();
        for (Map.Entry<Object, List<TimeSeriesPoint<Long>>> entry : getRange(model, keys, start, end, rollup, environmentId).entrySet()) {
            long sum = 0;
            for (TimeSeriesPoint<Long> point : entry.getValue()) {
                sum += point.value();
            }
            sums.put(entry.getKey(), sum);
        }
        return sums;
    }

    /**
     * Distinct counts of the model's aggregate column per key and time bucket.
     *
     * @return {@code {key: [(timestamp, count), ...]}} with points sorted by timestamp
     */
    public Map<Object, List<TimeSeriesPoint<Long>>> getDistinctCountsSeries(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Object result = getData(model, keys, params(start, end, rollup, environmentId), AggregationFunction.UNIQ, true, true);
        return toSortedSeries(asMap(result));
    }

    /**
     * Distinct counts of the model's aggregate column per key over the range.
     */
    public Map<Object, Long> getDistinctCountsTotals(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Object result = getData(model, keys, params(start, end, rollup, environmentId), AggregationFunction.UNIQ, true, false);
        Map<Object, Long> totals = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : asMap(result).entrySet()) {
            totals.put(entry.getKey(), toCount(entry.getValue()));
        }
        return totals;
    }

    /**
     * Distinct count of the model's aggregate column across all keys over the range.
     *
     * @return the count, 0 when there is no data or the model is not supported
     */
    public long getDistinctCountsUnion(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Object result = getData(model, keys, params(start, end, rollup, environmentId), AggregationFunction.UNIQ, false, false);
        return toCount(result);
    }

    /**
     * Most frequent values of the model's aggregate column per key over the range.
     *
     * <p>The backend ranks the values most frequent first. With {@code k} values returned the most
     * frequent value scores {@code k} and the least frequent scores {@code 1}.</p>
     *
     * @param limit number of values to return per key, {@link #DEFAULT_TOP_K_LIMIT} when null
     * @return {@code {key: [(value, score), ...]}} ordered by ascending score
     */
    public Map<Object, List<ScoredValue>> getMostFrequent(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Integer limit,
        @Nullable Long environmentId
    ) {
        AggregationFunction aggregation = AggregationFunction.topK(limit == null ? DEFAULT_TOP_K_LIMIT : limit);
        Object result = getData(model, keys, params(start, end, rollup, environmentId), aggregation, true, false);
        Map<Object, List<ScoredValue>> scored = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : asMap(result).entrySet()) {
            scored.put(entry.getKey(), score(entry.getValue()));
        }
        return scored;
    }

    /**
     * Most frequent values of the model's aggregate column per key and time bucket.
     *
     * @param limit number of values to return per key and bucket, {@link #DEFAULT_TOP_K_LIMIT} when null
     * @return {@code {key: [(timestamp, {value: score, ...}), ...]}} with points sorted by timestamp
     * @see #getMostFrequent
     */
    public Map<Object, List<TimeSeriesPoint<Map<Object, Double>>>> getMostFrequentSeries(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Integer limit,
        @Nullable Long environmentId
    ) {
        AggregationFunction aggregation = AggregationFunction.topK(limit == null ? DEFAULT_TOP_K_LIMIT : limit);
        Object result = getData(model, keys, params(start, end, rollup, environmentId), aggregation, true, true);
        Map<Object, List<TimeSeriesPoint<Map<Object, Double>>>> series = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : asMap(result).entrySet()) {
            List<TimeSeriesPoint<Map<Object, Double>>> points = new ArrayList<>();
            for (Map.Entry<Object, Object> bucket : asMap(entry.getValue()).entrySet()) {
                Map<Object, Double> scores = new LinkedHashMap<>();
                for (ScoredValue value : score(bucket.getValue())) {
                    scores.put(value.value(), value.score());
                }
                points.add(new TimeSeriesPoint<>(toTimestamp(bucket.getKey()), scores));
            }
            points.sort(TimeSeriesPoint.byTimestamp());
            series.put(entry.getKey(), points);
        }
        return series;
    }

    /**
     * Event counts per key and time bucket, broken down by value of the model's aggregate column
     * when the model has one.
     *
     * <p>Points are returned in the order the backend returned the buckets and are not sorted.</p>
     *
     * @return {@code {key: [(timestamp, frequencies), ...]}}
     */
    public Map<Object, List<TimeSeriesPoint<Frequencies>>> getFrequencySeries(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Object result = getData(model, keys, params(start, end, rollup, environmentId), AggregationFunction.COUNT, true, true);
        Map<Object, List<TimeSeriesPoint<Frequencies>>> series = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : asMap(result).entrySet()) {
            List<TimeSeriesPoint<Frequencies>> points = new ArrayList<>();
            for (Map.Entry<Object, Object> bucket : asMap(entry.getValue()).entrySet()) {
                points.add(new TimeSeriesPoint<>(toTimestamp(bucket.getKey()), toFrequencies(bucket.getValue())));
            }
            series.put(entry.getKey(), points);
        }
        return series;
    }

    /**
     * Event counts per key over the range, broken down by value of the model's aggregate column
     * when the model has one.
     *
     * @return {@code {key: frequencies}}
     */
    public Map<Object, Frequencies> getFrequencyTotals(
        TSDBModel model,
        KeySet keys,
        Instant start,
        Instant end,
        @Nullable Long rollup,
        @Nullable Long environmentId
    ) {
        Object result = getData(model, keys, params(start, end, rollup, environmentId), AggregationFunction.COUNT, true, false);
        Map<Object, Frequencies> totals = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : asMap(result).entrySet()) {
            totals.put(entry.getKey(), toFrequencies(entry.getValue()));
        }
        return totals;
    }

    /**
     * Always returns the finest rollup, as the backend can bucket on any granularity.
     *
     * @param start start of the range to be read, unused
     * @return bucket width in seconds
     */
    public long getOptimalRollup(Instant start) {
        return rollupConfig.finest();
    }

    public List<RollupConfig.Rollup> getRollups() {
        return rollupConfig.getRollups();
    }

    /**
     * Floors a timestamp to the start of its bucket at the given rollup.
     *
     * @return bucket start in epoch seconds
     */
    public long normalizeToRollup(Instant timestamp, long rollupSeconds) {
        return Time.floorToRollup(timestamp, rollupSeconds);
    }

    /**
     * Runs a read against the backend and nests the result by the request's group-by columns.
     *
     * @return the nested result, or null when the model is not supported or nothing matched an ungrouped read
     */
    @Nullable
    Object getData(
        TSDBModel model,
        KeySet keys,
        AnalyticsQueryBuilder.Params params,
        AggregationFunction aggregation,
        boolean groupOnModel,
        boolean groupOnTime
    ) {
        Optional<AnalyticsQueryRequest> request = queryBuilder.build(model, keys, params, aggregation, groupOnModel, groupOnTime);
        if (request.isEmpty()) {
            return null;
        }
        List<String> groupBy = request.get().getGroupBy();

        Map<String, Object> body;
        try {
            body = transport.post(queryPath, toJson(request.get()));
        } catch (IOException e) {
            throw new BackendQueryException("Failed to query analytic backend for model [" + model + "]", e);
        }

        List<Map<String, Object>> rows = ResponseScrubber.scrub(AnalyticsQueryResponse.fromMap(body), groupBy);
        logger.debug("Backend returned {} rows for model [{}] grouped by {}", rows.size(), model, groupBy);
        return ResultNester.nest(rows, groupBy);
    }

    private static AnalyticsQueryBuilder.Params params(Instant start, Instant end, @Nullable Long rollup, @Nullable Long environmentId) {
        return new AnalyticsQueryBuilder.Params(start, end, rollup, environmentId);
    }

    private static String toJson(AnalyticsQueryRequest request) throws IOException {
        XContentBuilder builder = XContentFactory.jsonBuilder();
        request.toXContent(builder, ToXContent.EMPTY_PARAMS);
        return BytesReference.bytes(builder).utf8ToString();
    }

    private static Map<Object, List<TimeSeriesPoint<Long>>> toSortedSeries(Map<Object, Object> nested) {
        Map<Object, List<TimeSeriesPoint<Long>>> series = new LinkedHashMap<>();
        for (Map.Entry<Object, Object> entry : nested.entrySet()) {
            List<TimeSeriesPoint<Long>> points = new ArrayList<>();
            for (Map.Entry<Object, Object> bucket : asMap(entry.getValue()).entrySet()) {
                points.add(new TimeSeriesPoint<>(toTimestamp(bucket.getKey()), toCount(bucket.getValue())));
            }
            points.sort(TimeSeriesPoint.byTimestamp());
            series.put(entry.getKey(), points);
        }
        return series;
    }

    /**
     * Turns a ranked top-K list, most frequent first, into values ordered by ascending score.
     */
    static List<ScoredValue> score(Object ranked) {
        if (ranked instanceof List<?> values) {
            int k = values.size();
            List<ScoredValue> scored = new ArrayList<>(k);
            for (int i = k - 1; i >= 0; i--) {
                scored.add(new ScoredValue(values.get(i), (double) (k - i)));
            }
            return scored;
        }
        // No values for this group: the aggregate was zero-filled
        return List.of();
    }

    /**
     * A leaf count. A map leaf comes from a count grouped by the aggregate column and is summed.
     */
    private static long toCount(@Nullable Object leaf) {
        if (leaf == null) {
            return 0L;
        }
        if (leaf instanceof Number number) {
            return number.longValue();
        }
        if (leaf instanceof Map<?, ?> map) {
            long sum = 0;
            for (Object value : map.values()) {
                sum += toCount(value);
            }
            return sum;
        }
        throw new IllegalStateException("Expected a numeric aggregate but got: " + leaf);
    }

    /**
     * A count leaf, or a {value: count} leaf when the count was grouped by the aggregate column.
     */
    private static Frequencies toFrequencies(@Nullable Object leaf) {
        if (leaf instanceof Map<?, ?> map) {
            Map<Object, Long> counts = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                counts.put(entry.getKey(), toCount(entry.getValue()));
            }
            return Frequencies.byValue(counts);
        }
        return Frequencies.count(toCount(leaf));
    }

    private static long toTimestamp(Object bucket) {
        if (bucket instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Expected an epoch seconds time bucket but got: " + bucket);
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> asMap(@Nullable Object nested) {
        if (nested == null) {
            return Map.of();
        }
        if (nested instanceof Map<?, ?>) {
            return (Map<Object, Object>) nested;
        }
        throw new IllegalStateException("Expected a nested result but got: " + nested);
    }
}
