/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb;

import org.opensearch.analyticstsdb.TestUtils.RecordingTransport;
import org.opensearch.analyticstsdb.core.model.Frequencies;
import org.opensearch.analyticstsdb.core.model.KeySet;
import org.opensearch.analyticstsdb.core.model.ScoredValue;
import org.opensearch.analyticstsdb.core.model.TSDBModel;
import org.opensearch.analyticstsdb.core.model.TimeSeriesPoint;
import org.opensearch.analyticstsdb.lookup.EnvironmentResolver;
import org.opensearch.analyticstsdb.lookup.IssueResolver;
import org.opensearch.analyticstsdb.lookup.PartitionResolver;
import org.opensearch.analyticstsdb.transport.AnalyticsTransport;
import org.opensearch.analyticstsdb.transport.BackendQueryException;
import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.opensearch.analyticstsdb.TestUtils.responseBody;
import static org.opensearch.analyticstsdb.TestUtils.row;

public class AnalyticsTSDBTests extends OpenSearchTestCase {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-01-02T00:00:00Z");
    private static final long T0 = 1704067200L;
    private static final long T1 = T0 + 3600;

    private static final EnvironmentResolver ENVIRONMENTS = environmentId -> "production";
    private static final IssueResolver ISSUES = projectIds -> Map.of(101L, List.of("a1b2c3"));
    private static final PartitionResolver PARTITIONS = (column, ids) -> "issue".equals(column) ? Set.of(1L) : Set.of();

    public void testGetRange() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(List.of("issue", "time", "aggregate"), row("issue", 101, "time", "2024-01-01T00:00:00Z", "aggregate", 5))
        );

        Map<Object, List<TimeSeriesPoint<Long>>> range = tsdb(transport).getRange(
            TSDBModel.GROUP,
            KeySet.flat(List.of(101, 102)),
            START,
            END,
            3600L,
            null
        );

        assertEquals(Map.of(101L, List.of(new TimeSeriesPoint<>(T0, 5L))), range);
        assertEquals(List.of("/query"), transport.getEndpoints());
        Map<String, Object> request = transport.lastRequest();
        assertEquals("2024-01-01T00:00:00.000Z", request.get("from_date"));
        assertEquals("2024-01-02T00:00:00.000Z", request.get("to_date"));
        assertEquals(List.of(List.of("issue", "IN", List.of(101, 102))), request.get("conditions"));
        assertEquals(List.of("issue", "time"), request.get("groupby"));
        assertEquals(List.of(1), request.get("project"));
        assertEquals("count", request.get("aggregation"));
        assertEquals(3600, request.get("granularity"));
        assertEquals(List.of(List.of(101, List.of("a1b2c3"))), request.get("issues"));
        assertFalse(request.containsKey("aggregateby"));
    }

    public void testGetRangeSortsPointsAndSumsAggregateLevel() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("issue", "time", "user_id", "aggregate"),
                row("issue", 101, "time", T1, "user_id", "alice", "aggregate", 2),
                row("issue", 101, "time", T0, "user_id", "alice", "aggregate", 1),
                row("issue", 101, "time", T0, "user_id", "bob", "aggregate", 3)
            )
        );

        Map<Object, List<TimeSeriesPoint<Long>>> range = tsdb(transport).getRange(
            TSDBModel.USERS_AFFECTED_BY_GROUP,
            KeySet.flat(List.of(101)),
            START,
            END,
            null,
            null
        );

        assertEquals(Map.of(101L, List.of(new TimeSeriesPoint<>(T0, 4L), new TimeSeriesPoint<>(T1, 2L))), range);
        assertEquals(List.of("issue", "time", "user_id"), transport.lastRequest().get("groupby"));
        assertFalse(transport.lastRequest().containsKey("granularity"));
    }

    public void testGetSums() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("project_id", "time", "aggregate"),
                row("project_id", 1, "time", T0, "aggregate", 5),
                row("project_id", 1, "time", T1, "aggregate", 7),
                row("project_id", 2, "time", T0, "aggregate", null)
            )
        );

        Map<Object, Long> sums = tsdb(transport).getSums(TSDBModel.PROJECT, KeySet.flat(List.of(1, 2)), START, END, null, null);

        assertEquals(Map.of(1L, 12L, 2L, 0L), sums);
    }

    public void testEnvironmentFilter() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("project_id", "time", "aggregate")));

        tsdb(transport).getRange(TSDBModel.PROJECT, KeySet.flat(List.of(1)), START, END, null, 7L);

        List<?> conditions = (List<?>) transport.lastRequest().get("conditions");
        assertEquals(List.of("environment", "=", "production"), conditions.get(conditions.size() - 1));
    }

    public void testGetDistinctCountsSeries() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("issue", "time", "aggregate"),
                row("issue", 101, "time", T1, "aggregate", 1),
                row("issue", 101, "time", T0, "aggregate", 3)
            )
        );

        Map<Object, List<TimeSeriesPoint<Long>>> series = tsdb(transport).getDistinctCountsSeries(
            TSDBModel.USERS_AFFECTED_BY_GROUP,
            KeySet.flat(List.of(101)),
            START,
            END,
            3600L,
            null
        );

        assertEquals(Map.of(101L, List.of(new TimeSeriesPoint<>(T0, 3L), new TimeSeriesPoint<>(T1, 1L))), series);
        assertEquals("uniq", transport.lastRequest().get("aggregation"));
        assertEquals("user_id", transport.lastRequest().get("aggregateby"));
        assertEquals(List.of("issue", "time"), transport.lastRequest().get("groupby"));
    }

    public void testGetDistinctCountsTotals() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(List.of("issue", "aggregate"), row("issue", 101, "aggregate", 3), row("issue", 102, "aggregate", null))
        );

        Map<Object, Long> totals = tsdb(transport).getDistinctCountsTotals(
            TSDBModel.USERS_AFFECTED_BY_GROUP,
            KeySet.flat(List.of(101, 102)),
            START,
            END,
            null,
            null
        );

        assertEquals(Map.of(101L, 3L, 102L, 0L), totals);
        assertEquals(List.of("issue"), transport.lastRequest().get("groupby"));
    }

    public void testGetDistinctCountsUnion() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("aggregate"), row("aggregate", 7)));

        long union = tsdb(transport).getDistinctCountsUnion(
            TSDBModel.USERS_AFFECTED_BY_PROJECT,
            KeySet.flat(List.of(1, 2)),
            START,
            END,
            null,
            null
        );

        assertEquals(7L, union);
        assertEquals(List.of(), transport.lastRequest().get("groupby"));
        assertEquals(List.of(1, 2), transport.lastRequest().get("project"));
    }

    public void testGetDistinctCountsUnionWithoutRows() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("aggregate")));

        assertEquals(
            0L,
            tsdb(transport).getDistinctCountsUnion(TSDBModel.USERS_AFFECTED_BY_PROJECT, KeySet.flat(List.of(1)), START, END, null, null)
        );
    }

    public void testGetMostFrequent() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("issue", "aggregate"),
                row("issue", 101, "aggregate", List.of("b", "a")),
                row("issue", 102, "aggregate", null)
            )
        );

        Map<Object, List<ScoredValue>> frequent = tsdb(transport).getMostFrequent(
            TSDBModel.FREQUENT_RELEASES_BY_GROUP,
            KeySet.flat(List.of(101, 102)),
            START,
            END,
            null,
            null,
            null
        );

        assertEquals(Map.of(101L, List.of(new ScoredValue("a", 1.0), new ScoredValue("b", 2.0)), 102L, List.of()), frequent);
        assertEquals("topK(10)", transport.lastRequest().get("aggregation"));
        assertEquals("release", transport.lastRequest().get("aggregateby"));
    }

    public void testGetMostFrequentWithLimit() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("issue", "aggregate")));

        Map<Object, List<ScoredValue>> frequent = tsdb(transport).getMostFrequent(
            TSDBModel.FREQUENT_ENVIRONMENTS_BY_GROUP,
            KeySet.flat(List.of(101)),
            START,
            END,
            null,
            3,
            null
        );

        assertEquals(Map.of(), frequent);
        assertEquals("topK(3)", transport.lastRequest().get("aggregation"));
    }

    public void testGetMostFrequentSeries() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("issue", "time", "aggregate"),
                row("issue", 101, "time", T1, "aggregate", List.of("production")),
                row("issue", 101, "time", T0, "aggregate", List.of("staging", "production"))
            )
        );

        Map<Object, List<TimeSeriesPoint<Map<Object, Double>>>> series = tsdb(transport).getMostFrequentSeries(
            TSDBModel.FREQUENT_ENVIRONMENTS_BY_GROUP,
            KeySet.flat(List.of(101)),
            START,
            END,
            3600L,
            null,
            null
        );

        assertEquals(
            Map.of(
                101L,
                List.of(
                    new TimeSeriesPoint<>(T0, Map.of("production", 1.0, "staging", 2.0)),
                    new TimeSeriesPoint<>(T1, Map.of("production", 1.0))
                )
            ),
            series
        );
        assertEquals(List.of("issue", "time"), transport.lastRequest().get("groupby"));
    }

    public void testGetFrequencySeriesKeepsBackendOrder() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("issue", "time", "environment", "aggregate"),
                row("issue", 101, "time", T1, "environment", "production", "aggregate", 2),
                row("issue", 101, "time", T0, "environment", "production", "aggregate", 1),
                row("issue", 101, "time", T0, "environment", "staging", "aggregate", 4)
            )
        );

        Map<Object, List<TimeSeriesPoint<Frequencies>>> series = tsdb(transport).getFrequencySeries(
            TSDBModel.FREQUENT_ENVIRONMENTS_BY_GROUP,
            KeySet.flat(List.of(101)),
            START,
            END,
            3600L,
            null
        );

        assertEquals(
            Map.of(
                101L,
                List.of(
                    new TimeSeriesPoint<>(T1, Frequencies.byValue(Map.of("production", 2L))),
                    new TimeSeriesPoint<>(T0, Frequencies.byValue(Map.of("production", 1L, "staging", 4L)))
                )
            ),
            series
        );
        assertEquals(List.of("issue", "time", "environment"), transport.lastRequest().get("groupby"));
        assertEquals("count", transport.lastRequest().get("aggregation"));
        assertFalse(transport.lastRequest().containsKey("aggregateby"));
    }

    public void testGetFrequencyTotals() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("issue", "release", "aggregate"),
                row("issue", 101, "release", "1.0", "aggregate", 3),
                row("issue", 101, "release", "1.1", "aggregate", 4)
            )
        );

        Map<Object, Frequencies> totals = tsdb(transport).getFrequencyTotals(
            TSDBModel.FREQUENT_RELEASES_BY_GROUP,
            KeySet.flat(List.of(101)),
            START,
            END,
            null,
            null
        );

        assertEquals(Map.of(101L, Frequencies.byValue(Map.of("1.0", 3L, "1.1", 4L))), totals);
        assertEquals(7L, totals.get(101L).total());
        assertEquals(List.of("issue", "release"), transport.lastRequest().get("groupby"));
    }

    public void testFrequencyTotalsOnModelWithoutAggregateColumn() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(List.of("issue", "aggregate"), row("issue", 101, "aggregate", 5), row("issue", 102, "aggregate", null))
        );

        Map<Object, Frequencies> totals = tsdb(transport).getFrequencyTotals(
            TSDBModel.GROUP,
            KeySet.flat(List.of(101, 102)),
            START,
            END,
            null,
            null
        );

        assertEquals(Map.of(101L, Frequencies.count(5L), 102L, Frequencies.count(0L)), totals);
        assertEquals(1, transport.getRequests().size());
        assertEquals(List.of("issue"), transport.lastRequest().get("groupby"));
        assertEquals("count", transport.lastRequest().get("aggregation"));
    }

    public void testFrequencySeriesOnModelWithoutAggregateColumn() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(
                List.of("project_id", "time", "aggregate"),
                row("project_id", 1, "time", T1, "aggregate", 2),
                row("project_id", 1, "time", T0, "aggregate", 5)
            )
        );

        Map<Object, List<TimeSeriesPoint<Frequencies>>> series = tsdb(transport).getFrequencySeries(
            TSDBModel.PROJECT,
            KeySet.flat(List.of(1)),
            START,
            END,
            3600L,
            null
        );

        assertEquals(
            Map.of(1L, List.of(new TimeSeriesPoint<>(T1, Frequencies.count(2L)), new TimeSeriesPoint<>(T0, Frequencies.count(5L)))),
            series
        );
        assertEquals(1, transport.getRequests().size());
        assertEquals(List.of("project_id", "time"), transport.lastRequest().get("groupby"));
    }

    public void testUnsupportedModelsReadNothing() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("aggregate")));
        AnalyticsTSDB tsdb = tsdb(transport);
        KeySet keys = KeySet.flat(List.of(1));

        assertEquals(Map.of(), tsdb.getRange(TSDBModel.PROJECT_TOTAL_RECEIVED, keys, START, END, null, null));
        assertEquals(Map.of(), tsdb.getSums(TSDBModel.ORGANIZATION_TOTAL_REJECTED, keys, START, END, null, null));
        assertEquals(Map.of(), tsdb.getDistinctCountsTotals(TSDBModel.KEY_TOTAL_BLACKLISTED, keys, START, END, null, null));
        assertEquals(0L, tsdb.getDistinctCountsUnion(TSDBModel.KEY_TOTAL_RECEIVED, keys, START, END, null, null));
        assertEquals(
            Map.of(),
            tsdb.getMostFrequent(TSDBModel.FREQUENT_ORGANIZATION_RECEIVED_BY_SYSTEM, keys, START, END, null, null, null)
        );
        assertTrue(transport.getEndpoints().isEmpty());
    }

    public void testCustomQueryPath() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("aggregate")));
        AnalyticsTSDB tsdb = new AnalyticsTSDB(
            Settings.builder().put("analytics_tsdb.backend.query_path", "/v2/query").build(),
            transport,
            ENVIRONMENTS,
            ISSUES,
            PARTITIONS
        );

        tsdb.getDistinctCountsUnion(TSDBModel.USERS_AFFECTED_BY_PROJECT, KeySet.flat(List.of(1)), START, END, null, null);

        assertEquals(List.of("/v2/query"), transport.getEndpoints());
    }

    public void testTransportFailure() {
        IOException cause = new IOException("connection refused");
        AnalyticsTransport failing = (endpoint, body) -> { throw cause; };

        BackendQueryException e = expectThrows(
            BackendQueryException.class,
            () -> tsdb(failing).getRange(TSDBModel.GROUP, KeySet.flat(List.of(101)), START, END, null, null)
        );
        assertSame(cause, e.getCause());
    }

    public void testMalformedResponse() {
        AnalyticsTransport transport = (endpoint, body) -> Map.of("error", "query timed out");

        expectThrows(
            BackendQueryException.class,
            () -> tsdb(transport).getRange(TSDBModel.GROUP, KeySet.flat(List.of(101)), START, END, null, null)
        );
    }

    public void testUnexpectedColumn() {
        RecordingTransport transport = new RecordingTransport(
            responseBody(List.of("release", "aggregate"), row("release", "1.0", "aggregate", 1))
        );

        expectThrows(
            IllegalStateException.class,
            () -> tsdb(transport).getDistinctCountsTotals(TSDBModel.GROUP, KeySet.flat(List.of(101)), START, END, null, null)
        );
    }

    public void testInvalidRange() {
        RecordingTransport transport = new RecordingTransport(responseBody(List.of("aggregate")));

        expectThrows(
            IllegalArgumentException.class,
            () -> tsdb(transport).getRange(TSDBModel.GROUP, KeySet.flat(List.of(101)), END, START, null, null)
        );
        assertTrue(transport.getEndpoints().isEmpty());
    }

    public void testRollups() {
        AnalyticsTSDB tsdb = tsdb(new RecordingTransport(responseBody(List.of("aggregate"))));

        assertEquals(10L, tsdb.getOptimalRollup(START));
        assertEquals(10L, tsdb.getOptimalRollup(Instant.EPOCH));
        assertEquals(2, tsdb.getRollups().size());
        assertEquals(T0, tsdb.normalizeToRollup(Instant.ofEpochSecond(T0 + 65), 3600));
        assertEquals(T0 + 60, tsdb.normalizeToRollup(Instant.ofEpochSecond(T0 + 65), 60));
    }

    public void testScore() {
        assertEquals(List.of(new ScoredValue("a", 1.0), new ScoredValue("b", 2.0)), AnalyticsTSDB.score(List.of("b", "a")));
        assertEquals(
            List.of(new ScoredValue(3L, 1.0), new ScoredValue(2L, 2.0), new ScoredValue(1L, 3.0)),
            AnalyticsTSDB.score(List.of(1L, 2L, 3L))
        );
        assertEquals(List.of(), AnalyticsTSDB.score(List.of()));
        assertEquals(List.of(), AnalyticsTSDB.score(0L));
    }

    private static AnalyticsTSDB tsdb(AnalyticsTransport transport) {
        return new AnalyticsTSDB(Settings.EMPTY, transport, ENVIRONMENTS, ISSUES, PARTITIONS);
    }
}
