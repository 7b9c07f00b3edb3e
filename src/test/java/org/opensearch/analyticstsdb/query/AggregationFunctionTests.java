/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.query;

import org.opensearch.test.OpenSearchTestCase;

public class AggregationFunctionTests extends OpenSearchTestCase {

    public void testBackendNames() {
        assertEquals("count", AggregationFunction.COUNT.toString());
        assertEquals("uniq", AggregationFunction.UNIQ.toString());
        assertEquals("topK(10)", AggregationFunction.topK(10).toString());
    }

    public void testFromString() {
        assertEquals(AggregationFunction.COUNT, AggregationFunction.fromString("count"));
        assertEquals(AggregationFunction.UNIQ, AggregationFunction.fromString("UNIQ"));
        int limit = randomIntBetween(1, 100);
        assertEquals(AggregationFunction.topK(limit), AggregationFunction.fromString("topK(" + limit + ")"));
        expectThrows(IllegalArgumentException.class, () -> AggregationFunction.fromString("sum"));
    }

    public void testTopKLimitMustBePositive() {
        expectThrows(IllegalArgumentException.class, () -> AggregationFunction.topK(0));
        expectThrows(IllegalArgumentException.class, () -> AggregationFunction.fromString("topK(0)"));
        expectThrows(IllegalArgumentException.class, () -> new AggregationFunction(AggregationFunction.Kind.UNIQ, 3));
    }

    public void testIsCount() {
        assertTrue(AggregationFunction.COUNT.isCount());
        assertFalse(AggregationFunction.UNIQ.isCount());
        assertFalse(AggregationFunction.topK(5).isCount());
    }
}
