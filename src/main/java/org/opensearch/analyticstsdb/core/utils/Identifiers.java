/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.utils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes identifiers and values exchanged with the backend.
 *
 * <p>JSON parsing yields {@link Integer} or {@link Long} depending on magnitude, and callers pass
 * whichever boxed type they hold. Widening every integral number to {@link Long} lets caller keys,
 * request values and response values be compared and used as map keys interchangeably.</p>
 */
public final class Identifiers {

    private Identifiers() {}

    /**
     * Widens integral numbers that fit to {@link Long}. Lists are normalized element-wise and other values are returned as-is.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        // Unsigned 64 bit values above Long.MAX_VALUE stay BigIntegers
        if (value instanceof BigInteger bigInteger && bigInteger.bitLength() < Long.SIZE) {
            return bigInteger.longValue();
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object element : list) {
                normalized.add(normalize(element));
            }
            return normalized;
        }
        return value;
    }

    /**
     * Converts an identifier to a partition id.
     *
     * @throws IllegalArgumentException if the identifier is neither an integral number nor a numeric string
     */
    public static long toPartitionId(Object id) {
        if (id instanceof Number number) {
            if (number instanceof Double || number instanceof Float) {
                throw new IllegalArgumentException("Partition id must be integral, got: " + id);
            }
            return number.longValue();
        }
        if (id instanceof String string) {
            try {
                return Long.parseLong(string);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Partition id must be numeric, got: " + id, e);
            }
        }
        throw new IllegalArgumentException("Partition id must be numeric, got: " + id);
    }
}
