/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.model;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.analyticstsdb.core.utils.Identifiers;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Keys a caller asks about, in one of the shapes accepted by TSDB read operations.
 *
 * <ul>
 *   <li>{@link Flat}: a plain set of keys for the model's group column, e.g. issue ids</li>
 *   <li>{@link Nested}: {@code {groupKey: [aggregateKey, ...]}}, e.g. issue id to environment names</li>
 *   <li>{@link Unrecognized}: any other shape; contributes no filter</li>
 * </ul>
 */
public sealed interface KeySet permits KeySet.Flat, KeySet.Nested, KeySet.Unrecognized {

    /**
     * Split the keys into the group level and the union of the aggregate level.
     */
    NormalizedKeys normalize();

    /**
     * Group keys only.
     *
     * @throws IllegalArgumentException if a key is null
     */
    static KeySet flat(Collection<?> keys) {
        return new Flat(normalizeAll(keys));
    }

    /**
     * A null value set is treated as empty.
     *
     * @throws IllegalArgumentException if a key at either level is null
     */
    static KeySet nested(Map<?, ? extends Collection<?>> keys) {
        Map<Object, Set<Object>> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ? extends Collection<?>> entry : keys.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Key sets cannot contain null keys");
            }
            Collection<?> values = entry.getValue() == null ? Collections.emptySet() : entry.getValue();
            normalized.put(Identifiers.normalize(entry.getKey()), normalizeAll(values));
        }
        return new Nested(normalized);
    }

    /**
     * Resolve loosely typed caller input into a key set.
     *
     * <p>A collection is a flat key set and a map whose values are collections is a nested key set.
     * Anything else is {@link Unrecognized}, which is tolerated rather than rejected.</p>
     */
    static KeySet from(Object raw) {
        if (raw instanceof KeySet keySet) {
            return keySet;
        }
        if (raw instanceof Collection<?> collection) {
            return flat(collection);
        }
        if (raw instanceof Map<?, ?> map) {
            Map<Object, Collection<?>> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() instanceof Collection<?> values) {
                    nested.put(entry.getKey(), values);
                } else {
                    Unrecognized.logger.debug("Unrecognized nested key set value for key [{}]", entry.getKey());
                    return Unrecognized.INSTANCE;
                }
            }
            return nested(nested);
        }
        Unrecognized.logger.debug("Unrecognized key set of type [{}]", raw == null ? null : raw.getClass().getName());
        return Unrecognized.INSTANCE;
    }

    private static Set<Object> normalizeAll(Collection<?> keys) {
        Set<Object> normalized = new LinkedHashSet<>(keys.size());
        for (Object key : keys) {
            if (key == null) {
                throw new IllegalArgumentException("Key sets cannot contain null keys");
            }
            normalized.add(Identifiers.normalize(key));
        }
        return normalized;
    }

    /**
     * A plain set of group keys.
     */
    record Flat(Set<Object> keys) implements KeySet {
        @Override
        public NormalizedKeys normalize() {
            return new NormalizedKeys(keys, null);
        }
    }

    /**
     * Group keys each mapped to a set of aggregate keys.
     */
    record Nested(Map<Object, Set<Object>> keys) implements KeySet {
        @Override
        public NormalizedKeys normalize() {
            Set<Object> union = new LinkedHashSet<>();
            for (Set<Object> values : keys.values()) {
                union.addAll(values);
            }
            return new NormalizedKeys(new LinkedHashSet<>(keys.keySet()), union);
        }
    }

    /**
     * A caller shape that is neither flat nor nested.
     */
    final class Unrecognized implements KeySet {
        private static final Logger logger = LogManager.getLogger(Unrecognized.class);

        static final Unrecognized INSTANCE = new Unrecognized();

        private Unrecognized() {}

        @Override
        public NormalizedKeys normalize() {
            return NormalizedKeys.NONE;
        }

        @Override
        public String toString() {
            return "KeySet.Unrecognized";
        }
    }
}
