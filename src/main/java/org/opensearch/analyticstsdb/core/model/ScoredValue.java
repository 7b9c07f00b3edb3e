/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.model;

/**
 * A value from a top-K result together with its frequency score. Higher scores are more frequent.
 */
public record ScoredValue(Object value, double score) {}
