/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.model;

import org.opensearch.analyticstsdb.core.mapping.Constants.Columns;

import java.util.Locale;
import java.util.Optional;

/**
 * Time series models a TSDB caller can ask about.
 *
 * <p>Only models derived from event data can be answered by the analytic backend. The remaining
 * models are part of the closed set so that callers can pass them, but {@link #columns()} is empty
 * for them and every read operation degrades to an empty result.</p>
 */
public enum TSDBModel {
    PROJECT(Columns.PROJECT_ID, null),
    GROUP(Columns.ISSUE, null),
    RELEASE(Columns.RELEASE, null),

    USERS_AFFECTED_BY_GROUP(Columns.ISSUE, Columns.USER_ID),
    USERS_AFFECTED_BY_PROJECT(Columns.PROJECT_ID, Columns.USER_ID),

    FREQUENT_ENVIRONMENTS_BY_GROUP(Columns.ISSUE, Columns.ENVIRONMENT),
    FREQUENT_RELEASES_BY_GROUP(Columns.ISSUE, Columns.RELEASE),
    FREQUENT_ISSUES_BY_PROJECT(Columns.PROJECT_ID, Columns.ISSUE),

    // Outcome counters are recorded outside of the event stream
    PROJECT_TOTAL_RECEIVED,
    PROJECT_TOTAL_REJECTED,
    PROJECT_TOTAL_BLACKLISTED,
    ORGANIZATION_TOTAL_RECEIVED,
    ORGANIZATION_TOTAL_REJECTED,
    ORGANIZATION_TOTAL_BLACKLISTED,
    KEY_TOTAL_RECEIVED,
    KEY_TOTAL_REJECTED,
    KEY_TOTAL_BLACKLISTED,
    FREQUENT_ORGANIZATION_RECEIVED_BY_SYSTEM,
    FREQUENT_ORGANIZATION_REJECTED_BY_REASON;

    private final ColumnPair columns;

    TSDBModel() {
        this.columns = null;
    }

    TSDBModel(String groupColumn, String aggregateColumn) {
        this.columns = new ColumnPair(groupColumn, aggregateColumn);
    }

    /**
     * Translates this model into the columns required for querying the backend.
     *
     * @return the (group, aggregate) column pair, or empty if the backend cannot answer this model
     */
    public Optional<ColumnPair> columns() {
        return Optional.ofNullable(columns);
    }

    public boolean isSupported() {
        return columns != null;
    }

    /**
     * Parse a model from its snake case name.
     */
    public static TSDBModel fromString(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown TSDB model: " + name);
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
