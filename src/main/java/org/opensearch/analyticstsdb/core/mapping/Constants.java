/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.core.mapping;

/**
 * Defines the column and field names of the analytic query backend.
 */
public final class Constants {

    /**
     * Private constructor to prevent instantiation of utility class.
     */
    private Constants() {
        // Utility class
    }

    /**
     * Column names understood by the backend's query endpoint.
     */
    public static final class Columns {
        /**
         * Private constructor to prevent instantiation of utility class.
         */
        private Columns() {
            // Utility class
        }

        /**
         * Partition column. Every query is ultimately scoped to a set of projects.
         */
        public static final String PROJECT_ID = "project_id";

        /**
         * Issue (group) column. Referencing it requires the issue to fingerprint mapping.
         */
        public static final String ISSUE = "issue";

        public static final String RELEASE = "release";

        public static final String USER_ID = "user_id";

        public static final String ENVIRONMENT = "environment";

        /**
         * Time bucket column, only present when grouping on time.
         */
        public static final String TIME = "time";

        /**
         * Name of the aggregate value in every result row.
         */
        public static final String AGGREGATE = "aggregate";
    }

    /**
     * Field names of the backend request and response payloads.
     */
    public static final class Wire {
        private Wire() {
            // Utility class
        }

        public static final String FROM_DATE = "from_date";
        public static final String TO_DATE = "to_date";
        public static final String CONDITIONS = "conditions";
        public static final String GROUPBY = "groupby";
        public static final String PROJECT = "project";
        public static final String AGGREGATION = "aggregation";
        public static final String AGGREGATEBY = "aggregateby";
        public static final String GRANULARITY = "granularity";
        public static final String ISSUES = "issues";

        public static final String META = "meta";
        public static final String DATA = "data";
        public static final String NAME = "name";
    }
}
