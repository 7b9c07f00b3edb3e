/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.config;

import org.opensearch.common.settings.Setting;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.function.Function;

/**
 * Settings of the analytic TSDB.
 */
public final class AnalyticsTSDBSettings {

    private AnalyticsTSDBSettings() {}

    /**
     * Base URL of the analytic query backend.
     */
    public static final Setting<String> BACKEND_URL = Setting.simpleString(
        "analytics_tsdb.backend.url",
        "http://localhost:5000",
        AnalyticsTSDBSettings::validateUrl,
        Setting.Property.NodeScope
    );

    /**
     * Path of the query endpoint, relative to {@link #BACKEND_URL}.
     */
    public static final Setting<String> QUERY_PATH = Setting.simpleString(
        "analytics_tsdb.backend.query_path",
        "/query",
        value -> {
            if (value.startsWith("/") == false) {
                throw new IllegalArgumentException("Query path must start with '/', got: " + value);
            }
        },
        Setting.Property.NodeScope
    );

    /**
     * Available rollups as {@code <bucket width>:<retained buckets>}, e.g. {@code 10s:360}.
     */
    public static final Setting<List<String>> ROLLUPS = Setting.listSetting(
        "analytics_tsdb.rollups",
        List.of("10s:360", "1h:168"),
        Function.identity(),
        value -> RollupConfig.parse(value),
        Setting.Property.NodeScope
    );

    /**
     * All settings, for plugin registration.
     */
    public static List<Setting<?>> getSettings() {
        return List.of(BACKEND_URL, QUERY_PATH, ROLLUPS);
    }

    private static void validateUrl(String value) {
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("Backend URL must be absolute, got: " + value);
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid backend URL: " + value, e);
        }
    }
}
