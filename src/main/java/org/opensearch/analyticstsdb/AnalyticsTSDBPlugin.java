/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb;

import org.opensearch.analyticstsdb.config.AnalyticsTSDBSettings;
import org.opensearch.common.settings.Setting;
import org.opensearch.plugins.Plugin;

import java.util.List;

/**
 * Plugin registering the settings of the analytic TSDB.
 */
public class AnalyticsTSDBPlugin extends Plugin {

    /**
     * Default constructor
     */
    public AnalyticsTSDBPlugin() {}

    @Override
    public List<Setting<?>> getSettings() {
        return AnalyticsTSDBSettings.getSettings();
    }
}
