/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.lookup;

/**
 * Resolves environment ids to the environment names stored by the backend.
 */
@FunctionalInterface
public interface EnvironmentResolver {

    /**
     * Get an environment name from an id.
     *
     * @param environmentId the environment id
     * @return the environment name
     * @throws org.opensearch.ResourceNotFoundException if no environment has this id
     */
    String nameFor(long environmentId);
}
