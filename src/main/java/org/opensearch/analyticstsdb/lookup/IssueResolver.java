/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.lookup;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the issues of a set of projects to the fingerprint hashes grouped under each issue.
 *
 * <p>The backend stores raw events by fingerprint hash, so any query referencing the issue column
 * must carry this mapping.</p>
 */
@FunctionalInterface
public interface IssueResolver {

    /**
     * Get the issues and associated fingerprint hashes for a set of projects.
     *
     * @param projectIds the projects to list issues for
     * @return fingerprint hashes keyed by issue id, empty if the projects have no issues
     */
    Map<Long, List<String>> fingerprintsFor(Set<Long> projectIds);
}
