/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.transport;

import java.io.IOException;
import java.util.Map;

/**
 * Synchronous transport to the analytic backend.
 *
 * <p>Implementations own connection management, timeouts and retries. A call blocks for the whole
 * round trip and any failure is final for the operation that issued it.</p>
 */
@FunctionalInterface
public interface AnalyticsTransport {

    /**
     * POST a JSON body to a backend endpoint.
     *
     * @param endpoint the endpoint path, e.g. {@code /query}
     * @param jsonBody the request body
     * @return the parsed JSON response body
     * @throws IOException if the request fails, the backend answers with an error status, or the body is not JSON
     */
    Map<String, Object> post(String endpoint, String jsonBody) throws IOException;
}
