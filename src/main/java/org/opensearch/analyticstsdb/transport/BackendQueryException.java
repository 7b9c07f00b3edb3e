/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.transport;

import org.opensearch.OpenSearchException;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.rest.RestStatus;

import java.io.IOException;

/**
 * Exception thrown when a query against the analytic backend fails, either because the round trip
 * failed or because the backend returned a body that is not a query response.
 */
public class BackendQueryException extends OpenSearchException {

    public BackendQueryException(String msg) {
        super(msg);
    }

    public BackendQueryException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public BackendQueryException(StreamInput in) throws IOException {
        super(in);
    }

    @Override
    public RestStatus status() {
        return RestStatus.BAD_GATEWAY;
    }
}
