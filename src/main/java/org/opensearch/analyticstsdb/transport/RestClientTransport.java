/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.analyticstsdb.transport;

import org.apache.http.HttpEntity;
import org.apache.http.HttpHost;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.analyticstsdb.config.AnalyticsTSDBSettings;
import org.opensearch.client.Request;
import org.opensearch.client.Response;
import org.opensearch.client.RestClient;
import org.opensearch.client.RestClientBuilder;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.xcontent.json.JsonXContent;
import org.opensearch.core.xcontent.DeprecationHandler;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.core.xcontent.XContentParser;
import org.opensearch.rest.RestRequest;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link AnalyticsTransport} backed by the OpenSearch low-level {@link RestClient}.
 *
 * <p>Connection pooling, timeouts and retries are those of the REST client; this class only
 * performs the POST and decodes the JSON body.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * try (RestClientTransport transport = RestClientTransport.create(settings)) {
 *     Map<String, Object> body = transport.post("/query", "{...}");
 * }
 * }</pre>
 */
public final class RestClientTransport implements AnalyticsTransport, Closeable {

    private static final Logger logger = LogManager.getLogger(RestClientTransport.class);

    private final RestClient restClient;

    public RestClientTransport(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient cannot be null");
    }

    /**
     * Creates a transport to the backend configured by {@link AnalyticsTSDBSettings#BACKEND_URL}.
     */
    public static RestClientTransport create(Settings settings) {
        URI backendUrl = URI.create(AnalyticsTSDBSettings.BACKEND_URL.get(settings));
        logger.info("Creating analytic backend transport to [{}]", backendUrl);
        return new RestClientTransport(clientBuilder(backendUrl).build());
    }

    /**
     * Builds a REST client for a backend URL. A path in the URL becomes the client's path prefix.
     */
    static RestClientBuilder clientBuilder(URI backendUrl) {
        if (backendUrl.getHost() == null || backendUrl.getScheme() == null) {
            throw new IllegalArgumentException("Backend URL must be absolute, got: " + backendUrl);
        }
        RestClientBuilder builder = RestClient.builder(new HttpHost(backendUrl.getHost(), backendUrl.getPort(), backendUrl.getScheme()));
        String path = backendUrl.getPath();
        if (path != null && path.isEmpty() == false && "/".equals(path) == false) {
            builder.setPathPrefix(path);
        }
        return builder;
    }

    @Override
    public Map<String, Object> post(String endpoint, String jsonBody) throws IOException {
        Request request = new Request(RestRequest.Method.POST.name(), endpoint);
        request.setJsonEntity(jsonBody);

        // Error statuses surface as ResponseException
        Response response = restClient.performRequest(request);
        HttpEntity entity = response.getEntity();
        if (entity == null) {
            throw new IOException(
                String.format(Locale.ROOT, "Empty response from backend: status=%d", response.getStatusLine().getStatusCode())
            );
        }
        try (InputStream content = entity.getContent()) {
            return parseBody(content);
        }
    }

    /**
     * Decodes a JSON response body.
     *
     * @throws IOException if the body is not a JSON object
     */
    static Map<String, Object> parseBody(InputStream content) throws IOException {
        try (
            XContentParser parser = JsonXContent.jsonXContent.createParser(
                NamedXContentRegistry.EMPTY,
                DeprecationHandler.THROW_UNSUPPORTED_OPERATION,
                content
            )
        ) {
            if (parser.nextToken() != XContentParser.Token.START_OBJECT) {
                throw new IOException("Backend response is not a JSON object");
            }
            return parser.mapOrdered();
        } catch (RuntimeException e) {
            // XContentParseException and friends
            throw new IOException("Failed to decode backend response: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        restClient.close();
    }
}
