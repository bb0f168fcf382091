/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.ssb.pilosa;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal client for the Pilosa HTTP API: PQL queries, index and frame creation, and the server version.
 *
 * Thread-safe. The connection pool is sized for {@code maxConnections} concurrent requests; a benchmark run with more
 * workers than that would measure pool contention instead of the server.
 */
public class PilosaClient implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(PilosaClient.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final String baseUri;
    private final CloseableHttpClient client;

    public PilosaClient(String address, int maxConnections, int connectTimeoutMillis, int responseTimeoutMillis) {
        if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be positive");
        this.baseUri = StringUtils.removeEnd(address.contains("://") ? address : "http://" + address, "/");
        this.client = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxConnections)
                        .setMaxConnPerRoute(maxConnections)
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMillis))
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMillis))
                        .build())
                .build();
    }

    public String getBaseUri() {
        return baseUri;
    }

    /**
     * Runs a (possibly compound) PQL query against an index and returns the entries of the response's
     * {@code results} array, one per top-level call in the query.
     */
    public List<JsonNode> query(String index, String pql) throws PilosaException {
        HttpPost post = new HttpPost(baseUri + "/index/" + index + "/query");
        post.setEntity(new StringEntity(pql, ContentType.TEXT_PLAIN.withCharset(StandardCharsets.UTF_8)));
        JsonNode body = parse(send(post, HttpStatus.SC_OK));
        if (body.hasNonNull("error")) {
            throw new PilosaException(HttpStatus.SC_OK, body.get("error").asText());
        }
        JsonNode results = body.get("results");
        if (results == null || !results.isArray()) {
            throw new PilosaException("query response has no results array: " + body, null);
        }
        List<JsonNode> ret = new ArrayList<>(results.size());
        results.forEach(ret::add);
        return ret;
    }

    /** Creates the index unless it already exists. Returns true if it was created */
    public boolean ensureIndex(String index) throws PilosaException {
        return create("/index/" + index);
    }

    /** Creates the frame unless it already exists. Returns true if it was created */
    public boolean ensureFrame(String index, String frame) throws PilosaException {
        return create("/index/" + index + "/frame/" + frame);
    }

    public String getVersion() throws PilosaException {
        JsonNode body = parse(send(new HttpGet(baseUri + "/version"), HttpStatus.SC_OK));
        JsonNode version = body.get("version");
        if (version == null) {
            throw new PilosaException("version response has no version field: " + body, null);
        }
        return version.asText();
    }

    private boolean create(String path) throws PilosaException {
        HttpPost post = new HttpPost(baseUri + path);
        post.setEntity(new StringEntity("{\"options\":{}}", ContentType.APPLICATION_JSON));
        Response response = execute(post);
        if (response.code == HttpStatus.SC_CONFLICT) {
            logger.debug("{} already exists", path);
            return false;
        } else if (response.code != HttpStatus.SC_OK) {
            throw new PilosaException(response.code, errorMessage(response.body));
        }
        logger.info("created {}", path);
        return true;
    }

    private String send(HttpUriRequestBase request, int expectedCode) throws PilosaException {
        Response response = execute(request);
        if (response.code != expectedCode) {
            throw new PilosaException(response.code, errorMessage(response.body));
        }
        return response.body;
    }

    private Response execute(HttpUriRequestBase request) throws PilosaException {
        try {
            return client.execute(request, response -> new Response(response.getCode(),
                    response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new PilosaException(request.getMethod() + " " + request.getRequestUri() + ": " + e, e);
        }
    }

    private static JsonNode parse(String body) throws PilosaException {
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new PilosaException("malformed response: " + StringUtils.abbreviate(body, 200), e);
        }
    }

    /** The engine reports errors as {"error": "..."}; fall back to the raw body for anything else */
    private static String errorMessage(String body) {
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (IOException e) {
            logger.debug("error body is not JSON", e);
        }
        return StringUtils.abbreviate(StringUtils.strip(body), 200);
    }

    @Override
    public void close() throws IOException {
        client.close();
    }

    private static class Response {
        final int code;
        final String body;

        Response(int code, String body) {
            this.code = code;
            this.body = body;
        }
    }
}
