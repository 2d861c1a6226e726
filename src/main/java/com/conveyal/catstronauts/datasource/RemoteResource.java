package com.conveyal.catstronauts.datasource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One family of remote REST resources living under a common base address. Data sources delegate their fetches to an
 * instance of this class, which resolves URLs, issues the GET through the transport, decodes the JSON body into
 * backing records and caches results.
 *
 * The cache lives exactly as long as this object. A data source creates one RemoteResource per request context, so
 * two unrelated requests never see each other's results. Within that lifetime a second GET on the same URL reuses the
 * first one's outcome, even while it is still in flight. Failures are kept too: every resolver asking for a URL that
 * failed gets the same failure, and only a new request context goes back to the network.
 *
 * Callers never receive the cached future itself, only a stage derived from it, so cancelling what a caller holds
 * does not affect the entry.
 */
public class RemoteResource {

    private static final Logger LOG = LoggerFactory.getLogger(RemoteResource.class);

    public final String baseUrl;
    private final HttpTransport transport;
    private final ObjectMapper mapper;
    private final Executor executor;
    private final Cache<RemoteRequest, CompletableFuture<JsonNode>> cache;
    private final AtomicInteger fetchCount = new AtomicInteger();

    public RemoteResource(String baseUrl, HttpTransport transport, ObjectMapper mapper, Executor executor) {
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.transport = transport;
        this.mapper = mapper;
        this.executor = executor;
        this.cache = Caffeine.newBuilder().executor(executor).build();
    }

    /** Fetch a single record of the given type. */
    public <T> CompletableFuture<T> get(String relativePath, Class<T> recordType) {
        return get(relativePath, mapper.constructType(recordType));
    }

    /** Fetch an ordered list of records of the given type. */
    public <T> CompletableFuture<List<T>> getList(String relativePath, Class<T> recordType) {
        return get(relativePath, mapper.getTypeFactory().constructCollectionType(List.class, recordType));
    }

    private <T> CompletableFuture<T> get(String relativePath, JavaType type) {
        RemoteRequest request = RemoteRequest.get(resolve(relativePath));
        return cache
            .get(request, key -> CompletableFuture.supplyAsync(() -> fetch(key), executor))
            .thenApply(json -> decode(request, json, type));
    }

    /** The absolute URL for a path relative to the base address. */
    public String resolve(String relativePath) {
        String path = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
        return baseUrl + path;
    }

    /** Number of network calls actually issued, i.e. fetches not answered from the cache. */
    public int fetchCount() {
        return fetchCount.get();
    }

    private JsonNode fetch(RemoteRequest request) {
        fetchCount.incrementAndGet();
        LOG.debug("Fetching {}", request);
        RemoteResponse response;
        try {
            response = transport.get(request.url);
        } catch (IOException e) {
            LOG.warn("{} failed: {}", request, e.toString());
            throw FetchException.transport(request.url, e);
        }
        if (!response.isSuccess()) {
            LOG.warn("{} responded with status {}", request, response.status);
            throw FetchException.remote(request.url, response.status);
        }
        if (response.body == null || response.body.isBlank()) {
            throw FetchException.decode(request.url, "response body is empty", null);
        }
        JsonNode json;
        try {
            json = mapper.readTree(response.body);
        } catch (JsonProcessingException e) {
            throw FetchException.decode(request.url, e.getOriginalMessage(), e);
        }
        if (json == null || json.isNull() || json.isMissingNode()) {
            throw FetchException.decode(request.url, "response body is JSON null", null);
        }
        return json;
    }

    private <T> T decode(RemoteRequest request, JsonNode json, JavaType type) {
        try {
            return mapper.treeToValue(json, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw FetchException.decode(request.url, String.format("expected %s", type.toCanonical()), e);
        }
    }

    private static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isEmpty()) {
            throw new IllegalArgumentException("A base URL is required for a remote resource.");
        }
        return baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }
}
