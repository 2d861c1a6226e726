package com.conveyal.catstronauts.datasource;

import com.conveyal.catstronauts.ServiceConfig;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * {@link HttpTransport} on top of Apache HttpClient. One instance (and its connection pool) is meant to be shared by
 * all requests; it holds no per-request state. Retries are disabled, a failed attempt is reported to the caller.
 */
public class ApacheHttpTransport implements HttpTransport, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ApacheHttpTransport.class);

    private final CloseableHttpClient httpClient;

    public ApacheHttpTransport(ServiceConfig config) {
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectTimeout(config.connectTimeoutMillis)
            .setConnectionRequestTimeout(config.connectTimeoutMillis)
            .setSocketTimeout(config.socketTimeoutMillis)
            .build();
        this.httpClient = HttpClients.custom()
            .setDefaultRequestConfig(requestConfig)
            .disableAutomaticRetries()
            .build();
    }

    @Override
    public RemoteResponse get(String url) throws IOException {
        HttpGet request = new HttpGet(url);
        request.setHeader(HttpHeaders.ACCEPT, "application/json");
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            String body = entity == null ? null : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            LOG.debug("GET {} -> {}", url, status);
            return new RemoteResponse(status, body);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
