package com.conveyal.catstronauts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Settings for reaching the remote catalogue. Defaults come from catstronauts.properties on the classpath, and any
 * JVM system property with the same name takes precedence.
 */
public class ServiceConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceConfig.class);

    public static final String PROPERTIES_RESOURCE = "catstronauts.properties";
    public static final String BASE_URL = "remote.baseUrl";
    public static final String CONNECT_TIMEOUT = "remote.connectTimeoutMillis";
    public static final String SOCKET_TIMEOUT = "remote.socketTimeoutMillis";

    private static final int DEFAULT_TIMEOUT_MILLIS = 10_000;

    public final String baseUrl;
    public final int connectTimeoutMillis;
    public final int socketTimeoutMillis;

    public ServiceConfig(String baseUrl, int connectTimeoutMillis, int socketTimeoutMillis) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException(String.format("Property %s must be set.", BASE_URL));
        }
        if (connectTimeoutMillis <= 0 || socketTimeoutMillis <= 0) {
            throw new IllegalArgumentException("Timeouts must be positive.");
        }
        this.baseUrl = baseUrl;
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.socketTimeoutMillis = socketTimeoutMillis;
    }

    /** Load from the classpath defaults, overridden by system properties. */
    public static ServiceConfig load() {
        Properties properties = new Properties();
        try (InputStream in = ServiceConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                LOG.warn("{} not found on classpath, relying on system properties.", PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + PROPERTIES_RESOURCE, e);
        }
        properties.putAll(System.getProperties());
        return fromProperties(properties);
    }

    public static ServiceConfig fromProperties(Properties properties) {
        return new ServiceConfig(
            properties.getProperty(BASE_URL),
            intProperty(properties, CONNECT_TIMEOUT),
            intProperty(properties, SOCKET_TIMEOUT)
        );
    }

    /** A copy of this configuration pointing at another base URL. */
    public ServiceConfig withBaseUrl(String otherBaseUrl) {
        return new ServiceConfig(otherBaseUrl, connectTimeoutMillis, socketTimeoutMillis);
    }

    private static int intProperty(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) return DEFAULT_TIMEOUT_MILLIS;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property %s must be an integer, got '%s'.", key, value));
        }
    }

    @Override
    public String toString() {
        return String.format("%s (connect timeout %d ms, socket timeout %d ms)",
            baseUrl, connectTimeoutMillis, socketTimeoutMillis);
    }
}
