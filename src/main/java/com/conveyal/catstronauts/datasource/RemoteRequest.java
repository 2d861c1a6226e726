package com.conveyal.catstronauts.datasource;

import java.util.Objects;

/**
 * Identity of an outgoing request, used as the key of the per-request cache. Two requests are the same if they use
 * the same method on the same fully resolved URL.
 */
public class RemoteRequest {

    public static final String GET = "GET";

    public final String method;
    public final String url;

    public RemoteRequest(String method, String url) {
        this.method = method;
        this.url = url;
    }

    public static RemoteRequest get(String url) {
        return new RemoteRequest(GET, url);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RemoteRequest that = (RemoteRequest) o;
        return method.equals(that.method) && url.equals(that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, url);
    }

    @Override
    public String toString() {
        return method + " " + url;
    }
}
