package com.conveyal.catstronauts.datasource;

import java.io.IOException;

/**
 * The bare HTTP primitive that data sources are built on. Implementations perform exactly one attempt per call and
 * must report timeouts as an IOException instead of blocking forever.
 */
public interface HttpTransport {

    RemoteResponse get(String url) throws IOException;
}
