package com.conveyal.catstronauts.graphql;

import com.conveyal.catstronauts.datasource.HttpTransport;
import com.conveyal.catstronauts.datasource.RemoteResource;
import com.conveyal.catstronauts.datasource.TrackAPI;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.schema.DataFetchingEnvironment;

import java.util.concurrent.Executor;

/**
 * Everything a resolver may reach during one GraphQL execution: one instance of every data source, addressed by name.
 * A new context is built for every execution and never handed to another one, so whatever the data sources cache
 * stays within a single request.
 */
public final class RequestContext {

    public final TrackAPI trackAPI;

    public RequestContext(TrackAPI trackAPI) {
        this.trackAPI = trackAPI;
    }

    /** Build a context with freshly constructed data sources. */
    public static RequestContext create(String baseUrl, HttpTransport transport, ObjectMapper mapper, Executor executor) {
        return new RequestContext(new TrackAPI(new RemoteResource(baseUrl, transport, mapper, executor)));
    }

    /**
     * Helper to obtain the context of the execution a fetcher is running in. Every fetcher reaching a data source
     * must go through here so that it uses the same data source instances as its siblings.
     */
    public static RequestContext from(DataFetchingEnvironment environment) {
        RequestContext context = environment.getGraphQlContext().get(RequestContext.class);
        if (context == null) {
            throw new IllegalStateException("RequestContext is not defined, unable to fetch remote data!");
        }
        return context;
    }
}
