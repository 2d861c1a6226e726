package com.conveyal.catstronauts.graphql.fetchers;

import com.conveyal.catstronauts.graphql.RequestContext;
import com.google.common.base.Strings;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Root fetcher looking up a single entity by its id argument. An empty id matches nothing, so it resolves to null
 * without a remote call.
 */
public class ByIdFetcher<R> implements DataFetcher<CompletableFuture<R>> {

    public static final String ID_ARG = "id";

    private final BiFunction<RequestContext, String, CompletableFuture<R>> load;

    public ByIdFetcher(BiFunction<RequestContext, String, CompletableFuture<R>> load) {
        this.load = load;
    }

    @Override
    public CompletableFuture<R> get(DataFetchingEnvironment environment) {
        String id = environment.getArgument(ID_ARG);
        if (Strings.isNullOrEmpty(id)) {
            return CompletableFuture.completedFuture(null);
        }
        return load.apply(RequestContext.from(environment), id);
    }
}
