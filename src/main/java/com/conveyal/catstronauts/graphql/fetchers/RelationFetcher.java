package com.conveyal.catstronauts.graphql.fetchers;

import com.conveyal.catstronauts.graphql.RequestContext;
import com.google.common.base.Strings;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Resolves an exposed relation that the parent's backing record only carries as a foreign key, e.g. the author of a
 * track from the track's authorId. The key is read off the parent and handed to a data source operation; the record
 * it returns is the backing record of the related type, so resolution continues on it.
 *
 * A null or empty key resolves to no related entity without calling the data source.
 *
 * @param <P> backing record type of the parent
 * @param <R> backing record type of the related entity
 */
public class RelationFetcher<P, R> implements DataFetcher<CompletableFuture<R>> {

    private static final Logger LOG = LoggerFactory.getLogger(RelationFetcher.class);

    private final String relationName;
    private final Function<P, String> foreignKey;
    private final BiFunction<RequestContext, String, CompletableFuture<R>> load;

    /**
     * @param relationName used for logging only.
     * @param foreignKey   reads the key from the parent record. Must not modify the parent.
     * @param load         fetches the related record by key through the request's data sources.
     */
    public RelationFetcher(
        String relationName,
        Function<P, String> foreignKey,
        BiFunction<RequestContext, String, CompletableFuture<R>> load
    ) {
        this.relationName = relationName;
        this.foreignKey = foreignKey;
        this.load = load;
    }

    @Override
    public CompletableFuture<R> get(DataFetchingEnvironment environment) {
        P parent = environment.getSource();
        String key = parent == null ? null : foreignKey.apply(parent);
        if (Strings.isNullOrEmpty(key)) {
            LOG.debug("No {} key on {}, resolving to null.", relationName, parent);
            return CompletableFuture.completedFuture(null);
        }
        return load.apply(RequestContext.from(environment), key);
    }
}
