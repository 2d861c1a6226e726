package com.conveyal.catstronauts.graphql.fetchers;

import com.conveyal.catstronauts.graphql.RequestContext;
import com.conveyal.catstronauts.model.TrackRecord;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fetch the track list for the home page. This is a root field, there is no parent value. The track records it
 * returns still carry authorId only; the author of each is resolved further down by a {@link RelationFetcher}.
 */
public class TracksForHomeFetcher implements DataFetcher<CompletableFuture<List<TrackRecord>>> {

    @Override
    public CompletableFuture<List<TrackRecord>> get(DataFetchingEnvironment environment) {
        return RequestContext.from(environment).trackAPI.getTracksForHome();
    }
}
