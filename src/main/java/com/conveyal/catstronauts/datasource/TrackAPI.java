package com.conveyal.catstronauts.datasource;

import com.conveyal.catstronauts.model.AuthorRecord;
import com.conveyal.catstronauts.model.TrackRecord;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Data source for the Catstronauts catalogue: tracks and their authors. Create one per request context, the
 * underlying {@link RemoteResource} caches for the lifetime of this object.
 */
public class TrackAPI {

    private static final Escaper PATH_SEGMENT = UrlEscapers.urlPathSegmentEscaper();

    private final RemoteResource resource;

    public TrackAPI(RemoteResource resource) {
        this.resource = resource;
    }

    /** The tracks shown on the home page, in the order the catalogue lists them. */
    public CompletableFuture<List<TrackRecord>> getTracksForHome() {
        return resource.getList("tracks", TrackRecord.class);
    }

    public CompletableFuture<TrackRecord> getTrack(String trackId) {
        return resource.get("track/" + PATH_SEGMENT.escape(trackId), TrackRecord.class);
    }

    public CompletableFuture<AuthorRecord> getAuthor(String authorId) {
        return resource.get("author/" + PATH_SEGMENT.escape(authorId), AuthorRecord.class);
    }

    public RemoteResource resource() {
        return resource;
    }
}
