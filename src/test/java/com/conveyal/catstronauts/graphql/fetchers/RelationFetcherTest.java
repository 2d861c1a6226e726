package com.conveyal.catstronauts.graphql.fetchers;

import com.conveyal.catstronauts.datasource.FakeTransport;
import com.conveyal.catstronauts.graphql.RequestContext;
import com.conveyal.catstronauts.model.AuthorRecord;
import com.conveyal.catstronauts.model.TrackRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphql.GraphQLContext;
import graphql.schema.DataFetchingEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static graphql.schema.DataFetchingEnvironmentImpl.newDataFetchingEnvironment;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RelationFetcherTest {

    private static final String BASE_URL = "http://catalogue.test/";

    private final RelationFetcher<TrackRecord, AuthorRecord> authorFetcher = new RelationFetcher<>(
        "author",
        track -> track.authorId,
        (context, authorId) -> context.trackAPI.getAuthor(authorId)
    );
    private FakeTransport transport;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport()
            .respond(BASE_URL + "author/cat-1", 200, "{\"id\":\"cat-1\",\"name\":\"Grumpy Cat\"}");
        context = RequestContext.create(BASE_URL, transport, new ObjectMapper(), Runnable::run);
    }

    private DataFetchingEnvironment environmentFor(TrackRecord track) {
        return newDataFetchingEnvironment()
            .source(track)
            .graphQLContext(GraphQLContext.newContext().of(RequestContext.class, context).build())
            .build();
    }

    private static TrackRecord track(String authorId) {
        TrackRecord track = new TrackRecord();
        track.id = "c_0";
        track.authorId = authorId;
        return track;
    }

    @Test
    void fetchesRelatedRecordByForeignKey() {
        TrackRecord track = track("cat-1");

        AuthorRecord author = authorFetcher.get(environmentFor(track)).join();

        assertThat(author.id, is(track.authorId));
        assertThat(author.name, is("Grumpy Cat"));
        assertThat(transport.callCount(BASE_URL + "author/cat-1"), is(1));
        assertThat(transport.totalCalls(), is(1));
        assertThat(track.authorId, is("cat-1"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void resolvesMissingKeyToNullWithoutFetching(String authorId) {
        AuthorRecord author = authorFetcher.get(environmentFor(track(authorId))).join();

        assertThat(author, nullValue());
        assertThat(transport.totalCalls(), is(0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"cat-1", "cat-2"})
    void fetchesOncePerKeyWithinOneContext(String authorId) {
        authorFetcher.get(environmentFor(track(authorId))).exceptionally(e -> null).join();
        authorFetcher.get(environmentFor(track(authorId))).exceptionally(e -> null).join();

        // cat-2 has no canned response; its failure is reused like a success.
        assertThat(transport.callCount(BASE_URL + "author/" + authorId), is(1));
    }

    @Test
    void requiresRequestContext() {
        DataFetchingEnvironment withoutContext = newDataFetchingEnvironment()
            .source(track("cat-1"))
            .graphQLContext(GraphQLContext.newContext().build())
            .build();

        assertThrows(IllegalStateException.class, () -> authorFetcher.get(withoutContext));
    }
}
