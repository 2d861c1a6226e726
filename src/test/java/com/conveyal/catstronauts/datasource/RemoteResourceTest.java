package com.conveyal.catstronauts.datasource;

import com.conveyal.catstronauts.model.AuthorRecord;
import com.conveyal.catstronauts.model.TrackRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.SocketTimeoutException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RemoteResourceTest {

    private static final String BASE_URL = "http://catalogue.test/";
    private static final String AUTHOR_URL = BASE_URL + "author/cat-1";
    private static final String AUTHOR_JSON = "{\"id\":\"cat-1\",\"name\":\"Grumpy Cat\",\"photo\":\"grumpy.jpg\"}";
    private static final Executor DIRECT = Runnable::run;

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private FakeTransport transport;

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
    }

    private RemoteResource newResource() {
        return new RemoteResource(BASE_URL, transport, mapper, DIRECT);
    }

    @Test
    void resolvesPathsAgainstBaseUrl() {
        RemoteResource withoutSlash = new RemoteResource("http://catalogue.test", transport, mapper, DIRECT);
        assertThat(withoutSlash.resolve("/tracks"), is("http://catalogue.test/tracks"));
        assertThat(withoutSlash.resolve("author/cat-1"), is(AUTHOR_URL));
        assertThat(newResource().resolve("tracks"), is("http://catalogue.test/tracks"));
    }

    @Test
    void rejectsMissingBaseUrl() {
        assertThrows(IllegalArgumentException.class, () -> new RemoteResource("", transport, mapper, DIRECT));
    }

    @Test
    void decodesRecordListInOrderIgnoringUnknownProperties() {
        transport.respond(BASE_URL + "tracks", 200,
            "[{\"id\":\"c_0\",\"title\":\"Cat-stronomy\",\"authorId\":\"cat-1\",\"modules\":[\"l_0\"]}," +
            "{\"id\":\"c_1\",\"title\":\"Kitty space suits\",\"authorId\":\"cat-2\",\"length\":1916}]");

        List<TrackRecord> tracks = newResource().getList("tracks", TrackRecord.class).join();

        assertThat(tracks.size(), is(2));
        assertThat(tracks.get(0).id, is("c_0"));
        assertThat(tracks.get(0).authorId, is("cat-1"));
        assertThat(tracks.get(0).length, nullValue());
        assertThat(tracks.get(1).id, is("c_1"));
        assertThat(tracks.get(1).length, is(1916));
    }

    @Test
    void reusesResultOfIdenticalRequest() {
        transport.respond(AUTHOR_URL, 200, AUTHOR_JSON);
        RemoteResource resource = newResource();

        AuthorRecord first = resource.get("author/cat-1", AuthorRecord.class).join();
        AuthorRecord second = resource.get("/author/cat-1", AuthorRecord.class).join();

        assertThat(transport.callCount(AUTHOR_URL), is(1));
        assertThat(resource.fetchCount(), is(1));
        assertThat(first.id, is("cat-1"));
        assertThat(second.id, is(first.id));
        assertThat(second.name, is(first.name));
    }

    @Test
    void sharesFetchStillInFlight() {
        transport.respond(AUTHOR_URL, 200, AUTHOR_JSON);
        Queue<Runnable> pending = new ArrayDeque<>();
        RemoteResource resource = new RemoteResource(BASE_URL, transport, mapper, pending::add);

        CompletableFuture<AuthorRecord> first = resource.get("author/cat-1", AuthorRecord.class);
        CompletableFuture<AuthorRecord> second = resource.get("author/cat-1", AuthorRecord.class);
        assertThat(first.isDone(), is(false));
        assertThat(transport.callCount(AUTHOR_URL), is(0));
        while (!pending.isEmpty()) pending.remove().run();

        assertThat(first.join().name, is("Grumpy Cat"));
        assertThat(second.join().name, is("Grumpy Cat"));
        assertThat(transport.callCount(AUTHOR_URL), is(1));
    }

    @Test
    void separateInstancesDoNotShareResults() {
        transport.respond(AUTHOR_URL, 200, AUTHOR_JSON);

        newResource().get("author/cat-1", AuthorRecord.class).join();
        newResource().get("author/cat-1", AuthorRecord.class).join();

        assertThat(transport.callCount(AUTHOR_URL), is(2));
    }

    @Test
    void reportsNonSuccessStatusAsRemoteFailure() {
        transport.respond(AUTHOR_URL, 503, "{\"message\":\"down for maintenance\"}");

        FetchException failure = fetchFailure(newResource().get("author/cat-1", AuthorRecord.class));

        assertThat(failure.errorType, is(FetchErrorType.REMOTE));
        assertThat(failure.status, is(503));
        assertThat(failure.url, is(AUTHOR_URL));
    }

    @Test
    void reportsIOExceptionAsTransportFailure() {
        transport.fail(AUTHOR_URL, new SocketTimeoutException("Read timed out"));

        FetchException failure = fetchFailure(newResource().get("author/cat-1", AuthorRecord.class));

        assertThat(failure.errorType, is(FetchErrorType.TRANSPORT));
        assertThat(failure.status, nullValue());
        assertThat(failure.getCause(), instanceOf(SocketTimeoutException.class));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "null", "<html>Application error</html>", "[" + AUTHOR_JSON + "]", "{\"id\":[1,2]}"})
    void reportsUnreadableBodyAsDecodeFailure(String body) {
        transport.respond(AUTHOR_URL, 200, body);

        FetchException failure = fetchFailure(newResource().get("author/cat-1", AuthorRecord.class));

        assertThat(failure.errorType, is(FetchErrorType.DECODE));
    }

    @Test
    void keepsFailureForTheLifetimeOfTheResource() {
        transport.respond(AUTHOR_URL, 500, "{}");
        RemoteResource resource = newResource();
        FetchException first = fetchFailure(resource.get("author/cat-1", AuthorRecord.class));

        transport.respond(AUTHOR_URL, 200, AUTHOR_JSON);
        FetchException second = fetchFailure(resource.get("author/cat-1", AuthorRecord.class));

        assertThat(second, sameInstance(first));
        assertThat(transport.callCount(AUTHOR_URL), is(1));
        assertThat(resource.fetchCount(), is(1));

        // A new resource, as created for the next request context, asks again.
        AuthorRecord author = newResource().get("author/cat-1", AuthorRecord.class).join();
        assertThat(author.name, is("Grumpy Cat"));
        assertThat(transport.callCount(AUTHOR_URL), is(2));
    }

    @Test
    void sharesFailingFetchAcrossConcurrentCallers() {
        transport.respond(AUTHOR_URL, 500, "{}");
        RemoteResource resource = new RemoteResource(BASE_URL, transport, mapper, ForkJoinPool.commonPool());

        List<CompletableFuture<AuthorRecord>> pending = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            pending.add(resource.get("author/cat-1", AuthorRecord.class));
        }
        for (CompletableFuture<AuthorRecord> future : pending) {
            assertThat(fetchFailure(future).status, is(500));
        }

        assertThat(transport.callCount(AUTHOR_URL), is(1));
    }

    @Test
    void cancellingOneCallerLeavesTheEntryIntact() {
        transport.respond(AUTHOR_URL, 200, AUTHOR_JSON);
        Queue<Runnable> queued = new ArrayDeque<>();
        RemoteResource resource = new RemoteResource(BASE_URL, transport, mapper, queued::add);

        CompletableFuture<AuthorRecord> cancelled = resource.get("author/cat-1", AuthorRecord.class);
        CompletableFuture<AuthorRecord> kept = resource.get("author/cat-1", AuthorRecord.class);
        cancelled.cancel(true);
        while (!queued.isEmpty()) queued.remove().run();

        assertThat(kept.join().name, is("Grumpy Cat"));
        assertThat(resource.get("author/cat-1", AuthorRecord.class).join().name, is("Grumpy Cat"));
        assertThat(transport.callCount(AUTHOR_URL), is(1));
    }

    @Test
    void doesNotRetryOnItsOwn() {
        transport.fail(AUTHOR_URL, new SocketTimeoutException("connect timed out"));

        fetchFailure(newResource().get("author/cat-1", AuthorRecord.class));

        assertThat(transport.callCount(AUTHOR_URL), is(1));
    }

    @Test
    void keepsRequestsToDifferentUrlsApart() {
        transport.respond(AUTHOR_URL, 200, AUTHOR_JSON);
        transport.respond(BASE_URL + "author/cat-2", 200, "{\"id\":\"cat-2\",\"name\":\"Henri\"}");
        RemoteResource resource = newResource();

        List<String> names = List.of(
            resource.get("author/cat-1", AuthorRecord.class).join().name,
            resource.get("author/cat-2", AuthorRecord.class).join().name
        );

        assertThat(names, contains("Grumpy Cat", "Henri"));
        assertThat(transport.totalCalls(), is(2));
    }

    static FetchException fetchFailure(CompletableFuture<?> future) {
        CompletionException exception = assertThrows(CompletionException.class, future::join);
        assertThat(exception.getCause(), instanceOf(FetchException.class));
        return (FetchException) exception.getCause();
    }
}
