package com.conveyal.catstronauts.graphql;

import com.conveyal.catstronauts.graphql.fetchers.ByIdFetcher;
import com.conveyal.catstronauts.graphql.fetchers.RelationFetcher;
import com.conveyal.catstronauts.graphql.fetchers.TracksForHomeFetcher;
import com.conveyal.catstronauts.model.AuthorRecord;
import com.conveyal.catstronauts.model.EntityModelRegistry;
import com.conveyal.catstronauts.model.TrackRecord;
import graphql.schema.GraphQLCodeRegistry;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;

import static com.conveyal.catstronauts.graphql.GraphQLUtil.field;
import static com.conveyal.catstronauts.graphql.GraphQLUtil.id;
import static com.conveyal.catstronauts.graphql.GraphQLUtil.idArg;
import static com.conveyal.catstronauts.graphql.GraphQLUtil.intt;
import static com.conveyal.catstronauts.graphql.GraphQLUtil.requiredString;
import static com.conveyal.catstronauts.graphql.GraphQLUtil.string;
import static graphql.schema.GraphQLFieldDefinition.newFieldDefinition;
import static graphql.schema.GraphQLList.list;
import static graphql.schema.GraphQLNonNull.nonNull;
import static graphql.schema.GraphQLObjectType.newObject;

/**
 * This defines the types of the catalogue GraphQL API. The types only declare fields; which fetcher produces each
 * field is decided by the {@link ResolverMap} when the schema is built.
 */
public class GraphQLCatstronautsSchema {

    // Leaf types first, so that later types can refer to them directly instead of by name.

    public static final GraphQLObjectType authorType = newObject().name("Author")
            .description("Author of a complete Track")
            .field(id("id"))
            .field(requiredString("name"))
            .field(string("photo"))
            .build();

    public static final GraphQLObjectType trackType = newObject().name("Track")
            .description("A track is a group of Modules that teaches about a specific topic")
            .field(id("id"))
            .field(requiredString("title"))
            .field(string("thumbnail"))
            .field(intt("length"))
            .field(intt("modulesCount"))
            .field(string("description"))
            .field(intt("numberOfViews"))
            // Not on the backing record, which only has authorId. Nullable so a missing author does not void the track.
            .field(field("author", authorType))
            .build();

    public static final GraphQLObjectType queryType = newObject().name("Query")
            .field(newFieldDefinition()
                    .name("tracksForHome")
                    .description("Tracks for the home page grid")
                    .type(nonNull(list(nonNull(trackType)))))
            .field(newFieldDefinition()
                    .name("track")
                    .description("A single track by id")
                    .type(trackType)
                    .argument(idArg(ByIdFetcher.ID_ARG)))
            .field(newFieldDefinition()
                    .name("author")
                    .description("A single author by id")
                    .type(authorType)
                    .argument(idArg(ByIdFetcher.ID_ARG)))
            .build();

    /** The explicit bindings. Every other Track and Author field is read straight off its backing record. */
    public static ResolverMap resolverMap() {
        return new ResolverMap()
                .bind("Query", "tracksForHome", new TracksForHomeFetcher())
                .bind("Query", "track", new ByIdFetcher<TrackRecord>((context, trackId) -> context.trackAPI.getTrack(trackId)))
                .bind("Query", "author", new ByIdFetcher<AuthorRecord>((context, authorId) -> context.trackAPI.getAuthor(authorId)))
                .bind("Track", "author", new RelationFetcher<TrackRecord, AuthorRecord>(
                        "author",
                        track -> track.authorId,
                        (context, authorId) -> context.trackAPI.getAuthor(authorId)));
    }

    /**
     * Assemble the executable schema.
     *
     * @throws com.conveyal.catstronauts.model.ModelMismatchException if some field has neither a binding nor a
     *         compatible backing record field.
     */
    public static GraphQLSchema build(ResolverMap resolvers, EntityModelRegistry registry) {
        GraphQLCodeRegistry codeRegistry = resolvers.toCodeRegistry(registry, queryType, trackType, authorType);
        return GraphQLSchema.newSchema()
                .query(queryType)
                .codeRegistry(codeRegistry)
                .build();
    }
}
