package com.conveyal.catstronauts.graphql;

import graphql.schema.GraphQLArgument;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLOutputType;

import static graphql.Scalars.GraphQLID;
import static graphql.Scalars.GraphQLInt;
import static graphql.Scalars.GraphQLString;
import static graphql.schema.GraphQLArgument.newArgument;
import static graphql.schema.GraphQLFieldDefinition.newFieldDefinition;
import static graphql.schema.GraphQLNonNull.nonNull;

/**
 * Shorthands for field and argument definitions. Fetchers are not attached here, {@link ResolverMap} wires them.
 */
public class GraphQLUtil {

    public static GraphQLFieldDefinition id (String name) {
        return field(name, nonNull(GraphQLID));
    }

    public static GraphQLFieldDefinition string (String name) {
        return field(name, GraphQLString);
    }

    public static GraphQLFieldDefinition requiredString (String name) {
        return field(name, nonNull(GraphQLString));
    }

    public static GraphQLFieldDefinition intt (String name) {
        return field(name, GraphQLInt);
    }

    public static GraphQLFieldDefinition field (String name, GraphQLOutputType type) {
        return newFieldDefinition()
                .name(name)
                .type(type)
                .build();
    }

    public static GraphQLArgument idArg (String name) {
        return newArgument()
                .name(name)
                .type(nonNull(GraphQLID))
                .build();
    }
}
