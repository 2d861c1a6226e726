package com.conveyal.catstronauts.graphql;

import com.conveyal.catstronauts.graphql.fetchers.RecordFieldFetcher;
import com.conveyal.catstronauts.model.EntityModelRegistry;
import com.conveyal.catstronauts.model.ModelMismatchException;
import graphql.schema.DataFetcher;
import graphql.schema.FieldCoordinates;
import graphql.schema.GraphQLCodeRegistry;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLObjectType;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static graphql.schema.FieldCoordinates.coordinates;

/**
 * Explicit bindings from (type, field) to the fetcher producing that field. Fields without a binding fall back to
 * reading the identically named field of the backing record, but only after the {@link EntityModelRegistry} has
 * confirmed that such a field exists with a compatible type. Any field that ends up with neither is reported as a
 * {@link ModelMismatchException} when the code registry is built, before the schema can serve a query.
 */
public class ResolverMap {

    private final Map<FieldCoordinates, DataFetcher<?>> bindings = new LinkedHashMap<>();

    public ResolverMap bind(String typeName, String fieldName, DataFetcher<?> fetcher) {
        if (bindings.putIfAbsent(coordinates(typeName, fieldName), fetcher) != null) {
            throw new IllegalArgumentException(String.format("%s.%s is already bound.", typeName, fieldName));
        }
        return this;
    }

    public boolean isBound(String typeName, String fieldName) {
        return bindings.containsKey(coordinates(typeName, fieldName));
    }

    /**
     * The fetcher for one field: the explicit binding if there is one, otherwise the identity default.
     */
    public DataFetcher<?> fetcherFor(String typeName, GraphQLFieldDefinition field, EntityModelRegistry registry) {
        DataFetcher<?> explicit = bindings.get(coordinates(typeName, field.getName()));
        if (explicit != null) return explicit;
        if (!registry.isRegistered(typeName)) {
            // Root types have no backing record to read from.
            throw new ModelMismatchException(typeName, field.getName(), "no resolver is bound and the type has no backing record");
        }
        return new RecordFieldFetcher(registry.backingField(typeName, field));
    }

    /**
     * Wire every field of the given object types.
     */
    public GraphQLCodeRegistry toCodeRegistry(EntityModelRegistry registry, GraphQLObjectType... types) {
        GraphQLCodeRegistry.Builder codeRegistry = GraphQLCodeRegistry.newCodeRegistry();
        Set<FieldCoordinates> wired = new HashSet<>();
        for (GraphQLObjectType type : types) {
            for (GraphQLFieldDefinition field : type.getFieldDefinitions()) {
                FieldCoordinates fieldCoordinates = coordinates(type.getName(), field.getName());
                codeRegistry.dataFetcher(fieldCoordinates, fetcherFor(type.getName(), field, registry));
                wired.add(fieldCoordinates);
            }
        }
        for (FieldCoordinates bound : bindings.keySet()) {
            if (!wired.contains(bound)) {
                throw new ModelMismatchException(bound.getTypeName(), bound.getFieldName(),
                    "a resolver is bound but the schema does not declare this field");
            }
        }
        return codeRegistry.build();
    }
}
