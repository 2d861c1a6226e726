package com.conveyal.catstronauts.model;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Set;

/**
 * Declares, for every exposed GraphQL object type, the class its values are decoded into when they come back from the
 * remote resource. The exposed type and its backing record are allowed to differ (a track record carries an authorId
 * where the exposed Track has an author object); this registry is what the resolver wiring is checked against.
 *
 * Instances are immutable and meant to be built once at startup and shared by all requests.
 */
public class EntityModelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(EntityModelRegistry.class);

    // Java types that may back each built-in scalar when a field is read straight off a record.
    private static final ImmutableMap<String, ImmutableSet<Class<?>>> SCALAR_JAVA_TYPES =
        ImmutableMap.<String, ImmutableSet<Class<?>>>builder()
            .put("ID", ImmutableSet.of(String.class))
            .put("String", ImmutableSet.of(String.class))
            .put("Int", ImmutableSet.of(int.class, Integer.class, long.class, Long.class))
            .put("Float", ImmutableSet.of(double.class, Double.class, float.class, Float.class))
            .put("Boolean", ImmutableSet.of(boolean.class, Boolean.class))
            .build();

    private final ImmutableMap<String, Class<?>> backingRecords;

    private EntityModelRegistry(ImmutableMap<String, Class<?>> backingRecords) {
        this.backingRecords = backingRecords;
    }

    /** The registry for the Catstronauts catalogue. */
    public static EntityModelRegistry catstronauts() {
        return builder()
            .register("Track", TrackRecord.class)
            .register("Author", AuthorRecord.class)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isRegistered(String typeName) {
        return backingRecords.containsKey(typeName);
    }

    public Set<String> exposedTypeNames() {
        return backingRecords.keySet();
    }

    public Class<?> backingRecordFor(String typeName) {
        Class<?> recordClass = backingRecords.get(typeName);
        if (recordClass == null) {
            throw new ModelMismatchException(typeName, "no backing record is registered for this type");
        }
        return recordClass;
    }

    /**
     * Find the backing record field that can stand in for an exposed field under the identity default, i.e. a public
     * instance field with the same name and a Java type compatible with the exposed GraphQL type.
     *
     * @throws ModelMismatchException if there is no such field. The caller must then bind an explicit resolver.
     */
    public Field backingField(String typeName, GraphQLFieldDefinition fieldDefinition) {
        Class<?> recordClass = backingRecordFor(typeName);
        String fieldName = fieldDefinition.getName();
        Field field;
        try {
            field = recordClass.getField(fieldName);
        } catch (NoSuchFieldException e) {
            throw new ModelMismatchException(typeName, fieldName, String.format(
                "no resolver is bound and %s has no field of that name", recordClass.getSimpleName()));
        }
        if (Modifier.isStatic(field.getModifiers())) {
            throw new ModelMismatchException(typeName, fieldName, "backing field must not be static");
        }
        if (!isCompatible(fieldDefinition.getType(), field.getType())) {
            throw new ModelMismatchException(typeName, fieldName, String.format(
                "%s.%s has type %s, which cannot be exposed as %s",
                recordClass.getSimpleName(),
                fieldName,
                field.getType().getSimpleName(),
                GraphQLTypeUtil.simplePrint(fieldDefinition.getType())
            ));
        }
        LOG.debug("{}.{} reads {}.{}", typeName, fieldName, recordClass.getSimpleName(), fieldName);
        return field;
    }

    private boolean isCompatible(GraphQLType exposedType, Class<?> javaType) {
        GraphQLType type = GraphQLTypeUtil.unwrapNonNull(exposedType);
        if (GraphQLTypeUtil.isList(type)) {
            // Element types are not inspected, only the container.
            return List.class.isAssignableFrom(javaType) || javaType.isArray();
        }
        if (type instanceof GraphQLScalarType) {
            Set<Class<?>> accepted = SCALAR_JAVA_TYPES.get(((GraphQLScalarType) type).getName());
            return accepted != null && accepted.contains(javaType);
        }
        if (type instanceof GraphQLNamedType) {
            // A nested object is only readable directly if the record already holds that object's backing record.
            Class<?> nestedRecord = backingRecords.get(((GraphQLNamedType) type).getName());
            return nestedRecord != null && nestedRecord.equals(javaType);
        }
        return false;
    }

    public static class Builder {

        private final ImmutableMap.Builder<String, Class<?>> backingRecords = ImmutableMap.builder();

        private Builder() { }

        public Builder register(String typeName, Class<?> recordClass) {
            backingRecords.put(typeName, recordClass);
            return this;
        }

        public EntityModelRegistry build() {
            return new EntityModelRegistry(backingRecords.buildOrThrow());
        }
    }
}
