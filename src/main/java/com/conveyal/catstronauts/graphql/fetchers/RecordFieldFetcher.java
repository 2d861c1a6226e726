package com.conveyal.catstronauts.graphql.fetchers;

import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;

import java.lang.reflect.Field;

/**
 * This just reads one public field off the backing record the parent fetcher returned. It is the default for every
 * exposed field whose backing record carries a field of the same name and a compatible type; the registry checks
 * that before this fetcher is created.
 */
public class RecordFieldFetcher implements DataFetcher<Object> {

    private final Field field;

    public RecordFieldFetcher(Field field) {
        this.field = field;
    }

    @Override
    public Object get(DataFetchingEnvironment environment) {
        Object source = environment.getSource();
        if (source == null) return null;
        try {
            return field.get(source);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read backing field " + field, e);
        }
    }
}
