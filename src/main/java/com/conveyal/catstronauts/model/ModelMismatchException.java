package com.conveyal.catstronauts.model;

/**
 * Thrown while the schema is being assembled when an exposed field can be satisfied neither by an explicit resolver
 * nor by an identically named field of its backing record. This is a declaration defect: it must surface before any
 * request is served.
 */
public class ModelMismatchException extends IllegalStateException {

    public final String typeName;

    /** Null when the whole type is at fault rather than one of its fields. */
    public final String fieldName;

    public ModelMismatchException(String typeName, String reason) {
        super(String.format("%s: %s", typeName, reason));
        this.typeName = typeName;
        this.fieldName = null;
    }

    public ModelMismatchException(String typeName, String fieldName, String reason) {
        super(String.format("%s.%s: %s", typeName, fieldName, reason));
        this.typeName = typeName;
        this.fieldName = fieldName;
    }
}
