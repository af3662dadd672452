package com.fxmodules.core.entity;

import java.util.Set;

/**
 * Field property keys recognized by the entity DSL.
 */
public final class FieldProperties {

    public static final String PRIMARY_KEY = "primary-key?";
    public static final String IDENTITY = "identity?";
    public static final String FOREIGN_KEY = "foreign-key?";

    /** Normalized optional marker. */
    public static final String OPTIONAL = "optional";

    /** Optional marker as written by users; rewritten to {@link #OPTIONAL}. */
    public static final String OPTIONAL_INPUT = "optional?";

    public static final String ONE_TO_ONE = "one-to-one?";
    public static final String MANY_TO_ONE = "many-to-one?";
    public static final String ONE_TO_MANY = "one-to-many?";
    public static final String MANY_TO_MANY = "many-to-many?";

    /** Relationship markers that make a reference a foreign key. */
    public static final Set<String> REQUIRED_RELATIONS = Set.of(ONE_TO_ONE, MANY_TO_ONE);

    /** Relationship markers that are never persisted as columns. */
    public static final Set<String> OPTIONAL_RELATIONS = Set.of(ONE_TO_MANY, MANY_TO_MANY);

    private FieldProperties() {
    }
}
