package com.fxmodules.core.entity;

import com.fxmodules.core.error.Diagnostics;
import com.fxmodules.core.error.FxException;

import java.util.List;
import java.util.Map;

/**
 * Raised when data does not conform to a registered entity schema.
 */
public class DataValidationException extends FxException {

    private final EntityType entityType;
    private final Map<String, List<String>> errors;

    public DataValidationException(EntityType entityType, Diagnostics diagnostics) {
        super("Invalid data for entity " + entityType + " " + diagnostics);
        this.entityType = entityType;
        this.errors = diagnostics.asMap();
    }

    public EntityType getEntityType() {
        return entityType;
    }

    /**
     * Per-field diagnostics, e.g. {@code {name=[should be a string]}}.
     *
     * @return field name to messages
     */
    public Map<String, List<String>> getErrors() {
        return errors;
    }
}
