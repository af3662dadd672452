package com.fxmodules.core.entity;

import com.fxmodules.core.error.FxException;

/**
 * Raised when validation or introspection touches an entity type that was never registered.
 */
public class UnknownEntityException extends FxException {

    private final EntityType entityType;

    public UnknownEntityException(EntityType entityType) {
        super("Unknown entity " + entityType);
        this.entityType = entityType;
    }

    public UnknownEntityException(EntityType entityType, String message) {
        super(message);
        this.entityType = entityType;
    }

    public EntityType getEntityType() {
        return entityType;
    }
}
