package com.fxmodules.core.entity;

import java.util.List;
import java.util.Objects;

/**
 * Result of normalizing an entity declaration.
 *
 * @param spec canonical spec
 * @param dependencies entity types this entity requires through foreign keys, in declaration order
 */
public record PreparedSpec(EntitySpec spec, List<EntityType> dependencies) {

    public PreparedSpec {
        Objects.requireNonNull(spec, "spec must not be null");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
