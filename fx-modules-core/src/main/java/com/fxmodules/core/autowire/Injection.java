package com.fxmodules.core.autowire;

import java.util.Objects;

/**
 * A factory parameter tagged as an auto-injectable reference.
 *
 * @param parameter name the dependency is passed under
 * @param target component name in the same scope, or a qualified {@code scope/name} key
 */
public record Injection(String parameter, String target) {

    public Injection {
        Objects.requireNonNull(parameter, "parameter must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }
}
