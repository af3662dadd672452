package com.fxmodules.core.autowire;

import java.util.Objects;

/**
 * Symbolic scope identifier, accepted by {@link ScopeScanner#scan(Object)} alongside plain strings.
 *
 * @param value dotted scope name, e.g. {@code com.acme}
 */
public record ScopeName(String value) {

    public ScopeName {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ScopeName of(String value) {
        return new ScopeName(value);
    }

    /**
     * True if {@code scope} equals this name or lies below it ({@code com.acme} covers {@code com.acme.web}).
     *
     * @param scope scope name to test
     * @return whether the scope is reachable from this root
     */
    public boolean covers(String scope) {
        return scope.equals(value) || scope.startsWith(value + ".");
    }

    @Override
    public String toString() {
        return value;
    }
}
