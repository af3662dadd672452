package com.fxmodules.core.graph;

import java.util.Objects;

/**
 * Scope-qualified component identifier, written {@code scope/name}.
 *
 * <p>Scopes never contain {@code /}; names may, e.g. entity nodes keyed
 * {@code fx.entity/shop.user/user}. Parsing splits on the first slash, so
 * {@code parse(key.toString())} round-trips.
 *
 * @param scope owning scope, e.g. {@code com.acme.web}
 * @param name component name within the scope, e.g. {@code db-connection}
 */
public record ComponentKey(String scope, String name) {

    public ComponentKey {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (scope.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("Component key needs a scope and a name: " + scope + "/" + name);
        }
        if (scope.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Component scope must not contain '/': " + scope);
        }
    }

    public static ComponentKey of(String scope, String name) {
        return new ComponentKey(scope, name);
    }

    /**
     * Parses {@code scope/name}, splitting on the first slash.
     *
     * @param qualified qualified key
     * @return component key
     * @throws IllegalArgumentException if the text has no scope
     */
    public static ComponentKey parse(String qualified) {
        int slash = qualified.indexOf('/');
        if (slash <= 0 || slash == qualified.length() - 1) {
            throw new IllegalArgumentException("Not a qualified component key: " + qualified);
        }
        return new ComponentKey(qualified.substring(0, slash), qualified.substring(slash + 1));
    }

    /**
     * Resolves a dependency name relative to this key: qualified names are taken as-is,
     * simple names land in this key's scope.
     *
     * @param nameOrKey {@code name} or {@code scope/name}
     * @return resolved key
     */
    public ComponentKey resolve(String nameOrKey) {
        return nameOrKey.indexOf('/') > 0 ? parse(nameOrKey) : new ComponentKey(scope, nameOrKey);
    }

    @Override
    public String toString() {
        return scope + "/" + name;
    }
}
