package com.fxmodules.core.entity;

import java.util.Objects;

/**
 * Globally unique, namespace-qualified entity identifier written {@code namespace/name}.
 *
 * @param namespace qualifying namespace (e.g. {@code app.user})
 * @param name entity name within the namespace (e.g. {@code user})
 */
public record EntityType(String namespace, String name) {

    private static final String REF_SUFFIX = "-ref";

    public EntityType {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("Entity type needs a namespace and a name: " + namespace + "/" + name);
        }
    }

    /**
     * Parses {@code namespace/name}; a leading {@code :} is ignored.
     *
     * @param qualified qualified identifier
     * @return entity type
     * @throws IllegalArgumentException if the text is not qualified
     */
    public static EntityType parse(String qualified) {
        if (!isQualified(qualified)) {
            throw new IllegalArgumentException("Not a qualified entity identifier: " + qualified);
        }
        String text = stripColon(qualified);
        int slash = text.indexOf('/');
        return new EntityType(text.substring(0, slash), text.substring(slash + 1));
    }

    /**
     * Checks whether text has the {@code namespace/name} shape.
     *
     * @param text candidate identifier, may be null
     * @return true if both parts are present and there is exactly one separator
     */
    public static boolean isQualified(String text) {
        if (text == null) {
            return false;
        }
        String stripped = stripColon(text);
        int slash = stripped.indexOf('/');
        return slash > 0
            && slash < stripped.length() - 1
            && stripped.indexOf('/', slash + 1) < 0
            && stripped.chars().noneMatch(Character::isWhitespace);
    }

    /**
     * Companion reference type: {@code app.user/user} becomes {@code app.user/user-ref}.
     *
     * @return reference type identifier
     */
    public EntityType refType() {
        return new EntityType(namespace, name + REF_SUFFIX);
    }

    static String stripColon(String text) {
        return text.startsWith(":") ? text.substring(1) : text;
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
