package com.fxmodules.core.entity.type;

import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Catalog of primitive type keywords usable in entity field declarations.
 *
 * <p>Each constant owns the keywords that name it (both the bare form, e.g. {@code string},
 * and the predicate form, e.g. {@code string?}), the predicate values must satisfy, and the
 * humanized message reported when they don't. Parametrized declarations such as
 * {@code [string, {max: 250}]} add {@code min}/{@code max} bounds through
 * {@link #checkBounds(Object, Map)}.
 */
public enum PrimitiveType {

    STRING("should be a string", value -> value instanceof CharSequence, "string", "string?"),
    INT("should be an integer", PrimitiveType::isIntegral, "int", "int?", "integer?", "long", "long?"),
    DOUBLE("should be a number", value -> value instanceof Number, "double", "double?", "number", "number?"),
    BOOLEAN("should be a boolean", value -> value instanceof Boolean, "boolean", "boolean?"),
    UUID_TYPE("should be a uuid", value -> value instanceof UUID, "uuid", "uuid?"),
    KEYWORD("should be a keyword", PrimitiveType::isKeyword, "keyword", "keyword?"),
    INSTANT("should be an instant", value -> value instanceof TemporalAccessor || value instanceof Date, "inst", "inst?"),
    MAP("should be a map", value -> value instanceof Map, "map", "map?"),
    SEQUENTIAL("should be a sequence", value -> value instanceof List, "sequential", "sequential?", "vector", "vector?"),
    ANY("should be any value", value -> true, "any", "any?");

    private static final Map<String, PrimitiveType> BY_KEYWORD = new HashMap<>();

    static {
        for (PrimitiveType type : values()) {
            for (String keyword : type.keywords) {
                BY_KEYWORD.put(keyword, type);
            }
        }
    }

    private final String message;
    private final Predicate<Object> predicate;
    private final List<String> keywords;

    PrimitiveType(String message, Predicate<Object> predicate, String... keywords) {
        this.message = message;
        this.predicate = predicate;
        this.keywords = List.of(keywords);
    }

    /**
     * Resolves a type keyword; a leading {@code :} is ignored.
     *
     * @param keyword type keyword such as {@code uuid?} or {@code :string}
     * @return matching type, or empty if the keyword is unknown
     */
    public static Optional<PrimitiveType> lookup(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        String key = keyword.startsWith(":") ? keyword.substring(1) : keyword;
        return Optional.ofNullable(BY_KEYWORD.get(key));
    }

    public boolean accepts(Object value) {
        return value != null ? predicate.test(value) : this == ANY;
    }

    public String message() {
        return message;
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * Checks that {@code min}/{@code max} properties, if present, are numbers.
     *
     * @param properties declaration properties
     * @return a grammar message, or empty when the properties are usable
     */
    public Optional<String> checkProperties(Map<String, Object> properties) {
        for (String bound : List.of("min", "max")) {
            Object limit = properties.get(bound);
            if (limit != null && !(limit instanceof Number)) {
                return Optional.of("property " + bound + " should be a number");
            }
        }
        return Optional.empty();
    }

    /**
     * Checks {@code min}/{@code max} bounds for a value that already passed {@link #accepts(Object)}.
     *
     * <p>Strings are measured by length, collections and maps by size, numbers by value.
     *
     * @param value value to check
     * @param properties declaration properties holding the bounds
     * @return a humanized message, or empty if the value is within bounds
     */
    public Optional<String> checkBounds(Object value, Map<String, Object> properties) {
        Number min = (Number) properties.get("min");
        Number max = (Number) properties.get("max");
        if (min == null && max == null) {
            return Optional.empty();
        }

        if (value instanceof CharSequence text) {
            return checkRange(text.length(), min, max, " characters");
        }
        if (value instanceof Collection<?> collection) {
            return checkRange(collection.size(), min, max, " elements");
        }
        if (value instanceof Map<?, ?> map) {
            return checkRange(map.size(), min, max, " entries");
        }
        if (value instanceof Number number) {
            return checkRange(number.doubleValue(), min, max, "");
        }
        return Optional.empty();
    }

    private static Optional<String> checkRange(double actual, Number min, Number max, String unit) {
        if (min != null && actual < min.doubleValue()) {
            return Optional.of("should be at least " + format(min) + unit);
        }
        if (max != null && actual > max.doubleValue()) {
            return Optional.of("should be at most " + format(max) + unit);
        }
        return Optional.empty();
    }

    private static String format(Number number) {
        double value = number.doubleValue();
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte
            || value instanceof BigInteger;
    }

    private static boolean isKeyword(Object value) {
        return value instanceof CharSequence text
            && text.length() > 0
            && text.chars().noneMatch(Character::isWhitespace);
    }
}
