package com.fxmodules.core.entity;

import java.util.List;
import java.util.Map;

/**
 * Raw client/user declarations referencing each other.
 */
final class EntityFixtures {

    static final EntityType CLIENT = EntityType.parse("app.client/client");
    static final EntityType USER = EntityType.parse("app.user/user");

    static final List<Object> CLIENT_SPEC = List.of(
        "spec", Map.of("table", "client"),
        List.of("id", Map.of("primary-key?", true), "uuid?"),
        List.of("name", List.of("string", Map.of("max", 250))),
        List.of("users", Map.of("one-to-many?", true), "app.user/user"));

    static final List<Object> USER_SPEC = List.of(
        ":spec", Map.of("table", "user"),
        List.of("id", Map.of("primary-key?", true, "identity?", true), ":uuid?"),
        List.of("email", "string"),
        List.of("nickname", Map.of("optional?", true), "string"),
        List.of("client", Map.of("many-to-one?", true), ":app.client/client"));

    private EntityFixtures() {
    }
}
