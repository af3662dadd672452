package com.fxmodules.core.autowire;

import java.util.List;

/**
 * A code scope (normally a Java package) exporting component definitions.
 *
 * <p>Scopes are discovered via Java Service Provider Interface (SPI). Each scope lists
 * the definitions it exports; only those carrying the AUTOWIRED marker become components.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.fxmodules.core.autowire.ComponentScope}
 *
 * @see AbstractComponentScope
 * @see ScopeScanner
 */
public interface ComponentScope {

    /**
     * Returns the scope name used to qualify component keys (e.g. {@code com.acme.web}).
     *
     * @return scope name
     */
    String name();

    /**
     * Returns the definitions exported by this scope, in declaration order.
     *
     * @return exported definitions, tagged or not
     */
    List<Definition> definitions();
}
