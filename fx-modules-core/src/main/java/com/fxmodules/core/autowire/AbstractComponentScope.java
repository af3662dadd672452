package com.fxmodules.core.autowire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for component scopes.
 *
 * <p>Names the scope after the package of the concrete class, so a scope declared as
 * {@code com.acme.web.WebComponents} produces keys such as {@code com.acme.web/router}.
 */
public abstract class AbstractComponentScope implements ComponentScope {

    /**
     * Logger instance for this scope.
     * Automatically initialized with the concrete scope class name.
     */
    protected final Logger log;

    protected AbstractComponentScope() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public String name() {
        return getClass().getPackageName();
    }

    @Override
    public String toString() {
        return name();
    }
}
