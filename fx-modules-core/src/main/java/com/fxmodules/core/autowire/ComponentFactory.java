package com.fxmodules.core.autowire;

/**
 * Creates a component instance from its injected dependencies.
 */
@FunctionalInterface
public interface ComponentFactory {

    Object create(Dependencies dependencies);
}
