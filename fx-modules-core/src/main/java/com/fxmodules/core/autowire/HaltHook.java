package com.fxmodules.core.autowire;

/**
 * Releases a component instance when the system halts.
 */
@FunctionalInterface
public interface HaltHook {

    void halt(Object instance);
}
