package com.fxmodules.core.autowire;

import java.util.List;

/**
 * Settings for scope scanning.
 *
 * @param defaultRoot root scanned when no root is given; null scans every project scope
 * @param strict raise {@link UnsupportedScanInputException} for unsupported roots (otherwise return nothing)
 * @param excludedScopes scope prefixes never returned, on top of jar-packaged scopes
 * @param classLoader class loader used to discover {@link ComponentScope} providers
 */
public record ScanContext(
    String defaultRoot,
    boolean strict,
    List<String> excludedScopes,
    ClassLoader classLoader
) {
    /**
     * Compact constructor with defaults.
     */
    public ScanContext {
        if (excludedScopes == null) {
            excludedScopes = List.of();
        }
        if (classLoader == null) {
            classLoader = Thread.currentThread().getContextClassLoader();
        }
    }

    /**
     * Strict scanning of every project scope with the context class loader.
     *
     * @return default context
     */
    public static ScanContext defaults() {
        return new ScanContext(null, true, List.of(), null);
    }

    public ScanContext withDefaultRoot(String root) {
        return new ScanContext(root, strict, excludedScopes, classLoader);
    }

    public ScanContext withStrict(boolean strictMode) {
        return new ScanContext(defaultRoot, strictMode, excludedScopes, classLoader);
    }
}
