package com.fxmodules.core.autowire;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Supplier;

/**
 * Enumerates the project's own component scopes.
 *
 * <p>Providers of {@link ComponentScope} are loaded through {@link ServiceLoader}. A scope is
 * project-owned when its class was loaded from a class-path directory; scopes shipped in
 * jars belong to dependencies and are skipped, as are scopes under
 * {@link ScanContext#excludedScopes()}.
 *
 * <p>Root handling:
 * <ul>
 *   <li>{@link #scan()} scans {@link ScanContext#defaultRoot()}, or every project scope when unset</li>
 *   <li>{@code scan(null)} returns nothing; an explicit null is not the same as no root</li>
 *   <li>{@code scan(String)} and {@code scan(ScopeName)} return the root scope and the scopes below it</li>
 *   <li>any other input raises {@link UnsupportedScanInputException}, or returns nothing when
 *       the context is not strict</li>
 * </ul>
 *
 * <p>Results are sorted by scope name.
 */
public class ScopeScanner {

    private static final Logger log = LoggerFactory.getLogger(ScopeScanner.class);

    private final ScanContext context;
    private final Supplier<? extends Collection<ComponentScope>> providers;

    public ScopeScanner(ScanContext context) {
        this(context, () -> ServiceLoader.load(ComponentScope.class, context.classLoader()).stream()
            .map(ServiceLoader.Provider::get)
            .toList());
    }

    /**
     * Creates a scanner over an explicit set of candidate scopes.
     *
     * @param context scan settings
     * @param providers candidate scopes; ownership and exclusion rules still apply
     */
    public ScopeScanner(ScanContext context, Supplier<? extends Collection<ComponentScope>> providers) {
        this.context = context;
        this.providers = providers;
    }

    /**
     * Scans from the configured default root.
     *
     * @return project scopes, sorted by name
     */
    public List<ComponentScope> scan() {
        if (context.defaultRoot() == null) {
            return projectScopes(null);
        }
        return projectScopes(ScopeName.of(context.defaultRoot()));
    }

    /**
     * Scans from an explicit root.
     *
     * @param root a {@link String} or {@link ScopeName}; null yields an empty result
     * @return project scopes reachable from the root, sorted by name
     * @throws UnsupportedScanInputException if the root has an unsupported type and the context is strict
     */
    public List<ComponentScope> scan(Object root) {
        if (root == null) {
            return List.of();
        }
        if (root instanceof String text) {
            return projectScopes(ScopeName.of(text));
        }
        if (root instanceof ScopeName name) {
            return projectScopes(name);
        }

        if (context.strict()) {
            throw new UnsupportedScanInputException(root);
        }
        log.debug("Ignoring unsupported scan root {} ({})", root, root.getClass().getName());
        return List.of();
    }

    private List<ComponentScope> projectScopes(ScopeName root) {
        List<ComponentScope> scopes = providers.get().stream()
            .filter(scope -> root == null || root.covers(scope.name()))
            .filter(this::isIncluded)
            .filter(ScopeScanner::isProjectOwned)
            .sorted(Comparator.comparing(ComponentScope::name))
            .toList();

        log.debug("Found {} project scopes under {}", scopes.size(), root == null ? "<all>" : root);
        return scopes;
    }

    private boolean isIncluded(ComponentScope scope) {
        return context.excludedScopes().stream()
            .map(ScopeName::of)
            .noneMatch(excluded -> excluded.covers(scope.name()));
    }

    /**
     * A scope is project-owned if its class comes from a directory rather than a jar.
     *
     * @param scope candidate scope
     * @return true for scopes compiled from this project's sources
     */
    static boolean isProjectOwned(ComponentScope scope) {
        Optional<URL> location = Optional.ofNullable(scope.getClass().getProtectionDomain().getCodeSource())
            .map(CodeSource::getLocation);
        if (location.isEmpty()) {
            return false;
        }

        try {
            return Files.isDirectory(Path.of(location.get().toURI()));
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            log.debug("Treating scope {} as vendored, unreadable location {}: {}", scope.name(), location.get(), e.getMessage());
            return false;
        }
    }
}
