package com.fxmodules.core.autowire.broken;

import com.fxmodules.core.autowire.AbstractComponentScope;
import com.fxmodules.core.autowire.Definition;

import java.util.List;

/**
 * Test scope whose component depends on a definition that does not exist.
 */
public class BrokenComponents extends AbstractComponentScope {

    @Override
    public List<Definition> definitions() {
        return List.of(
            Definition.autowired("orphan")
                .inject("ghost")
                .factory(deps -> "orphan of " + deps.get("ghost"))
        );
    }
}
