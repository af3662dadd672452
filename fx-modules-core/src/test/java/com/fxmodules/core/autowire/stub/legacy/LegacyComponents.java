package com.fxmodules.core.autowire.stub.legacy;

import com.fxmodules.core.autowire.AbstractComponentScope;
import com.fxmodules.core.autowire.Definition;

import java.util.List;

/**
 * Test scope used to check scope exclusion.
 */
public class LegacyComponents extends AbstractComponentScope {

    @Override
    public List<Definition> definitions() {
        return List.of(Definition.autowired("old-client").value("legacy"));
    }
}
