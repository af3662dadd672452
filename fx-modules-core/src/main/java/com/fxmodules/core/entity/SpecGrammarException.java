package com.fxmodules.core.entity;

import com.fxmodules.core.error.Diagnostics;
import com.fxmodules.core.error.FxException;

import java.util.List;
import java.util.Map;

/**
 * Raised when a raw entity spec does not match the entity DSL grammar.
 *
 * <p>Carries a humanized diff against the expected grammar, keyed by location
 * (e.g. {@code fields[2].type}).
 */
public class SpecGrammarException extends FxException {

    private final Map<String, List<String>> errors;

    public SpecGrammarException(String message, Diagnostics diagnostics) {
        super(message + " " + diagnostics);
        this.errors = diagnostics.asMap();
    }

    public Map<String, List<String>> getErrors() {
        return errors;
    }
}
