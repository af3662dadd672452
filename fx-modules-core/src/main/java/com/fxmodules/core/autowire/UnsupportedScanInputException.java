package com.fxmodules.core.autowire;

import com.fxmodules.core.error.FxException;

/**
 * Raised when the scope scanner receives a root that is neither a string nor a {@link ScopeName}.
 */
public class UnsupportedScanInputException extends FxException {

    private final transient Object input;

    public UnsupportedScanInputException(Object input) {
        super("Unsupported scan root " + input + " (" + input.getClass().getName()
            + "); expected a String or ScopeName");
        this.input = input;
    }

    public Object getInput() {
        return input;
    }
}
