package com.fxmodules.core.error;

/**
 * Root of the unchecked exception hierarchy raised by FX modules.
 *
 * <p>Declaration-time failures (grammar, scan input) and runtime failures
 * (data validation, unknown entities, wiring) all extend this type so callers can
 * catch a single exception at the system boundary.
 */
public class FxException extends RuntimeException {

    public FxException(String message) {
        super(message);
    }

    public FxException(String message, Throwable cause) {
        super(message, cause);
    }
}
