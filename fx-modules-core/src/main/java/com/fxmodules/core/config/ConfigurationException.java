package com.fxmodules.core.config;

import com.fxmodules.core.error.FxException;

/**
 * Raised when an {@code fx.yaml} document exists but cannot be read into {@link FxConfig}.
 */
public class ConfigurationException extends FxException {

    private final String source;

    public ConfigurationException(String source, Throwable cause) {
        super("Invalid configuration in " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
