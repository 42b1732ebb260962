package com.tradepilot.common.exception;

/**
 * Base unchecked exception for engine components. The message is prefixed with the
 * component that raised it.
 */
public class EngineException extends RuntimeException {

    private final String component;

    public EngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public EngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
