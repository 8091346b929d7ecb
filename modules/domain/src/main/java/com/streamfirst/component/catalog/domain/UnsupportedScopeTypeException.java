package com.streamfirst.component.catalog.domain;

/**
 * Thrown when a caller names a taxonomy level that latest-component lookups do not support.
 * This is a caller contract violation and must not be retried.
 */
public class UnsupportedScopeTypeException extends IllegalArgumentException {

    private final String modelName;

    public UnsupportedScopeTypeException(String modelName) {
        super("Unsupported scope type: " + modelName);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
