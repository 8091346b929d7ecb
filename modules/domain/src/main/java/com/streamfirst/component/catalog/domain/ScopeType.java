package com.streamfirst.component.catalog.domain;

import java.util.Arrays;

/**
 * Levels of the product taxonomy a latest-component lookup can be scoped to.
 * Product streams are the only level carrying an active flag.
 */
public enum ScopeType {
    PRODUCT("Product", false),
    PRODUCT_VERSION("ProductVersion", false),
    PRODUCT_STREAM("ProductStream", true),
    PRODUCT_VARIANT("ProductVariant", false);

    private final String modelName;
    private final boolean activeFlagged;

    ScopeType(String modelName, boolean activeFlagged) {
        this.modelName = modelName;
        this.activeFlagged = activeFlagged;
    }

    /**
     * Returns the taxonomy model name, e.g. {@code "ProductStream"}.
     */
    public String modelName() {
        return modelName;
    }

    /**
     * Whether inactive nodes of this level are hidden unless the caller opts in.
     */
    public boolean isActiveFlagged() {
        return activeFlagged;
    }

    /**
     * Looks up a scope type by its taxonomy model name.
     *
     * @param modelName one of "Product", "ProductVersion", "ProductStream", "ProductVariant"
     * @return the matching scope type
     * @throws UnsupportedScopeTypeException if the name matches no scope type
     */
    public static ScopeType fromModelName(String modelName) {
        return Arrays.stream(values())
                .filter(type -> type.modelName.equals(modelName))
                .findFirst()
                .orElseThrow(() -> new UnsupportedScopeTypeException(modelName));
    }
}
