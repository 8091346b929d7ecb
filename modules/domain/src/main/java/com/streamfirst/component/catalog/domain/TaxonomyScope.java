package com.streamfirst.component.catalog.domain;

import java.util.Objects;

/**
 * A node of the product taxonomy, identified by its external URI.
 *
 * @param type the taxonomy level of the node
 * @param ofuri the node's external URI (e.g., "o:redhat:rhel:8.2.eus")
 */
public record TaxonomyScope(ScopeType type, String ofuri) {
    public TaxonomyScope {
        Objects.requireNonNull(type, "Scope type cannot be null");
        Objects.requireNonNull(ofuri, "Scope ofuri cannot be null");
        if (ofuri.trim().isEmpty()) {
            throw new IllegalArgumentException("Scope ofuri cannot be empty");
        }
    }

    public static TaxonomyScope of(ScopeType type, String ofuri) {
        return new TaxonomyScope(type, ofuri);
    }

    public static TaxonomyScope product(String ofuri) {
        return new TaxonomyScope(ScopeType.PRODUCT, ofuri);
    }

    public static TaxonomyScope productVersion(String ofuri) {
        return new TaxonomyScope(ScopeType.PRODUCT_VERSION, ofuri);
    }

    public static TaxonomyScope productStream(String ofuri) {
        return new TaxonomyScope(ScopeType.PRODUCT_STREAM, ofuri);
    }

    public static TaxonomyScope productVariant(String ofuri) {
        return new TaxonomyScope(ScopeType.PRODUCT_VARIANT, ofuri);
    }

    @Override
    public String toString() {
        return type.modelName() + "(" + ofuri + ")";
    }
}
