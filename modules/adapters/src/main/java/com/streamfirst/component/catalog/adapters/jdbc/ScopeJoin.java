package com.streamfirst.component.catalog.adapters.jdbc;

import com.streamfirst.component.catalog.domain.ScopeType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tables linking components to one level of the product taxonomy.
 *
 * @param nodeTable the taxonomy node table, carrying {@code uuid} and {@code ofuri}
 * @param membershipTable the many-to-many table between components and nodes
 * @param nodeKey the node foreign key column in the membership table
 */
record ScopeJoin(String nodeTable, String membershipTable, String nodeKey) {

    private static final Map<ScopeType, ScopeJoin> JOINS = new EnumMap<>(ScopeType.class);

    static {
        JOINS.put(ScopeType.PRODUCT,
                new ScopeJoin("core_product", "core_component_products", "product_id"));
        JOINS.put(ScopeType.PRODUCT_VERSION,
                new ScopeJoin("core_productversion", "core_component_productversions", "productversion_id"));
        JOINS.put(ScopeType.PRODUCT_STREAM,
                new ScopeJoin("core_productstream", "core_component_productstreams", "productstream_id"));
        JOINS.put(ScopeType.PRODUCT_VARIANT,
                new ScopeJoin("core_productvariant", "core_component_productvariants", "productvariant_id"));
    }

    static ScopeJoin forType(ScopeType type) {
        return JOINS.get(type);
    }
}
