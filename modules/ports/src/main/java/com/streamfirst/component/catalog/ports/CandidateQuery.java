package com.streamfirst.component.catalog.ports;

import com.streamfirst.component.catalog.domain.ComponentIdentity;
import com.streamfirst.component.catalog.domain.TaxonomyScope;

import java.util.Objects;

/**
 * Selects the builds of one component family visible in one taxonomy node.
 *
 * @param scope the taxonomy node the builds must belong to
 * @param identity the exact component family
 * @param includeInactiveStreams whether inactive product streams count as visible
 */
public record CandidateQuery(TaxonomyScope scope, ComponentIdentity identity, boolean includeInactiveStreams) {
    public CandidateQuery {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(identity, "Identity cannot be null");
    }

    @Override
    public String toString() {
        return identity + " in " + scope + (includeInactiveStreams ? " (including inactive)" : "");
    }
}
