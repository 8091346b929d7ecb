package com.streamfirst.component.catalog.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A single build row yielded by the catalog while resolving the latest component.
 * Candidates are immutable snapshots; the resolver only reads them.
 */
@Value
@EqualsAndHashCode(of = "id")
public class ComponentCandidate {
    /** Unique key of this build */
    @NonNull ComponentId id;

    /** The family this build belongs to */
    @NonNull ComponentIdentity identity;

    /** Epoch, version and release used for ordering */
    @NonNull EpochVersionRelease evr;

    public static ComponentCandidate of(String id, ComponentIdentity identity,
                                        Integer epoch, String version, String release) {
        return new ComponentCandidate(ComponentId.of(id), identity, EpochVersionRelease.of(epoch, version, release));
    }

    @Override
    public String toString() {
        return "ComponentCandidate{" + "id=" + id + ", identity=" + identity + ", evr=" + evr + '}';
    }
}
