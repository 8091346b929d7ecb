package com.streamfirst.component.catalog.domain;

import java.util.Objects;

/**
 * Opaque unique key of a component record in the catalog (typically a UUID).
 *
 * @param value the identifier as stored by the catalog
 */
public record ComponentId(String value) implements Comparable<ComponentId> {
    public ComponentId {
        Objects.requireNonNull(value, "Component ID cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Component ID cannot be empty");
        }
    }

    public static ComponentId of(String value) {
        return new ComponentId(value);
    }

    @Override
    public int compareTo(ComponentId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
