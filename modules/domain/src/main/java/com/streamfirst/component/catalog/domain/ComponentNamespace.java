package com.streamfirst.component.catalog.domain;

/**
 * Origin of a component. Vendor builds live in {@link #REDHAT}, anything pulled in from
 * community sources lives in {@link #UPSTREAM}.
 */
public enum ComponentNamespace {
    REDHAT,
    UPSTREAM
}
