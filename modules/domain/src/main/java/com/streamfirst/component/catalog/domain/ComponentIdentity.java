package com.streamfirst.component.catalog.domain;

import java.util.Comparator;
import java.util.Objects;

/**
 * Exact identity of a component family. Every build of the same family shares this
 * identity and differs only by epoch, version and release.
 *
 * @param namespace where the component comes from
 * @param name the component name (e.g., "ansible-runner")
 * @param type the component type (e.g., "RPM", "OCI", "RPMMOD", "GITHUB")
 * @param arch the architecture (e.g., "src", "noarch", "x86_64")
 */
public record ComponentIdentity(ComponentNamespace namespace, String name, String type, String arch) {

    /** Stable ordering used when listing identities. */
    public static final Comparator<ComponentIdentity> ORDER = Comparator
            .comparing(ComponentIdentity::namespace)
            .thenComparing(ComponentIdentity::name)
            .thenComparing(ComponentIdentity::type)
            .thenComparing(ComponentIdentity::arch);

    public ComponentIdentity {
        Objects.requireNonNull(namespace, "Component namespace cannot be null");
        requireText(name, "name");
        requireText(type, "type");
        requireText(arch, "arch");
    }

    public static ComponentIdentity of(ComponentNamespace namespace, String name, String type, String arch) {
        return new ComponentIdentity(namespace, name, type, arch);
    }

    private static void requireText(String value, String field) {
        Objects.requireNonNull(value, "Component " + field + " cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Component " + field + " cannot be empty");
        }
    }

    @Override
    public String toString() {
        return namespace + "/" + type + "/" + name + "." + arch;
    }
}
