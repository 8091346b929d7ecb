package com.streamfirst.component.catalog.domain;

/**
 * Decides which components are roots of a provenance tree and therefore take part in
 * latest-component resolution. The policy is fixed:
 * <ul>
 *   <li>source RPMs ({@code RPM}, arch {@code src})</li>
 *   <li>modules ({@code RPMMOD}, any arch)</li>
 *   <li>multi-arch index container images ({@code OCI}, arch {@code noarch})</li>
 *   <li>vendor upstream modules on GitHub ({@code GITHUB}, arch {@code noarch}, namespace REDHAT)</li>
 * </ul>
 */
public final class RootComponentPredicate {

    public static final String RPM = "RPM";
    public static final String RPM_MODULE = "RPMMOD";
    public static final String CONTAINER_IMAGE = "OCI";
    public static final String GITHUB = "GITHUB";

    public static final String SOURCE_ARCH = "src";
    public static final String NOARCH = "noarch";

    private RootComponentPredicate() {
    }

    public static boolean test(ComponentIdentity identity) {
        String type = identity.type();
        String arch = identity.arch();
        return (RPM.equals(type) && SOURCE_ARCH.equals(arch))
                || RPM_MODULE.equals(type)
                || (CONTAINER_IMAGE.equals(type) && NOARCH.equals(arch))
                || (GITHUB.equals(type) && NOARCH.equals(arch) && identity.namespace() == ComponentNamespace.REDHAT);
    }

    public static boolean test(ComponentCandidate candidate) {
        return test(candidate.getIdentity());
    }
}
