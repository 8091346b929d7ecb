package com.streamfirst.component.catalog.domain;

import com.streamfirst.component.catalog.domain.version.VersionComparator;

/**
 * The ordering fields of a build. A missing epoch is stored as 0 and missing version or
 * release strings as empty strings, which are the lower bound of the version order.
 */
public record EpochVersionRelease(int epoch, String version, String release)
        implements Comparable<EpochVersionRelease> {

    public EpochVersionRelease {
        version = version == null ? "" : version;
        release = release == null ? "" : release;
    }

    public static EpochVersionRelease of(Integer epoch, String version, String release) {
        return new EpochVersionRelease(epoch == null ? 0 : epoch, version, release);
    }

    @Override
    public int compareTo(EpochVersionRelease other) {
        return VersionComparator.compare(this, other);
    }

    @Override
    public String toString() {
        String vr = release.isEmpty() ? version : version + "-" + release;
        return epoch == 0 ? vr : epoch + ":" + vr;
    }
}
