package com.streamfirst.component.catalog.application;

import com.streamfirst.component.catalog.domain.ComponentCandidate;
import com.streamfirst.component.catalog.domain.version.VersionComparator;

/**
 * Decides whether a newly visited candidate replaces the running best build.
 * A strictly newer epoch/version/release always wins; the policies differ only when two
 * builds of the same family carry identical epoch, version and release.
 */
public enum TieBreakPolicy {

    /**
     * Keep the later-visited build on a tie. The winner among exact duplicates then
     * depends on retrieval order, so duplicates must be removed upstream.
     */
    LAST_VISITED {
        @Override
        boolean replacesOnTie(ComponentCandidate candidate, ComponentCandidate best) {
            return true;
        }
    },

    /**
     * Keep the build with the lowest identifier on a tie, independent of retrieval order.
     */
    LOWEST_IDENTIFIER {
        @Override
        boolean replacesOnTie(ComponentCandidate candidate, ComponentCandidate best) {
            return candidate.getId().compareTo(best.getId()) < 0;
        }
    };

    abstract boolean replacesOnTie(ComponentCandidate candidate, ComponentCandidate best);

    /**
     * Returns true if {@code candidate} should become the new running best.
     */
    public boolean replaces(ComponentCandidate candidate, ComponentCandidate best) {
        int rc = VersionComparator.compare(candidate.getEvr(), best.getEvr());
        return rc > 0 || (rc == 0 && replacesOnTie(candidate, best));
    }
}
