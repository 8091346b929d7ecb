package com.streamfirst.component.catalog.domain.version;

import com.streamfirst.component.catalog.domain.EpochVersionRelease;

import java.util.Comparator;
import java.util.List;

/**
 * RPM-compatible ordering of version and release strings ({@code rpmvercmp}), extended
 * with epoch to order whole builds.
 *
 * <p>Strings are compared token by token (see {@link VersionTokenizer}). At each position
 * the sort order is: {@code ~} &lt; end of string &lt; {@code ^} &lt; letters &lt; digits.
 * Two letter runs compare by code point, two digit runs compare numerically without
 * leading zeros. The first differing position decides. Any input, including empty and
 * {@code null} strings, yields a result; the empty string is the lower bound of every
 * string that does not start with {@code ~}.
 */
public final class VersionComparator {

    /** Orders single version or release strings. */
    public static final Comparator<String> SEGMENT_ORDER = VersionComparator::compareSegment;

    /** Orders builds by epoch, then version, then release. */
    public static final Comparator<EpochVersionRelease> EVR_ORDER = VersionComparator::compare;

    // rank of the end of a token sequence relative to VersionToken.Kind ordinals
    private static final int END_RANK = 1;

    private VersionComparator() {
    }

    /**
     * Compares two version (or release) strings.
     *
     * @return -1, 0 or 1 as {@code a} sorts before, equal to, or after {@code b}
     */
    public static int compareSegment(String a, String b) {
        String one = a == null ? "" : a;
        String two = b == null ? "" : b;
        if (one.equals(two)) {
            return 0;
        }

        List<VersionToken> left = VersionTokenizer.tokenize(one);
        List<VersionToken> right = VersionTokenizer.tokenize(two);
        int length = Math.max(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            VersionToken x = i < left.size() ? left.get(i) : null;
            VersionToken y = i < right.size() ? right.get(i) : null;
            int rc = compareTokens(x, y);
            if (rc != 0) {
                return rc;
            }
        }
        return 0;
    }

    /**
     * Compares two builds: epoch first (missing epoch is 0), then version, then release.
     * The first differing field decides.
     *
     * @return -1, 0 or 1
     */
    public static int compareEpochVersionRelease(Integer e1, String v1, String r1,
                                                 Integer e2, String v2, String r2) {
        return compare(EpochVersionRelease.of(e1, v1, r1), EpochVersionRelease.of(e2, v2, r2));
    }

    public static int compare(EpochVersionRelease first, EpochVersionRelease second) {
        int rc = Integer.compare(first.epoch(), second.epoch());
        if (rc != 0) {
            return Integer.signum(rc);
        }
        rc = compareSegment(first.version(), second.version());
        if (rc != 0) {
            return rc;
        }
        return compareSegment(first.release(), second.release());
    }

    private static int compareTokens(VersionToken x, VersionToken y) {
        int rankX = rank(x);
        int rankY = rank(y);
        if (rankX != rankY) {
            return rankX < rankY ? -1 : 1;
        }
        if (x == null) {
            return 0;
        }
        return switch (x.kind()) {
            case NUMERIC -> compareNumeric(x.text(), y.text());
            case ALPHA -> Integer.signum(x.text().compareTo(y.text()));
            case TILDE, CARET -> 0;
        };
    }

    private static int rank(VersionToken token) {
        if (token == null) {
            return END_RANK;
        }
        int ordinal = token.kind().ordinal();
        return ordinal < END_RANK ? ordinal : ordinal + 1;
    }

    private static int compareNumeric(String x, String y) {
        String one = stripLeadingZeros(x);
        String two = stripLeadingZeros(y);
        if (one.length() != two.length()) {
            return one.length() > two.length() ? 1 : -1;
        }
        return Integer.signum(one.compareTo(two));
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
