package com.streamfirst.component.catalog.domain.version;

import java.util.Objects;

/**
 * One segment of a version or release string.
 *
 * @param kind what the segment is made of
 * @param text the segment characters exactly as they appeared in the source string
 */
public record VersionToken(Kind kind, String text) {

    /**
     * Segment kinds, declared in ascending sort order. End-of-string sorts between
     * {@link #TILDE} and {@link #CARET}.
     */
    public enum Kind {
        /** Pre-release marker; lower than anything, including the end of the string */
        TILDE,
        /** Post-release marker; higher than the end of the string, lower than any run */
        CARET,
        /** Run of ASCII letters */
        ALPHA,
        /** Run of ASCII digits */
        NUMERIC
    }

    public static final VersionToken TILDE = new VersionToken(Kind.TILDE, "~");
    public static final VersionToken CARET = new VersionToken(Kind.CARET, "^");

    public VersionToken {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Token text cannot be empty");
        }
    }

    public static VersionToken numeric(String digits) {
        return new VersionToken(Kind.NUMERIC, digits);
    }

    public static VersionToken alpha(String letters) {
        return new VersionToken(Kind.ALPHA, letters);
    }

    public boolean isSeparator() {
        return kind == Kind.TILDE || kind == Kind.CARET;
    }

    @Override
    public String toString() {
        return text;
    }
}
