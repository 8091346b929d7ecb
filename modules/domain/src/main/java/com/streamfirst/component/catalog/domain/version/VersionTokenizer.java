package com.streamfirst.component.catalog.domain.version;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits version and release strings into {@link VersionToken}s. Digit runs and letter
 * runs become tokens, each {@code ~} and {@code ^} becomes its own token, and every other
 * character only ends the current run.
 */
public final class VersionTokenizer {

    private VersionTokenizer() {
    }

    public static List<VersionToken> tokenize(String value) {
        List<VersionToken> tokens = new ArrayList<>();
        if (value == null) {
            return tokens;
        }
        int length = value.length();
        int i = 0;
        while (i < length) {
            char c = value.charAt(i);
            if (c == '~') {
                tokens.add(VersionToken.TILDE);
                i++;
            } else if (c == '^') {
                tokens.add(VersionToken.CARET);
                i++;
            } else if (isDigit(c)) {
                int start = i;
                while (i < length && isDigit(value.charAt(i))) {
                    i++;
                }
                tokens.add(VersionToken.numeric(value.substring(start, i)));
            } else if (isLetter(c)) {
                int start = i;
                while (i < length && isLetter(value.charAt(i))) {
                    i++;
                }
                tokens.add(VersionToken.alpha(value.substring(start, i)));
            } else {
                i++;
            }
        }
        return tokens;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // rpm only treats ASCII letters as alphabetic
    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
