package com.mainframe.fixedwidth.util;

import lombok.experimental.UtilityClass;

/**
 * Positional helpers that count unicode code points rather than UTF-16 chars, so a
 * supplementary character occupies one column position.
 */
@UtilityClass
public class CodePointUtil {

    public static int length(String s) {
        return s == null ? 0 : s.codePointCount(0, s.length());
    }

    /**
     * Code points {@code [start, start + count)} of {@code s}. Positions past the end of the
     * string are dropped, so a range entirely beyond it yields an empty string.
     */
    public static String slice(String s, int start, int count) {
        if (s == null || count <= 0) {
            return "";
        }
        int total = length(s);
        if (start >= total) {
            return "";
        }
        int begin = s.offsetByCodePoints(0, start);
        int available = Math.min(count, total - start);
        int end = s.offsetByCodePoints(begin, available);
        return s.substring(begin, end);
    }
}
