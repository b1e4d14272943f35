package com.modelicaformatter.plugins.modelica.stages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hides string literals, quoted identifiers and comments behind placeholders so that spacing
 * rules only ever see code. A placeholder is built from private-use characters, which no rule
 * pattern matches as a word character, whitespace, digit or operator.
 *
 * <pre>
 * ProtectedRegions regions = ProtectedRegions.mask(text);
 * String rewritten = rules.apply(regions.text());
 * String result = regions.restore(rewritten);
 * </pre>
 */
public final class ProtectedRegions {
    static final char OPEN = '\uE000';
    static final char CLOSE = '\uE001';
    private static final char DIGIT_ZERO = '\uE010';

    private final String maskedText;
    private final List<String> regions;

    private ProtectedRegions(String maskedText, List<String> regions) {
        this.maskedText = maskedText;
        this.regions = regions;
    }

    public static ProtectedRegions mask(String text) {
        // never produce ambiguous placeholders
        if (text.indexOf(OPEN) >= 0 || text.indexOf(CLOSE) >= 0) {
            return new ProtectedRegions(text, List.of());
        }

        List<String> regions = new ArrayList<>();
        StringBuilder masked = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int end = _regionEnd(text, i);
            if (end > i) {
                masked.append(_placeholder(regions.size()));
                regions.add(text.substring(i, end));
                i = end;
            } else {
                masked.append(text.charAt(i));
                i++;
            }
        }
        return new ProtectedRegions(masked.toString(), Collections.unmodifiableList(regions));
    }

    public String text() {
        return maskedText;
    }

    public List<String> getRegions() {
        return regions;
    }

    /**
     * Replaces every placeholder in {@code rewritten} with the region it stands for.
     */
    public String restore(String rewritten) {
        if (regions.isEmpty()) {
            return rewritten;
        }
        StringBuilder out = new StringBuilder(rewritten.length() + 64);
        int i = 0;
        while (i < rewritten.length()) {
            char c = rewritten.charAt(i);
            if (c == OPEN) {
                int close = rewritten.indexOf(CLOSE, i + 1);
                int index = close < 0 ? -1 : _decodeIndex(rewritten, i + 1, close);
                if (index >= 0 && index < regions.size()) {
                    out.append(regions.get(index));
                    i = close + 1;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * End index (exclusive) of the protected region starting at {@code start}, or {@code start}
     * when no region starts there.
     */
    private static int _regionEnd(String text, int start) {
        char c = text.charAt(start);
        char next = start + 1 < text.length() ? text.charAt(start + 1) : '\0';

        if (c == '"') {
            int i = start + 1;
            while (i < text.length()) {
                char ch = text.charAt(i);
                if (ch == '\\') {
                    i += 2;
                    continue;
                }
                if (ch == '"') {
                    return i + 1;
                }
                i++;
            }
            return text.length();
        }
        if (c == '\'') {
            // quoted identifiers never span lines; a lone quote is left alone
            for (int i = start + 1; i < text.length(); i++) {
                char ch = text.charAt(i);
                if (ch == '\n') {
                    return start;
                }
                if (ch == '\\') {
                    i++;
                } else if (ch == '\'') {
                    return i + 1;
                }
            }
            return start;
        }
        if (c == '/' && next == '/') {
            int newline = text.indexOf('\n', start);
            return newline < 0 ? text.length() : newline;
        }
        if (c == '/' && next == '*') {
            int close = text.indexOf("*/", start + 2);
            return close < 0 ? text.length() : close + 2;
        }
        return start;
    }

    private static String _placeholder(int index) {
        StringBuilder sb = new StringBuilder().append(OPEN);
        for (char digit : Integer.toString(index).toCharArray()) {
            sb.append((char) (DIGIT_ZERO + (digit - '0')));
        }
        return sb.append(CLOSE).toString();
    }

    private static int _decodeIndex(String text, int from, int to) {
        if (from == to) {
            return -1;
        }
        int index = 0;
        for (int i = from; i < to; i++) {
            int digit = text.charAt(i) - DIGIT_ZERO;
            if (digit < 0 || digit > 9) {
                return -1;
            }
            index = index * 10 + digit;
        }
        return index;
    }
}
