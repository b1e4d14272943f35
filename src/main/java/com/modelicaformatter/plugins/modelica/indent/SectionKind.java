package com.modelicaformatter.plugins.modelica.indent;

/**
 * The part of a class body a line belongs to.
 */
public enum SectionKind {
    NONE(null),
    EQUATION("equation"),
    ALGORITHM("algorithm"),
    INITIAL_EQUATION("initial equation"),
    INITIAL_ALGORITHM("initial algorithm");

    private final String keyword;

    SectionKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Equation and algorithm sections (initial or not) are the ones whose statements are indented
     * below the header and may contain control blocks.
     */
    public boolean isActive() {
        return this != NONE;
    }

    public boolean isAlgorithm() {
        return this == ALGORITHM || this == INITIAL_ALGORITHM;
    }

    /**
     * Returns the section opened by a line consisting exactly of a section keyword, or null.
     */
    public static SectionKind fromHeader(String trimmedLine) {
        for (SectionKind kind : values()) {
            if (kind.keyword != null && kind.keyword.equals(trimmedLine)) {
                return kind;
            }
        }
        return null;
    }
}
