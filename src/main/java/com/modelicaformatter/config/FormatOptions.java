package com.modelicaformatter.config;

/**
 * The two options the formatting engine understands.
 * {@code printWidth} is carried for compatibility with pretty-printer hosts; no rule wraps lines.
 */
public final class FormatOptions {
    public static final int DEFAULT_TAB_WIDTH = 2;
    public static final int DEFAULT_PRINT_WIDTH = 80;

    private final int tabWidth;
    private final int printWidth;

    public FormatOptions(int tabWidth, int printWidth) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive, got " + tabWidth);
        }
        if (printWidth < 1) {
            throw new IllegalArgumentException("printWidth must be positive, got " + printWidth);
        }
        this.tabWidth = tabWidth;
        this.printWidth = printWidth;
    }

    public static FormatOptions defaults() {
        return new FormatOptions(DEFAULT_TAB_WIDTH, DEFAULT_PRINT_WIDTH);
    }

    public int getTabWidth() {
        return tabWidth;
    }

    public int getPrintWidth() {
        return printWidth;
    }

    /**
     * Leading whitespace for the given indent level.
     */
    public String indent(int level) {
        return " ".repeat(Math.max(0, level) * tabWidth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FormatOptions)) {
            return false;
        }
        FormatOptions other = (FormatOptions) o;
        return tabWidth == other.tabWidth && printWidth == other.printWidth;
    }

    @Override
    public int hashCode() {
        return 31 * tabWidth + printWidth;
    }

    @Override
    public String toString() {
        return "FormatOptions{tabWidth=" + tabWidth + ", printWidth=" + printWidth + "}";
    }
}
