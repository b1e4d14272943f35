package com.modelicaformatter.plugins.modelica.indent;

/**
 * One physical line split into its leading whitespace and trimmed content.
 */
public final class SourceLine {
    private final int number;
    private final String leadingWhitespace;
    private final String content;

    private SourceLine(int number, String leadingWhitespace, String content) {
        this.number = number;
        this.leadingWhitespace = leadingWhitespace;
        this.content = content;
    }

    /**
     * @param number 1-based line number, used for diagnostics only
     */
    public static SourceLine of(int number, String raw) {
        int i = 0;
        while (i < raw.length() && Character.isWhitespace(raw.charAt(i))) {
            i++;
        }
        return new SourceLine(number, raw.substring(0, i), raw.strip());
    }

    public int getNumber() {
        return number;
    }

    public String getContent() {
        return content;
    }

    public boolean isBlank() {
        return content.isEmpty();
    }

    /**
     * Width of the leading whitespace in columns, counting a tab as {@code tabWidth} columns.
     */
    public int indentWidth(int tabWidth) {
        int width = 0;
        for (int i = 0; i < leadingWhitespace.length(); i++) {
            width += leadingWhitespace.charAt(i) == '\t' ? tabWidth : 1;
        }
        return width;
    }

    @Override
    public String toString() {
        return number + ": " + leadingWhitespace + content;
    }
}
