package com.modelicaformatter.plugins.modelica.indent;

public enum ControlBlockKind {
    IF("if", "then"),
    WHEN("when", "then"),
    FOR("for", "loop"),
    WHILE("while", "loop");

    private final String keyword;
    private final String headerTerminator;

    ControlBlockKind(String keyword, String headerTerminator) {
        this.keyword = keyword;
        this.headerTerminator = headerTerminator;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * The keyword an opener line must end with: "then" or "loop".
     */
    public String getHeaderTerminator() {
        return headerTerminator;
    }

    public String getClosingKeyword() {
        return "end " + keyword;
    }

    public static ControlBlockKind fromKeyword(String keyword) {
        for (ControlBlockKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return kind;
            }
        }
        return null;
    }
}
