package com.modelicaformatter.api;

/**
 * Records that one formatting stage changed the text, and which line span it touched.
 * Line numbers are 1-based and refer to the stage's output.
 */
public class AppliedRewrite {
    private final String stage;
    private final int startLine;
    private final int endLine;
    private final int changedLines;

    public AppliedRewrite(String stage, int startLine, int endLine, int changedLines) {
        this.stage = stage;
        this.startLine = startLine;
        this.endLine = endLine;
        this.changedLines = changedLines;
    }

    public String getStage() { return stage; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public int getChangedLines() { return changedLines; }

    public String getDescription() {
        return stage + " changed " + changedLines + " line(s) between lines " + startLine + " and " + endLine;
    }
}
