package com.modelicaformatter.plugins.modelica.indent;

import java.util.Objects;

/**
 * An open if/when/for/while block. {@code level} is the indent level its opener line was emitted
 * at; else/elseif lines realign to it.
 */
public final class ControlBlockFrame {
    private final ControlBlockKind kind;
    private final int level;
    private final int openedAtLine;

    public ControlBlockFrame(ControlBlockKind kind, int level, int openedAtLine) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.level = level;
        this.openedAtLine = openedAtLine;
    }

    public ControlBlockKind getKind() {
        return kind;
    }

    public int getLevel() {
        return level;
    }

    public int getOpenedAtLine() {
        return openedAtLine;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ControlBlockFrame)) {
            return false;
        }
        ControlBlockFrame other = (ControlBlockFrame) o;
        return kind == other.kind && level == other.level && openedAtLine == other.openedAtLine;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, level, openedAtLine);
    }

    @Override
    public String toString() {
        return kind.getKeyword() + "@" + level + " (line " + openedAtLine + ")";
    }
}
