package com.modelicaformatter.plugins.modelica.indent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable scan state of the indentation engine. Each processed line maps one context to the next.
 * The indent level is clamped at zero.
 */
public final class IndentContext {
    private static final IndentContext INITIAL = new IndentContext(0, SectionKind.NONE, List.of());

    private final int indentLevel;
    private final SectionKind section;
    // bottom of the stack first
    private final List<ControlBlockFrame> frames;

    private IndentContext(int indentLevel, SectionKind section, List<ControlBlockFrame> frames) {
        this.indentLevel = Math.max(0, indentLevel);
        this.section = Objects.requireNonNull(section, "section");
        this.frames = frames;
    }

    public static IndentContext initial() {
        return INITIAL;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    public SectionKind getSection() {
        return section;
    }

    public boolean inSection() {
        return section.isActive();
    }

    public int depth() {
        return frames.size();
    }

    public boolean hasOpenBlocks() {
        return !frames.isEmpty();
    }

    /**
     * Innermost open block, or null when the stack is empty.
     */
    public ControlBlockFrame top() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public List<ControlBlockFrame> getFrames() {
        return frames;
    }

    public IndentContext withIndentLevel(int level) {
        return level == indentLevel ? this : new IndentContext(level, section, frames);
    }

    public IndentContext withSection(SectionKind kind) {
        return kind == section ? this : new IndentContext(indentLevel, kind, frames);
    }

    public IndentContext push(ControlBlockFrame frame) {
        List<ControlBlockFrame> next = new ArrayList<>(frames);
        next.add(Objects.requireNonNull(frame, "frame"));
        return new IndentContext(indentLevel, section, Collections.unmodifiableList(next));
    }

    /**
     * Removes the innermost frame. Popping an empty stack returns this context unchanged.
     */
    public IndentContext pop() {
        if (frames.isEmpty()) {
            return this;
        }
        List<ControlBlockFrame> next = new ArrayList<>(frames.subList(0, frames.size() - 1));
        return new IndentContext(indentLevel, section, Collections.unmodifiableList(next));
    }

    /**
     * Discards every open frame and restores the indent level that was in force before the
     * outermost one was opened.
     */
    public IndentContext closeOpenBlocks() {
        if (frames.isEmpty()) {
            return this;
        }
        return new IndentContext(frames.get(0).getLevel() - 1, section, List.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndentContext)) {
            return false;
        }
        IndentContext other = (IndentContext) o;
        return indentLevel == other.indentLevel && section == other.section && frames.equals(other.frames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(indentLevel, section, frames);
    }

    @Override
    public String toString() {
        return "IndentContext{level=" + indentLevel + ", section=" + section + ", frames=" + frames + "}";
    }
}
