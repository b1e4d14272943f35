package com.modelicaformatter.plugins.modelica.stages;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.config.FormatOptions;
import com.modelicaformatter.plugins.modelica.FormatContext;
import com.modelicaformatter.plugins.modelica.FormatStage;
import com.modelicaformatter.plugins.modelica.indent.ControlBlockFrame;
import com.modelicaformatter.plugins.modelica.indent.ControlBlockKind;
import com.modelicaformatter.plugins.modelica.indent.IndentContext;
import com.modelicaformatter.plugins.modelica.indent.IndentStep;
import com.modelicaformatter.plugins.modelica.indent.ModelicaKeywords;
import com.modelicaformatter.plugins.modelica.indent.SectionKind;
import com.modelicaformatter.plugins.modelica.indent.SourceLine;
import com.modelicaformatter.util.LoggerUtil;

/**
 * Single forward scan that re-indents every line from its trimmed content.
 *
 * <p>Each line is classified in a fixed priority order: blank line, section header, section
 * boundary ({@code end}, {@code public}, {@code protected}), class start, class end, and then,
 * inside an equation or algorithm section, comment, control-block opener, branch, control-block
 * closer, continuation and plain statement. Lines outside a section keep the current level.
 *
 * <p>Statements in a section sit one level below the current level; an opener increments the
 * level and records a {@link ControlBlockFrame}; {@code else}/{@code elseif} realign to the frame's
 * level; a closer pops the frame and decrements. A section header only switches the section, and
 * class starts and ends only move the level, so a section stays active until the next
 * {@code end}, {@code public} or {@code protected} line.
 *
 * <p>Unbalanced branches and closers fall back to the current level. They are collected as
 * warnings that never influence the output. With the {@link ModelicaKeywords#EXTENDED} keyword
 * set, headers and class boundaries also drop blocks left open and class boundaries leave the
 * current section.
 */
public class IndentationEngine implements FormatStage {
    private static final Logger logger = LoggerUtil.getLogger(IndentationEngine.class);

    public static final String UNMATCHED_BRANCH = "UNMATCHED_BRANCH";
    public static final String UNMATCHED_BLOCK_END = "UNMATCHED_BLOCK_END";
    public static final String MISMATCHED_BLOCK_END = "MISMATCHED_BLOCK_END";
    public static final String UNCLOSED_BLOCK = "UNCLOSED_BLOCK";

    private final ModelicaKeywords keywords;

    public IndentationEngine() {
        this(ModelicaKeywords.STANDARD);
    }

    public IndentationEngine(ModelicaKeywords keywords) {
        this.keywords = keywords;
    }

    @Override
    public String name() {
        return "indent";
    }

    @Override
    public String apply(String text, FormatContext context) {
        FormatOptions options = context.getOptions();
        String[] rawLines = text.split("\n", -1);
        List<String> result = new ArrayList<>(rawLines.length);

        IndentContext state = IndentContext.initial();
        for (int i = 0; i < rawLines.length; i++) {
            SourceLine line = SourceLine.of(i + 1, rawLines[i]);
            String previousRaw = i > 0 ? rawLines[i - 1] : null;

            IndentStep step = step(state, line, previousRaw, options);
            result.add(step.getEmitted());
            step.getDiagnostics().forEach(context::report);
            state = step.getNext();
        }

        List<FormatterError> trailing = new ArrayList<>();
        _reportOpenBlocks(state, trailing);
        trailing.forEach(context::report);

        int finalLevel = state.getIndentLevel();
        logger.fine(() -> "Indented " + rawLines.length + " lines with the " + keywords
                + " keyword set, final level " + finalLevel);
        return String.join("\n", result);
    }

    /**
     * Processes one line.
     *
     * @param previousRawLine the untrimmed line before this one, or null for the first line
     */
    public IndentStep step(IndentContext context, SourceLine line, String previousRawLine, FormatOptions options) {
        String content = line.getContent();
        List<FormatterError> diagnostics = new ArrayList<>();

        if (line.isBlank()) {
            return new IndentStep("", context, diagnostics);
        }

        SectionKind header = SectionKind.fromHeader(content);
        if (header != null) {
            IndentContext next = _dropOpenBlocks(context, diagnostics).withSection(header);
            return _emit(options, next.getIndentLevel(), content, next, diagnostics);
        }

        if (ModelicaKeywords.isSectionBoundary(content)) {
            IndentContext next = _dropOpenBlocks(context, diagnostics).withSection(SectionKind.NONE);
            if (ModelicaKeywords.isBareEnd(content)) {
                next = next.withIndentLevel(next.getIndentLevel() - 1);
            }
            return _emit(options, next.getIndentLevel(), content, next, diagnostics);
        }

        if (keywords.opensClass(content)) {
            IndentContext next = _leaveSection(_dropOpenBlocks(context, diagnostics));
            int level = next.getIndentLevel();
            if (!keywords.isSelfContainedClass(content)) {
                next = next.withIndentLevel(level + 1);
            }
            return _emit(options, level, content, next, diagnostics);
        }

        if (keywords.isClassEnd(content)) {
            IndentContext next = _leaveSection(_dropOpenBlocks(context, diagnostics));
            next = next.withIndentLevel(next.getIndentLevel() - 1);
            return _emit(options, next.getIndentLevel(), content, next, diagnostics);
        }

        if (context.inSection()) {
            return _stepInSection(context, line, previousRawLine, options, diagnostics);
        }

        return _emit(options, context.getIndentLevel(), content, context, diagnostics);
    }

    private IndentStep _stepInSection(IndentContext context, SourceLine line, String previousRawLine,
                                      FormatOptions options, List<FormatterError> diagnostics) {
        String content = line.getContent();
        int level = context.getIndentLevel();

        if (keywords.isComment(content)) {
            return _emit(options, level + 1, content, context, diagnostics);
        }

        ControlBlockKind opened = keywords.openedBlock(content);
        if (opened != null) {
            ControlBlockFrame frame = new ControlBlockFrame(opened, level + 1, line.getNumber());
            IndentContext next = context.push(frame).withIndentLevel(level + 1);
            return _emit(options, level + 1, content, next, diagnostics);
        }

        if (keywords.isBranch(content)) {
            ControlBlockFrame top = context.top();
            if (top == null) {
                diagnostics.add(FormatterError.warning(UNMATCHED_BRANCH,
                        "'" + _firstWord(content) + "' without an open if/when block", line.getNumber()));
                return _emit(options, level, content, context, diagnostics);
            }
            IndentContext next = context.withIndentLevel(top.getLevel());
            return _emit(options, top.getLevel(), content, next, diagnostics);
        }

        ControlBlockKind closed = keywords.closedBlock(content);
        if (closed != null) {
            ControlBlockFrame top = context.top();
            if (top == null) {
                diagnostics.add(FormatterError.warning(UNMATCHED_BLOCK_END,
                        "'" + closed.getClosingKeyword() + "' without a matching opener", line.getNumber()));
                return _emit(options, level, content, context, diagnostics);
            }
            if (top.getKind() != closed) {
                diagnostics.add(FormatterError.warning(MISMATCHED_BLOCK_END,
                        "'" + closed.getClosingKeyword() + "' closes the '" + top.getKind().getKeyword()
                                + "' opened at line " + top.getOpenedAtLine(), line.getNumber()));
            }
            IndentContext next = context.pop().withIndentLevel(level - 1);
            return _emit(options, next.getIndentLevel(), content, next, diagnostics);
        }

        if (ModelicaKeywords.continuesAfter(previousRawLine)) {
            return _emit(options, level + 2, content, context, diagnostics);
        }

        return _emit(options, level + 1, content, context, diagnostics);
    }

    /**
     * In extended mode, drops the frames still open at a section or class boundary and restores
     * the level in force before them. The standard keyword set keeps them until a closer pops them.
     */
    private IndentContext _dropOpenBlocks(IndentContext context, List<FormatterError> diagnostics) {
        if (!keywords.isExtended() || !context.hasOpenBlocks()) {
            return context;
        }
        _reportOpenBlocks(context, diagnostics);
        return context.closeOpenBlocks();
    }

    private IndentContext _leaveSection(IndentContext context) {
        return keywords.isExtended() ? context.withSection(SectionKind.NONE) : context;
    }

    private static void _reportOpenBlocks(IndentContext context, List<FormatterError> diagnostics) {
        for (ControlBlockFrame frame : context.getFrames()) {
            diagnostics.add(FormatterError.warning(UNCLOSED_BLOCK,
                    "'" + frame.getKind().getKeyword() + "' block is never closed with '"
                            + frame.getKind().getClosingKeyword() + "'", frame.getOpenedAtLine()));
        }
    }

    private static IndentStep _emit(FormatOptions options, int level, String content, IndentContext next,
                                    List<FormatterError> diagnostics) {
        return new IndentStep(options.indent(level) + content, next, diagnostics);
    }

    private static String _firstWord(String content) {
        int space = content.indexOf(' ');
        return space < 0 ? content : content.substring(0, space);
    }
}
