package com.modelicaformatter.plugins.modelica.indent;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line classification shared by the indentation engine and the corrective pass.
 * Every method expects trimmed line content and looks at that single line only.
 *
 * <p>{@link #STANDARD} recognizes the fixed keyword set the formatter has always used: the seven
 * class kinds followed by a space, {@code if}/{@code when}/{@code for} blocks, {@code else} and
 * {@code elseif}, and {@code //} comments. {@link #EXTENDED} is enabled with the
 * {@code extendedSyntax} option and adds class prefixes, {@code type} and {@code operator}
 * definitions, short and one-line classes, {@code while} loops, {@code elsewhen} and {@code /*}
 * comments; with it, class boundaries also close open blocks and leave the current section.
 */
public final class ModelicaKeywords {

    public static final ModelicaKeywords STANDARD = new ModelicaKeywords(false,
            Pattern.compile("^(?:model|block|package|function|record|connector|class) "),
            Pattern.compile("^end (if|when|for)\\b"),
            EnumSet.of(ControlBlockKind.IF, ControlBlockKind.WHEN, ControlBlockKind.FOR));

    private static final String CLASS_PREFIXES =
            "(?:(?:encapsulated|partial|expandable|pure|impure|replaceable|redeclare|operator)\\s+)*";
    private static final String CLASS_KINDS =
            "(?:model|block|package|function|record|connector|class|type|operator)";

    public static final ModelicaKeywords EXTENDED = new ModelicaKeywords(true,
            Pattern.compile("^" + CLASS_PREFIXES + CLASS_KINDS + "\\s"),
            Pattern.compile("^end\\s+(if|when|for|while)\\b"),
            EnumSet.allOf(ControlBlockKind.class));

    // "type Voltage = Real(unit=\"V\");" or "model M = N(k=2);"
    private static final Pattern SHORT_CLASS = Pattern.compile(
            "^" + CLASS_PREFIXES + CLASS_KINDS + "\\s+[\\w'.]+\\s*=");

    // "record R Real x; end R;" on one line
    private static final Pattern ONE_LINE_CLASS = Pattern.compile("\\bend\\s+[\\w'.]+\\s*;\\s*$");

    private final boolean extended;
    private final Pattern classStart;
    private final Pattern controlEnd;
    private final Set<ControlBlockKind> blockKinds;

    private ModelicaKeywords(boolean extended, Pattern classStart, Pattern controlEnd,
                             Set<ControlBlockKind> blockKinds) {
        this.extended = extended;
        this.classStart = classStart;
        this.controlEnd = controlEnd;
        this.blockKinds = blockKinds;
    }

    public boolean isExtended() {
        return extended;
    }

    public static boolean isBareEnd(String line) {
        return line.equals("end") || line.equals("end;");
    }

    /**
     * {@code end}, {@code end;}, {@code public} and {@code protected}: lines that terminate the
     * current section without opening a new equation or algorithm section.
     */
    public static boolean isSectionBoundary(String line) {
        return isBareEnd(line) || line.equals("public") || line.equals("protected");
    }

    /**
     * Start of a class-like definition such as {@code model Foo}.
     */
    public boolean opensClass(String line) {
        return classStart.matcher(line).find();
    }

    /**
     * A class definition that has no separate body: short class definitions and definitions that
     * already end with their own {@code end Name;}. Always false for the standard keyword set.
     */
    public boolean isSelfContainedClass(String line) {
        return extended && (SHORT_CLASS.matcher(line).find() || ONE_LINE_CLASS.matcher(line).find());
    }

    /**
     * {@code end Name;} closing a class, as opposed to {@code end if} and friends.
     */
    public boolean isClassEnd(String line) {
        return line.startsWith("end ") && closedBlock(line) == null;
    }

    /**
     * Kind of control block opened by this line: an {@code if}/{@code when} header ending in
     * {@code then}, or a {@code for} (or {@code while}) header ending in {@code loop}.
     */
    public ControlBlockKind openedBlock(String line) {
        for (ControlBlockKind kind : blockKinds) {
            if (line.startsWith(kind.getKeyword() + " ") && line.endsWith(kind.getHeaderTerminator())) {
                return kind;
            }
        }
        return null;
    }

    public ControlBlockKind closedBlock(String line) {
        Matcher matcher = controlEnd.matcher(line);
        return matcher.find() ? ControlBlockKind.fromKeyword(matcher.group(1)) : null;
    }

    /**
     * {@code else} and {@code elseif ...}, plus {@code elsewhen ...} in extended mode.
     */
    public boolean isBranch(String line) {
        return line.equals("else") || line.startsWith("elseif ")
                || (extended && line.startsWith("elsewhen "));
    }

    public boolean isComment(String line) {
        return line.startsWith("//") || (extended && line.startsWith("/*"));
    }

    /**
     * A line is a continuation when the raw line before it ends with an open parenthesis or a comma.
     */
    public static boolean continuesAfter(String previousRawLine) {
        if (previousRawLine == null) {
            return false;
        }
        String previous = previousRawLine.strip();
        return previous.endsWith("(") || previous.endsWith(",");
    }

    @Override
    public String toString() {
        return extended ? "extended" : "standard";
    }
}
