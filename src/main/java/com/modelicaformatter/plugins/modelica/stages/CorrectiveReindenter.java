package com.modelicaformatter.plugins.modelica.stages;

import com.modelicaformatter.config.FormatOptions;
import com.modelicaformatter.plugins.modelica.FormatContext;
import com.modelicaformatter.plugins.modelica.FormatStage;
import com.modelicaformatter.plugins.modelica.indent.ControlBlockKind;
import com.modelicaformatter.plugins.modelica.indent.ModelicaKeywords;
import com.modelicaformatter.plugins.modelica.indent.SectionKind;
import com.modelicaformatter.plugins.modelica.indent.SourceLine;

/**
 * Second indentation scan over the normalized text. Inside an equation or algorithm section every
 * if/when header, else/elseif line and end if/when/for line is moved to exactly one level below
 * the section header, measured from the header's own indentation. A section ends at the next
 * {@code end}, {@code end;}, {@code public} or {@code protected} line.
 *
 * <p>Nesting is not tracked, so control structures nested inside another one end up on the same
 * level as the outermost one. Body lines and for headers are left where the first pass put them.
 * With the extended keyword set, elsewhen and end while lines are realigned as well and a class
 * end also leaves the section.
 */
public class CorrectiveReindenter implements FormatStage {

    private final ModelicaKeywords keywords;

    public CorrectiveReindenter() {
        this(ModelicaKeywords.STANDARD);
    }

    public CorrectiveReindenter(ModelicaKeywords keywords) {
        this.keywords = keywords;
    }

    @Override
    public String name() {
        return "realign-control";
    }

    @Override
    public String apply(String text, FormatContext context) {
        FormatOptions options = context.getOptions();
        String[] lines = text.split("\n", -1);

        boolean inSection = false;
        int headerLevel = 0;

        for (int i = 0; i < lines.length; i++) {
            SourceLine line = SourceLine.of(i + 1, lines[i]);
            String content = line.getContent();

            if (SectionKind.fromHeader(content) != null) {
                inSection = true;
                headerLevel = line.indentWidth(options.getTabWidth()) / options.getTabWidth();
                continue;
            }

            if (!inSection) {
                continue;
            }

            if (ModelicaKeywords.isSectionBoundary(content)
                    || (keywords.isExtended() && keywords.isClassEnd(content))) {
                inSection = false;
                continue;
            }

            if (isRealigned(content)) {
                lines[i] = options.indent(headerLevel + 1) + content;
            }
        }

        return String.join("\n", lines);
    }

    /**
     * Control-keyword lines whose indentation this pass overrides.
     */
    boolean isRealigned(String content) {
        ControlBlockKind opened = keywords.openedBlock(content);
        if (opened == ControlBlockKind.IF || opened == ControlBlockKind.WHEN) {
            return true;
        }
        if (keywords.isBranch(content)) {
            return true;
        }
        // end if/when/for, plus end while with the extended keyword set
        return keywords.closedBlock(content) != null;
    }
}
