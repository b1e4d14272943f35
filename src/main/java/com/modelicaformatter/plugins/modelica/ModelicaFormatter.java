package com.modelicaformatter.plugins.modelica;

import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import com.modelicaformatter.api.FormatterPlugin;
import com.modelicaformatter.api.FormatterResult;
import com.modelicaformatter.api.error.FormatterError;
import com.modelicaformatter.config.FormatOptions;
import com.modelicaformatter.config.FormatterConfig;
import com.modelicaformatter.plugins.modelica.stages.IdentifierTightening;
import com.modelicaformatter.util.LoggerUtil;

/**
 * Formatter plugin for Modelica ({@code .mo}) files. The text is never parsed; the formatting
 * pipeline works on lines and regular expressions only, so any input produces output.
 */
public class ModelicaFormatter implements FormatterPlugin {
    private static final Logger logger = LoggerUtil.getLogger(ModelicaFormatter.class);

    private volatile ModelicaPipeline pipeline = ModelicaPipeline.standard();
    private volatile FormatOptions options = FormatOptions.defaults();
    private volatile IdentifierTightening tightening = IdentifierTightening.defaults();
    private volatile boolean reportUnbalancedBlocks = false;

    @Override
    public void initialize(FormatterConfig config) {
        this.options = config.toFormatOptions();
        this.tightening = new IdentifierTightening(config.getPluginStringList(
                FormatterConfig.MODELICA_PLUGIN, "tightIdentifiers", IdentifierTightening.DEFAULT_IDENTIFIERS));
        this.reportUnbalancedBlocks = config.getPluginConfig(
                FormatterConfig.MODELICA_PLUGIN, "reportUnbalancedBlocks", false);
        boolean extendedSyntax = config.getPluginConfig(FormatterConfig.MODELICA_PLUGIN, "extendedSyntax", false);
        this.pipeline = extendedSyntax ? ModelicaPipeline.extended() : ModelicaPipeline.standard();

        logger.fine("Modelica formatter initialized with " + options
                + ", tight identifiers " + tightening.getIdentifiers()
                + (extendedSyntax ? ", extended syntax" : ""));
    }

    @Override
    public FormatterResult format(Path filePath, String sourceCode) {
        PipelineResult result = pipeline.format(sourceCode, new FormatContext(options, tightening));

        List<FormatterError> errors = reportUnbalancedBlocks ? result.getDiagnostics() : List.of();
        boolean successful = errors.stream().noneMatch(e -> e.getSeverity().failsResult());

        if (!errors.isEmpty()) {
            logger.fine(() -> filePath + ": " + errors.size() + " diagnostic(s)");
        }

        return FormatterResult.builder()
                .successful(successful)
                .formattedCode(result.getText())
                .errors(errors)
                .appliedRewrites(result.getRewrites())
                .build();
    }

    public FormatOptions getOptions() {
        return options;
    }

    public IdentifierTightening getTightening() {
        return tightening;
    }
}
