package com.verilog.tools.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.cli.exception.OptionsValidationException;
import com.verilog.tools.cli.model.ResolvedSources;
import com.verilog.tools.cli.model.SourceOptions;
import com.verilog.tools.cli.validation.SourceOptionsValidator;
import com.verilog.tools.preproc.PreprocessResult;
import com.verilog.tools.preproc.Preprocessor;
import com.verilog.tools.util.FileWriteUtil;
import com.verilog.tools.util.LoggingUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Writes the preprocessed text of the input files, in order.
 */
@Command(
        name = "preproc",
        mixinStandardHelpOptions = true,
        version = "verilog-tools preproc 1.0.0",
        description = "Preprocesses Verilog files: expands macros, resolves conditionals and inlines includes."
)
public class PreprocCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PreprocCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions sources;

    @Option(names = {"--output", "-o"}, description = "Output file (defaults to standard output)")
    private Path output;

    @Option(names = {"--defines-only"}, description = "Print the macro table after processing instead of the text")
    private boolean definesOnly;

    @Option(names = {"--includes-only"}, description = "Print the include directories instead of the text")
    private boolean includesOnly;

    @Option(names = {"--no-expand"}, description = "Process directives but do not substitute macros")
    private boolean noExpand;

    @Option(names = {"--debug"}, description = "Enable debug logging")
    private boolean debug;

    @Override
    public Integer call() {
        if (debug) {
            LoggingUtil.enableDebug();
        }

        try {
            ResolvedSources resolved = new SourceOptionsValidator().validate(sources, !(definesOnly || includesOnly));

            if (includesOnly) {
                StringBuilder sb = new StringBuilder("Include Paths:\n==============\n");
                resolved.getIncludePaths().forEach(p -> sb.append("  ").append(p).append('\n'));
                FileWriteUtil.writeOrPrint(output, sb.toString(), spec.commandLine().getOut());
                return 0;
            }

            Preprocessor preprocessor = new Preprocessor(resolved.toPreprocessorConfig(!noExpand));
            StringBuilder text = new StringBuilder();
            boolean failed = false;

            for (Path file : resolved.getFiles()) {
                try {
                    PreprocessResult result = preprocessor.processFile(file);
                    if (!result.isSuccess()) {
                        log.error("Preprocessing failed: {}", result.getErrorMessage());
                        failed = true;
                    }
                    text.append(result.getText());
                    if (text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
                        text.append('\n');
                    }
                } catch (IOException e) {
                    log.error("Cannot read {} ({})", file, e.getMessage());
                    failed = true;
                }
            }

            if (definesOnly) {
                StringBuilder sb = new StringBuilder("Defines:\n========\n");
                for (Map.Entry<String, String> define : preprocessor.getDefines().entrySet()) {
                    sb.append("`define ").append(define.getKey()).append(' ').append(define.getValue()).append('\n');
                }
                FileWriteUtil.writeOrPrint(output, sb.toString(), spec.commandLine().getOut());
            } else {
                FileWriteUtil.writeOrPrint(output, text.toString(), spec.commandLine().getOut());
            }

            return failed ? 1 : 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (IOException e) {
            log.error("Cannot write output {} ({})", output, e.getMessage());
            return 1;
        }
    }
}
