package com.verilog.tools.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.cli.exception.OptionsValidationException;
import com.verilog.tools.cli.model.HierarchyOptions;
import com.verilog.tools.cli.model.ResolvedSources;
import com.verilog.tools.cli.model.SourceOptions;
import com.verilog.tools.cli.output.HierarchyPrinter;
import com.verilog.tools.cli.validation.SourceOptionsValidator;
import com.verilog.tools.language.LanguageStandard;
import com.verilog.tools.netlist.FileReadResult;
import com.verilog.tools.netlist.Netlist;
import com.verilog.tools.netlist.model.Module;
import com.verilog.tools.util.FileWriteUtil;
import com.verilog.tools.util.LoggingUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Reads all input files, links them once and prints the requested views of the design
 * hierarchy. Without any view option the cell hierarchy is printed.
 */
@Command(
        name = "hier",
        mixinStandardHelpOptions = true,
        version = "verilog-tools hier 1.0.0",
        description = "Displays the module and instance hierarchy of Verilog files."
)
public class HierCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HierCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private SourceOptions sources;

    @Option(names = {"--language"}, paramLabel = "STD", description = "Language standard, e.g. 1364-2001 or 1800-2017")
    private String language;

    @Option(names = {"--sv"}, description = "Use the most recent SystemVerilog standard")
    private boolean systemVerilog;

    @Option(names = {"--cells"}, description = "Show the cell hierarchy")
    private boolean cells;

    @Option(names = {"--forest"}, description = "Show the hierarchy as a tree")
    private boolean forest;

    @Option(names = {"--modules"}, description = "List module names")
    private boolean modules;

    @Option(names = {"--module-files"}, description = "Show the file defining each module")
    private boolean moduleFiles;

    @Option(names = {"--includes"}, description = "Show the files included by each input file")
    private boolean includes;

    @Option(names = {"--input-files"}, description = "List the files read")
    private boolean inputFiles;

    @Option(names = {"--missing"}, description = "List modules that are instantiated but not found")
    private boolean missing;

    @Option(names = {"--instance"}, description = "Show the module name next to each instance")
    private boolean instance;

    @Option(names = {"--top-module"}, paramLabel = "NAME", description = "Start the cell views at this module")
    private String topModule;

    @Option(names = {"--xml"}, description = "Write the views as XML")
    private boolean xml;

    @Option(names = {"--skeleton"}, description = "Append the regenerated Verilog skeleton")
    private boolean skeleton;

    @Option(names = {"--dump"}, description = "Append the diagnostic netlist dump")
    private boolean dump;

    @Option(names = {"--output", "-o"}, description = "Output file (defaults to standard output)")
    private Path output;

    @Option(names = {"--debug"}, description = "Enable debug logging")
    private boolean debug;

    @Override
    public Integer call() {
        if (debug) {
            LoggingUtil.enableDebug();
        }

        try {
            ResolvedSources resolved = new SourceOptionsValidator().validate(sources);
            LanguageStandard standard = resolveLanguage();

            Netlist netlist = new Netlist(resolved.toNetlistConfig(standard));
            boolean failed = false;
            for (Path file : resolved.getFiles()) {
                FileReadResult result = netlist.readFile(file);
                if (!result.isSuccess()) {
                    failed = true;
                }
            }
            netlist.link();

            List<Module> roots;
            if (topModule != null) {
                Optional<Module> top = netlist.findModule(topModule);
                if (top.isEmpty()) {
                    log.error("Top module {} not found", topModule);
                    return 1;
                }
                roots = List.of(top.get());
            } else {
                roots = netlist.getTopModules();
            }

            String text = new HierarchyPrinter().print(netlist, roots, buildOptions());
            FileWriteUtil.writeOrPrint(output, text, spec.commandLine().getOut());

            return failed ? 1 : 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (IOException e) {
            log.error("Cannot write output {} ({})", output, e.getMessage());
            return 1;
        }
    }

    private LanguageStandard resolveLanguage() {
        if (systemVerilog) {
            return LanguageStandard.maximum();
        }
        if (language == null) {
            return LanguageStandard.maximum();
        }
        return LanguageStandard.fromLabel(language)
                .orElseThrow(() -> new OptionsValidationException("Unknown language standard: " + language));
    }

    private HierarchyOptions buildOptions() {
        boolean anyView = cells || forest || modules || moduleFiles || includes || inputFiles || missing
                || skeleton || dump;
        return HierarchyOptions.builder()
                .cells(cells || !anyView)
                .forest(forest)
                .modules(modules)
                .moduleFiles(moduleFiles)
                .includes(includes)
                .inputFiles(inputFiles)
                .missing(missing)
                .instance(instance)
                .xml(xml)
                .skeleton(skeleton)
                .dump(dump)
                .build();
    }
}
