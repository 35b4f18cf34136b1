package com.verilog.tools;

import com.verilog.tools.cli.HierCommand;
import com.verilog.tools.cli.PreprocCommand;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Main entry point of the Verilog tools.
 * {@code preproc} writes preprocessed source, {@code hier} shows the design hierarchy.
 */
@Command(
        name = "verilog-tools",
        mixinStandardHelpOptions = true,
        version = "verilog-tools 1.0.0",
        description = "Verilog preprocessor and hierarchy tools.",
        subcommands = {PreprocCommand.class, HierCommand.class}
)
public class VerilogToolsApplication implements Runnable {

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new VerilogToolsApplication())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command: preproc or hier");
    }
}
