package com.verilog.tools.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Source selection options shared by the commands. Holds values only; interpretation of
 * plus-arguments and file lists happens in the validator.
 */
@Getter
public class SourceOptions {

	@Parameters(paramLabel = "FILE", arity = "0..*",
			description = "Verilog files, or +define+NAME[=VALUE], +incdir+DIR and +libext+EXT arguments")
	private List<String> arguments = new ArrayList<>();

	@Option(names = { "-D", "--define" }, paramLabel = "NAME[=VALUE]", description = "Define a macro (value defaults to 1)")
	private List<String> defines = new ArrayList<>();

	@Option(names = { "-I", "--include" }, paramLabel = "DIR", description = "Add an include directory")
	private List<Path> includePaths = new ArrayList<>();

	@Option(names = { "-f", "--file-list" }, paramLabel = "FILE", description = "Read more arguments from a file, one or more per line")
	private List<Path> fileLists = new ArrayList<>();

	@Option(names = { "-y", "--library-dir" }, paramLabel = "DIR", description = "Directory searched for modules that are instantiated but not read")
	private List<Path> libraryDirs = new ArrayList<>();
}
