package com.verilog.tools.cli.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.verilog.tools.language.LanguageStandard;
import com.verilog.tools.netlist.NetlistConfig;
import com.verilog.tools.preproc.PreprocessorConfig;

import lombok.Builder;
import lombok.Value;

/**
 * Sources after plus-arguments and file lists have been expanded.
 */
@Value
@Builder
public class ResolvedSources {
	List<Path> files;
	Map<String, String> defines;
	List<Path> includePaths;
	List<Path> libraryDirs;
	List<String> libraryExtensions;

	public PreprocessorConfig toPreprocessorConfig(boolean expandMacros) {
		return PreprocessorConfig.builder()
				.defines(defines)
				.includePaths(includePaths)
				.expandMacros(expandMacros)
				.build();
	}

	public NetlistConfig toNetlistConfig(LanguageStandard language) {
		return NetlistConfig.builder()
				.preprocessor(toPreprocessorConfig(true))
				.language(language)
				.libraryDirs(libraryDirs)
				.libraryExtensions(libraryExtensions)
				.build();
	}
}
