package com.verilog.tools.cli.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.cli.exception.OptionsValidationException;
import com.verilog.tools.cli.model.ResolvedSources;
import com.verilog.tools.cli.model.SourceOptions;

/**
 * Expands plus-arguments and {@code -f} file lists, then checks the result.
 *
 * File lists hold one or more arguments per line; {@code //} and {@code #} start comments.
 * Inside them {@code -f}, {@code -y}, {@code -v}, {@code -I} and {@code -D} are recognized
 * as well as plus-arguments. All problems are collected and thrown together.
 */
public class SourceOptionsValidator {

	private static final Logger log = LoggerFactory.getLogger(SourceOptionsValidator.class);

	private static final Pattern MACRO_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");

	/**
	 * Same as {@link #validate(SourceOptions, boolean)} with input files required.
	 */
	public ResolvedSources validate(SourceOptions o) {
		return validate(o, true);
	}

	public ResolvedSources validate(SourceOptions o, boolean requireFiles) {
		Collected c = new Collected();

		for (String define : o.getDefines()) {
			addDefine(define, c);
		}
		c.includePaths.addAll(o.getIncludePaths());
		c.libraryDirs.addAll(o.getLibraryDirs());
		for (Path list : o.getFileLists()) {
			readFileList(list, c);
		}
		for (String argument : o.getArguments()) {
			interpret(argument, c);
		}

		if (requireFiles && c.files.isEmpty()) {
			c.errors.add("No input files specified.");
		}
		for (Path dir : c.includePaths) {
			if (!Files.isDirectory(dir)) {
				c.errors.add("Include directory does not exist or is not a directory: " + dir);
			}
		}
		for (Path dir : c.libraryDirs) {
			if (!Files.isDirectory(dir)) {
				c.errors.add("Library directory does not exist or is not a directory: " + dir);
			}
		}

		if (!c.errors.isEmpty()) {
			throw new OptionsValidationException(c.errors);
		}

		return ResolvedSources.builder()
				.files(List.copyOf(c.files))
				.defines(c.defines)
				.includePaths(List.copyOf(c.includePaths))
				.libraryDirs(List.copyOf(c.libraryDirs))
				.libraryExtensions(List.copyOf(c.libraryExtensions))
				.build();
	}

	private void interpret(String argument, Collected c) {
		if (argument.startsWith("+define+")) {
			for (String define : plusValues(argument, "+define+")) {
				addDefine(define, c);
			}
		} else if (argument.startsWith("+incdir+")) {
			for (String dir : plusValues(argument, "+incdir+")) {
				c.includePaths.add(Path.of(dir));
			}
		} else if (argument.startsWith("+libext+")) {
			c.libraryExtensions.addAll(plusValues(argument, "+libext+"));
		} else if (argument.startsWith("+")) {
			log.warn("Ignoring unsupported argument {}", argument);
		} else {
			c.files.add(Path.of(argument));
		}
	}

	private static List<String> plusValues(String argument, String prefix) {
		List<String> values = new ArrayList<>();
		for (String value : argument.substring(prefix.length()).split("\\+")) {
			if (!value.isEmpty()) {
				values.add(value);
			}
		}
		return values;
	}

	private void addDefine(String define, Collected c) {
		int eq = define.indexOf('=');
		String name = eq >= 0 ? define.substring(0, eq) : define;
		String value = eq >= 0 ? define.substring(eq + 1) : "1";
		if (!MACRO_NAME.matcher(name).matches()) {
			c.errors.add("Invalid macro name in define: " + define);
			return;
		}
		c.defines.put(name, value);
	}

	private void readFileList(Path list, Collected c) {
		Path normalized = list.toAbsolutePath().normalize();
		if (!c.visitedLists.add(normalized)) {
			c.errors.add("File list referenced more than once: " + list);
			return;
		}

		List<String> lines;
		try {
			lines = Files.readAllLines(list);
		} catch (IOException e) {
			c.errors.add("Cannot read file list " + list + " (" + e.getMessage() + ")");
			return;
		}

		List<String> words = new ArrayList<>();
		for (String line : lines) {
			String content = stripListComment(line).trim();
			if (!content.isEmpty()) {
				words.addAll(List.of(content.split("\\s+")));
			}
		}

		Iterator<String> it = words.iterator();
		while (it.hasNext()) {
			String word = it.next();
			if (isSwitch(word, "-f") || isSwitch(word, "-y") || isSwitch(word, "-v")
					|| isSwitch(word, "-I") || isSwitch(word, "-D")) {
				String flag = word.substring(0, 2);
				String value = word.length() > 2 ? word.substring(2) : (it.hasNext() ? it.next() : null);
				if (value == null) {
					c.errors.add("Missing value for " + flag + " in file list " + list);
					continue;
				}
				applySwitch(flag, value, c);
			} else if (word.startsWith("-")) {
				log.warn("Ignoring unsupported option {} in file list {}", word, list);
			} else {
				interpret(word, c);
			}
		}
	}

	private void applySwitch(String flag, String value, Collected c) {
		switch (flag) {
			case "-f":
				readFileList(Path.of(value), c);
				break;
			case "-y":
				c.libraryDirs.add(Path.of(value));
				break;
			case "-v":
				c.files.add(Path.of(value));
				break;
			case "-I":
				c.includePaths.add(Path.of(value));
				break;
			default:
				addDefine(value, c);
				break;
		}
	}

	private static boolean isSwitch(String word, String flag) {
		return word.startsWith(flag);
	}

	private static String stripListComment(String line) {
		String trimmed = line.trim();
		if (trimmed.startsWith("#")) {
			return "";
		}
		int comment = line.indexOf("//");
		return comment >= 0 ? line.substring(0, comment) : line;
	}

	private static final class Collected {
		private final List<String> errors = new ArrayList<>();
		private final List<Path> files = new ArrayList<>();
		private final Map<String, String> defines = new LinkedHashMap<>();
		private final List<Path> includePaths = new ArrayList<>();
		private final List<Path> libraryDirs = new ArrayList<>();
		private final List<String> libraryExtensions = new ArrayList<>();
		private final Set<Path> visitedLists = new HashSet<>();
	}
}
