package com.verilog.tools.netlist;

import java.nio.file.Path;
import java.util.List;

import com.verilog.tools.language.LanguageStandard;
import com.verilog.tools.preproc.PreprocessorConfig;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration of a {@link Netlist}.
 */
@Value
@Builder(toBuilder = true)
public class NetlistConfig {

    /** Seeds a fresh preprocessor for every file read. */
    @Builder.Default
    PreprocessorConfig preprocessor = PreprocessorConfig.defaults();

    /** Keyword set used by the tokenizer. */
    @Builder.Default
    LanguageStandard language = LanguageStandard.maximum();

    /** Directories searched for modules that are instantiated but never read. */
    @Singular
    List<Path> libraryDirs;

    /** File extensions tried in library directories; {@code .v} and {@code .sv} when empty. */
    @Singular
    List<String> libraryExtensions;

    /** Whether linking may read missing modules from the library directories. */
    @Builder.Default
    boolean linkRead = true;

    /** Whether a pin connected to an undeclared net creates an implicit wire. */
    @Builder.Default
    boolean implicitWires = true;

    public static NetlistConfig defaults() {
        return NetlistConfig.builder().build();
    }

    public List<String> effectiveLibraryExtensions() {
        return libraryExtensions.isEmpty() ? List.of(".v", ".sv") : libraryExtensions;
    }
}
