package com.verilog.tools.preproc;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration handed to a {@link Preprocessor} at construction time.
 */
@Value
@Builder(toBuilder = true)
public class PreprocessorConfig {

    /** Initial macro table, name to raw replacement text. */
    @Singular
    Map<String, String> defines;

    /** Include directories, searched in order after the including file's directory. */
    @Singular
    List<Path> includePaths;

    /** When false, directives are still processed but no macro is substituted. */
    @Builder.Default
    boolean expandMacros = true;

    public static PreprocessorConfig defaults() {
        return PreprocessorConfig.builder().build();
    }
}
