package com.verilog.tools.preproc;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of preprocessing one top-level file.
 *
 * A failed result still carries the best-effort text produced before the failure was
 * detected.
 */
@Data
@Builder
public class PreprocessResult {
    private boolean success;
    private String text;
    private String errorMessage;

    /** Files inlined by {@code `include} while producing the text, in inclusion order. */
    @Builder.Default
    private List<Path> includedFiles = List.of();

    public static PreprocessResult failure(String errorMessage, String partialText, List<Path> includedFiles) {
        return PreprocessResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .text(partialText)
                .includedFiles(includedFiles)
                .build();
    }
}
