package com.verilog.tools.netlist;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of reading one source file into a {@link Netlist}.
 */
@Data
@Builder
public class FileReadResult {
    private boolean success;
    private String file;
    private String errorMessage;

    /** Modules registered from this file, in source order. */
    @Builder.Default
    private List<String> moduleNames = List.of();

    @Builder.Default
    private List<Path> includedFiles = List.of();

    public static FileReadResult failure(String file, String errorMessage) {
        return FileReadResult.builder()
                .success(false)
                .file(file)
                .errorMessage(errorMessage)
                .build();
    }
}
