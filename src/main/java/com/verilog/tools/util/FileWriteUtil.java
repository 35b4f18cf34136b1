package com.verilog.tools.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes tool output to a file or to the command's standard output.
 */
public final class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content);
    }

    /**
     * Writes {@code content} to {@code target}, or to {@code out} when no target was given.
     */
    public static void writeOrPrint(Path target, String content, PrintWriter out) throws IOException {
        if (target != null) {
            safeWriteString(target, content);
        } else {
            out.print(content);
            out.flush();
        }
    }
}
