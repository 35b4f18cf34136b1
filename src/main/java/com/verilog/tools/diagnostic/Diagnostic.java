package com.verilog.tools.diagnostic;

import lombok.Value;

/**
 * One reported problem. {@code file} may be null for problems not tied to a source file,
 * {@code line} is 0 when unknown.
 */
@Value
public class Diagnostic {
    DiagnosticKind kind;
    String message;
    String file;
    int line;

    @Override
    public String toString() {
        if (file == null) {
            return kind + ": " + message;
        }
        return line > 0
                ? file + ":" + line + ": " + kind + ": " + message
                : file + ": " + kind + ": " + message;
    }
}
