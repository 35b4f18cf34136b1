package com.verilog.tools.diagnostic;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated while processing a set of sources.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<Diagnostic> errors = new ArrayList<>();
    private final List<Diagnostic> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public void error(DiagnosticKind kind, String message, String file, int line) {
        errors.add(new Diagnostic(kind, message, file, line));
    }

    public void warning(DiagnosticKind kind, String message, String file, int line) {
        warnings.add(new Diagnostic(kind, message, file, line));
    }

    public void info(String message) {
        infos.add(message);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * True when any error or warning of the given kind was recorded.
     */
    public boolean has(DiagnosticKind kind) {
        return count(kind) > 0;
    }

    public long count(DiagnosticKind kind) {
        return errors.stream().filter(d -> d.getKind() == kind).count()
                + warnings.stream().filter(d -> d.getKind() == kind).count();
    }

    /**
     * Appends everything recorded in {@code other}.
     */
    public void addAll(ToolDiagnostics other) {
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
        infos.addAll(other.infos);
    }
}
