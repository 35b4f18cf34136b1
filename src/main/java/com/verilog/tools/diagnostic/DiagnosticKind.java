package com.verilog.tools.diagnostic;

/**
 * Categories of problems reported while reading, parsing and linking Verilog sources.
 */
public enum DiagnosticKind {
    MALFORMED_DIRECTIVE,
    UNRESOLVED_INCLUDE,
    CYCLIC_INCLUDE,
    UNBALANCED_CONDITIONAL,
    UNRESOLVED_MODULE_REFERENCE,
    MISSING_TOP_LEVEL_FILE,
    MALFORMED_NUMERIC_LITERAL,
    DUPLICATE_DECLARATION,
    UNTERMINATED_MODULE,
    MULTIPLE_DRIVERS
}
