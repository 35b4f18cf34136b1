package com.verilog.tools.parser.model;

import lombok.Builder;
import lombok.Value;

/**
 * A port declared by {@code input}, {@code output} or {@code inout}.
 * {@code netType} is set when the declaration names one, as in {@code output reg q}.
 */
@Value
@Builder
public class PortDeclaration {
    PortDirection direction;
    String name;
    @Builder.Default
    int width = 1;
    /** Packed range text such as {@code [7:0]}, null when none was written. */
    String range;
    String netType;
    int line;
}
