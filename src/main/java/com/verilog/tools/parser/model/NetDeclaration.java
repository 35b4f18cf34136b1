package com.verilog.tools.parser.model;

import lombok.Builder;
import lombok.Value;

/**
 * A net or variable declared by a net-type keyword such as {@code wire} or {@code reg}.
 */
@Value
@Builder
public class NetDeclaration {
    String netType;
    String name;
    @Builder.Default
    int width = 1;
    /** Packed range text such as {@code [7:0]}, null when none was written. */
    String range;
    int line;
}
