package com.verilog.tools.parser.model;

import lombok.Builder;
import lombok.Value;

/**
 * A {@code parameter} or {@code localparam}. {@code value} is the raw expression text,
 * empty when no default was given.
 */
@Value
@Builder
public class ParameterDeclaration {
    String name;
    @Builder.Default
    String value = "";
    boolean local;
    int line;
}
