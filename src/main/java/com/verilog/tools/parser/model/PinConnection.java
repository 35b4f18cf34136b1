package com.verilog.tools.parser.model;

import lombok.Value;

/**
 * One connection in an instance's port list. Positional connections are named by their
 * zero-based position. {@code netName} is null when the connected expression is empty or
 * is not a plain identifier.
 */
@Value
public class PinConnection {
    String pinName;
    String netName;
    String expression;
    boolean positional;
}
