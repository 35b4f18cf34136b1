package com.verilog.tools.parser.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An instantiation {@code moduleName instanceName (connections);} inside a module body.
 */
@Value
@Builder
public class InstanceDeclaration {
    String moduleName;
    String instanceName;
    @Singular
    List<PinConnection> connections;
    int line;
}
