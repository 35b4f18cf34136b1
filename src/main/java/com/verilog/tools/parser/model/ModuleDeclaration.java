package com.verilog.tools.parser.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Everything harvested for one module: its name plus the ports, nets, parameters and
 * instances declared between {@code module} and {@code endmodule}.
 */
@Value
@Builder
public class ModuleDeclaration {
    String name;
    String sourceFile;
    int line;
    List<PortDeclaration> ports;
    List<NetDeclaration> nets;
    List<ParameterDeclaration> parameters;
    List<InstanceDeclaration> instances;
    /** False when the input ended before {@code endmodule}. */
    boolean terminated;
}
