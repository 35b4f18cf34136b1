package com.verilog.tools.netlist.model;

import com.verilog.tools.parser.model.PortDirection;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A module-boundary signal. Every port is backed by the net of the same name in its module.
 */
@Getter
@ToString
public class Port {
    private final String name;
    private final PortDirection direction;
    private final int width;
    private final String range;
    private final String netType;
    private final int line;

    @Setter
    @ToString.Exclude
    private Net net;

    @Setter
    @ToString.Exclude
    private Module module;

    @Builder
    public Port(String name, PortDirection direction, int width, String range, String netType, int line) {
        this.name = name;
        this.direction = direction;
        this.width = width > 0 ? width : 1;
        this.range = range;
        this.netType = netType;
        this.line = line;
    }
}
