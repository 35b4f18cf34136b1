package com.verilog.tools.netlist.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A named connection point on a cell, optionally attached to a net of the parent module.
 */
@Getter
@ToString
public class Pin {
    private final String name;

    /** Connected expression as written, empty for an unconnected pin. */
    private final String expression;

    @Setter
    @ToString.Exclude
    private Net net;

    @Setter
    @ToString.Exclude
    private Cell cell;

    /** Port of the instantiated module this pin binds to, set when the cell is linked. */
    @Setter
    @ToString.Exclude
    private Port port;

    public Pin(String name, String expression) {
        this.name = name;
        this.expression = expression != null ? expression : "";
    }

    public String getNetName() {
        return net != null ? net.getName() : null;
    }
}
