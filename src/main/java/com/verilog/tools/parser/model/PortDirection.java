package com.verilog.tools.parser.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Direction of a module port, named by its Verilog keyword.
 */
public enum PortDirection {
    INPUT("input"),
    OUTPUT("output"),
    INOUT("inout");

    private final String keyword;

    PortDirection(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<PortDirection> fromKeyword(String keyword) {
        return Arrays.stream(values())
                .filter(d -> d.keyword.equals(keyword))
                .findFirst();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
