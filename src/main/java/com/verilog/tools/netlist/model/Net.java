package com.verilog.tools.netlist.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A signal inside one module, with the instance pins attached to it.
 *
 * {@code connections} holds every attached pin; the linker classifies them into the driver
 * and the loads once the instantiated modules are known.
 */
@Getter
@ToString
public class Net {
    private final String name;
    private final String netType;
    private final int width;
    private final String range;
    private final int line;

    /** True for nets created for a port or a pin rather than declared. */
    private final boolean implicit;

    @ToString.Exclude
    private Pin driver;

    @ToString.Exclude
    private final List<Pin> loads = new ArrayList<>();

    @ToString.Exclude
    private final List<Pin> connections = new ArrayList<>();

    @Setter
    @ToString.Exclude
    private Module module;

    @Builder
    public Net(String name, String netType, int width, String range, int line, boolean implicit) {
        this.name = name;
        this.netType = netType != null ? netType : "wire";
        this.width = width > 0 ? width : 1;
        this.range = range;
        this.line = line;
        this.implicit = implicit;
    }

    public void connect(Pin pin) {
        connections.add(pin);
    }

    public List<Pin> getLoads() {
        return Collections.unmodifiableList(loads);
    }

    public List<Pin> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    /**
     * Record {@code pin} as the driver.
     *
     * @return false if another pin already drives this net; the first driver is kept
     */
    public boolean addDriver(Pin pin) {
        if (driver != null && driver != pin) {
            return false;
        }
        driver = pin;
        return true;
    }

    public void addLoad(Pin pin) {
        if (!loads.contains(pin)) {
            loads.add(pin);
        }
    }
}
