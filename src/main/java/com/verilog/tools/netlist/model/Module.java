package com.verilog.tools.netlist.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * A module definition: ports, nets, cells and parameters in declaration order.
 *
 * Names are unique per collection. Adding a second member of an existing name is refused
 * and the first one is kept.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
public class Module {
    @ToString.Include
    private final String name;
    @ToString.Include
    private final String sourceFile;
    private final int line;

    private final Map<String, Port> ports = new LinkedHashMap<>();
    private final Map<String, Net> nets = new LinkedHashMap<>();
    private final Map<String, Cell> cells = new LinkedHashMap<>();
    private final Map<String, String> parameters = new LinkedHashMap<>();

    /** Maintained by the linker; {@code Netlist.getTopModules()} is authoritative. */
    @Setter
    private boolean top;

    public Module(String name, String sourceFile, int line) {
        this.name = name;
        this.sourceFile = sourceFile;
        this.line = line;
    }

    public boolean addPort(Port port) {
        if (ports.containsKey(port.getName())) {
            return false;
        }
        ports.put(port.getName(), port);
        port.setModule(this);
        return true;
    }

    public boolean addNet(Net net) {
        if (nets.containsKey(net.getName())) {
            return false;
        }
        nets.put(net.getName(), net);
        net.setModule(this);
        return true;
    }

    public boolean addCell(Cell cell) {
        if (cells.containsKey(cell.getName())) {
            return false;
        }
        cells.put(cell.getName(), cell);
        cell.setModule(this);
        return true;
    }

    public boolean addParameter(String parameterName, String value) {
        if (parameters.containsKey(parameterName)) {
            return false;
        }
        parameters.put(parameterName, value);
        return true;
    }

    public Optional<Port> getPort(String portName) {
        return Optional.ofNullable(ports.get(portName));
    }

    public Optional<Net> getNet(String netName) {
        return Optional.ofNullable(nets.get(netName));
    }

    public Optional<Cell> getCell(String cellName) {
        return Optional.ofNullable(cells.get(cellName));
    }

    public Collection<Port> getPorts() {
        return Collections.unmodifiableCollection(ports.values());
    }

    public Collection<Net> getNets() {
        return Collections.unmodifiableCollection(nets.values());
    }

    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }
}
