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
 * An instance of another module, referenced by name until the linker resolves it.
 */
@Getter
@ToString
public class Cell {
    private final String name;
    private final String moduleName;
    private final int line;

    @ToString.Exclude
    private final Map<String, Pin> pins = new LinkedHashMap<>();

    /** Set by the linker only. */
    @Setter
    @ToString.Exclude
    private Module resolvedModule;

    @Setter
    @ToString.Exclude
    private Module module;

    public Cell(String name, String moduleName, int line) {
        this.name = name;
        this.moduleName = moduleName;
        this.line = line;
    }

    /**
     * @return false if a pin of that name already exists; the first one is kept
     */
    public boolean addPin(Pin pin) {
        if (pins.containsKey(pin.getName())) {
            return false;
        }
        pins.put(pin.getName(), pin);
        pin.setCell(this);
        return true;
    }

    public Optional<Pin> getPin(String pinName) {
        return Optional.ofNullable(pins.get(pinName));
    }

    public Collection<Pin> getPins() {
        return Collections.unmodifiableCollection(pins.values());
    }

    public boolean isResolved() {
        return resolvedModule != null;
    }
}
