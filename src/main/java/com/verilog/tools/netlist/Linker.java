package com.verilog.tools.netlist;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.diagnostic.DiagnosticKind;
import com.verilog.tools.netlist.model.Cell;
import com.verilog.tools.netlist.model.Module;
import com.verilog.tools.netlist.model.Net;
import com.verilog.tools.netlist.model.Pin;
import com.verilog.tools.netlist.model.Port;
import com.verilog.tools.parser.model.PortDirection;

/**
 * Resolves cells to module definitions.
 *
 * The worklist holds the cells of modules registered since the last run plus every cell
 * still unresolved. Rounds repeat while they make progress, which library reads can keep
 * doing by registering new modules with cells of their own. The number of rounds is bounded
 * by the total cell count, so the loop cannot run away.
 *
 * Re-running is safe: resolved cells are never visited again and each unresolved cell is
 * reported once.
 */
class Linker {
    private static final Logger log = LoggerFactory.getLogger(Linker.class);

    private final Netlist netlist;
    private final Set<Cell> reported = new HashSet<>();

    Linker(Netlist netlist) {
        this.netlist = netlist;
    }

    /**
     * @return number of cells resolved by this run
     */
    int link() {
        Set<Cell> worklist = new LinkedHashSet<>();
        enqueue(worklist, netlist.drainPending());
        for (Module module : netlist.getModules()) {
            for (Cell cell : module.getCells()) {
                if (!cell.isResolved()) {
                    worklist.add(cell);
                }
            }
        }

        int resolved = 0;
        int rounds = 0;
        boolean progress = true;
        while (progress && !worklist.isEmpty() && rounds <= netlist.cellCount()) {
            progress = false;
            rounds++;

            for (Cell cell : new ArrayList<>(worklist)) {
                Optional<Module> target = netlist.findModule(cell.getModuleName());
                if (target.isEmpty()) {
                    target = netlist.readLibraryModule(cell.getModuleName());
                }
                if (target.isPresent()) {
                    bind(cell, target.get());
                    worklist.remove(cell);
                    resolved++;
                    progress = true;
                }
            }

            // modules read from libraries bring cells of their own
            if (enqueue(worklist, netlist.drainPending())) {
                progress = true;
            }
        }

        for (Cell cell : worklist) {
            if (reported.add(cell)) {
                String message = "Module '" + cell.getModuleName() + "' not found for instance '"
                        + cell.getName() + "' in module " + cell.getModule().getName();
                log.warn("{}:{}: {}", cell.getModule().getSourceFile(), cell.getLine(), message);
                netlist.getDiagnostics().warning(DiagnosticKind.UNRESOLVED_MODULE_REFERENCE, message,
                        cell.getModule().getSourceFile(), cell.getLine());
            }
        }

        Set<Module> tops = new HashSet<>(netlist.getTopModules());
        for (Module module : netlist.getModules()) {
            module.setTop(tops.contains(module));
        }

        log.info("Linked {} cells in {} rounds, {} unresolved", resolved, rounds, worklist.size());
        return resolved;
    }

    private static boolean enqueue(Set<Cell> worklist, List<Module> modules) {
        boolean added = false;
        for (Module module : modules) {
            for (Cell cell : module.getCells()) {
                if (!cell.isResolved() && worklist.add(cell)) {
                    added = true;
                }
            }
        }
        return added;
    }

    /**
     * Resolve {@code cell} and classify its pins by the direction of the port they bind to.
     * Positional pins bind to the port at their position.
     */
    private void bind(Cell cell, Module target) {
        cell.setResolvedModule(target);
        List<Port> ports = new ArrayList<>(target.getPorts());

        for (Pin pin : cell.getPins()) {
            Port port = target.getPort(pin.getName()).orElse(null);
            if (port == null && isPosition(pin.getName())) {
                int index = Integer.parseInt(pin.getName());
                port = index < ports.size() ? ports.get(index) : null;
            }
            if (port == null) {
                log.debug("Instance {} connects pin {} that module {} does not declare",
                        cell.getName(), pin.getName(), target.getName());
                continue;
            }
            pin.setPort(port);

            Net net = pin.getNet();
            if (net == null) {
                continue;
            }
            if (port.getDirection() == PortDirection.OUTPUT) {
                if (!net.addDriver(pin)) {
                    String message = "Net '" + net.getName() + "' in module " + cell.getModule().getName()
                            + " is driven by both " + describe(net.getDriver()) + " and " + describe(pin);
                    log.warn("{}:{}: {}", cell.getModule().getSourceFile(), cell.getLine(), message);
                    netlist.getDiagnostics().warning(DiagnosticKind.MULTIPLE_DRIVERS, message,
                            cell.getModule().getSourceFile(), cell.getLine());
                }
            } else {
                net.addLoad(pin);
            }
        }
    }

    private static boolean isPosition(String pinName) {
        return !pinName.isEmpty() && pinName.chars().allMatch(Character::isDigit);
    }

    static String describe(Pin pin) {
        return pin.getCell().getName() + "." + (pin.getPort() != null ? pin.getPort().getName() : pin.getName());
    }
}
