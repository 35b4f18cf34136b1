package com.verilog.tools.netlist;

import java.util.Map;
import java.util.stream.Collectors;

import com.verilog.tools.netlist.model.Cell;
import com.verilog.tools.netlist.model.Module;
import com.verilog.tools.netlist.model.Net;
import com.verilog.tools.netlist.model.Pin;
import com.verilog.tools.netlist.model.Port;

/**
 * Line-oriented diagnostic listing of a netlist.
 */
class NetlistDumper {

    String dump(Netlist netlist) {
        StringBuilder sb = new StringBuilder();
        sb.append("Netlist Dump:\n");
        sb.append("=============\n");

        for (Module module : netlist.getModules()) {
            sb.append('\n');
            sb.append("Module: ").append(module.getName());
            if (module.isTop()) {
                sb.append(" (top)");
            }
            sb.append("  [").append(module.getSourceFile()).append(':').append(module.getLine()).append("]\n");

            sb.append("  Ports: ").append(module.getPorts().size()).append('\n');
            for (Port port : module.getPorts()) {
                sb.append("    ").append(port.getDirection()).append(' ').append(port.getName());
                if (port.getWidth() > 1) {
                    sb.append(" [").append(port.getWidth()).append(" bits]");
                }
                sb.append('\n');
            }

            sb.append("  Nets: ").append(module.getNets().size()).append('\n');
            for (Net net : module.getNets()) {
                sb.append("    ").append(net.getNetType()).append(' ').append(net.getName());
                if (net.getDriver() != null) {
                    sb.append("  driver=").append(Linker.describe(net.getDriver()));
                }
                if (!net.getLoads().isEmpty()) {
                    sb.append("  loads=").append(net.getLoads().stream()
                            .map(Linker::describe)
                            .collect(Collectors.joining(",")));
                }
                sb.append('\n');
            }

            sb.append("  Cells: ").append(module.getCells().size()).append('\n');
            for (Cell cell : module.getCells()) {
                sb.append("    ").append(cell.getName()).append(" (").append(cell.getModuleName()).append(')');
                if (!cell.isResolved()) {
                    sb.append(" unresolved");
                }
                sb.append('\n');
                for (Pin pin : cell.getPins()) {
                    sb.append("      .").append(pin.getName()).append('(')
                            .append(pin.getNetName() != null ? pin.getNetName() : pin.getExpression())
                            .append(")\n");
                }
            }

            if (!module.getParameters().isEmpty()) {
                sb.append("  Parameters: ").append(module.getParameters().size()).append('\n');
                for (Map.Entry<String, String> parameter : module.getParameters().entrySet()) {
                    sb.append("    ").append(parameter.getKey()).append(" = ").append(parameter.getValue()).append('\n');
                }
            }
        }
        return sb.toString();
    }
}
