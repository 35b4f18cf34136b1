package com.verilog.tools.netlist;

import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.diagnostic.DiagnosticKind;
import com.verilog.tools.diagnostic.ToolDiagnostics;
import com.verilog.tools.language.VerilogLanguage;
import com.verilog.tools.netlist.model.Cell;
import com.verilog.tools.netlist.model.Module;
import com.verilog.tools.netlist.model.Net;
import com.verilog.tools.netlist.model.Pin;
import com.verilog.tools.netlist.model.Port;
import com.verilog.tools.parser.model.InstanceDeclaration;
import com.verilog.tools.parser.model.ModuleDeclaration;
import com.verilog.tools.parser.model.NetDeclaration;
import com.verilog.tools.parser.model.ParameterDeclaration;
import com.verilog.tools.parser.model.PinConnection;
import com.verilog.tools.parser.model.PortDeclaration;

/**
 * Materializes a {@link Module} from a harvested {@link ModuleDeclaration}.
 *
 * Declared nets are created first so that ports and pins attach to them regardless of
 * the order they appear in the source. A port without a declared net gets an implicit one
 * of the same name.
 */
public class NetlistBuilder {
    private static final Logger log = LoggerFactory.getLogger(NetlistBuilder.class);

    private static final Pattern LITERAL = Pattern.compile("[0-9_]*'[sS]?[A-Za-z][0-9A-Za-z_?]*|[0-9][0-9_]*");

    private final boolean implicitWires;

    public NetlistBuilder(boolean implicitWires) {
        this.implicitWires = implicitWires;
    }

    public Module build(ModuleDeclaration declaration, ToolDiagnostics diagnostics) {
        String file = declaration.getSourceFile();
        Module module = new Module(declaration.getName(), file, declaration.getLine());

        for (NetDeclaration decl : declaration.getNets()) {
            Net net = Net.builder()
                    .name(decl.getName())
                    .netType(decl.getNetType())
                    .width(decl.getWidth())
                    .range(decl.getRange())
                    .line(decl.getLine())
                    .build();
            if (!module.addNet(net)) {
                duplicate(diagnostics, module, "net", decl.getName(), file, decl.getLine());
            }
        }

        for (PortDeclaration decl : declaration.getPorts()) {
            Port port = Port.builder()
                    .name(decl.getName())
                    .direction(decl.getDirection())
                    .width(decl.getWidth())
                    .range(decl.getRange())
                    .netType(decl.getNetType())
                    .line(decl.getLine())
                    .build();
            if (!module.addPort(port)) {
                duplicate(diagnostics, module, "port", decl.getName(), file, decl.getLine());
                continue;
            }
            Net net = module.getNet(decl.getName()).orElseGet(() -> {
                Net implicit = Net.builder()
                        .name(decl.getName())
                        .netType(decl.getNetType())
                        .width(decl.getWidth())
                        .range(decl.getRange())
                        .line(decl.getLine())
                        .implicit(true)
                        .build();
                module.addNet(implicit);
                return implicit;
            });
            port.setNet(net);
        }

        for (ParameterDeclaration decl : declaration.getParameters()) {
            if (!module.addParameter(decl.getName(), decl.getValue())) {
                duplicate(diagnostics, module, "parameter", decl.getName(), file, decl.getLine());
                continue;
            }
            String value = decl.getValue();
            if (LITERAL.matcher(value).matches() && VerilogLanguage.numberValue(value).isEmpty()) {
                String message = "Malformed number '" + value + "' for parameter " + decl.getName()
                        + " in module " + module.getName();
                log.warn("{}:{}: {}", file, decl.getLine(), message);
                diagnostics.warning(DiagnosticKind.MALFORMED_NUMERIC_LITERAL, message, file, decl.getLine());
            }
        }

        for (InstanceDeclaration decl : declaration.getInstances()) {
            Cell cell = new Cell(decl.getInstanceName(), decl.getModuleName(), decl.getLine());
            if (!module.addCell(cell)) {
                duplicate(diagnostics, module, "instance", decl.getInstanceName(), file, decl.getLine());
                continue;
            }
            for (PinConnection connection : decl.getConnections()) {
                Pin pin = new Pin(connection.getPinName(), connection.getExpression());
                if (!cell.addPin(pin)) {
                    duplicate(diagnostics, module, "pin", cell.getName() + "." + connection.getPinName(), file, decl.getLine());
                    continue;
                }
                attach(module, pin, connection.getNetName(), decl.getLine());
            }
        }

        log.debug("Built module {}: {} ports, {} nets, {} cells", module.getName(),
                module.getPorts().size(), module.getNets().size(), module.getCells().size());
        return module;
    }

    private void attach(Module module, Pin pin, String netName, int line) {
        if (netName == null) {
            return;
        }
        Net net = module.getNet(netName).orElse(null);
        if (net == null && implicitWires) {
            net = Net.builder()
                    .name(netName)
                    .line(line)
                    .implicit(true)
                    .build();
            module.addNet(net);
        }
        if (net != null) {
            pin.setNet(net);
            net.connect(pin);
        }
    }

    private static void duplicate(ToolDiagnostics diagnostics, Module module, String what, String name,
                                  String file, int line) {
        String message = "Duplicate " + what + " '" + name + "' in module " + module.getName() + ", keeping the first";
        log.warn("{}:{}: {}", file, line, message);
        diagnostics.warning(DiagnosticKind.DUPLICATE_DECLARATION, message, file, line);
    }
}
