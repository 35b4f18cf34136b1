package com.verilog.tools.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.diagnostic.DiagnosticKind;
import com.verilog.tools.diagnostic.ToolDiagnostics;
import com.verilog.tools.parser.model.InstanceDeclaration;
import com.verilog.tools.parser.model.ModuleDeclaration;
import com.verilog.tools.parser.model.NetDeclaration;
import com.verilog.tools.parser.model.ParameterDeclaration;
import com.verilog.tools.parser.model.PortDeclaration;

/**
 * Listener that harvests module declarations from parser events.
 *
 * The accumulators are reset on every {@code moduleBegin} and sealed into a
 * {@link ModuleDeclaration} on {@code moduleEnd}. Every sealed module is kept, so a file
 * holding several modules is harvested completely. Events can be forwarded to a delegate.
 */
public class DeclarationCollector implements ParserListener {
    private static final Logger log = LoggerFactory.getLogger(DeclarationCollector.class);

    private static final ParserListener NO_DELEGATE = new ParserListener() {
    };

    private final String sourceFile;
    private final ParserListener delegate;
    private final ToolDiagnostics diagnostics = new ToolDiagnostics();
    private final List<ModuleDeclaration> modules = new ArrayList<>();

    private String moduleName;
    private int moduleLine;
    private List<PortDeclaration> ports = new ArrayList<>();
    private List<NetDeclaration> nets = new ArrayList<>();
    private List<ParameterDeclaration> parameters = new ArrayList<>();
    private List<InstanceDeclaration> instances = new ArrayList<>();

    public DeclarationCollector(String sourceFile) {
        this(sourceFile, NO_DELEGATE);
    }

    public DeclarationCollector(String sourceFile, ParserListener delegate) {
        this.sourceFile = sourceFile;
        this.delegate = delegate != null ? delegate : NO_DELEGATE;
    }

    @Override
    public void moduleBegin(String name, int line) {
        if (moduleName != null) {
            sealUnterminated();
        }
        moduleName = name;
        moduleLine = line;
        ports = new ArrayList<>();
        nets = new ArrayList<>();
        parameters = new ArrayList<>();
        instances = new ArrayList<>();
        delegate.moduleBegin(name, line);
    }

    @Override
    public void moduleEnd(int line) {
        if (moduleName != null) {
            modules.add(snapshot(true));
            moduleName = null;
        }
        delegate.moduleEnd(line);
    }

    @Override
    public void portDeclaration(PortDeclaration port) {
        ports.add(port);
        delegate.portDeclaration(port);
    }

    @Override
    public void netDeclaration(NetDeclaration net) {
        nets.add(net);
        delegate.netDeclaration(net);
    }

    @Override
    public void parameterDeclaration(ParameterDeclaration parameter) {
        parameters.add(parameter);
        delegate.parameterDeclaration(parameter);
    }

    @Override
    public void instanceDeclaration(InstanceDeclaration instance) {
        instances.add(instance);
        delegate.instanceDeclaration(instance);
    }

    @Override
    public void alwaysBegin(int line) {
        delegate.alwaysBegin(line);
    }

    @Override
    public void assign(int line) {
        delegate.assign(line);
    }

    @Override
    public void directive(String text, int line, int column) {
        delegate.directive(text, line, column);
    }

    @Override
    public void identifier(String text, int line, int column) {
        delegate.identifier(text, line, column);
    }

    @Override
    public void endOfInput(int line) {
        if (moduleName != null) {
            sealUnterminated();
        }
        delegate.endOfInput(line);
    }

    /**
     * The module currently being collected, as declared so far.
     */
    public ModuleDeclaration snapshot() {
        return snapshot(false);
    }

    /**
     * Modules sealed so far, in source order.
     */
    public List<ModuleDeclaration> getModules() {
        return Collections.unmodifiableList(modules);
    }

    public ToolDiagnostics getDiagnostics() {
        return diagnostics;
    }

    private void sealUnterminated() {
        String message = "Module '" + moduleName + "' has no endmodule";
        log.warn("{}: {}", sourceFile, message);
        diagnostics.warning(DiagnosticKind.UNTERMINATED_MODULE, message, sourceFile, moduleLine);
        modules.add(snapshot(false));
        moduleName = null;
    }

    private ModuleDeclaration snapshot(boolean terminated) {
        return ModuleDeclaration.builder()
                .name(moduleName)
                .sourceFile(sourceFile)
                .line(moduleLine)
                .ports(List.copyOf(ports))
                .nets(List.copyOf(nets))
                .parameters(List.copyOf(parameters))
                .instances(List.copyOf(instances))
                .terminated(terminated)
                .build();
    }
}
