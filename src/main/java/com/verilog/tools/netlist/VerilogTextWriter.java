package com.verilog.tools.netlist;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.verilog.tools.netlist.model.Cell;
import com.verilog.tools.netlist.model.Module;
import com.verilog.tools.netlist.model.Net;
import com.verilog.tools.netlist.model.Pin;
import com.verilog.tools.netlist.model.Port;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders modules back to a Verilog skeleton: header, port directions, net declarations
 * and instances, independent of the original formatting.
 */
public class VerilogTextWriter {

    private static final String TEMPLATE = "verilog-skeleton.ftl";

    private final Configuration freemarkerConfig;

    public VerilogTextWriter() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String write(Collection<Module> modules) {
        List<Map<String, Object>> views = new ArrayList<>();
        for (Module module : modules) {
            views.add(moduleView(module));
        }

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(Map.of("modules", views), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + TEMPLATE, e);
        }
    }

    private static Map<String, Object> moduleView(Module module) {
        List<String> portNames = new ArrayList<>();
        List<String> portDeclarations = new ArrayList<>();
        for (Port port : module.getPorts()) {
            portNames.add(port.getName());
            String keyword = port.getNetType() != null
                    ? port.getDirection().getKeyword() + " " + port.getNetType()
                    : port.getDirection().getKeyword();
            portDeclarations.add(declaration(keyword, port.getRange(), port.getName()));
        }

        // a port's own net is only declared again when the source declared it separately
        List<String> netDeclarations = new ArrayList<>();
        for (Net net : module.getNets()) {
            if (module.getPort(net.getName()).isEmpty() || !net.isImplicit()) {
                netDeclarations.add(declaration(net.getNetType(), net.getRange(), net.getName()));
            }
        }

        List<Map<String, Object>> instances = new ArrayList<>();
        for (Cell cell : module.getCells()) {
            List<String> connections = new ArrayList<>();
            for (Pin pin : cell.getPins()) {
                connections.add(isPositional(pin)
                        ? pin.getExpression()
                        : "." + pin.getName() + "(" + pin.getExpression() + ")");
            }
            Map<String, Object> instance = new LinkedHashMap<>();
            instance.put("moduleName", cell.getModuleName());
            instance.put("name", cell.getName());
            instance.put("connections", connections);
            instances.add(instance);
        }

        Map<String, Object> view = new LinkedHashMap<>();
        view.put("name", module.getName());
        view.put("portNames", portNames);
        view.put("portDeclarations", portDeclarations);
        view.put("netDeclarations", netDeclarations);
        view.put("instances", instances);
        return view;
    }

    private static String declaration(String keyword, String range, String name) {
        return range != null && !range.isEmpty()
                ? keyword + " " + range + " " + name
                : keyword + " " + name;
    }

    private static boolean isPositional(Pin pin) {
        return !pin.getName().isEmpty() && pin.getName().chars().allMatch(Character::isDigit);
    }
}
