package com.verilog.tools.cli.output;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.verilog.tools.cli.model.HierarchyOptions;
import com.verilog.tools.netlist.Netlist;
import com.verilog.tools.netlist.model.Cell;
import com.verilog.tools.netlist.model.Module;

/**
 * Renders the selected views of a linked netlist as text or XML.
 * No reading, no linking, no file output.
 *
 * A module instantiated inside its own subtree is printed once and not descended into.
 */
public class HierarchyPrinter {

    public String print(Netlist netlist, List<Module> roots, HierarchyOptions o) {
        StringBuilder sb = new StringBuilder();
        if (o.isXml()) {
            sb.append("<vhier>\n");
        }

        if (o.isCells()) {
            section(sb, o, "cells", "Cell Hierarchy:");
            for (Module root : roots) {
                if (o.isXml()) {
                    xmlModule(sb, root, "  ", new HashSet<>());
                } else {
                    textModule(sb, root, "", o.isInstance(), new HashSet<>());
                }
            }
            endSection(sb, o, "cells");
        }

        if (o.isForest()) {
            section(sb, o, "forest", "Hierarchy Forest:");
            for (Module root : roots) {
                if (o.isXml()) {
                    xmlModule(sb, root, "  ", new HashSet<>());
                } else {
                    sb.append(root.getName()).append('\n');
                    forest(sb, root, "", new HashSet<>(Set.of(root)));
                }
            }
            endSection(sb, o, "forest");
        }

        if (o.isModules()) {
            section(sb, o, "modules", "Module Names:");
            for (Module module : netlist.getModules()) {
                if (o.isXml()) {
                    sb.append("  <module>").append(escape(module.getName())).append("</module>\n");
                } else {
                    sb.append("  ").append(module.getName()).append('\n');
                }
            }
            endSection(sb, o, "modules");
        }

        if (o.isModuleFiles()) {
            section(sb, o, "module_files", "Module File Mapping:");
            for (Module module : netlist.getModules()) {
                String file = module.getSourceFile() != null ? module.getSourceFile() : "unknown";
                if (o.isXml()) {
                    sb.append("  <module_file module=\"").append(escape(module.getName()))
                            .append("\" file=\"").append(escape(file)).append("\"/>\n");
                } else {
                    sb.append("  ").append(module.getName()).append(": ").append(file).append('\n');
                }
            }
            endSection(sb, o, "module_files");
        }

        if (o.isIncludes()) {
            section(sb, o, "includes", "Include Files:");
            for (Map.Entry<String, List<Path>> entry : netlist.getIncludedFiles().entrySet()) {
                if (entry.getValue().isEmpty()) {
                    continue;
                }
                if (o.isXml()) {
                    sb.append("  <file name=\"").append(escape(entry.getKey())).append("\">\n");
                    for (Path include : entry.getValue()) {
                        sb.append("    <include>").append(escape(include.toString())).append("</include>\n");
                    }
                    sb.append("  </file>\n");
                } else {
                    sb.append("  ").append(entry.getKey()).append('\n');
                    for (Path include : entry.getValue()) {
                        sb.append("    ").append(include).append('\n');
                    }
                }
            }
            endSection(sb, o, "includes");
        }

        if (o.isInputFiles()) {
            section(sb, o, "input_files", "Input Files:");
            for (Path file : netlist.getInputFiles()) {
                if (o.isXml()) {
                    sb.append("  <file>").append(escape(file.toString())).append("</file>\n");
                } else {
                    sb.append("  ").append(file).append('\n');
                }
            }
            endSection(sb, o, "input_files");
        }

        if (o.isMissing()) {
            section(sb, o, "missing", "Missing Modules:");
            for (String name : netlist.getMissingModuleNames()) {
                if (o.isXml()) {
                    sb.append("  <module>").append(escape(name)).append("</module>\n");
                } else {
                    sb.append("  ").append(name).append('\n');
                }
            }
            endSection(sb, o, "missing");
        }

        if (o.isXml()) {
            sb.append("</vhier>\n");
        }

        // raw text views stay outside the XML document
        if (o.isSkeleton()) {
            sb.append(netlist.verilogText());
        }
        if (o.isDump()) {
            sb.append(netlist.dump());
        }
        return sb.toString();
    }

    private static void section(StringBuilder sb, HierarchyOptions o, String tag, String title) {
        if (o.isXml()) {
            sb.append(" <").append(tag).append(">\n");
        } else {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(title).append('\n');
            sb.append("=".repeat(title.length())).append('\n');
        }
    }

    private static void endSection(StringBuilder sb, HierarchyOptions o, String tag) {
        if (o.isXml()) {
            sb.append(" </").append(tag).append(">\n");
        }
    }

    private void textModule(StringBuilder sb, Module module, String indent, boolean instance, Set<Module> path) {
        sb.append(indent).append(module.getName()).append('\n');
        path.add(module);
        for (Cell cell : module.getCells()) {
            sb.append(indent).append("  ").append(cell.getName());
            if (instance) {
                sb.append(" (").append(cell.getModuleName()).append(')');
            }
            Module child = cell.getResolvedModule();
            if (child != null && path.contains(child)) {
                sb.append(" [recursive]\n");
            } else if (child == null) {
                sb.append(" [missing]\n");
            } else {
                sb.append('\n');
                textModule(sb, child, indent + "    ", instance, path);
            }
        }
        path.remove(module);
    }

    private void xmlModule(StringBuilder sb, Module module, String indent, Set<Module> path) {
        sb.append(indent).append("<module name=\"").append(escape(module.getName())).append("\">\n");
        path.add(module);
        for (Cell cell : module.getCells()) {
            Module child = cell.getResolvedModule();
            sb.append(indent).append("  <cell name=\"").append(escape(cell.getName()))
                    .append("\" module=\"").append(escape(cell.getModuleName())).append('"');
            if (child == null || path.contains(child)) {
                sb.append("/>\n");
                continue;
            }
            sb.append(">\n");
            xmlModule(sb, child, indent + "    ", path);
            sb.append(indent).append("  </cell>\n");
        }
        sb.append(indent).append("</module>\n");
        path.remove(module);
    }

    private void forest(StringBuilder sb, Module module, String prefix, Set<Module> path) {
        List<Cell> cells = new ArrayList<>(module.getCells());
        for (int i = 0; i < cells.size(); i++) {
            Cell cell = cells.get(i);
            boolean last = i == cells.size() - 1;
            Module child = cell.getResolvedModule();

            sb.append(prefix).append(last ? "`-- " : "|-- ")
                    .append(cell.getName()).append(' ').append(cell.getModuleName());
            if (child == null) {
                sb.append(" [missing]\n");
            } else if (path.contains(child)) {
                sb.append(" [recursive]\n");
            } else {
                sb.append('\n');
                path.add(child);
                forest(sb, child, prefix + (last ? "    " : "|   "), path);
                path.remove(child);
            }
        }
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&':
                    sb.append("&amp;");
                    break;
                case '<':
                    sb.append("&lt;");
                    break;
                case '>':
                    sb.append("&gt;");
                    break;
                case '"':
                    sb.append("&quot;");
                    break;
                default:
                    sb.append(c);
                    break;
            }
        }
        return sb.toString();
    }
}
