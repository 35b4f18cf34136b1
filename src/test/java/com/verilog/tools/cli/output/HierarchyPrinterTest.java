package com.verilog.tools.cli.output;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.verilog.tools.cli.model.HierarchyOptions;
import com.verilog.tools.netlist.Netlist;
import com.verilog.tools.netlist.model.Module;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for HierarchyPrinter.
 */
class HierarchyPrinterTest {

    private final HierarchyPrinter printer = new HierarchyPrinter();
    private Netlist netlist;

    @BeforeEach
    void setUp() {
        netlist = new Netlist();
        netlist.readText("""
                module A;
                  B inst();
                  Missing m1();
                endmodule
                module B;
                endmodule
                """, "a.v");
        netlist.link();
    }

    @Test
    void testCellHierarchy() {
        String out = printer.print(netlist, netlist.getTopModules(), HierarchyOptions.builder().cells(true).build());

        assertThat(out).isEqualTo("""
                Cell Hierarchy:
                ===============
                A
                  inst
                    B
                  m1 [missing]
                """);
    }

    @Test
    void testCellHierarchyWithModuleNames() {
        String out = printer.print(netlist, netlist.getTopModules(),
                HierarchyOptions.builder().cells(true).instance(true).build());

        assertThat(out).contains("  inst (B)\n", "  m1 (Missing) [missing]\n");
    }

    @Test
    void testForest() {
        String out = printer.print(netlist, netlist.getTopModules(), HierarchyOptions.builder().forest(true).build());

        assertThat(out).isEqualTo("""
                Hierarchy Forest:
                =================
                A
                |-- inst B
                `-- m1 Missing [missing]
                """);
    }

    @Test
    void testModuleAndMissingSections() {
        String out = printer.print(netlist, netlist.getTopModules(),
                HierarchyOptions.builder().modules(true).missing(true).moduleFiles(true).build());

        assertThat(out).isEqualTo("""
                Module Names:
                =============
                  A
                  B

                Module File Mapping:
                ====================
                  A: a.v
                  B: a.v

                Missing Modules:
                ================
                  Missing
                """);
    }

    @Test
    void testRecursionIsCut() {
        Netlist recursive = new Netlist();
        recursive.readText("module R;\n  R self();\nendmodule\n", "r.v");
        recursive.link();
        Module r = recursive.findModule("R").orElseThrow();

        assertThat(recursive.getTopModules()).isEmpty();
        assertThat(printer.print(recursive, List.of(r), HierarchyOptions.builder().cells(true).build()))
                .endsWith("R\n  self [recursive]\n");
        assertThat(printer.print(recursive, List.of(r), HierarchyOptions.builder().forest(true).build()))
                .endsWith("R\n`-- self R [recursive]\n");
    }

    @Test
    void testXml() {
        String out = printer.print(netlist, netlist.getTopModules(),
                HierarchyOptions.builder().xml(true).cells(true).missing(true).build());

        assertThat(out).startsWith("<vhier>\n <cells>\n");
        assertThat(out).contains(
                "  <module name=\"A\">\n",
                "    <cell name=\"inst\" module=\"B\">\n",
                "      <module name=\"B\">\n",
                "      </module>\n",
                "    <cell name=\"m1\" module=\"Missing\"/>\n",
                " <missing>\n  <module>Missing</module>\n </missing>\n");
        assertThat(out).endsWith("</vhier>\n");
    }

    @Test
    void testEscape() {
        assertThat(HierarchyPrinter.escape("a<b>&\"c\"")).isEqualTo("a&lt;b&gt;&amp;&quot;c&quot;");
    }
}
