package com.verilog.tools.parser;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.verilog.tools.parser.model.InstanceDeclaration;
import com.verilog.tools.parser.model.NetDeclaration;
import com.verilog.tools.parser.model.ParameterDeclaration;
import com.verilog.tools.parser.model.PinConnection;
import com.verilog.tools.parser.model.PortDeclaration;
import com.verilog.tools.parser.model.PortDirection;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StructuralParser.
 */
class StructuralParserTest {

    private static final String SAMPLE = """
            module top (input clk, input [7:0] data, output reg [3:0] q);
              parameter WIDTH = 8, DEPTH = 16;
              localparam MAX = WIDTH-1;
              wire a, b;
              reg [15:0] r;
              sub #(.W(8)) u1 (.x(a), .y(data[3:0]), .z());
              sub u2 (a, , b);
              assign a = b;
              always @(posedge clk) q <= 4'h1;
            endmodule
            """;

    @Test
    void testModuleBoundaries() {
        Recorder recorder = parse(SAMPLE);

        assertThat(recorder.events).startsWith("moduleBegin top 1");
        assertThat(recorder.events).contains("moduleEnd 10");
        assertThat(recorder.events.get(recorder.events.size() - 1)).startsWith("endOfInput");
    }

    @Test
    void testAnsiPorts() {
        Recorder recorder = parse(SAMPLE);

        assertThat(recorder.ports).extracting(PortDeclaration::getName).containsExactly("clk", "data", "q");
        assertThat(recorder.ports).extracting(PortDeclaration::getDirection)
                .containsExactly(PortDirection.INPUT, PortDirection.INPUT, PortDirection.OUTPUT);
        assertThat(recorder.ports).extracting(PortDeclaration::getWidth).containsExactly(1, 8, 4);

        PortDeclaration data = recorder.ports.get(1);
        assertThat(data.getRange()).isEqualTo("[7:0]");
        assertThat(data.getLine()).isEqualTo(1);

        PortDeclaration q = recorder.ports.get(2);
        assertThat(q.getNetType()).isEqualTo("reg");
        assertThat(q.getRange()).isEqualTo("[3:0]");
    }

    @Test
    void testParameters() {
        Recorder recorder = parse(SAMPLE);

        assertThat(recorder.parameters).extracting(ParameterDeclaration::getName)
                .containsExactly("WIDTH", "DEPTH", "MAX");
        assertThat(recorder.parameters).extracting(ParameterDeclaration::getValue)
                .containsExactly("8", "16", "WIDTH-1");
        assertThat(recorder.parameters).extracting(ParameterDeclaration::isLocal)
                .containsExactly(false, false, true);
        assertThat(recorder.parameters.get(2).getLine()).isEqualTo(3);
    }

    @Test
    void testNets() {
        Recorder recorder = parse(SAMPLE);

        assertThat(recorder.nets).extracting(NetDeclaration::getName).containsExactly("a", "b", "r");
        assertThat(recorder.nets).extracting(NetDeclaration::getNetType).containsExactly("wire", "wire", "reg");
        assertThat(recorder.nets.get(2).getWidth()).isEqualTo(16);
        assertThat(recorder.nets.get(2).getRange()).isEqualTo("[15:0]");
    }

    @Test
    void testOversizedRangesFallBackToWidthOne() {
        Recorder recorder = parse("""
                module m;
                  wire [2147483647:0] a;
                  wire [4294967296:0] b;
                  wire [65535:0][65535:0] c;
                  wire [2147483646:0] d;
                  wire [3:0][7:0] e;
                endmodule
                """);

        assertThat(recorder.nets).extracting(NetDeclaration::getName).containsExactly("a", "b", "c", "d", "e");
        assertThat(recorder.nets).extracting(NetDeclaration::getWidth)
                .containsExactly(1, 1, 1, 2147483647, 32);
    }

    @Test
    void testNamedConnections() {
        Recorder recorder = parse(SAMPLE);

        InstanceDeclaration u1 = recorder.instances.get(0);
        assertThat(u1.getModuleName()).isEqualTo("sub");
        assertThat(u1.getInstanceName()).isEqualTo("u1");
        assertThat(u1.getLine()).isEqualTo(6);
        assertThat(u1.getConnections()).extracting(PinConnection::getPinName).containsExactly("x", "y", "z");
        assertThat(u1.getConnections()).extracting(PinConnection::getNetName).containsExactly("a", "data", null);
        assertThat(u1.getConnections().get(1).getExpression()).isEqualTo("data[3:0]");
        assertThat(u1.getConnections().get(2).getExpression()).isEmpty();
    }

    @Test
    void testPositionalConnections() {
        Recorder recorder = parse(SAMPLE);

        InstanceDeclaration u2 = recorder.instances.get(1);
        assertThat(u2.getInstanceName()).isEqualTo("u2");
        assertThat(u2.getConnections()).extracting(PinConnection::getPinName).containsExactly("0", "1", "2");
        assertThat(u2.getConnections()).extracting(PinConnection::getNetName).containsExactly("a", null, "b");
        assertThat(u2.getConnections()).allMatch(PinConnection::isPositional);
    }

    @Test
    void testBehaviouralEvents() {
        Recorder recorder = parse(SAMPLE);

        assertThat(recorder.events).contains("assign 8", "always 9", "identifier clk 9");
    }

    @Test
    void testNonAnsiHeaderAndPortDeclarations() {
        Recorder recorder = parse("""
                module m(a, b);
                  input a;
                  output [1:0] b;
                endmodule
                """);

        assertThat(recorder.events).contains("identifier a 1", "identifier b 1");
        assertThat(recorder.ports).extracting(PortDeclaration::getName).containsExactly("a", "b");
        assertThat(recorder.ports.get(1).getWidth()).isEqualTo(2);
        assertThat(recorder.instances).isEmpty();
    }

    @Test
    void testInstanceListAndShorthand() {
        Recorder recorder = parse("""
                module m;
                  inv i0 (.a, .y(n0)), i1 (.a(n0), .*);
                endmodule
                """);

        assertThat(recorder.instances).extracting(InstanceDeclaration::getInstanceName).containsExactly("i0", "i1");
        assertThat(recorder.instances.get(0).getConnections().get(0).getNetName()).isEqualTo("a");
        assertThat(recorder.instances.get(1).getConnections()).extracting(PinConnection::getPinName)
                .containsExactly("a");
    }

    @Test
    void testDirectivesAreReported() {
        Recorder recorder = parse("`timescale 1ns/1ps\nmodule m; endmodule\n");

        assertThat(recorder.events).contains("directive timescale 1");
    }

    @Test
    void testGarbageTerminates() {
        Recorder recorder = parse("module ; endmodule ((( [[[ , = ;; input");

        assertThat(recorder.events.get(recorder.events.size() - 1)).startsWith("endOfInput");
    }

    @Test
    void testTokensAreKept() {
        StructuralParser parser = new StructuralParser(new Recorder());
        parser.parse("wire a;");

        assertThat(parser.getTokens()).extracting(VerilogToken::getValue)
                .containsExactly("wire", " ", "a", ";", "");
    }

    private static Recorder parse(String text) {
        Recorder recorder = new Recorder();
        new StructuralParser(recorder).parse(text);
        return recorder;
    }

    private static class Recorder implements ParserListener {
        private final List<String> events = new ArrayList<>();
        private final List<PortDeclaration> ports = new ArrayList<>();
        private final List<NetDeclaration> nets = new ArrayList<>();
        private final List<ParameterDeclaration> parameters = new ArrayList<>();
        private final List<InstanceDeclaration> instances = new ArrayList<>();

        @Override
        public void moduleBegin(String name, int line) {
            events.add("moduleBegin " + name + " " + line);
        }

        @Override
        public void moduleEnd(int line) {
            events.add("moduleEnd " + line);
        }

        @Override
        public void portDeclaration(PortDeclaration port) {
            ports.add(port);
        }

        @Override
        public void netDeclaration(NetDeclaration net) {
            nets.add(net);
        }

        @Override
        public void parameterDeclaration(ParameterDeclaration parameter) {
            parameters.add(parameter);
        }

        @Override
        public void instanceDeclaration(InstanceDeclaration instance) {
            instances.add(instance);
        }

        @Override
        public void alwaysBegin(int line) {
            events.add("always " + line);
        }

        @Override
        public void assign(int line) {
            events.add("assign " + line);
        }

        @Override
        public void directive(String text, int line, int column) {
            events.add("directive " + text + " " + line);
        }

        @Override
        public void identifier(String text, int line, int column) {
            events.add("identifier " + text + " " + line);
        }

        @Override
        public void endOfInput(int line) {
            events.add("endOfInput " + line);
        }
    }
}
