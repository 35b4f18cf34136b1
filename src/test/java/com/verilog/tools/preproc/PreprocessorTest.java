package com.verilog.tools.preproc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.verilog.tools.diagnostic.DiagnosticKind;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Preprocessor.
 */
class PreprocessorTest {

    private static final String CHAIN = """
            `ifdef A
            a_block
            `elsif B
            b_block
            `else
            else_block
            `endif
            """;

    @TempDir
    Path tempDir;

    @Test
    void testIfdefElse() {
        String text = """
                `ifdef X
                first
                `else
                second
                `endif
                """;

        assertThat(process(withDefines("X"), text)).isEqualTo("first\n");
        assertThat(process(new Preprocessor(), text)).isEqualTo("second\n");
    }

    @Test
    void testElsifTakesTheFirstMatchingBranch() {
        assertThat(process(withDefines("B"), CHAIN)).isEqualTo("b_block\n");
        assertThat(process(withDefines("A", "B"), CHAIN)).isEqualTo("a_block\n");
        assertThat(process(new Preprocessor(), CHAIN)).isEqualTo("else_block\n");
    }

    @Test
    void testLaterElsifIsSkippedOnceMatched() {
        String text = """
                `ifdef A
                a_block
                `elsif B
                b_block
                `elsif C
                c_block
                `endif
                """;

        assertThat(process(withDefines("B", "C"), text)).isEqualTo("b_block\n");
    }

    @Test
    void testIfndef() {
        String text = "`ifndef GUARD\nguarded\n`endif\n";

        assertThat(process(new Preprocessor(), text)).isEqualTo("guarded\n");
        assertThat(process(withDefines("GUARD"), text)).isEmpty();
    }

    @Test
    void testNestedRegionsAreSuppressedByTheirParent() {
        String text = """
                `ifdef A
                `ifndef B
                inner
                `endif
                `endif
                after
                """;

        assertThat(process(new Preprocessor(), text)).isEqualTo("after\n");
    }

    @Test
    void testDirectivesInInactiveRegionsAreIgnored() {
        Preprocessor preprocessor = new Preprocessor();

        process(preprocessor, "`ifdef A\n`define X 1\n`endif\n");

        assertThat(preprocessor.isDefined("X")).isFalse();
    }

    @Test
    void testMacroSubstitutionIsWholeWord() {
        String text = "`define W 8\nwire [W-1:0] Wide;\n";

        assertThat(process(new Preprocessor(), text)).isEqualTo("wire [8-1:0] Wide;\n");
    }

    @Test
    void testBacktickMacroUse() {
        Preprocessor preprocessor = new Preprocessor();

        assertThat(process(preprocessor, "`define WIDTH 8\nwire [`WIDTH-1:0] d;\n")).isEqualTo("wire [8-1:0] d;\n");
        assertThat(process(preprocessor, "`WIDTH\n")).isEqualTo("8\n");
    }

    @Test
    void testSubstitutionIsNotRecursive() {
        assertThat(process(new Preprocessor(), "`define A B\n`define B C\nA\n")).isEqualTo("B\n");
    }

    @Test
    void testBasedLiteralsAreLeftAlone() {
        assertThat(process(withDefines("hFF"), "x = 8'hFF;\n")).isEqualTo("x = 8'hFF;\n");
    }

    @Test
    void testTextWithoutDirectivesRoundTrips() {
        String text = """
                module m;
                  wire a; // comment
                endmodule
                """;

        assertThat(process(new Preprocessor(), text)).isEqualTo(text);
    }

    @Test
    void testLineContinuation() {
        assertThat(process(new Preprocessor(), "`define LONG a \\\n b\nLONG\n")).isEqualTo("a   b\n");
    }

    @Test
    void testDefineValueDropsComments() {
        Preprocessor preprocessor = new Preprocessor();

        process(preprocessor, "`define DEPTH 16 // entries\n");

        assertThat(preprocessor.getDefines()).containsEntry("DEPTH", "16");
    }

    @Test
    void testUndef() {
        Preprocessor preprocessor = new Preprocessor();

        String out = process(preprocessor, "`define X 1\n`undef X\n`ifdef X\nyes\n`endif\n`undef NEVER\n");

        assertThat(out).doesNotContain("yes");
        assertThat(preprocessor.getDiagnostics().getWarnings()).isEmpty();
    }

    @Test
    void testMacrosPersistAcrossCalls() {
        Preprocessor preprocessor = new Preprocessor();

        process(preprocessor, "`define X 1\n");

        assertThat(process(preprocessor, "`ifdef X\nyes\n`endif\n")).isEqualTo("yes\n");
    }

    @Test
    void testDefinesSnapshotIsReadOnly() {
        Preprocessor preprocessor = new Preprocessor();
        preprocessor.define("X", "1");

        Map<String, String> defines = preprocessor.getDefines();

        assertThatThrownBy(() -> defines.put("Y", "2")).isInstanceOf(UnsupportedOperationException.class);
        preprocessor.undefine("X");
        assertThat(defines).containsKey("X");
    }

    @Test
    void testPassThroughAndUnknownDirectives() {
        String out = process(new Preprocessor(), "`timescale 1ns/1ps\n`celldefine\n");

        assertThat(out).isEqualTo("`timescale 1ns/1ps\n`celldefine\n");
    }

    @Test
    void testMacroArgumentsAreRejected() {
        Preprocessor preprocessor = new Preprocessor();

        process(preprocessor, "`define MAX(a,b) a\n");

        assertThat(preprocessor.isDefined("MAX")).isFalse();
        assertThat(preprocessor.getDiagnostics().has(DiagnosticKind.MALFORMED_DIRECTIVE)).isTrue();
    }

    @Test
    void testExpansionCanBeDisabled() {
        Preprocessor preprocessor = new Preprocessor(PreprocessorConfig.builder().expandMacros(false).build());

        assertThat(process(preprocessor, "`define W 8\nW\n")).isEqualTo("W\n");
        assertThat(preprocessor.isDefined("W")).isTrue();
    }

    @Test
    void testUnbalancedConditionalFails() {
        Preprocessor preprocessor = new Preprocessor();

        PreprocessResult result = preprocessor.process("`ifdef X\nfoo\n", "open.v");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("has no matching `endif");
        assertThat(preprocessor.getDiagnostics().has(DiagnosticKind.UNBALANCED_CONDITIONAL)).isTrue();
        assertThat(preprocessor.getDiagnostics().hasErrors()).isTrue();
    }

    @Test
    void testOrphanEndifIsAWarning() {
        Preprocessor preprocessor = new Preprocessor();

        PreprocessResult result = preprocessor.process("`endif\nfoo\n", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("foo\n");
        assertThat(preprocessor.getDiagnostics().count(DiagnosticKind.UNBALANCED_CONDITIONAL)).isEqualTo(1);
    }

    @Test
    void testSecondElseIsIgnored() {
        Preprocessor preprocessor = new Preprocessor();

        String out = process(preprocessor, "`ifdef X\na\n`else\nb\n`else\nc\n`endif\n");

        assertThat(out).isEqualTo("b\nc\n");
        assertThat(preprocessor.getDiagnostics().count(DiagnosticKind.UNBALANCED_CONDITIONAL)).isEqualTo(1);
    }

    @Test
    void testIncludeFromIncludingDirectory() throws Exception {
        Path inc = Files.writeString(tempDir.resolve("inc.vh"), "wire from_include;\n");
        Path top = Files.writeString(tempDir.resolve("top.v"), "`include \"inc.vh\"\nmodule m;\nendmodule\n");

        PreprocessResult result = new Preprocessor().processFile(top);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("wire from_include;\nmodule m;\nendmodule\n");
        assertThat(result.getIncludedFiles()).containsExactly(inc.toAbsolutePath().normalize());
    }

    @Test
    void testIncludeFromIncludePath() throws Exception {
        Path incDir = Files.createDirectory(tempDir.resolve("include"));
        Path srcDir = Files.createDirectory(tempDir.resolve("src"));
        Files.writeString(incDir.resolve("defs.vh"), "`define BUS 32\n");
        Path top = Files.writeString(srcDir.resolve("top.v"), "`include \"defs.vh\"\nwire [BUS-1:0] d;\n");

        Preprocessor preprocessor = new Preprocessor(PreprocessorConfig.builder().includePath(incDir).build());
        PreprocessResult result = preprocessor.processFile(top);

        assertThat(result.getText()).isEqualTo("wire [32-1:0] d;\n");
        assertThat(preprocessor.getDefines()).containsEntry("BUS", "32");
    }

    @Test
    void testIncludedConditionalsAreIndependent() throws Exception {
        Files.writeString(tempDir.resolve("guard.vh"), "`ifndef G\n`define G\nguarded\n`endif\n");
        Path top = Files.writeString(tempDir.resolve("top.v"),
                "`include \"guard.vh\"\n`include \"guard.vh\"\nend\n");

        PreprocessResult result = new Preprocessor().processFile(top);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("guarded\nend\n");
    }

    @Test
    void testMissingIncludeIsAWarning() throws Exception {
        Path top = Files.writeString(tempDir.resolve("top.v"), "`include \"nowhere.vh\"\nmodule m;\n");
        Preprocessor preprocessor = new Preprocessor();

        PreprocessResult result = preprocessor.processFile(top);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("module m;\n");
        assertThat(preprocessor.getDiagnostics().has(DiagnosticKind.UNRESOLVED_INCLUDE)).isTrue();
    }

    @Test
    void testCyclicIncludeIsReported() throws Exception {
        Path x = Files.writeString(tempDir.resolve("x.v"), "`include \"y.v\"\nx_line\n");
        Files.writeString(tempDir.resolve("y.v"), "`include \"x.v\"\ny_line\n");
        Preprocessor preprocessor = new Preprocessor();

        PreprocessResult result = preprocessor.processFile(x);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getText()).isEqualTo("y_line\nx_line\n");
        assertThat(preprocessor.getDiagnostics().count(DiagnosticKind.CYCLIC_INCLUDE)).isEqualTo(1);
    }

    private static Preprocessor withDefines(String... names) {
        PreprocessorConfig.PreprocessorConfigBuilder builder = PreprocessorConfig.builder();
        for (String name : names) {
            builder.define(name, "");
        }
        return new Preprocessor(builder.build());
    }

    private static String process(Preprocessor preprocessor, String text) {
        PreprocessResult result = preprocessor.process(text, null);
        assertThat(result.isSuccess()).isTrue();
        return result.getText();
    }
}
