package com.verilog.tools.parser;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.verilog.tools.language.LanguageStandard;
import com.verilog.tools.parser.VerilogToken.TokenType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VerilogTokenizer.
 */
class VerilogTokenizerTest {

    @Test
    void testEmptySourceYieldsOnlyEof() {
        List<VerilogToken> tokens = new VerilogTokenizer("").tokenize();

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.EOF);
        assertThat(tokens.get(0).getLine()).isEqualTo(1);
        assertThat(tokens.get(0).getColumn()).isEqualTo(1);
    }

    @Test
    void testSimpleModuleHeader() {
        List<VerilogToken> tokens = new VerilogTokenizer("module m;").tokenize();

        assertThat(tokens).extracting(VerilogToken::getType).containsExactly(
                TokenType.KEYWORD, TokenType.WHITESPACE, TokenType.IDENTIFIER, TokenType.DELIMITER, TokenType.EOF);
        assertThat(tokens.get(2).getColumn()).isEqualTo(8);
        assertThat(tokens.get(4).getColumn()).isEqualTo(10);
    }

    @Test
    void testEofIsAlwaysLast() {
        List<VerilogToken> tokens = new VerilogTokenizer("wire a; // trailing").tokenize();

        assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.EOF);
        assertThat(tokens).filteredOn(t -> t.getType() == TokenType.EOF).hasSize(1);
    }

    @Test
    void testPositionsAfterMultiLineComment() {
        List<VerilogToken> tokens = new VerilogTokenizer("/* a\nb */ x").tokenize();

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.COMMENT);
        VerilogToken x = tokens.get(2);
        assertThat(x.getValue()).isEqualTo("x");
        assertThat(x.getLine()).isEqualTo(2);
        assertThat(x.getColumn()).isEqualTo(6);
    }

    @Test
    void testPositionsMatchSourceText() {
        String source = """
                module counter(input clk, output reg [3:0] q);
                  /* block
                     comment */ always @(posedge clk) q <= q + 4'd1; // inc
                  assign \\bus[0] = "text";
                endmodule
                """;

        List<VerilogToken> tokens = new VerilogTokenizer(source).tokenize();

        String[] lines = source.split("\n", -1);
        for (VerilogToken token : tokens) {
            int offset = 0;
            for (int i = 0; i < token.getLine() - 1; i++) {
                offset += lines[i].length() + 1;
            }
            offset += token.getColumn() - 1;
            assertThat(source.substring(offset, offset + token.getValue().length()))
                    .as("token %s", token)
                    .isEqualTo(token.getValue());
        }
    }

    @Test
    void testNumbers() {
        assertThat(significant("8'hFF 4'sb1010 12 'd7 1_000"))
                .containsExactly("NUMBER:8'hFF", "NUMBER:4'sb1010", "NUMBER:12", "NUMBER:'d7", "NUMBER:1_000");
    }

    @Test
    void testOperatorsDoNotSwallowComments() {
        assertThat(significant("a<=b")).containsExactly("IDENTIFIER:a", "OPERATOR:<=", "IDENTIFIER:b");

        List<VerilogToken> tokens = new VerilogTokenizer("a+//c").tokenize();
        assertThat(tokens).extracting(VerilogToken::getValue).containsExactly("a", "+", "//c", "");
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.COMMENT);
    }

    @Test
    void testDirectivesStringsAndIdentifiers() {
        assertThat(significant("`define W \"hi\" $display \\esc[0] "))
                .containsExactly("DIRECTIVE:`define", "IDENTIFIER:W", "STRING:\"hi\"",
                        "IDENTIFIER:$display", "IDENTIFIER:\\esc[0]");
    }

    @Test
    void testKeywordsDependOnStandard() {
        assertThat(new VerilogTokenizer("logic").tokenize().get(0).getType()).isEqualTo(TokenType.KEYWORD);
        assertThat(new VerilogTokenizer("logic", LanguageStandard.V2001).tokenize().get(0).getType())
                .isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void testCarriageReturnNewline() {
        List<VerilogToken> tokens = new VerilogTokenizer("a\r\nb").tokenize();

        assertThat(tokens).extracting(VerilogToken::getType).containsExactly(
                TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.EOF);
        assertThat(tokens.get(1).getValue()).isEqualTo("\r\n");
        assertThat(tokens.get(2).getLine()).isEqualTo(2);
        assertThat(tokens.get(2).getColumn()).isEqualTo(1);
    }

    @Test
    void testUnknownCharactersAreSkipped() {
        assertThat(significant("a ` b")).containsExactly("IDENTIFIER:a", "IDENTIFIER:b");
    }

    private static List<String> significant(String source) {
        return new VerilogTokenizer(source).tokenize().stream()
                .filter(t -> !t.isTrivia() && t.getType() != TokenType.EOF)
                .map(t -> t.getType() + ":" + t.getValue())
                .collect(Collectors.toList());
    }
}
