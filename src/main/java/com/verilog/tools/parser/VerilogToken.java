package com.verilog.tools.parser;

import lombok.Value;

/**
 * Represents a token from the Verilog tokenizer.
 */
@Value
public class VerilogToken {
    TokenType type;
    String value;
    int line;
    int column;

    public enum TokenType {
        KEYWORD,
        IDENTIFIER,
        NUMBER,
        STRING,
        OPERATOR,
        DELIMITER,
        DIRECTIVE,
        COMMENT,
        WHITESPACE,
        NEWLINE,
        EOF
    }

    /**
     * Whitespace, newlines and comments carry no structure.
     */
    public boolean isTrivia() {
        return type == TokenType.WHITESPACE || type == TokenType.NEWLINE || type == TokenType.COMMENT;
    }

    public boolean isDelimiter(char c) {
        return type == TokenType.DELIMITER && value.length() == 1 && value.charAt(0) == c;
    }
}
