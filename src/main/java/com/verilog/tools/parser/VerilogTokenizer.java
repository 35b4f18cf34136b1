package com.verilog.tools.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.language.LanguageStandard;
import com.verilog.tools.parser.VerilogToken.TokenType;

/**
 * Maximal-munch tokenizer for Verilog source text.
 *
 * At every position the lexical classes are tried in a fixed order: comment, string,
 * number, directive, keyword/identifier, operator, delimiter, whitespace. Characters
 * that match nothing are skipped.
 */
public class VerilogTokenizer {
    private static final Logger log = LoggerFactory.getLogger(VerilogTokenizer.class);

    private static final String OPERATOR_CHARS = "+-*/%<>=!&|^~?";
    private static final String DELIMITER_CHARS = "(){}[];,.#:@";

    private final String source;
    private final LanguageStandard standard;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public VerilogTokenizer(String source) {
        this(source, LanguageStandard.maximum());
    }

    public VerilogTokenizer(String source, LanguageStandard standard) {
        this.source = source != null ? source : "";
        this.standard = standard != null ? standard : LanguageStandard.maximum();
    }

    /**
     * Tokenize the entire source text. The last token is always the single EOF token.
     */
    public List<VerilogToken> tokenize() {
        List<VerilogToken> tokens = new ArrayList<>();
        int skipped = 0;

        while (pos < source.length()) {
            VerilogToken token = nextToken();
            if (token != null) {
                tokens.add(token);
            } else {
                // Unknown character, skip it
                advance(1);
                skipped++;
            }
        }

        if (skipped > 0) {
            log.debug("Skipped {} unrecognized characters", skipped);
        }
        tokens.add(new VerilogToken(TokenType.EOF, "", line, column));
        return tokens;
    }

    private VerilogToken nextToken() {
        char c = source.charAt(pos);

        if (c == '/' && (peekChar(1) == '/' || peekChar(1) == '*')) {
            return readComment();
        }
        if (c == '"') {
            VerilogToken string = readString();
            if (string != null) {
                return string;
            }
        }
        if (Character.isDigit(c) || c == '\'') {
            VerilogToken number = readNumber();
            if (number != null) {
                return number;
            }
        }
        if (c == '`') {
            return readDirective();
        }
        if (Character.isLetter(c) || c == '_' || c == '$') {
            return readIdentifierOrKeyword();
        }
        if (c == '\\' && pos + 1 < source.length() && !Character.isWhitespace(peekChar(1))) {
            return readEscapedIdentifier();
        }
        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            return readOperator();
        }
        if (DELIMITER_CHARS.indexOf(c) >= 0) {
            return emit(TokenType.DELIMITER, 1);
        }
        if (c == '\n') {
            return emit(TokenType.NEWLINE, 1);
        }
        if (c == '\r' && peekChar(1) == '\n') {
            return emit(TokenType.NEWLINE, 2);
        }
        if (Character.isWhitespace(c)) {
            int end = pos;
            while (end < source.length() && source.charAt(end) != '\n'
                    && Character.isWhitespace(source.charAt(end))
                    && !(source.charAt(end) == '\r' && end + 1 < source.length() && source.charAt(end + 1) == '\n')) {
                end++;
            }
            return emit(TokenType.WHITESPACE, end - pos);
        }
        return null;
    }

    private VerilogToken readComment() {
        int end;
        if (peekChar(1) == '/') {
            end = source.indexOf('\n', pos);
            if (end < 0) {
                end = source.length();
            }
            // keep a trailing \r out of the comment so \r\n stays one newline
            if (end > pos && source.charAt(end - 1) == '\r') {
                end--;
            }
        } else {
            int close = source.indexOf("*/", pos + 2);
            end = close < 0 ? source.length() : close + 2;
        }
        return emit(TokenType.COMMENT, end - pos);
    }

    private VerilogToken readString() {
        int close = source.indexOf('"', pos + 1);
        if (close < 0) {
            return null;
        }
        return emit(TokenType.STRING, close + 1 - pos);
    }

    /**
     * Sized or unsized based literal ({@code 8'hFF}, {@code 4'sb1010}, {@code 'd7}) or a plain
     * decimal integer. A width not followed by a valid base part is a plain decimal.
     */
    private VerilogToken readNumber() {
        int end = pos;
        while (end < source.length() && (Character.isDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            end++;
        }
        int decimalEnd = end;

        if (end < source.length() && source.charAt(end) == '\'') {
            int p = end + 1;
            if (p < source.length() && (source.charAt(p) == 's' || source.charAt(p) == 'S')) {
                p++;
            }
            if (p < source.length()) {
                String digits = digitsFor(source.charAt(p));
                if (digits != null) {
                    int q = p + 1;
                    while (q < source.length() && digits.indexOf(source.charAt(q)) >= 0) {
                        q++;
                    }
                    if (q > p + 1) {
                        return emit(TokenType.NUMBER, q - pos);
                    }
                }
            }
        }

        if (decimalEnd == pos) {
            return null;
        }
        return emit(TokenType.NUMBER, decimalEnd - pos);
    }

    private static String digitsFor(char base) {
        switch (Character.toLowerCase(base)) {
            case 'b':
                return "01xXzZ?_";
            case 'o':
                return "01234567xXzZ?_";
            case 'd':
                return "0123456789xXzZ?_";
            case 'h':
                return "0123456789abcdefABCDEFxXzZ?_";
            default:
                return null;
        }
    }

    private VerilogToken readDirective() {
        int end = pos + 1;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        if (end == pos + 1) {
            return null;
        }
        return emit(TokenType.DIRECTIVE, end - pos);
    }

    private VerilogToken readIdentifierOrKeyword() {
        int end = pos + 1;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        String word = source.substring(pos, end);
        TokenType type = standard.keywords().contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return emit(type, end - pos);
    }

    private VerilogToken readEscapedIdentifier() {
        int end = pos + 1;
        while (end < source.length() && !Character.isWhitespace(source.charAt(end))) {
            end++;
        }
        return emit(TokenType.IDENTIFIER, end - pos);
    }

    private VerilogToken readOperator() {
        int end = pos;
        while (end < source.length() && OPERATOR_CHARS.indexOf(source.charAt(end)) >= 0) {
            // never swallow the start of a comment
            if (end > pos && source.charAt(end) == '/' && end + 1 < source.length()
                    && (source.charAt(end + 1) == '/' || source.charAt(end + 1) == '*')) {
                break;
            }
            end++;
        }
        return emit(TokenType.OPERATOR, end - pos);
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private char peekChar(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private VerilogToken emit(TokenType type, int length) {
        VerilogToken token = new VerilogToken(type, source.substring(pos, pos + length), line, column);
        advance(length);
        return token;
    }

    private void advance(int length) {
        for (int i = 0; i < length && pos < source.length(); i++) {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }
}
