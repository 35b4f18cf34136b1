package com.verilog.tools.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.tools.language.LanguageStandard;
import com.verilog.tools.language.VerilogLanguage;
import com.verilog.tools.parser.VerilogToken.TokenType;
import com.verilog.tools.parser.model.InstanceDeclaration;
import com.verilog.tools.parser.model.NetDeclaration;
import com.verilog.tools.parser.model.ParameterDeclaration;
import com.verilog.tools.parser.model.PinConnection;
import com.verilog.tools.parser.model.PortDeclaration;
import com.verilog.tools.parser.model.PortDirection;

/**
 * Lightweight structural parser for Verilog.
 *
 * Scans the token stream once, left to right, and dispatches on keywords to small
 * handlers that raise {@link ParserListener} events. This is not a grammar: a declaration
 * handler skips forward to the next identifier and takes it as the declared name, then
 * follows any comma-separated names of the same declaration. Instances are recognized by
 * the shape {@code Type [#(...)] name [range] (...)} inside a module body.
 *
 * Every dispatch step consumes at least one token, so parsing terminates on any input.
 */
public class StructuralParser {
    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private static final Set<String> MODULE_KEYWORDS = Set.of("module", "macromodule");
    private static final Set<String> PARAMETER_KEYWORDS = Set.of("parameter", "localparam");
    private static final Set<String> ALWAYS_KEYWORDS = Set.of("always", "always_comb", "always_ff", "always_latch");

    /** Keywords that declare a net or variable. */
    public static final Set<String> NET_TYPES = Set.of(
            "wire", "reg", "logic", "tri", "tri0", "tri1", "triand", "trior", "trireg",
            "wand", "wor", "supply0", "supply1", "uwire", "wreal");

    private final ParserListener listener;
    private final LanguageStandard standard;

    private List<VerilogToken> allTokens = List.of();
    private List<VerilogToken> tokens = List.of();
    private int pos = 0;
    private boolean inModule = false;

    public StructuralParser(ParserListener listener) {
        this(listener, LanguageStandard.maximum());
    }

    public StructuralParser(ParserListener listener, LanguageStandard standard) {
        this.listener = listener;
        this.standard = standard;
    }

    /**
     * Tokenize {@code text} and raise events for everything recognized in it.
     */
    public void parse(String text) {
        allTokens = new VerilogTokenizer(text, standard).tokenize();
        tokens = allTokens.stream()
                .filter(t -> !t.isTrivia())
                .collect(Collectors.toList());
        pos = 0;
        inModule = false;

        while (!isAtEnd()) {
            int start = pos;
            VerilogToken token = peek();

            switch (token.getType()) {
                case KEYWORD:
                    handleKeyword(token);
                    break;
                case DIRECTIVE:
                    listener.directive(token.getValue().substring(1), token.getLine(), token.getColumn());
                    advance();
                    break;
                case IDENTIFIER:
                    if (inModule && isInstanceStart()) {
                        parseInstances();
                    } else {
                        listener.identifier(token.getValue(), token.getLine(), token.getColumn());
                        advance();
                    }
                    break;
                default:
                    advance();
                    break;
            }

            if (pos == start) {
                advance();
            }
        }

        listener.endOfInput(peek().getLine());
    }

    /**
     * All tokens of the last parse, trivia included.
     */
    public List<VerilogToken> getTokens() {
        return Collections.unmodifiableList(allTokens);
    }

    private void handleKeyword(VerilogToken token) {
        String keyword = token.getValue();
        Optional<PortDirection> direction = PortDirection.fromKeyword(keyword);

        if (MODULE_KEYWORDS.contains(keyword)) {
            parseModule();
        } else if ("endmodule".equals(keyword)) {
            advance();
            inModule = false;
            listener.moduleEnd(token.getLine());
        } else if (direction.isPresent()) {
            parsePortDeclaration(direction.get());
        } else if (NET_TYPES.contains(keyword)) {
            parseNetDeclaration(keyword);
        } else if (PARAMETER_KEYWORDS.contains(keyword)) {
            parseParameterDeclaration("localparam".equals(keyword));
        } else if (ALWAYS_KEYWORDS.contains(keyword)) {
            advance();
            listener.alwaysBegin(token.getLine());
        } else if ("assign".equals(keyword)) {
            advance();
            listener.assign(token.getLine());
        } else {
            advance();
        }
    }

    private void parseModule() {
        advance();
        if (skipToIdentifier()) {
            VerilogToken name = advance();
            inModule = true;
            log.debug("Module {} at line {}", name.getValue(), name.getLine());
            listener.moduleBegin(name.getValue(), name.getLine());
        }
    }

    private void parsePortDeclaration(PortDirection direction) {
        parseDeclarations((head, name, value) -> listener.portDeclaration(PortDeclaration.builder()
                .direction(direction)
                .name(name.getValue())
                .width(head.width)
                .range(head.range)
                .netType(head.netType)
                .line(name.getLine())
                .build()));
    }

    private void parseNetDeclaration(String netType) {
        parseDeclarations((head, name, value) -> listener.netDeclaration(NetDeclaration.builder()
                .netType(netType)
                .name(name.getValue())
                .width(head.width)
                .range(head.range)
                .line(name.getLine())
                .build()));
    }

    private void parseParameterDeclaration(boolean local) {
        parseDeclarations((head, name, value) -> listener.parameterDeclaration(ParameterDeclaration.builder()
                .name(name.getValue())
                .value(value != null ? value : "")
                .local(local)
                .line(name.getLine())
                .build()));
    }

    /**
     * Consume the declaring keyword, then one declared name plus any names that follow
     * it after commas.
     */
    private void parseDeclarations(DeclarationSink sink) {
        advance();
        DeclarationHead head = readDeclarationHead();
        if (head == null) {
            return;
        }

        VerilogToken name = head.name;
        while (true) {
            // unpacked dimensions, e.g. reg [7:0] mem [0:255]
            while (peek().isDelimiter('[')) {
                readBracket();
            }
            String value = isAssignment(peek()) ? readAssignedValue() : null;
            sink.accept(head, name, value);

            if (peek().isDelimiter(',') && peek(1).getType() == TokenType.IDENTIFIER) {
                advance();
                name = advance();
            } else {
                break;
            }
        }
    }

    /**
     * Skip ahead to the declared name, remembering a net type keyword and the packed range
     * passed on the way. A name directly followed by another identifier was a type name.
     */
    private DeclarationHead readDeclarationHead() {
        DeclarationHead head = new DeclarationHead();

        while (!isAtEnd() && peek().getType() != TokenType.IDENTIFIER) {
            VerilogToken token = peek();
            if (token.getType() == TokenType.KEYWORD && NET_TYPES.contains(token.getValue())) {
                head.netType = token.getValue();
                advance();
            } else if (token.isDelimiter('[')) {
                readPackedRanges(head);
            } else {
                advance();
            }
        }
        if (isAtEnd()) {
            return null;
        }

        head.name = advance();
        if (peek().getType() == TokenType.IDENTIFIER) {
            head.name = advance();
        }
        return head;
    }

    private void readPackedRanges(DeclarationHead head) {
        StringBuilder text = new StringBuilder();
        Integer width = 1;

        while (peek().isDelimiter('[')) {
            List<VerilogToken> inner = readBracket();
            text.append('[').append(join(inner)).append(']');
            Integer groupWidth = rangeWidth(inner);
            width = (width != null && groupWidth != null) ? multiply(width, groupWidth) : null;
        }

        head.range = text.toString();
        head.width = width != null ? width : 1;
    }

    /**
     * Width of {@code msb:lsb} when both bounds are literals, otherwise null.
     */
    private static Integer rangeWidth(List<VerilogToken> inner) {
        if (inner.size() != 3 || !inner.get(1).isDelimiter(':')) {
            return null;
        }
        Optional<BigInteger> msb = VerilogLanguage.numberValue(inner.get(0).getValue());
        Optional<BigInteger> lsb = VerilogLanguage.numberValue(inner.get(2).getValue());
        if (inner.get(0).getType() != TokenType.NUMBER || inner.get(2).getType() != TokenType.NUMBER
                || msb.isEmpty() || lsb.isEmpty()) {
            return null;
        }
        BigInteger width = msb.get().subtract(lsb.get()).abs().add(BigInteger.ONE);
        return width.bitLength() < Integer.SIZE ? width.intValue() : null;
    }

    private static Integer multiply(int width, int groupWidth) {
        try {
            return Math.multiplyExact(width, groupWidth);
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static boolean isAssignment(VerilogToken token) {
        return token.getType() == TokenType.OPERATOR && token.getValue().startsWith("=")
                && !token.getValue().startsWith("==");
    }

    /**
     * Consume {@code = expression} and return the expression text.
     */
    private String readAssignedValue() {
        // the operator run may have swallowed a unary operator, as in "=-1"
        String prefix = advance().getValue().substring(1);
        return prefix + join(collectExpression());
    }

    private boolean isInstanceStart() {
        int j = pos + 1;
        if (tokenAt(j).isDelimiter('#')) {
            j++;
            if (tokenAt(j).isDelimiter('(')) {
                j = matchingClose(j);
                if (j < 0) {
                    return false;
                }
            }
            j++;
        }
        if (tokenAt(j).getType() != TokenType.IDENTIFIER) {
            return false;
        }
        j++;
        while (tokenAt(j).isDelimiter('[')) {
            j = matchingClose(j);
            if (j < 0) {
                return false;
            }
            j++;
        }
        return tokenAt(j).isDelimiter('(');
    }

    private void parseInstances() {
        VerilogToken moduleName = advance();
        if (peek().isDelimiter('#')) {
            advance();
            if (peek().isDelimiter('(')) {
                readGroup();
            } else {
                advance();
            }
        }

        do {
            VerilogToken instanceName = advance();
            while (peek().isDelimiter('[')) {
                readBracket();
            }

            InstanceDeclaration.InstanceDeclarationBuilder builder = InstanceDeclaration.builder()
                    .moduleName(moduleName.getValue())
                    .instanceName(instanceName.getValue())
                    .line(instanceName.getLine());
            if (peek().isDelimiter('(')) {
                advance();
                readConnections(builder);
            }

            InstanceDeclaration instance = builder.build();
            log.debug("Instance {} of {} at line {}", instance.getInstanceName(), instance.getModuleName(), instance.getLine());
            listener.instanceDeclaration(instance);
        } while (continuesInstanceList());
    }

    private boolean continuesInstanceList() {
        if (peek().isDelimiter(',') && peek(1).getType() == TokenType.IDENTIFIER
                && (peek(2).isDelimiter('(') || peek(2).isDelimiter('['))) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Read a connection list after its opening parenthesis, through the closing one.
     */
    private void readConnections(InstanceDeclaration.InstanceDeclarationBuilder builder) {
        if (peek().isDelimiter(')')) {
            advance();
            return;
        }

        int position = 0;
        while (!isAtEnd()) {
            if (peek().isDelimiter('.')) {
                advance();
                if (peek().getType() == TokenType.IDENTIFIER) {
                    VerilogToken pin = advance();
                    if (peek().isDelimiter('(')) {
                        advance();
                        List<VerilogToken> expression = collectExpression();
                        if (peek().isDelimiter(')')) {
                            advance();
                        }
                        builder.connection(new PinConnection(pin.getValue(), netNameOf(expression), join(expression), false));
                    } else {
                        // .name shorthand connects the net of the same name
                        builder.connection(new PinConnection(pin.getValue(), pin.getValue(), pin.getValue(), false));
                    }
                } else {
                    // .* wildcard
                    advance();
                }
            } else {
                List<VerilogToken> expression = collectExpression();
                builder.connection(new PinConnection(String.valueOf(position), netNameOf(expression), join(expression), true));
                position++;
            }

            if (peek().isDelimiter(',')) {
                advance();
                continue;
            }
            if (peek().isDelimiter(')')) {
                advance();
            }
            break;
        }
    }

    /**
     * A connection names a net when it is an identifier, optionally followed by selects.
     */
    private static String netNameOf(List<VerilogToken> expression) {
        if (expression.isEmpty() || expression.get(0).getType() != TokenType.IDENTIFIER) {
            return null;
        }
        if (expression.size() == 1) {
            return expression.get(0).getValue();
        }
        VerilogToken last = expression.get(expression.size() - 1);
        if (expression.get(1).isDelimiter('[') && last.isDelimiter(']')) {
            return expression.get(0).getValue();
        }
        return null;
    }

    /**
     * Collect tokens up to a top-level {@code ,}, {@code )} or {@code ;}, which is not consumed.
     */
    private List<VerilogToken> collectExpression() {
        List<VerilogToken> expression = new ArrayList<>();
        int depth = 0;
        while (!isAtEnd()) {
            VerilogToken token = peek();
            if (depth == 0 && (token.isDelimiter(',') || token.isDelimiter(')') || token.isDelimiter(';'))) {
                break;
            }
            if (isOpen(token)) {
                depth++;
            } else if (isClose(token)) {
                depth--;
            }
            expression.add(advance());
        }
        return expression;
    }

    /**
     * Consume a bracketed group starting at {@code [} and return the tokens inside it.
     */
    private List<VerilogToken> readBracket() {
        return readGroup();
    }

    private List<VerilogToken> readGroup() {
        List<VerilogToken> inner = new ArrayList<>();
        advance();
        int depth = 1;
        while (!isAtEnd()) {
            VerilogToken token = advance();
            if (isOpen(token)) {
                depth++;
            } else if (isClose(token)) {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            inner.add(token);
        }
        return inner;
    }

    private int matchingClose(int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            VerilogToken token = tokens.get(i);
            if (isOpen(token)) {
                depth++;
            } else if (isClose(token)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isOpen(VerilogToken token) {
        return token.isDelimiter('(') || token.isDelimiter('[') || token.isDelimiter('{');
    }

    private static boolean isClose(VerilogToken token) {
        return token.isDelimiter(')') || token.isDelimiter(']') || token.isDelimiter('}');
    }

    /**
     * Source-like text for a token run: word-like neighbours are separated by one space.
     */
    static String join(List<VerilogToken> run) {
        StringBuilder sb = new StringBuilder();
        VerilogToken previous = null;
        for (VerilogToken token : run) {
            if (previous != null && isWordLike(previous) && isWordLike(token)) {
                sb.append(' ');
            }
            sb.append(token.getValue());
            previous = token;
        }
        return sb.toString();
    }

    private static boolean isWordLike(VerilogToken token) {
        return token.getType() == TokenType.IDENTIFIER || token.getType() == TokenType.KEYWORD
                || token.getType() == TokenType.NUMBER;
    }

    private boolean skipToIdentifier() {
        while (!isAtEnd() && peek().getType() != TokenType.IDENTIFIER) {
            advance();
        }
        return !isAtEnd();
    }

    private boolean isAtEnd() {
        return pos >= tokens.size() || tokens.get(pos).getType() == TokenType.EOF;
    }

    private VerilogToken peek() {
        return tokenAt(pos);
    }

    private VerilogToken peek(int offset) {
        return tokenAt(pos + offset);
    }

    private VerilogToken tokenAt(int index) {
        return tokens.get(Math.min(index, tokens.size() - 1));
    }

    private VerilogToken advance() {
        VerilogToken token = peek();
        if (!isAtEnd()) {
            pos++;
        }
        return token;
    }

    private static final class DeclarationHead {
        private String netType;
        private int width = 1;
        private String range;
        private VerilogToken name;
    }

    @FunctionalInterface
    private interface DeclarationSink {
        void accept(DeclarationHead head, VerilogToken name, String value);
    }
}
