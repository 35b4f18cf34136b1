package com.verilog.tools.language;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * General utilities for the Verilog language: reserved words, compiler directives,
 * gate primitives and integer literal decoding.
 */
public final class VerilogLanguage {

    private static final Set<String> COMPILER_DIRECTIVES = Set.of(
            "`begin_keywords", "`celldefine", "`default_nettype", "`define",
            "`else", "`elsif", "`end_keywords", "`endcelldefine", "`endif",
            "`ifdef", "`ifndef", "`include", "`line", "`nounconnected_drive",
            "`pragma", "`resetall", "`timescale", "`unconnected_drive",
            "`undef", "`undefineall"
    );

    private static final Set<String> GATE_PRIMITIVES = Set.of(
            "and", "nand", "or", "nor", "xor", "xnor", "buf", "not",
            "bufif0", "bufif1", "notif0", "notif1", "pullup", "pulldown",
            "cmos", "rcmos", "nmos", "pmos", "rnmos", "rpmos", "tran",
            "rtran", "tranif0", "tranif1", "rtranif0", "rtranif1"
    );

    /** Largest bus {@link #splitBus(String)} expands bit by bit. */
    public static final int MAX_BUS_BITS = 1 << 20;

    private static final Pattern BUS = Pattern.compile("(.*?)\\[(\\d+):(\\d+)\\]");
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    private VerilogLanguage() {
        // Utility class
    }

    /**
     * True if the symbol is reserved in the most recent standard.
     */
    public static boolean isKeyword(String symbol) {
        return isKeyword(symbol, LanguageStandard.maximum());
    }

    public static boolean isKeyword(String symbol, LanguageStandard standard) {
        return symbol != null && standard != null && standard.keywords().contains(symbol);
    }

    /**
     * True if the symbol (including its leading backtick) is a standard compiler directive.
     */
    public static boolean isCompilerDirective(String symbol) {
        return COMPILER_DIRECTIVES.contains(symbol);
    }

    public static boolean isGatePrimitive(String symbol) {
        return GATE_PRIMITIVES.contains(symbol);
    }

    /**
     * Numeric value of a literal, or empty if it is malformed.
     */
    public static Optional<BigInteger> numberValue(String literal) {
        return NumberLiteral.parse(literal).map(NumberLiteral::value);
    }

    /**
     * Declared bit width of a literal (32 for unsized literals), or empty if it is malformed.
     */
    public static Optional<Integer> numberBits(String literal) {
        return NumberLiteral.parse(literal).map(NumberLiteral::getWidth);
    }

    /**
     * Whether a literal is signed, or empty if it is malformed.
     */
    public static Optional<Boolean> numberSigned(String literal) {
        return NumberLiteral.parse(literal).map(NumberLiteral::isSigned);
    }

    /**
     * Expand a bus reference like {@code data[3:0]} into its individual bits, in the
     * order the range is written. Anything else, including bounds outside {@code int} and
     * ranges wider than {@value #MAX_BUS_BITS} bits, comes back unchanged as a single element.
     */
    public static List<String> splitBus(String bus) {
        Matcher m = BUS.matcher(bus);
        if (!m.matches()) {
            return List.of(bus);
        }
        String name = m.group(1);
        int from;
        int to;
        try {
            from = Integer.parseInt(m.group(2));
            to = Integer.parseInt(m.group(3));
        } catch (NumberFormatException e) {
            return List.of(bus);
        }
        if (Math.abs((long) from - to) >= MAX_BUS_BITS) {
            return List.of(bus);
        }
        int step = from >= to ? -1 : 1;

        List<String> bits = new ArrayList<>();
        for (int i = from; ; i += step) {
            bits.add(name + "[" + i + "]");
            if (i == to) {
                break;
            }
        }
        return bits;
    }

    /**
     * Return the text with line and block comments removed.
     */
    public static String stripComments(String text) {
        String withoutBlocks = BLOCK_COMMENT.matcher(text).replaceAll("");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }
}
