package com.verilog.tools.language;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.Value;

/**
 * A decoded Verilog integer literal such as {@code 8'hFF}, {@code 4'sb1010} or {@code 42}.
 */
@Value
public class NumberLiteral {

    /** Width given to unsized literals. */
    public static final int DEFAULT_WIDTH = 32;

    private static final Pattern BASED = Pattern.compile(
            "(\\d[\\d_]*)?\\s*'([sS])?([bBoOdDhH])\\s*([0-9a-fA-FxXzZ?_]+)");

    private static final Pattern DECIMAL = Pattern.compile("\\d[\\d_]*");

    int width;
    boolean signed;
    /** False for plain decimal integers, which carry no width/base prefix. */
    boolean based;
    int radix;
    BigInteger magnitude;

    /**
     * Parse a literal. Returns empty for anything that is not a well-formed integer literal.
     */
    public static Optional<NumberLiteral> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();

        if (DECIMAL.matcher(trimmed).matches()) {
            return Optional.of(new NumberLiteral(DEFAULT_WIDTH, true, false, 10, new BigInteger(trimmed.replace("_", ""))));
        }

        Matcher m = BASED.matcher(trimmed);
        if (!m.matches()) {
            return Optional.empty();
        }

        int width = DEFAULT_WIDTH;
        if (m.group(1) != null) {
            try {
                width = Integer.parseInt(m.group(1).replace("_", ""));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
            if (width <= 0) {
                return Optional.empty();
            }
        }

        int radix = radixOf(m.group(3).charAt(0));
        String digits = m.group(4).replace("_", "").toLowerCase(Locale.ROOT)
                .replace('x', '0')
                .replace('z', '0')
                .replace('?', '0');
        if (digits.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new NumberLiteral(width, m.group(2) != null, true, radix, new BigInteger(digits, radix)));
        } catch (NumberFormatException e) {
            // digit outside the base, e.g. 4'b102
            return Optional.empty();
        }
    }

    /**
     * The value of the literal. Signed literals whose top bit is set are reinterpreted
     * as two's complement: {@code magnitude - 2^width}.
     */
    public BigInteger value() {
        if (signed && based && magnitude.testBit(width - 1)) {
            return magnitude.subtract(BigInteger.ONE.shiftLeft(width));
        }
        return magnitude;
    }

    private static int radixOf(char base) {
        switch (Character.toLowerCase(base)) {
            case 'b':
                return 2;
            case 'o':
                return 8;
            case 'h':
                return 16;
            default:
                return 10;
        }
    }
}
