package org.stackvm.assembler;

import java.util.regex.Pattern;

/**
 * Parses integer literals of the assembly language.
 * <p>
 * Accepted forms are an optional sign followed by {@code 0x}/{@code 0X} and hex digits,
 * a leading {@code 0} and octal digits, or decimal digits. A literal must fit in 32 bits,
 * either as a signed or as an unsigned value; the low 32 bits are returned.
 */
public final class NumericParser {

    private static final Pattern LITERAL = Pattern.compile("[+-]?(0[xX][0-9a-fA-F]+|[0-9]+)");
    private static final long MIN = Integer.MIN_VALUE;
    private static final long MAX = 0xFFFF_FFFFL;

    private NumericParser() {}

    /**
     * @param token The operand text.
     * @return true if the token has the shape of a numeric literal. It may still be out of range.
     */
    public static boolean isNumeric(String token) {
        return token != null && LITERAL.matcher(token).matches();
    }

    /**
     * Parses a numeric literal.
     * @param token The literal.
     * @return The low 32 bits of the value.
     * @throws NumberFormatException if the token is not a literal, has invalid octal digits, or does not fit in 32 bits.
     */
    public static int parseInt(String token) {
        if (!isNumeric(token)) {
            throw new NumberFormatException("Not a numeric literal: " + token);
        }
        String s = token;
        boolean negative = false;
        if (s.startsWith("+")) {
            s = s.substring(1);
        } else if (s.startsWith("-")) {
            negative = true;
            s = s.substring(1);
        }
        int radix = 10;
        if (s.startsWith("0x") || s.startsWith("0X")) {
            radix = 16;
            s = s.substring(2);
        } else if (s.length() > 1 && s.startsWith("0")) {
            radix = 8;
            s = s.substring(1);
        }
        long magnitude;
        try {
            magnitude = Long.parseLong(s, radix);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Invalid numeric literal: " + token);
        }
        long value = negative ? -magnitude : magnitude;
        if (value < MIN || value > MAX) {
            throw new NumberFormatException("Numeric literal does not fit in 32 bits: " + token);
        }
        return (int) value;
    }
}
