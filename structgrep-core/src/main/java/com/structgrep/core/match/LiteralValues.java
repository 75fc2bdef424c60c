package com.structgrep.core.match;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;

/**
 * Decoding of literal source text into comparable values.
 */
final class LiteralValues {

    private LiteralValues() {
        // Utility class
    }

    /**
     * Parses a Java-style integer literal: underscores, {@code L} suffix, hexadecimal, binary and
     * octal forms.
     */
    static Optional<BigInteger> parseInteger(String text) {
        String digits = text.replace("_", "").toLowerCase(Locale.ROOT);
        if (digits.endsWith("l")) {
            digits = digits.substring(0, digits.length() - 1);
        }
        try {
            if (digits.startsWith("0x")) {
                return Optional.of(new BigInteger(digits.substring(2), 16));
            }
            if (digits.startsWith("0b")) {
                return Optional.of(new BigInteger(digits.substring(2), 2));
            }
            if (digits.length() > 1 && digits.startsWith("0")) {
                return Optional.of(new BigInteger(digits.substring(1), 8));
            }
            return Optional.of(new BigInteger(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a floating point literal, dropping underscores and {@code f}/{@code d} suffixes.
     */
    static Optional<BigDecimal> parseDecimal(String text) {
        String digits = text.replace("_", "");
        char last = digits.isEmpty() ? ' ' : Character.toLowerCase(digits.charAt(digits.length() - 1));
        if (last == 'f' || last == 'd') {
            digits = digits.substring(0, digits.length() - 1);
        }
        try {
            if (digits.toLowerCase(Locale.ROOT).startsWith("0x")) {
                return Optional.of(BigDecimal.valueOf(Double.parseDouble(digits)));
            }
            return Optional.of(new BigDecimal(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Content of a quoted literal with escapes translated. Text blocks are stripped of their
     * incidental indentation first. Unquoted text is returned unchanged.
     */
    static String decodeQuoted(String text) {
        try {
            if (text.startsWith("\"\"\"") && text.endsWith("\"\"\"") && text.length() >= 6) {
                String body = text.substring(3, text.length() - 3);
                int newline = body.indexOf('\n');
                body = newline >= 0 ? body.substring(newline + 1) : body;
                return body.stripIndent().translateEscapes();
            }
            if (text.length() >= 2 && (text.startsWith("\"") || text.startsWith("'"))) {
                return text.substring(1, text.length() - 1).translateEscapes();
            }
        } catch (IllegalArgumentException e) {
            return text;
        }
        return text;
    }
}
