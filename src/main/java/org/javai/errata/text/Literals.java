package org.javai.errata.text;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Strict grammars for the numeric literals read from config and number files.
 *
 * <p>Both parsers accept ASCII digits only and report rejection with {@link NumberFormatException},
 * so callers convert them through {@link org.javai.errata.boundary.ErrorConversions} like the
 * JDK parsers they replace.
 */
public final class Literals {

    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("\\+?[0-9]+");

    // Decimal only: no hex floats, no d/f suffix
    private static final Pattern DECIMAL_FLOAT =
            Pattern.compile("[+-]?(?:[0-9]+\\.?[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    private static final Pattern SPECIAL_FLOAT = Pattern.compile("[+-]?(?:inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private Literals() {
    }

    /**
     * Parses an unsigned decimal integer no greater than {@code max}.
     *
     * @throws NumberFormatException if {@code text} is not {@code +?[0-9]+} or exceeds {@code max}
     */
    public static int parseUnsigned(String text, int max) {
        Objects.requireNonNull(text, "text must not be null");
        if (!UNSIGNED_INTEGER.matcher(text).matches()) {
            throw new NumberFormatException("For input string: \"" + text + "\"");
        }
        long value = 0;
        for (int i = text.charAt(0) == '+' ? 1 : 0; i < text.length(); i++) {
            value = value * 10 + (text.charAt(i) - '0');
            if (value > max) {
                throw new NumberFormatException("For input string: \"" + text + "\": out of range, maximum is " + max);
            }
        }
        return (int) value;
    }

    /**
     * Parses a decimal floating-point literal, or {@code inf}, {@code infinity} or {@code nan}
     * in any case, each with an optional sign.
     *
     * @throws NumberFormatException for anything else, including hex floats and type suffixes
     */
    public static double parseFloat(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (DECIMAL_FLOAT.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        if (SPECIAL_FLOAT.matcher(text).matches()) {
            boolean negative = text.charAt(0) == '-';
            String word = text.replaceFirst("^[+-]", "").toLowerCase(Locale.ROOT);
            if (word.equals("nan")) {
                return Double.NaN;
            }
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        throw new NumberFormatException("For input string: \"" + text + "\"");
    }

    /**
     * Removes leading and trailing Unicode white space, including no-break spaces.
     */
    public static String trim(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int start = 0;
        int end = text.length();
        while (start < end && isWhiteSpace(text.charAt(start))) {
            start++;
        }
        while (end > start && isWhiteSpace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    static boolean isWhiteSpace(char c) {
        return (c >= '\t' && c <= '\r') || c == '\u0085' || Character.isSpaceChar(c);
    }
}
