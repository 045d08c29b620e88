package adf;

import java.util.regex.Pattern;

public final class ScalarTypes {

    private static final Pattern INTEGER = Pattern.compile("^[+-]?[0-9]+$");
    private static final Pattern DECIMAL = Pattern.compile(
            "^[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?$");
    private static final Pattern SPECIAL_FLOAT = Pattern.compile(
            "^[+-]?(inf|infinity|nan)$", Pattern.CASE_INSENSITIVE);

    private ScalarTypes() {
    }

    /**
     * Boolean, then integer, then float, else the text itself.
     */
    public static Value infer(String text) {
        if (text == null) {
            return Value.nullValue();
        }
        if (isBooleanLiteral(text)) {
            return Value.of(Boolean.parseBoolean(text));
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                return Value.of(Long.parseLong(text));
            } catch (NumberFormatException ex) {
                return Value.of(Double.parseDouble(text));
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Value.of(Double.parseDouble(text));
        }
        if (SPECIAL_FLOAT.matcher(text).matches()) {
            return Value.of(parseSpecial(text));
        }
        return Value.of(text);
    }

    public static boolean isBooleanLiteral(String text) {
        return "true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text);
    }

    public static boolean looksNumeric(String text) {
        if (text == null) {
            return false;
        }
        return INTEGER.matcher(text).matches()
                || DECIMAL.matcher(text).matches()
                || SPECIAL_FLOAT.matcher(text).matches();
    }

    private static double parseSpecial(String text) {
        boolean negative = text.startsWith("-");
        String bare = text.startsWith("-") || text.startsWith("+") ? text.substring(1) : text;
        if ("nan".equalsIgnoreCase(bare)) {
            return Double.NaN;
        }
        return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
}
