package com.jscompiler.util;

import java.math.BigDecimal;

/**
 * Formats and normalizes numbers the way JavaScript prints them: integral values
 * carry no decimal point, everything else keeps its shortest decimal form.
 */
public final class JsNumbers {

    // 2^53, the largest integer a double represents exactly
    private static final double MAX_SAFE = 9007199254740992.0;

    private JsNumbers() {
        // Utility class
    }

    public static String format(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return Long.toString(number.longValue());
        }
        double d = number.doubleValue();
        if (Double.isNaN(d)) {
            return "NaN";
        } else if (Double.isInfinite(d)) {
            return d > 0 ? "Infinity" : "-Infinity";
        } else if (d == Math.floor(d) && Math.abs(d) <= MAX_SAFE) {
            return Long.toString((long) d);
        } else if (d == Math.floor(d) && Math.abs(d) < 1e21) {
            return new BigDecimal(d).toPlainString();
        }
        return Double.toString(d);
    }

    /**
     * @return an Integer or Long for integral values, otherwise a Double
     */
    public static Number normalize(Number number) {
        if (number instanceof Integer) {
            return number;
        } else if (number instanceof Long l) {
            return l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE ? (Number) l.intValue() : l;
        }
        double d = number.doubleValue();
        if (d == Math.floor(d) && !Double.isInfinite(d) && Math.abs(d) <= MAX_SAFE) {
            long l = (long) d;
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return (int) l;
            }
            return l;
        }
        return d;
    }

    public static Number negate(Number number) {
        Number n = normalize(number);
        if (n instanceof Integer || n instanceof Long) {
            return normalize(-n.longValue());
        }
        return -n.doubleValue();
    }
}
