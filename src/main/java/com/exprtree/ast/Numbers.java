package com.exprtree.ast;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Helpers for the two integral representations. An integer is a {@link Long} whenever it
 * fits and a {@link BigInteger} only when it does not.
 */
public final class Numbers {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private Numbers() {
    }

    /**
     * @return the value as a {@link Long} if it fits, otherwise the value itself
     */
    public static Number narrow(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }

    public static boolean isIntegral(Number value) {
        return value instanceof Long || value instanceof BigInteger;
    }

    public static BigInteger toBigInteger(Number value) {
        if (value instanceof BigInteger) {
            return (BigInteger) value;
        }
        return BigInteger.valueOf(value.longValue());
    }

    /**
     * Render a value for diagnostics. Integers print as-is; doubles use the shortest
     * round-trip digits, in plain notation for decimal exponents -4..15 and scientific
     * notation otherwise ({@code 14.0}, {@code 0.0001}, {@code 1e+16}, {@code 1e-05}).
     */
    public static String format(Number value) {
        if (!(value instanceof Double)) {
            return value.toString();
        }
        double d = value.doubleValue();
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return 1.0 / d < 0 ? "-0.0" : "0.0";
        }

        BigDecimal decimal = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        int exponent = decimal.precision() - decimal.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }

        String digits = decimal.unscaledValue().abs().toString();
        StringBuilder sb = new StringBuilder();
        if (decimal.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        int magnitude = Math.abs(exponent);
        sb.append('e').append(exponent < 0 ? '-' : '+');
        if (magnitude < 10) {
            sb.append('0');
        }
        return sb.append(magnitude).toString();
    }
}
