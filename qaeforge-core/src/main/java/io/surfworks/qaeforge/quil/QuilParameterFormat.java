package io.surfworks.qaeforge.quil;

/**
 * Formats gate angles the way Quil programs conventionally spell them.
 *
 * <p>Rational multiples of pi with a denominator of at most 8 are written
 * symbolically ({@code pi}, {@code -pi/2}, {@code 3*pi/4}); everything else
 * uses the shortest decimal that reads back to the same double. A symbolic
 * form is only used when {@code num * pi / den} reproduces the angle bit for
 * bit, so {@link QuilParser} always reads back the exact value.
 */
public final class QuilParameterFormat {

    static final int MAX_DENOMINATOR = 8;

    private QuilParameterFormat() {}

    public static String format(double angle) {
        if (angle == 0.0) {
            return "0";
        }
        double ratio = angle / Math.PI;
        for (int den = 1; den <= MAX_DENOMINATOR; den++) {
            long num = Math.round(ratio * den);
            if (num != 0 && piMultiple(num, den) == angle) {
                return symbolic(num, den);
            }
        }
        return Double.toString(angle);
    }

    /**
     * Value of {@code num * pi / den}, computed the same way for writing and reading.
     */
    static double piMultiple(long num, long den) {
        return num * Math.PI / den;
    }

    private static String symbolic(long num, int den) {
        String sign = num < 0 ? "-" : "";
        long abs = Math.abs(num);
        if (abs == 1 && den == 1) {
            return sign + "pi";
        }
        if (abs == 1) {
            return sign + "pi/" + den;
        }
        if (den == 1) {
            return num + "*pi";
        }
        return num + "*pi/" + den;
    }
}
