package io.surfworks.qaeforge.circuit;

/**
 * Immutable complex number used to evaluate gate matrices.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);

    public static Complex real(double re) {
        return new Complex(re, 0.0);
    }

    public Complex add(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex mul(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    public Complex conjugate() {
        return new Complex(re, -im);
    }

    public boolean approxEquals(Complex other, double tolerance) {
        return Math.abs(re - other.re) <= tolerance && Math.abs(im - other.im) <= tolerance;
    }

    /**
     * Product of two square matrices of the same size.
     */
    public static Complex[][] multiply(Complex[][] a, Complex[][] b) {
        int n = a.length;
        Complex[][] out = new Complex[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                Complex sum = ZERO;
                for (int k = 0; k < n; k++) {
                    sum = sum.add(a[i][k].mul(b[k][j]));
                }
                out[i][j] = sum;
            }
        }
        return out;
    }

    @Override
    public String toString() {
        if (im == 0.0) {
            return String.valueOf(re);
        }
        return re + (im < 0 ? "-" : "+") + Math.abs(im) + "i";
    }
}
