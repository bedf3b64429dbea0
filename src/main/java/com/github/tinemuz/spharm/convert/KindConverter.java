/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.spharm.convert;

import com.github.tinemuz.spharm.exceptions.NonRealFieldException;

import org.apache.commons.math3.complex.Complex;

/**
 * Conversion between real and complex coefficient arrays of the same
 * normalization and phase convention.
 *
 * <p>With c(l,0) = a(l,0), c(l,m) = (a(l,m) - i b(l,m))/sqrt(2) and
 * c(l,-m) = (-1)^m conj(c(l,m)), both arrays describe the same function.</p>
 *
 * <p>The 1/sqrt(2) factor differs from the SHTOOLS {@code SHrtoc} convention,
 * which divides by 2. Dividing by sqrt(2) keeps the complex expansion equal to
 * the real one on every grid and gives both the same power spectrum.</p>
 */
public final class KindConverter {
    private static final double SQRT2 = Math.sqrt(2.0);

    private KindConverter() {}

    public static Complex[][][] toComplex(double[][][] cilm) {
        int n = cilm[0].length;
        Complex[][][] out = new Complex[2][n][n];
        for (int l = 0; l < n; l++) {
            for (int m = 0; m < n; m++) {
                if (m > l) {
                    out[0][l][m] = Complex.ZERO;
                    out[1][l][m] = Complex.ZERO;
                } else if (m == 0) {
                    out[0][l][0] = new Complex(cilm[0][l][0], 0.0);
                    out[1][l][0] = Complex.ZERO;
                } else {
                    Complex c = new Complex(cilm[0][l][m], -cilm[1][l][m]).divide(SQRT2);
                    out[0][l][m] = c;
                    out[1][l][m] = m % 2 == 0 ? c.conjugate() : c.conjugate().negate();
                }
            }
        }
        return out;
    }

    /**
     * Real coefficients of a complex expansion.
     *
     * @param check     verify that the expansion is real before discarding imaginary parts
     * @param tolerance allowed deviation relative to the largest coefficient magnitude
     * @throws NonRealFieldException if {@code check} is set and the expansion is not real
     */
    public static double[][][] toReal(Complex[][][] cilm, boolean check, double tolerance) {
        int n = cilm[0].length;
        if (check) checkReal(cilm, tolerance);
        double[][][] out = new double[2][n][n];
        for (int l = 0; l < n; l++) {
            out[0][l][0] = cilm[0][l][0].getReal();
            for (int m = 1; m <= l; m++) {
                out[0][l][m] = SQRT2 * cilm[0][l][m].getReal();
                out[1][l][m] = -SQRT2 * cilm[0][l][m].getImaginary();
            }
        }
        return out;
    }

    private static void checkReal(Complex[][][] cilm, double tolerance) {
        int n = cilm[0].length;
        double scale = 0.0;
        for (int k = 0; k < 2; k++) {
            for (int l = 0; l < n; l++) {
                for (int m = 0; m <= l; m++) scale = Math.max(scale, cilm[k][l][m].abs());
            }
        }
        double limit = tolerance * Math.max(scale, Double.MIN_NORMAL);
        for (int l = 0; l < n; l++) {
            if (Math.abs(cilm[0][l][0].getImaginary()) > limit) {
                throw new NonRealFieldException(
                        "imaginary part of order 0 at degree " + l + " is "
                                + cilm[0][l][0].getImaginary() + ".");
            }
            for (int m = 1; m <= l; m++) {
                Complex mirror = cilm[1][l][m].conjugate();
                if (m % 2 == 1) mirror = mirror.negate();
                if (cilm[0][l][m].subtract(mirror).abs() > limit) {
                    throw new NonRealFieldException(
                            "coefficients of orders " + m + " and " + (-m) + " at degree " + l
                                    + " are not conjugate symmetric.");
                }
            }
        }
    }
}
