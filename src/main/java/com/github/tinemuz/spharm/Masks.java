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
package com.github.tinemuz.spharm;

import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;

import org.apache.commons.math3.complex.Complex;

/** Shape checks and the valid-entry mask of (2, lmax+1, lmax+1) coefficient arrays. */
final class Masks {
    private Masks() {}

    /** True exactly where 0 &lt;= m &lt;= l, except the sine plane at m = 0. */
    static boolean valid(int i, int l, int m) {
        return m <= l && !(i == 1 && m == 0);
    }

    static boolean[][][] of(int lmax) {
        boolean[][][] mask = new boolean[2][lmax + 1][lmax + 1];
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = 0; m <= l; m++) mask[i][l][m] = valid(i, l, m);
            }
        }
        return mask;
    }

    static int checkShape(Object[] coeffs) {
        if (coeffs == null || coeffs.length != 2) {
            throw new DimensionMismatchException(
                    "Coefficient arrays must have shape (2, lmax+1, lmax+1).");
        }
        Object[] first = (Object[]) coeffs[0];
        int n = first.length;
        if (n == 0) {
            throw new DimensionMismatchException("Coefficient arrays need at least degree 0.");
        }
        for (int i = 0; i < 2; i++) {
            Object[] plane = (Object[]) coeffs[i];
            if (plane.length != n) {
                throw new DimensionMismatchException(
                        "Both planes of a coefficient array must have " + n + " degrees.");
            }
            for (Object row : plane) {
                int len = row instanceof double[] ? ((double[]) row).length : ((Object[]) row).length;
                if (len != n) {
                    throw new DimensionMismatchException(
                            "Coefficient arrays must be square in (l, m). Found a row of length "
                                    + len + " with " + n + " degrees.");
                }
            }
        }
        return n - 1;
    }

    static double[][][] maskedCopy(double[][][] coeffs) {
        int lmax = checkShape(coeffs);
        double[][][] out = new double[2][lmax + 1][lmax + 1];
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = 0; m <= l; m++) {
                    if (valid(i, l, m)) out[i][l][m] = coeffs[i][l][m];
                }
            }
        }
        return out;
    }

    static Complex[][][] maskedCopy(Complex[][][] coeffs) {
        int lmax = checkShape(coeffs);
        Complex[][][] out = zerosComplex(lmax);
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = 0; m <= l; m++) {
                    if (valid(i, l, m) && coeffs[i][l][m] != null) out[i][l][m] = coeffs[i][l][m];
                }
            }
        }
        return out;
    }

    static Complex[][][] zerosComplex(int lmax) {
        Complex[][][] out = new Complex[2][lmax + 1][lmax + 1];
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = 0; m <= lmax; m++) out[i][l][m] = Complex.ZERO;
            }
        }
        return out;
    }

    static double[][][] copy(double[][][] a) {
        double[][][] out = new double[a.length][][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new double[a[i].length][];
            for (int l = 0; l < a[i].length; l++) out[i][l] = a[i][l].clone();
        }
        return out;
    }

    static Complex[][][] copy(Complex[][][] a) {
        Complex[][][] out = new Complex[a.length][][];
        for (int i = 0; i < a.length; i++) {
            out[i] = new Complex[a[i].length][];
            for (int l = 0; l < a[i].length; l++) out[i][l] = a[i][l].clone();
        }
        return out;
    }

    /** Position of a coefficient given a signed order; negative orders address plane 1. */
    static int[] address(int l, int m, int lmax) {
        int am = Math.abs(m);
        if (l < 0 || l > lmax || am > l) {
            throw new DimensionMismatchException(
                    "Degree and order (" + l + ", " + m + ") are outside 0 <= |m| <= l <= "
                            + lmax + ".");
        }
        return new int[] {m < 0 ? 1 : 0, l, am};
    }
}
