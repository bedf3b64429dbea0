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
package com.github.tinemuz.spharm.backend;

import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;

/**
 * Conversion between (2, lmax+1, lmax+1) arrays and vectors of length
 * (lmax+1)^2 indexed by l^2 + i l + m, where i = 1 (sine) requires m &gt;= 1.
 */
final class PackedVectors {
    private PackedVectors() {}

    static int index(int i, int l, int m) {
        return l * l + i * l + m;
    }

    static double[] toVector(double[][][] cilm) {
        int lmax = cilm[0].length - 1;
        double[] v = new double[(lmax + 1) * (lmax + 1)];
        for (int l = 0; l <= lmax; l++) {
            for (int m = 0; m <= l; m++) {
                v[index(0, l, m)] = cilm[0][l][m];
                if (m > 0) v[index(1, l, m)] = cilm[1][l][m];
            }
        }
        return v;
    }

    static double[][][] toCilm(double[] vector) {
        int lmax = lmaxOf(vector.length);
        double[][][] cilm = new double[2][lmax + 1][lmax + 1];
        for (int l = 0; l <= lmax; l++) {
            for (int m = 0; m <= l; m++) {
                cilm[0][l][m] = vector[index(0, l, m)];
                if (m > 0) cilm[1][l][m] = vector[index(1, l, m)];
            }
        }
        return cilm;
    }

    /** Column {@code i} of a packed taper matrix as coefficients. */
    static double[][][] column(double[][] packed, int i) {
        double[] v = new double[packed.length];
        for (int k = 0; k < packed.length; k++) v[k] = packed[k][i];
        return toCilm(v);
    }

    static int lmaxOf(int length) {
        int n = (int) Math.round(Math.sqrt(length));
        if (n * n != length || n == 0) {
            throw new DimensionMismatchException(
                    "Packed vector length must be a nonzero perfect square. Input length was "
                            + length + ".");
        }
        return n - 1;
    }
}
