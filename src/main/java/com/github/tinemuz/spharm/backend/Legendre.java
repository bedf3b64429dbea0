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

/**
 * 4pi-normalized associated Legendre functions without the Condon-Shortley
 * phase. {@code p[l][m]} holds the value for 0 &lt;= m &lt;= l; the mean
 * square of {@code p[l][m] cos(m phi)} over the sphere is one.
 */
final class Legendre {
    private Legendre() {}

    /** Allocate a table and fill it for {@code x = cos(theta)}. */
    static double[][] compute(int lmax, double x) {
        double[][] p = new double[lmax + 1][lmax + 1];
        fill(p, lmax, x);
        return p;
    }

    /**
     * Fill {@code p} with the functions up to {@code lmax}, reusing the
     * caller's table across latitudes.
     */
    static void fill(double[][] p, int lmax, double x) {
        double u = Math.sqrt(Math.max(0.0, 1.0 - x * x));
        p[0][0] = 1.0;
        if (lmax == 0) return;
        // Sectoral terms: p[m][m] from p[m-1][m-1]
        p[1][1] = Math.sqrt(3.0) * u;
        for (int m = 2; m <= lmax; m++) {
            p[m][m] = u * Math.sqrt((2.0 * m + 1.0) / (2.0 * m)) * p[m - 1][m - 1];
        }
        // Upward recursion in degree for every order
        for (int m = 0; m < lmax; m++) {
            p[m + 1][m] = Math.sqrt(2.0 * m + 3.0) * x * p[m][m];
            for (int l = m + 2; l <= lmax; l++) {
                double a = Math.sqrt((2.0 * l - 1.0) * (2.0 * l + 1.0) / ((double) (l - m) * (l + m)));
                double b =
                        Math.sqrt(
                                (2.0 * l + 1.0) * (l + m - 1.0) * (l - m - 1.0)
                                        / ((double) (l - m) * (l + m) * (2.0 * l - 3.0)));
                p[l][m] = a * x * p[l - 1][m] - b * p[l - 2][m];
            }
        }
    }
}
