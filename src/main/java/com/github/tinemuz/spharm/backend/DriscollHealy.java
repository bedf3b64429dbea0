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
 * Driscoll-Healy sampling: n latitudes at colatitude pi i / n starting at the
 * north pole, with the quadrature weights of Driscoll and Healy (1994).
 */
final class DriscollHealy {
    private DriscollHealy() {}

    static void checkShape(int nlat, int nlon) {
        if (nlat < 2 || nlat % 2 != 0) {
            throw new DimensionMismatchException(
                    "DH grids need an even number of latitudes. Input nlat was " + nlat + ".");
        }
        if (nlon != nlat && nlon != 2 * nlat) {
            throw new DimensionMismatchException(
                    "DH grids need nlon equal to nlat or 2 nlat. Input (nlat, nlon) was ("
                            + nlat + ", " + nlon + ").");
        }
    }

    static double[] cosColatitudes(int nlat) {
        double[] x = new double[nlat];
        for (int i = 0; i < nlat; i++) x[i] = Math.cos(Math.PI * i / nlat);
        return x;
    }

    /** Weights summing to 2, like Gauss-Legendre weights on [-1, 1]. */
    static double[] weights(int nlat) {
        double[] w = new double[nlat];
        for (int i = 0; i < nlat; i++) {
            double t = Math.PI * i / nlat;
            double s = 0.0;
            for (int k = 0; k < nlat / 2; k++) {
                s += Math.sin((2 * k + 1) * t) / (2 * k + 1);
            }
            w[i] = 4.0 / nlat * Math.sin(t) * s;
        }
        return w;
    }
}
