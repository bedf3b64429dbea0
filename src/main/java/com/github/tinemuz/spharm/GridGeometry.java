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

/** Sampling layout of a {@link GridSample}. */
public sealed interface GridGeometry permits DhGeometry, GlqGeometry {
    GridType gridType();

    int nlat();

    int nlon();

    /** Band limit resolved by the grid. */
    int lmax();

    /** Latitude of each row, north first. */
    double[] lats(boolean degrees);

    /** Longitude of each column, starting at 0 and increasing eastward. */
    default double[] lons(boolean degrees) {
        int n = nlon();
        double[] out = new double[n];
        for (int j = 0; j < n; j++) {
            out[j] = degrees ? 360.0 * j / n : 2.0 * Math.PI * j / n;
        }
        return out;
    }
}
