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

/**
 * Driscoll-Healy layout: an even number of latitudes from the north pole
 * (inclusive) to the south pole (exclusive), and nlat or 2 nlat longitudes.
 */
public record DhGeometry(int nlat, int nlon) implements GridGeometry {
    public DhGeometry {
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

    /** Geometry produced by expanding coefficients of the given band limit. */
    public static DhGeometry forLmax(int lmax, int sampling) {
        int nlat = 2 * (lmax + 1);
        return new DhGeometry(nlat, nlat * sampling);
    }

    @Override
    public GridType gridType() {
        return GridType.DH;
    }

    /** 1 for nlon = nlat, 2 for nlon = 2 nlat. */
    public int sampling() {
        return nlon / nlat;
    }

    @Override
    public int lmax() {
        return nlat / 2 - 1;
    }

    @Override
    public double[] lats(boolean degrees) {
        double[] out = new double[nlat];
        for (int i = 0; i < nlat; i++) {
            double d = 90.0 - 180.0 * i / nlat;
            out[i] = degrees ? d : Math.toRadians(d);
        }
        return out;
    }
}
