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

import com.github.tinemuz.spharm.backend.GaussLegendreQuadrature;

/**
 * Gauss-Legendre layout: lmax + 1 latitudes at the quadrature nodes and
 * 2 lmax + 1 equally spaced longitudes.
 */
public record GlqGeometry(GaussLegendreQuadrature nodes) implements GridGeometry {
    @Override
    public GridType gridType() {
        return GridType.GLQ;
    }

    @Override
    public int nlat() {
        return nodes.zeros().length;
    }

    @Override
    public int nlon() {
        return 2 * lmax() + 1;
    }

    @Override
    public int lmax() {
        return nodes.lmax();
    }

    /** Cosine of the colatitude of each row. */
    public double[] zeros() {
        return nodes.zeros().clone();
    }

    /** Quadrature weight of each row. */
    public double[] weights() {
        return nodes.weights().clone();
    }

    @Override
    public double[] lats(boolean degrees) {
        double[] z = nodes.zeros();
        double[] out = new double[z.length];
        for (int i = 0; i < z.length; i++) {
            double rad = Math.PI / 2.0 - Math.acos(z[i]);
            out[i] = degrees ? Math.toDegrees(rad) : rad;
        }
        return out;
    }
}
