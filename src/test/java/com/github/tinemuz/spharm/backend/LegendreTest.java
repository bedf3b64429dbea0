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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LegendreTest {

    private static final double TOLERANCE = 1e-12;

    @Test
    @DisplayName("Low degrees match closed forms")
    void closedForms() {
        double x = 0.3;
        double u = Math.sqrt(1 - x * x);
        double[][] p = Legendre.compute(2, x);
        assertEquals(1.0, p[0][0], TOLERANCE);
        assertEquals(Math.sqrt(3) * x, p[1][0], TOLERANCE);
        assertEquals(Math.sqrt(3) * u, p[1][1], TOLERANCE);
        assertEquals(Math.sqrt(5) * (3 * x * x - 1) / 2, p[2][0], TOLERANCE);
        assertEquals(Math.sqrt(15.0) * x * u, p[2][1], TOLERANCE);
        assertEquals(Math.sqrt(15.0 / 4.0) * u * u, p[2][2], TOLERANCE);
    }

    @Test
    @DisplayName("Functions of equal order are orthogonal with 4pi normalization")
    void orthogonality() {
        int lmax = 8;
        GaussLegendreQuadrature q = GaussLegendre.nodes(lmax);
        double[][][] p = new double[q.zeros().length][][];
        for (int k = 0; k < p.length; k++) p[k] = Legendre.compute(lmax, q.zeros()[k]);
        for (int m = 0; m <= lmax; m++) {
            for (int l1 = m; l1 <= lmax; l1++) {
                for (int l2 = m; l2 <= lmax; l2++) {
                    double s = 0.0;
                    for (int k = 0; k < p.length; k++) s += q.weights()[k] * p[k][l1][m] * p[k][l2][m];
                    double expected = l1 == l2 ? (m == 0 ? 2.0 : 4.0) : 0.0;
                    assertEquals(expected, s, 1e-10, "l1=" + l1 + " l2=" + l2 + " m=" + m);
                }
            }
        }
    }

    @Test
    @DisplayName("Sectoral terms vanish at the poles")
    void poles() {
        double[][] p = Legendre.compute(4, 1.0);
        for (int l = 0; l <= 4; l++) {
            assertEquals(Math.sqrt(2 * l + 1.0), p[l][0], TOLERANCE);
            for (int m = 1; m <= l; m++) assertEquals(0.0, p[l][m], TOLERANCE);
        }
    }
}
