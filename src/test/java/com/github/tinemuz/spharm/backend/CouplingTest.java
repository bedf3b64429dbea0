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

import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CouplingTest {

    private static final double TOLERANCE = 1e-12;

    @Nested
    @DisplayName("Wigner 3j symbols")
    class Symbols {

        @Test
        @DisplayName("Known values")
        void known() {
            assertEquals(1.0, Wigner3j.zeroOrders(0, 0, 0), TOLERANCE);
            assertEquals(-1.0 / Math.sqrt(3), Wigner3j.zeroOrders(1, 1, 0), TOLERANCE);
            assertEquals(Math.sqrt(2.0 / 15.0), Wigner3j.zeroOrders(1, 1, 2), TOLERANCE);
            assertEquals(-Math.sqrt(2.0 / 35.0), Wigner3j.zeroOrders(2, 2, 2), TOLERANCE);
        }

        @Test
        @DisplayName("Odd sums and broken triangles vanish")
        void selectionRules() {
            assertEquals(0.0, Wigner3j.zeroOrders(1, 1, 1), 0.0);
            assertEquals(0.0, Wigner3j.zeroOrders(1, 1, 4), 0.0);
        }

        @Test
        @DisplayName("Squares weighted by 2j+1 sum to one")
        void orthogonality() {
            int l1 = 5;
            int l2 = 3;
            double s = 0.0;
            for (int j = 0; j <= l1 + l2; j++) {
                double w = Wigner3j.zeroOrders(j, l1, l2);
                s += (2 * j + 1) * w * w;
            }
            assertEquals(1.0, s, TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Coupling matrix")
    class Matrix {

        @Test
        @DisplayName("A window of degree 0 leaves spectra unchanged")
        void identityWindow() {
            double[][] m = Coupling.matrix(4, new double[][] {{1.0}}, 1, null);
            assertEquals(5, m.length);
            for (int j = 0; j <= 4; j++) {
                for (int l = 0; l <= 4; l++) assertEquals(j == l ? 1.0 : 0.0, m[j][l], TOLERANCE);
            }
        }

        @Test
        @DisplayName("Too few weights are rejected")
        void weights() {
            assertThrows(DimensionMismatchException.class,
                    () -> Coupling.Weights.resolve(new double[] {1.0}, 2));
            assertArrayEquals(new double[] {0.25, 0.25, 0.25, 0.25}, Coupling.Weights.resolve(null, 4), 0.0);
        }
    }

    @Nested
    @DisplayName("Packed vectors")
    class Packing {

        @Test
        @DisplayName("Index is l^2 + i l + m")
        void index() {
            assertEquals(0, PackedVectors.index(0, 0, 0));
            assertEquals(3, PackedVectors.index(1, 1, 1));
            assertEquals(7, PackedVectors.index(1, 2, 1));
        }

        @Test
        @DisplayName("Vectors must have a perfect-square length")
        void length() {
            assertEquals(2, PackedVectors.lmaxOf(9));
            assertThrows(DimensionMismatchException.class, () -> PackedVectors.lmaxOf(10));
            assertThrows(DimensionMismatchException.class, () -> PackedVectors.lmaxOf(0));
        }

        @Test
        @DisplayName("Arrays survive packing")
        void roundTrip() {
            double[][][] c = new double[2][3][3];
            c[0][2][1] = 1.5;
            c[1][2][2] = -2.5;
            c[0][0][0] = 3.0;
            ShtBackend backend = new JavaShtBackend();
            double[] v = backend.cilmToVector(c);
            assertEquals(9, v.length);
            assertEquals(1.5, v[PackedVectors.index(0, 2, 1)], 0.0);
            double[][][] back = backend.vectorToCilm(v);
            for (int i = 0; i < 2; i++) {
                for (int l = 0; l < 3; l++) assertArrayEquals(c[i][l], back[i][l], 0.0);
            }
        }
    }
}
