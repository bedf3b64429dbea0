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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import java.util.Random;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class NormalizationConverterTest {

    private static final double TOLERANCE = 1e-12;

    private static double[][][] sample(int lmax, long seed) {
        Random rnd = new Random(seed);
        double[][][] c = new double[2][lmax + 1][lmax + 1];
        for (int l = 0; l <= lmax; l++) {
            for (int m = 0; m <= l; m++) {
                c[0][l][m] = rnd.nextGaussian();
                if (m > 0) c[1][l][m] = rnd.nextGaussian();
            }
        }
        return c;
    }

    @Nested
    @DisplayName("Factors")
    class Factors {

        @Test
        @DisplayName("4pi to Schmidt multiplies by sqrt(2l+1)")
        void fourPiToSchmidt() {
            for (int l = 0; l < 10; l++) {
                assertEquals(Math.sqrt(2 * l + 1.0),
                        NormalizationConverter.factor(Normalization.FOUR_PI, Normalization.SCHMIDT, l),
                        TOLERANCE, "l=" + l);
            }
        }

        @Test
        @DisplayName("4pi to orthonormal multiplies by sqrt(4pi)")
        void fourPiToOrtho() {
            assertEquals(Math.sqrt(4 * Math.PI),
                    NormalizationConverter.factor(Normalization.FOUR_PI, Normalization.ORTHONORMAL, 3),
                    TOLERANCE);
        }

        @Test
        @DisplayName("Schmidt to orthonormal multiplies by sqrt(4pi/(2l+1))")
        void schmidtToOrtho() {
            int l = 4;
            assertEquals(Math.sqrt(4 * Math.PI / (2 * l + 1.0)),
                    NormalizationConverter.factor(Normalization.SCHMIDT, Normalization.ORTHONORMAL, l),
                    TOLERANCE);
        }

        @Test
        @DisplayName("Identity for equal normalizations")
        void identity() {
            for (Normalization n : Normalization.values()) {
                assertEquals(1.0, NormalizationConverter.factor(n, n, 7), TOLERANCE, n.label());
            }
        }
    }

    @Nested
    @DisplayName("Array conversion")
    class ArrayConversion {

        @Test
        @DisplayName("Every pair of normalizations round trips")
        void roundTrips() {
            for (int lmax = 0; lmax <= 6; lmax++) {
                double[][][] c = sample(lmax, 11 + lmax);
                for (Normalization from : Normalization.values()) {
                    for (Normalization to : Normalization.values()) {
                        double[][][] there = NormalizationConverter.convert(
                                c, from, CsPhase.EXCLUDED, to, CsPhase.INCLUDED, lmax);
                        double[][][] back = NormalizationConverter.convert(
                                there, to, CsPhase.INCLUDED, from, CsPhase.EXCLUDED, lmax);
                        for (int i = 0; i < 2; i++) {
                            for (int l = 0; l <= lmax; l++) {
                                for (int m = 0; m <= l; m++) {
                                    assertEquals(c[i][l][m], back[i][l][m], TOLERANCE,
                                            from.label() + "->" + to.label() + " at " + i + "," + l + "," + m);
                                }
                            }
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Phase change negates odd orders only")
        void phaseFlip() {
            double[][][] c = sample(4, 3);
            double[][][] out = NormalizationConverter.convert(
                    c, Normalization.FOUR_PI, CsPhase.EXCLUDED, Normalization.FOUR_PI, CsPhase.INCLUDED, 4);
            for (int i = 0; i < 2; i++) {
                for (int l = 0; l <= 4; l++) {
                    for (int m = 0; m <= l; m++) {
                        double expected = m % 2 == 1 ? -c[i][l][m] : c[i][l][m];
                        assertEquals(expected, out[i][l][m], TOLERANCE);
                    }
                }
            }
        }

        @Test
        @DisplayName("Truncation keeps the low degrees and leaves the source untouched")
        void truncation() {
            double[][][] c = sample(5, 9);
            double before = c[0][5][3];
            double[][][] out = NormalizationConverter.convert(
                    c, Normalization.FOUR_PI, CsPhase.EXCLUDED, Normalization.FOUR_PI, CsPhase.EXCLUDED, 2);
            assertEquals(3, out[0].length);
            assertEquals(c[0][2][1], out[0][2][1], TOLERANCE);
            assertEquals(before, c[0][5][3], 0.0);
        }

        @Test
        @DisplayName("lmax out of range is rejected")
        void lmaxOutOfRange() {
            double[][][] c = sample(3, 1);
            assertThrows(DimensionMismatchException.class, () -> NormalizationConverter.convert(
                    c, Normalization.FOUR_PI, CsPhase.EXCLUDED, Normalization.SCHMIDT, CsPhase.EXCLUDED, 4));
            assertThrows(DimensionMismatchException.class, () -> NormalizationConverter.convert(
                    c, Normalization.FOUR_PI, CsPhase.EXCLUDED, Normalization.SCHMIDT, CsPhase.EXCLUDED, -1));
        }

        @Test
        @DisplayName("Complex arrays are scaled like real ones")
        void complexArrays() {
            Complex[][][] c = new Complex[2][3][3];
            for (int i = 0; i < 2; i++) {
                for (int l = 0; l < 3; l++) {
                    for (int m = 0; m < 3; m++) c[i][l][m] = Complex.ZERO;
                }
            }
            c[0][2][1] = new Complex(1.0, 2.0);
            Complex[][][] out = NormalizationConverter.convert(
                    c, Normalization.FOUR_PI, CsPhase.EXCLUDED, Normalization.SCHMIDT, CsPhase.INCLUDED, 2);
            double f = Math.sqrt(5.0);
            assertEquals(-f, out[0][2][1].getReal(), TOLERANCE);
            assertEquals(-2 * f, out[0][2][1].getImaginary(), TOLERANCE);
        }
    }
}
