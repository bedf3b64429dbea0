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

import com.github.tinemuz.spharm.exceptions.NonRealFieldException;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KindConverterTest {

    private static final double TOLERANCE = 1e-12;

    private static double[][][] realSample() {
        double[][][] c = new double[2][3][3];
        c[0][0][0] = 1.5;
        c[0][1][0] = -0.5;
        c[0][1][1] = 2.0;
        c[1][1][1] = -1.0;
        c[0][2][2] = 0.25;
        c[1][2][2] = 3.0;
        return c;
    }

    @Test
    @DisplayName("Positive orders are (a - ib)/sqrt(2)")
    void positiveOrders() {
        Complex[][][] c = KindConverter.toComplex(realSample());
        assertEquals(2.0 / Math.sqrt(2), c[0][1][1].getReal(), TOLERANCE);
        assertEquals(1.0 / Math.sqrt(2), c[0][1][1].getImaginary(), TOLERANCE);
        assertEquals(1.5, c[0][0][0].getReal(), TOLERANCE);
        assertEquals(0.0, c[0][0][0].getImaginary(), TOLERANCE);
    }

    @Test
    @DisplayName("Negative orders are (-1)^m times the conjugate")
    void negativeOrders() {
        Complex[][][] c = KindConverter.toComplex(realSample());
        assertEquals(-c[0][1][1].getReal(), c[1][1][1].getReal(), TOLERANCE);
        assertEquals(c[0][1][1].getImaginary(), c[1][1][1].getImaginary(), TOLERANCE);
        assertEquals(c[0][2][2].getReal(), c[1][2][2].getReal(), TOLERANCE);
        assertEquals(-c[0][2][2].getImaginary(), c[1][2][2].getImaginary(), TOLERANCE);
    }

    @Test
    @DisplayName("Real to complex to real is the identity")
    void roundTrip() {
        double[][][] r = realSample();
        double[][][] back = KindConverter.toReal(KindConverter.toComplex(r), true, 1e-10);
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l < 3; l++) {
                for (int m = 0; m < 3; m++) assertEquals(r[i][l][m], back[i][l][m], TOLERANCE);
            }
        }
    }

    @Test
    @DisplayName("Non-real expansions fail the check and pass without it")
    void nonReal() {
        Complex[][][] c = KindConverter.toComplex(realSample());
        c[0][0][0] = new Complex(1.5, 0.5);
        assertThrows(NonRealFieldException.class, () -> KindConverter.toReal(c, true, 1e-10));
        double[][][] r = KindConverter.toReal(c, false, 1e-10);
        assertEquals(1.5, r[0][0][0], TOLERANCE);
    }
}
