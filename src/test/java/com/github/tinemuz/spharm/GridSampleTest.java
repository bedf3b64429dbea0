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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.IncompatibleOperandsException;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GridSampleTest {

    private static final double TOLERANCE = 1e-12;

    private static double[][] filled(int nlat, int nlon, double value) {
        double[][] d = new double[nlat][nlon];
        for (double[] row : d) Arrays.fill(row, value);
        return d;
    }

    @Nested
    @DisplayName("Geometry")
    class Geometry {

        @Test
        @DisplayName("A 4 x 4 DH grid has lmax 1")
        void dhShape() {
            RealGrid g = RealGrid.fromArray(new double[4][4], GridType.DH);
            assertEquals(1, g.lmax());
            assertEquals(GridType.DH, g.gridType());
            assertEquals(1, ((DhGeometry) g.geometry()).sampling());
        }

        @Test
        @DisplayName("A 3 x 5 GLQ grid has lmax 2")
        void glqShape() {
            RealGrid g = RealGrid.fromArray(new double[3][5], GridType.GLQ);
            assertEquals(2, g.lmax());
            assertEquals(3, g.lats().length);
            assertEquals(5, g.lons().length);
        }

        @Test
        @DisplayName("Invalid shapes are rejected")
        void invalidShapes() {
            assertThrows(DimensionMismatchException.class, () -> RealGrid.fromArray(new double[3][4], GridType.GLQ));
            assertThrows(DimensionMismatchException.class, () -> RealGrid.fromArray(new double[3][3], GridType.DH));
            assertThrows(DimensionMismatchException.class, () -> RealGrid.fromArray(new double[4][6], GridType.DH));
        }

        @Test
        @DisplayName("DH latitudes start at the north pole and longitudes at zero")
        void dhCoordinates() {
            RealGrid g = RealGrid.fromArray(new double[4][8]);
            assertArrayEquals(new double[] {90.0, 45.0, 0.0, -45.0}, g.lats(), TOLERANCE);
            double[] lons = g.lons();
            assertEquals(8, lons.length);
            assertEquals(0.0, lons[0], TOLERANCE);
            assertEquals(45.0, lons[1], TOLERANCE);
            assertEquals(Math.PI / 2, g.lats(false)[0], TOLERANCE);
            assertEquals(Math.PI / 4, g.lons(false)[1], TOLERANCE);
        }

        @Test
        @DisplayName("GLQ latitudes are symmetric about the equator")
        void glqCoordinates() {
            double[] lats = RealGrid.fromArray(new double[4][7], GridType.GLQ).lats();
            assertEquals(-lats[0], lats[3], 1e-10);
            assertTrue(lats[0] > lats[1]);
        }
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Element-wise operations and reversed scalars")
        void elementWise() {
            RealGrid a = RealGrid.fromArray(filled(4, 4, 2.0));
            RealGrid b = RealGrid.fromArray(filled(4, 4, 4.0));
            assertEquals(6.0, a.add(b).get(1, 2), TOLERANCE);
            assertEquals(0.5, a.divide(b).get(3, 3), TOLERANCE);
            assertEquals(-1.0, a.subtractFrom(1.0).get(0, 0), TOLERANCE);
            assertEquals(2.0, b.divideInto(8.0).get(2, 1), TOLERANCE);
            assertEquals(8.0, a.pow(3).get(0, 1), TOLERANCE);
        }

        @Test
        @DisplayName("Grids of different type or shape do not combine")
        void incompatible() {
            RealGrid dh = RealGrid.fromArray(new double[4][8]);
            RealGrid glq = RealGrid.fromArray(new double[3][5], GridType.GLQ);
            assertThrows(IncompatibleOperandsException.class, () -> dh.add(glq));
            assertThrows(DimensionMismatchException.class, () -> dh.add(RealGrid.fromArray(new double[4][4])));
        }

        @Test
        @DisplayName("Complex grids split into real and imaginary parts")
        void complexParts() {
            ComplexGrid c = ComplexGrid.fromReal(RealGrid.fromArray(filled(4, 4, 3.0)));
            ComplexGrid shifted = c.add(new Complex(0.0, 2.0));
            assertEquals(3.0, shifted.real().get(1, 1), TOLERANCE);
            assertEquals(2.0, shifted.imaginary().get(1, 1), TOLERANCE);
            assertEquals(Kind.COMPLEX, shifted.kind());
        }

        @Test
        @DisplayName("Powers of zero complex samples stay finite")
        void complexPowOfZeros() {
            double[][] data = filled(4, 4, 0.0);
            data[0][0] = 2.0;
            ComplexGrid squared = ComplexGrid.fromReal(RealGrid.fromArray(data)).pow(2.0);
            assertEquals(4.0, squared.get(0, 0).getReal(), TOLERANCE);
            assertEquals(0.0, squared.get(1, 1).getReal(), 0.0);
            assertEquals(0.0, squared.get(1, 1).getImaginary(), 0.0);
        }
    }

    @Test
    @DisplayName("fromArray copies its input")
    void copiesInput() {
        double[][] data = filled(4, 4, 1.0);
        RealGrid g = RealGrid.fromArray(data);
        data[0][0] = 5.0;
        assertEquals(1.0, g.get(0, 0), 0.0);
    }
}
