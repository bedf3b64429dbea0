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
import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import com.github.tinemuz.spharm.io.CoefficientFormat;
import com.github.tinemuz.spharm.spectrum.SpectrumConvention;
import com.github.tinemuz.spharm.spectrum.SpectrumUnit;
import com.github.tinemuz.spharm.window.CouplingMode;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class VariantDispatcherTest {

    @Nested
    @DisplayName("Coefficient variants")
    class Coefficients {

        @Test
        @DisplayName("Each kind resolves to its own variant")
        void byKind() {
            CoefficientSet real = CoefficientSet.zeros(3, Kind.REAL, Normalization.FOUR_PI, CsPhase.EXCLUDED);
            CoefficientSet complex = CoefficientSet.zeros(3, Kind.COMPLEX, Normalization.FOUR_PI, CsPhase.EXCLUDED);
            assertInstanceOf(RealCoefficients.class, real);
            assertInstanceOf(ComplexCoefficients.class, complex);
            assertEquals(Kind.COMPLEX, complex.kind());
        }

        @Test
        @DisplayName("from converts a set to another kind")
        void fromOtherKind() {
            CoefficientSet r = CoefficientSet.random(new double[] {1.0, 1.0, 1.0}, Kind.REAL,
                    Normalization.FOUR_PI, CsPhase.EXCLUDED, false, new Well19937c(1));
            CoefficientSet c = VariantDispatcher.coefficients(Kind.COMPLEX)
                    .from(r, Normalization.SCHMIDT, CsPhase.INCLUDED, 1, true);
            assertInstanceOf(ComplexCoefficients.class, c);
            assertEquals(1, c.lmax());
            assertEquals(CsPhase.INCLUDED, c.csphase());
        }
    }

    @Nested
    @DisplayName("Grid types")
    class Grids {

        @Test
        @DisplayName("Shapes map to grid types")
        void infer() {
            assertEquals(GridType.DH, VariantDispatcher.inferGridType(4, 4));
            assertEquals(GridType.DH, VariantDispatcher.inferGridType(4, 8));
            assertEquals(GridType.GLQ, VariantDispatcher.inferGridType(3, 5));
            assertThrows(DimensionMismatchException.class, () -> VariantDispatcher.inferGridType(3, 4));
        }

        @Test
        @DisplayName("Geometry factories validate shapes")
        void geometry() {
            assertInstanceOf(DhGeometry.class, VariantDispatcher.geometry(GridType.DH, 6, 12));
            assertInstanceOf(GlqGeometry.class, VariantDispatcher.geometry(GridType.GLQ, 4, 7));
            assertThrows(DimensionMismatchException.class, () -> VariantDispatcher.geometry(GridType.GLQ, 4, 8));
        }
    }

    @Nested
    @DisplayName("Option parsing")
    class Options {

        @Test
        @DisplayName("Known option strings parse, ignoring case")
        void known() {
            assertEquals(Normalization.ORTHONORMAL, Normalization.parse("Ortho"));
            assertEquals(Normalization.FOUR_PI, Normalization.parse("4pi"));
            assertEquals(CsPhase.INCLUDED, CsPhase.parse("-1"));
            assertEquals(Kind.COMPLEX, Kind.parse("COMPLEX"));
            assertEquals(GridScheme.DH1, GridScheme.parse("dh"));
            assertEquals(GridScheme.DH2, GridScheme.parse("DH2"));
            assertEquals(SpectrumUnit.PER_DLOGL, SpectrumUnit.parse("per_dlogl"));
            assertEquals(SpectrumConvention.L2NORM, SpectrumConvention.parse("l2norm"));
            assertEquals(CouplingMode.VALID, CouplingMode.parse("valid"));
            assertEquals(CoefficientFormat.BINARY, CoefficientFormat.parse("npy"));
        }

        @Test
        @DisplayName("Unknown option strings are rejected")
        void unknown() {
            assertThrows(InvalidOptionException.class, () -> Normalization.parse("unnorm"));
            assertThrows(InvalidOptionException.class, () -> CsPhase.of(0));
            assertThrows(InvalidOptionException.class, () -> CsPhase.parse("yes"));
            assertThrows(InvalidOptionException.class, () -> Kind.parse(null));
            assertThrows(InvalidOptionException.class, () -> GridScheme.parse("healpix"));
            assertThrows(InvalidOptionException.class, () -> SpectrumUnit.parse("per_m"));
            assertThrows(InvalidOptionException.class, () -> CouplingMode.parse("partial"));
        }
    }
}
