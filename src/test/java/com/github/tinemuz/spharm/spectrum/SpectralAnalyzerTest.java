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
package com.github.tinemuz.spharm.spectrum;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.IncompatibleOperandsException;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SpectralAnalyzerTest {

    private static final double TOLERANCE = 1e-12;
    private static final double BASE = 10.0;

    private static RealCoefficients sample(int lmax, long seed) {
        double[] power = new double[lmax + 1];
        for (int l = 0; l <= lmax; l++) power[l] = Math.pow(l + 1.0, -2.0);
        return RealCoefficients.random(power, Normalization.FOUR_PI, CsPhase.EXCLUDED, false,
                new Well19937c(seed));
    }

    @Nested
    @DisplayName("Conventions")
    class Conventions {

        @Test
        @DisplayName("Energy is 4pi times power")
        void energy() {
            RealCoefficients c = sample(8, 1);
            double[] p = c.spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_L, BASE);
            double[] e = c.spectrum(SpectrumConvention.ENERGY, SpectrumUnit.PER_L, BASE);
            for (int l = 0; l <= 8; l++) assertEquals(4 * Math.PI * p[l], e[l], TOLERANCE);
        }

        @Test
        @DisplayName("The 4pi l2 norm equals the power")
        void l2norm() {
            RealCoefficients c = sample(5, 2);
            assertArrayEquals(c.spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_L, BASE),
                    c.spectrum(SpectrumConvention.L2NORM, SpectrumUnit.PER_L, BASE), TOLERANCE);
        }

        @Test
        @DisplayName("Power does not depend on normalization or phase")
        void normalizationInvariant() {
            RealCoefficients c = sample(7, 3);
            double[] p = c.spectrum();
            for (Normalization n : Normalization.values()) {
                for (CsPhase cs : CsPhase.values()) {
                    assertArrayEquals(p, c.convert(n, cs).spectrum(), 1e-10, n.label());
                }
            }
        }

        @Test
        @DisplayName("Power per degree sums the squared 4pi coefficients")
        void byHand() {
            RealCoefficients c = RealCoefficients.zeros(2, Normalization.FOUR_PI, CsPhase.EXCLUDED);
            c.setCoeffs(new double[] {1.0, 2.0, 3.0}, new int[] {0, 2, 2}, new int[] {0, 1, -2});
            assertArrayEquals(new double[] {1.0, 0.0, 13.0}, c.spectrum(), TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Units")
    class Units {

        @Test
        @DisplayName("per_lm divides per_l by 2l+1")
        void perLm() {
            RealCoefficients c = sample(6, 4);
            double[] perL = c.spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_L, BASE);
            double[] perLm = c.spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_LM, BASE);
            for (int l = 0; l <= 6; l++) assertEquals(perL[l] / (2 * l + 1), perLm[l], TOLERANCE);
        }

        @Test
        @DisplayName("per_dlogl multiplies per_l by l ln(base)")
        void perDlogl() {
            RealCoefficients c = sample(6, 5);
            double[] perL = c.spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_L, 2.0);
            double[] perLog = c.spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_DLOGL, 2.0);
            assertEquals(0.0, perLog[0], 0.0);
            for (int l = 1; l <= 6; l++) assertEquals(perL[l] * l * Math.log(2.0), perLog[l], TOLERANCE);
        }
    }

    @Nested
    @DisplayName("Cross spectra")
    class Cross {

        @Test
        @DisplayName("The cross spectrum of a set with itself is its power")
        void selfCross() {
            RealCoefficients c = sample(5, 6);
            assertArrayEquals(c.spectrum(),
                    SpectralAnalyzer.crossSpectrum(c, c, SpectrumConvention.POWER, SpectrumUnit.PER_L, BASE),
                    TOLERANCE);
        }

        @Test
        @DisplayName("Mismatched operands are rejected")
        void mismatched() {
            RealCoefficients a = sample(3, 7);
            assertThrows(IncompatibleOperandsException.class, () -> SpectralAnalyzer.crossSpectrum(
                    a, a.convert(Normalization.SCHMIDT, CsPhase.EXCLUDED),
                    SpectrumConvention.POWER, SpectrumUnit.PER_L, BASE));
            assertThrows(DimensionMismatchException.class, () -> SpectralAnalyzer.crossSpectrum(
                    a, sample(4, 8), SpectrumConvention.POWER, SpectrumUnit.PER_L, BASE));
        }
    }
}
