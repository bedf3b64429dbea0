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
package com.github.tinemuz.spharm.window;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import com.github.tinemuz.spharm.spectrum.SpectralEstimate;
import java.util.Arrays;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MultitaperEngineTest {

    private static final double TOLERANCE = 1e-9;
    private static final int LWIN = 3;
    private static final int LMAX = 5;

    private final MultitaperEngine engine = new MultitaperEngine();

    private static CapWindowBank cap() {
        return CapWindowBank.of(40.0, LWIN);
    }

    private static RealCoefficients constantField(int lmax) {
        RealCoefficients c = RealCoefficients.zeros(lmax, Normalization.FOUR_PI, CsPhase.EXCLUDED);
        c.setCoeff(1.0, 0, 0);
        return c;
    }

    private static RealCoefficients randomField(int lmax, long seed) {
        double[] power = new double[lmax + 1];
        for (int l = 0; l <= lmax; l++) power[l] = 1.0;
        return RealCoefficients.random(power, Normalization.FOUR_PI, CsPhase.EXCLUDED, false,
                new Well19937c(seed));
    }

    @Nested
    @DisplayName("Coupling matrix")
    class CouplingMatrix {

        @Test
        @DisplayName("Row counts follow the mode")
        void rows() {
            CapWindowBank bank = cap();
            assertEquals(9, engine.couplingMatrix(bank, LMAX, null, null, CouplingMode.FULL).length);
            assertEquals(6, engine.couplingMatrix(bank, LMAX, null, null, CouplingMode.SAME).length);
            double[][] valid = engine.couplingMatrix(bank, LMAX, null, null, CouplingMode.VALID);
            assertEquals(3, valid.length);
            assertEquals(LMAX + 1, valid[0].length);
        }

        @Test
        @DisplayName("Full columns sum to one")
        void columnsSumToOne() {
            double[][] m = cap().couplingMatrix(LMAX, CouplingMode.FULL);
            for (int l = 0; l <= LMAX; l++) {
                double s = 0.0;
                for (double[] row : m) s += row[l];
                assertEquals(1.0, s, TOLERANCE, "column " + l);
            }
        }

        @Test
        @DisplayName("Weights must match the number of tapers")
        void weightLength() {
            CapWindowBank bank = cap();
            assertThrows(DimensionMismatchException.class,
                    () -> engine.couplingMatrix(bank, LMAX, 3, new double[] {0.5, 0.5}, CouplingMode.FULL));
            assertThrows(DimensionMismatchException.class,
                    () -> engine.couplingMatrix(bank, 2, null, null, CouplingMode.VALID));
            assertThrows(DimensionMismatchException.class,
                    () -> engine.couplingMatrix(bank, LMAX, 17, null, CouplingMode.FULL));
        }
    }

    @Nested
    @DisplayName("Biased spectrum")
    class Biased {

        @Test
        @DisplayName("The output extends the input by lwin degrees")
        void length() {
            double[] power = {1.0, 0.5, 0.25, 0.125, 0.0625};
            assertEquals(power.length + LWIN, cap().biasedPowerSpectrum(power, 4).length);
        }

        @Test
        @DisplayName("A constant field shows the taper power")
        void constantField() {
            CapWindowBank bank = cap();
            double[] biased = bank.biasedPowerSpectrum(new double[] {1.0}, 1);
            double[][] spectra = bank.powerSpectra();
            for (int l = 0; l <= LWIN; l++) assertEquals(spectra[l][0], biased[l], TOLERANCE);
        }

        @Test
        @DisplayName("k must lie in 1..nwin")
        void kRange() {
            CapWindowBank bank = CapWindowBank.builder(40.0, LWIN).nwin(4).build();
            assertThrows(DimensionMismatchException.class, () -> bank.biasedPowerSpectrum(new double[] {1.0}, 0));
            assertThrows(DimensionMismatchException.class, () -> bank.biasedPowerSpectrum(new double[] {1.0}, 5));
        }

        @Test
        @DisplayName("Mask windows use their taper spectra")
        void mask() {
            boolean[][] all = new boolean[8][16];
            for (boolean[] row : all) Arrays.fill(row, true);
            MaskWindowBank bank = MaskWindowBank.fromMask(all, 1);
            double[] power = {1.0, 2.0, 3.0};
            double[] biased = bank.biasedPowerSpectrum(power, 1);
            assertEquals(4, biased.length);
        }
    }

    @Nested
    @DisplayName("Multitaper estimates")
    class Estimates {

        @Test
        @DisplayName("Estimates have lmax - lwin + 1 degrees")
        void length() {
            SpectralEstimate est = cap().multitaperPowerSpectrum(randomField(LMAX, 1), 3);
            assertEquals(LMAX - LWIN + 1, est.size());
            assertEquals(LMAX - LWIN + 1, est.standardError().length);
        }

        @Test
        @DisplayName("One taper has no standard error")
        void singleTaper() {
            SpectralEstimate est = cap().multitaperPowerSpectrum(randomField(LMAX, 2), 1);
            for (double sd : est.standardError()) assertEquals(0.0, sd, 0.0);
        }

        @Test
        @DisplayName("A constant field localized at the pole returns the taper power")
        void constantAtPole() {
            CapWindowBank bank = CapWindowBank.of(40.0, LWIN);
            SpectralEstimate est = bank.multitaperPowerSpectrum(constantField(2 * LWIN), 1);
            assertEquals(90.0, bank.clat().getAsDouble(), 0.0);
            double[][] spectra = bank.powerSpectra();
            for (int l = 0; l <= LWIN; l++) assertEquals(spectra[l][0], est.estimate()[l], TOLERANCE);
        }

        @Test
        @DisplayName("The cross spectrum of a field with itself is its power spectrum")
        void selfCross() {
            CapWindowBank bank = cap();
            RealCoefficients f = randomField(LMAX, 3);
            SpectralEstimate power = bank.multitaperPowerSpectrum(f, 4);
            SpectralEstimate cross = bank.multitaperCrossPowerSpectrum(f, f, 4);
            assertArrayEquals(power.estimate(), cross.estimate(), TOLERANCE);
            assertArrayEquals(power.standardError(), cross.standardError(), TOLERANCE);
        }

        @Test
        @DisplayName("Complex input is analysed through its real form")
        void complexInput() {
            RealCoefficients f = randomField(LMAX, 4);
            SpectralEstimate fromReal = cap().multitaperPowerSpectrum(f, 2);
            SpectralEstimate fromComplex = cap().multitaperPowerSpectrum(f.toComplex(), 2);
            assertArrayEquals(fromReal.estimate(), fromComplex.estimate(), TOLERANCE);
        }

        @Test
        @DisplayName("Options select the band limit, weights and centre")
        void options() {
            CapWindowBank bank = cap();
            RealCoefficients f = randomField(LMAX + 2, 5);
            MultitaperOptions options = MultitaperOptions.defaults()
                    .withLmax(LMAX)
                    .withTaperWeights(new double[] {0.5, 0.5})
                    .withCenter(-20.0, 45.0);
            SpectralEstimate est = engine.multitaperPowerSpectrum(bank, f, 2, options);
            assertEquals(LMAX - LWIN + 1, est.size());
            assertEquals(-20.0, bank.clat().getAsDouble(), 0.0);
            assertEquals(45.0, bank.clon().getAsDouble(), 0.0);
            assertThrows(DimensionMismatchException.class, () -> engine.multitaperPowerSpectrum(
                    bank, f, 2, MultitaperOptions.defaults().withTaperWeights(new double[] {1.0})));
        }

        @Test
        @DisplayName("A centre with only one coordinate is rejected")
        void halfCentre() {
            MultitaperOptions options = new MultitaperOptions(null, null, 10.0, null, true);
            assertThrows(InvalidOptionException.class,
                    () -> engine.multitaperPowerSpectrum(cap(), randomField(LMAX, 6), 1, options));
        }

        @Test
        @DisplayName("Data below the window bandwidth is rejected")
        void lmaxBelowLwin() {
            assertThrows(DimensionMismatchException.class,
                    () -> cap().multitaperPowerSpectrum(randomField(LWIN - 1, 7), 1));
        }
    }
}
