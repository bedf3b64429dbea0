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

import com.github.tinemuz.spharm.CoefficientSet;
import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.GridScheme;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.RealGrid;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.config.SpharmConfig;
import com.github.tinemuz.spharm.spectrum.SpectralAnalyzer;
import com.github.tinemuz.spharm.spectrum.SpectralEstimate;
import com.github.tinemuz.spharm.spectrum.SpectrumConvention;
import com.github.tinemuz.spharm.spectrum.SpectrumUnit;

/**
 * A bank of band-limited tapers concentrated within a region, ordered by
 * decreasing concentration factor.
 *
 * <p>Taper coefficients are real, 4pi normalized and exclude the
 * Condon-Shortley phase unless other conventions are requested.</p>
 */
public sealed interface WindowBank permits CapWindowBank, MaskWindowBank {

    WindowKind kind();

    /** Band limit of the tapers. */
    int lwin();

    /** Number of tapers retained, at most (lwin+1)^2. */
    int nwin();

    /** Concentration factors, descending. */
    double[] eigenvalues();

    /** Default taper weights, or {@code null} for equal weighting. */
    double[] weights();

    WindowBank copy();

    /**
     * Coefficients of taper {@code itaper}.
     *
     * @throws IndexOutOfBoundsException if the taper is not available
     */
    double[][][] toArray(int itaper, Normalization normalization, CsPhase csphase);

    default double[][][] toArray(int itaper) {
        return toArray(itaper, Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    default int[] degrees() {
        int[] d = new int[lwin() + 1];
        for (int l = 0; l < d.length; l++) d[l] = l;
        return d;
    }

    /** Number of tapers whose concentration factor is at least {@code alpha}. */
    default int number(double alpha) {
        int n = 0;
        for (double e : eigenvalues()) {
            if (e >= alpha) n++;
        }
        return n;
    }

    default RealCoefficients coefficients(int itaper, Normalization normalization, CsPhase csphase) {
        return RealCoefficients.adopt(toArray(itaper, normalization, csphase), normalization, csphase);
    }

    default RealCoefficients coefficients(int itaper) {
        return coefficients(itaper, Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    default RealGrid grid(int itaper, GridScheme scheme) {
        return coefficients(itaper).expand(scheme);
    }

    default double[][] toGrid(int itaper, GridScheme scheme) {
        return grid(itaper, scheme).data();
    }

    default double[][] toGrid(int itaper) {
        return toGrid(itaper, GridScheme.DH2);
    }

    /** Power (or energy) spectrum of one taper. */
    default double[] powerSpectrum(int itaper, SpectrumUnit unit, double base, boolean energy) {
        double[] l2 = ShtBackends.get().powerSpectrum(toArray(itaper));
        return SpectralAnalyzer.scale(l2, Normalization.FOUR_PI,
                energy ? SpectrumConvention.ENERGY : SpectrumConvention.POWER, unit, base);
    }

    /** Spectra of the first {@code count} tapers, indexed {@code [degree][taper]}. */
    default double[][] powerSpectra(int count, SpectrumUnit unit, double base, boolean energy) {
        double[][] out = new double[lwin() + 1][count];
        for (int i = 0; i < count; i++) {
            double[] s = powerSpectrum(i, unit, base, energy);
            for (int l = 0; l <= lwin(); l++) out[l][i] = s[l];
        }
        return out;
    }

    default double[][] powerSpectra() {
        return powerSpectra(nwin(), SpectrumUnit.PER_L, SpharmConfig.spectrumBase(), false);
    }

    default double[][] couplingMatrix(int lmax, CouplingMode mode) {
        return new MultitaperEngine().couplingMatrix(this, lmax, nwin(), weights(), mode);
    }

    default double[] biasedPowerSpectrum(double[] power, int k) {
        return new MultitaperEngine().biasedPowerSpectrum(this, power, k);
    }

    default SpectralEstimate multitaperPowerSpectrum(CoefficientSet clm, int k) {
        return new MultitaperEngine().multitaperPowerSpectrum(this, clm, k, MultitaperOptions.defaults());
    }

    default SpectralEstimate multitaperCrossPowerSpectrum(
            CoefficientSet clm, CoefficientSet slm, int k) {
        return new MultitaperEngine()
                .multitaperCrossPowerSpectrum(this, clm, slm, k, MultitaperOptions.defaults());
    }
}
