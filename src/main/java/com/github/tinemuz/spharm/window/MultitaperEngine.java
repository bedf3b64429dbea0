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
import com.github.tinemuz.spharm.ComplexCoefficients;
import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.backend.ShtBackend;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.spectrum.SpectralEstimate;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Localized spectral analysis with a {@link WindowBank}: expected biased
 * spectra, coupling matrices, and multitaper (cross-)power spectra.
 *
 * <p>Cap and mask banks use different backend entry points with the same
 * contract. Cap banks are rotated to the analysis centre when needed.</p>
 */
public final class MultitaperEngine {
    private static final Logger log = LoggerFactory.getLogger(MultitaperEngine.class);
    private static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    private final ShtBackend backend;

    public MultitaperEngine() {
        this(ShtBackends.get());
    }

    public MultitaperEngine(ShtBackend backend) {
        this.backend = backend;
    }

    /** Expected localized spectrum of a field with global power spectrum {@code power}. */
    public double[] biasedPowerSpectrum(WindowBank window, double[] power, int k) {
        return biasedPowerSpectrum(window, power, k, null);
    }

    /**
     * @param weights weights of the k tapers, or {@code null} for the bank default
     * @return spectrum of length power.length + lwin
     */
    public double[] biasedPowerSpectrum(WindowBank window, double[] power, int k, double[] weights) {
        checkK(window, k);
        double[] w = resolveWeights(window, weights, k);
        if (window instanceof CapWindowBank) {
            return backend.biasK(((CapWindowBank) window).tapersView(), power, k, w);
        }
        return backend.biasKMask(((MaskWindowBank) window).tapersView(), power, k, w);
    }

    /**
     * Matrix mapping a global power spectrum to the expected localized one.
     *
     * @param nwin    number of tapers to combine, or {@code null} for all
     * @param weights weights with {@code nwin} entries, or {@code null} for the bank default
     */
    public double[][] couplingMatrix(
            WindowBank window, int lmax, Integer nwin, double[] weights, CouplingMode mode) {
        int n = nwin == null ? window.nwin() : nwin;
        checkK(window, n);
        int lwin = window.lwin();
        if (mode == CouplingMode.VALID && lmax < lwin) {
            throw new DimensionMismatchException(
                    "VALID coupling needs lmax >= lwin = " + lwin + ". Input lmax was " + lmax + ".");
        }
        double[] w = weights;
        if (w == null) {
            w = window.weights();
            if (w != null && w.length != n) w = Arrays.copyOf(w, n);
        } else if (w.length != n) {
            throw new DimensionMismatchException(
                    "weights must have nwin = " + n + " entries. Input length was " + w.length + ".");
        }
        double[][] taperPower = taperPower(window, n);
        double[][] full = backend.couplingMatrix(lmax, taperPower, n, w);
        int rows = mode.rows(lmax, lwin);
        double[][] out = new double[rows][];
        for (int j = 0; j < rows; j++) out[j] = full[j].clone();
        return out;
    }

    /** Multitaper power spectrum estimate of {@code clm} from the first k tapers. */
    public SpectralEstimate multitaperPowerSpectrum(
            WindowBank window, CoefficientSet clm, int k, MultitaperOptions options) {
        checkK(window, k);
        int lmax = options.lmax() != null ? options.lmax() : clm.lmax();
        double[][][] cilm = canonical(clm, lmax);
        double[][] packed = packedTapers(window, k, options);
        double[] w = resolveWeights(window, options.taperWeights(), k);
        log.debug("Multitaper power spectrum lmax={} lwin={} k={}", lmax, window.lwin(), k);
        return backend.multitaperSE(cilm, packed, lmax, k, w);
    }

    /** Multitaper cross-power spectrum estimate of {@code clm} and {@code slm}. */
    public SpectralEstimate multitaperCrossPowerSpectrum(
            WindowBank window,
            CoefficientSet clm,
            CoefficientSet slm,
            int k,
            MultitaperOptions options) {
        checkK(window, k);
        int lmax = options.lmax() != null ? options.lmax() : Math.min(clm.lmax(), slm.lmax());
        double[][][] c1 = canonical(clm, lmax);
        double[][][] c2 = canonical(slm, lmax);
        double[][] packed = packedTapers(window, k, options);
        double[] w = resolveWeights(window, options.taperWeights(), k);
        log.debug("Multitaper cross spectrum lmax={} lwin={} k={}", lmax, window.lwin(), k);
        return backend.multitaperCSE(c1, c2, packed, lmax, k, w);
    }

    private double[][] packedTapers(WindowBank window, int k, MultitaperOptions options) {
        if (window instanceof CapWindowBank) {
            CapWindowBank cap = (CapWindowBank) window;
            cap.ensureCentered(options.clat(), options.clon(), options.coordDegrees(), k);
            return cap.rotatedTapers();
        }
        return ((MaskWindowBank) window).tapersView();
    }

    private double[][] taperPower(WindowBank window, int n) {
        double[][] power = new double[window.lwin() + 1][n];
        if (window instanceof CapWindowBank) {
            double[][] t = ((CapWindowBank) window).tapersView();
            for (int l = 0; l <= window.lwin(); l++) {
                for (int i = 0; i < n; i++) power[l][i] = t[l][i] * t[l][i];
            }
            return power;
        }
        for (int i = 0; i < n; i++) {
            double[] s = backend.powerSpectrum(window.toArray(i));
            for (int l = 0; l <= window.lwin(); l++) power[l][i] = s[l];
        }
        return power;
    }

    private static double[][][] canonical(CoefficientSet clm, int lmax) {
        RealCoefficients real = clm instanceof ComplexCoefficients
                ? ((ComplexCoefficients) clm).toReal(true)
                : (RealCoefficients) clm;
        return real.toArray(Normalization.FOUR_PI, CsPhase.EXCLUDED, lmax);
    }

    private static double[] resolveWeights(WindowBank window, double[] weights, int k) {
        double[] w;
        if (weights != null) {
            if (weights.length != k) {
                throw new DimensionMismatchException(
                        "taper weights must have k = " + k + " entries. Input length was "
                                + weights.length + ".");
            }
            w = weights.clone();
        } else {
            double[] stored = window.weights();
            if (stored == null) return null;
            w = Arrays.copyOf(stored, k);
        }
        double sum = 0.0;
        for (double v : w) sum += v;
        if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
            log.warn("Taper weights sum to {} rather than 1", sum);
        }
        return w;
    }

    private static void checkK(WindowBank window, int k) {
        if (k < 1 || k > window.nwin()) {
            throw new DimensionMismatchException(
                    "k must be between 1 and nwin = " + window.nwin() + ". Input value was " + k + ".");
        }
    }
}
