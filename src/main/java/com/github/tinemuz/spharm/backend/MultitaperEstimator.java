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

import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.spectrum.SpectralEstimate;

/**
 * Localized spectra from packed tapers. Each taper multiplies the field on a
 * Gauss-Legendre grid fine enough to hold the product exactly; the estimate
 * is the weighted mean of the per-taper spectra.
 */
final class MultitaperEstimator {
    private MultitaperEstimator() {}

    static SpectralEstimate estimate(
            double[][][] cilm1, double[][][] cilm2, double[][] packed, int lmax, int k,
            double[] weights) {
        int lwin = PackedVectors.lmaxOf(packed.length);
        if (lmax < lwin) {
            throw new DimensionMismatchException(
                    "lmax must be at least lwin = " + lwin + ". Input value was " + lmax + ".");
        }
        if (k < 1 || k > packed[0].length) {
            throw new DimensionMismatchException(
                    "k must be between 1 and " + packed[0].length + ". Input value was " + k + ".");
        }
        double[] w = Coupling.Weights.resolve(weights, k);
        int lout = lmax - lwin;
        int lgrid = lmax + lwin;
        GaussLegendreQuadrature q = GaussLegendre.nodes(lgrid);
        int nlon = 2 * lgrid + 1;
        double[][] f1 = SphericalTransforms.synthesize(resized(cilm1, lmax), q.zeros(), nlon);
        double[][] f2 =
                cilm2 == cilm1
                        ? f1
                        : SphericalTransforms.synthesize(resized(cilm2, lmax), q.zeros(), nlon);

        double[][] spectra = new double[k][];
        for (int i = 0; i < k; i++) {
            double[][] h = SphericalTransforms.synthesize(
                    PackedVectors.column(packed, i), q.zeros(), nlon);
            double[][][] a = localized(f1, h, q, lout);
            double[][][] b = f2 == f1 ? a : localized(f2, h, q, lout);
            spectra[i] = cross(a, b);
        }

        double[] mean = new double[lout + 1];
        for (int i = 0; i < k; i++) {
            for (int l = 0; l <= lout; l++) mean[l] += w[i] * spectra[i][l];
        }
        double[] sd = new double[lout + 1];
        double sumW2 = 0.0;
        for (int i = 0; i < k; i++) sumW2 += w[i] * w[i];
        if (k > 1 && sumW2 < 1.0) {
            for (int l = 0; l <= lout; l++) {
                double s = 0.0;
                for (int i = 0; i < k; i++) {
                    double d = spectra[i][l] - mean[l];
                    s += w[i] * w[i] * d * d;
                }
                sd[l] = Math.sqrt(s / (1.0 - sumW2));
            }
        }
        return new SpectralEstimate(mean, sd);
    }

    private static double[][][] localized(
            double[][] field, double[][] taper, GaussLegendreQuadrature q, int lout) {
        double[][] product = new double[field.length][field[0].length];
        for (int r = 0; r < field.length; r++) {
            for (int c = 0; c < field[0].length; c++) product[r][c] = field[r][c] * taper[r][c];
        }
        return SphericalTransforms.analyze(product, q.zeros(), q.weights(), lout);
    }

    private static double[] cross(double[][][] a, double[][][] b) {
        int n = a[0].length;
        double[] s = new double[n];
        for (int l = 0; l < n; l++) {
            for (int m = 0; m <= l; m++) {
                s[l] += a[0][l][m] * b[0][l][m] + a[1][l][m] * b[1][l][m];
            }
        }
        return s;
    }

    // Truncate or zero-pad to the requested band limit
    static double[][][] resized(double[][][] cilm, int lmax) {
        int n = cilm[0].length;
        if (n == lmax + 1) return cilm;
        double[][][] out = new double[2][lmax + 1][lmax + 1];
        int keep = Math.min(n, lmax + 1);
        for (int k = 0; k < 2; k++) {
            for (int l = 0; l < keep; l++) System.arraycopy(cilm[k][l], 0, out[k][l], 0, keep);
        }
        return out;
    }
}
