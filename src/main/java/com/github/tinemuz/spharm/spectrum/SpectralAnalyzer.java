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

import com.github.tinemuz.spharm.CoefficientSet;
import com.github.tinemuz.spharm.ComplexCoefficients;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.IncompatibleOperandsException;

/**
 * Spectra of coefficient sets.
 *
 * <p>The l2 norm of degree l is the sum of squared magnitudes of its
 * coefficients. Power divides it by the mean square of the basis functions
 * (1 for 4pi, 1/(2l+1) for Schmidt, 1/(4pi) for orthonormal), so it does not
 * depend on the normalization. Energy is 4pi times power.</p>
 */
public final class SpectralAnalyzer {
    private SpectralAnalyzer() {}

    public static double[] spectrum(
            CoefficientSet coeffs, SpectrumConvention convention, SpectrumUnit unit, double base) {
        double[] l2 = coeffs instanceof RealCoefficients
                ? ShtBackends.get().powerSpectrum(((RealCoefficients) coeffs).toArray())
                : ShtBackends.get().powerSpectrum(((ComplexCoefficients) coeffs).toArray());
        return scale(l2, coeffs.normalization(), convention, unit, base);
    }

    /** Cross spectrum of two real sets sharing normalization, phase and band limit. */
    public static double[] crossSpectrum(
            RealCoefficients a,
            RealCoefficients b,
            SpectrumConvention convention,
            SpectrumUnit unit,
            double base) {
        if (a.normalization() != b.normalization() || a.csphase() != b.csphase()) {
            throw new IncompatibleOperandsException(
                    "cross spectra need matching normalization and csphase.");
        }
        if (a.lmax() != b.lmax()) {
            throw new DimensionMismatchException(
                    "band limits differ: " + a.lmax() + " and " + b.lmax() + ".");
        }
        double[][][] x = a.toArray();
        double[][][] y = b.toArray();
        double[] l2 = new double[a.lmax() + 1];
        for (int l = 0; l <= a.lmax(); l++) {
            for (int m = 0; m <= l; m++) {
                l2[l] += x[0][l][m] * y[0][l][m] + x[1][l][m] * y[1][l][m];
            }
        }
        return scale(l2, a.normalization(), convention, unit, base);
    }

    /**
     * Apply a convention and unit to a per-degree l2 norm of coefficients in
     * the given normalization.
     */
    public static double[] scale(
            double[] l2norm,
            Normalization normalization,
            SpectrumConvention convention,
            SpectrumUnit unit,
            double base) {
        double[] out = new double[l2norm.length];
        for (int l = 0; l < out.length; l++) {
            double v = l2norm[l];
            if (convention != SpectrumConvention.L2NORM) {
                switch (normalization) {
                    case SCHMIDT:
                        v /= 2.0 * l + 1.0;
                        break;
                    case ORTHONORMAL:
                        v /= 4.0 * Math.PI;
                        break;
                    default:
                        break;
                }
                if (convention == SpectrumConvention.ENERGY) v *= 4.0 * Math.PI;
            }
            switch (unit) {
                case PER_LM:
                    v /= 2.0 * l + 1.0;
                    break;
                case PER_DLOGL:
                    v *= l * Math.log(base);
                    break;
                default:
                    break;
            }
            out[l] = v;
        }
        return out;
    }
}
