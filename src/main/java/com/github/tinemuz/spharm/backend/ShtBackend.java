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

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.spectrum.SpectralEstimate;

import org.apache.commons.math3.complex.Complex;

/**
 * Numerical primitives used by the library: spherical harmonic transforms,
 * quadrature, rotation, taper generation and spectral estimators.
 *
 * <p>Coefficient arrays have shape (2, lmax+1, lmax+1). Index 0 of the first
 * dimension holds cosine (real) or positive-order (complex) terms; index 1
 * holds sine or negative-order terms. Grids are indexed
 * {@code [latitude][longitude]} starting at the north pole and longitude 0.
 * Real coefficient arrays passed to rotation, taper and estimator methods
 * use 4pi normalization without the Condon-Shortley phase.</p>
 *
 * <p>Implementations must not modify their arguments.</p>
 */
public interface ShtBackend {

    /** Forward transform of a real Driscoll-Healy grid (nlon = nlat or 2 nlat). */
    double[][][] expandDh(double[][] grid, Normalization norm, CsPhase csphase);

    /** Forward transform of a complex Driscoll-Healy grid. */
    Complex[][][] expandDhComplex(Complex[][] grid, Normalization norm, CsPhase csphase);

    /** Forward transform of a real grid sampled on the given Gauss-Legendre nodes. */
    double[][][] expandGlq(
            double[][] grid, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase);

    /** Forward transform of a complex grid sampled on the given Gauss-Legendre nodes. */
    Complex[][][] expandGlqComplex(
            Complex[][] grid, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase);

    /** Real Driscoll-Healy grid with 2(lmax+1) latitudes and {@code sampling} times as many longitudes. */
    double[][] makeGridDh(double[][][] cilm, int sampling, Normalization norm, CsPhase csphase);

    /** Complex Driscoll-Healy grid. */
    Complex[][] makeGridDhComplex(
            Complex[][][] cilm, int sampling, Normalization norm, CsPhase csphase);

    /** Real grid on the Gauss-Legendre nodes, 2 lmax + 1 longitudes where lmax is that of the nodes. */
    double[][] makeGridGlq(
            double[][][] cilm, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase);

    /** Complex grid on the Gauss-Legendre nodes. */
    Complex[][] makeGridGlqComplex(
            Complex[][][] cilm, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase);

    /** Gauss-Legendre nodes and weights exact for band limit {@code lmax}. */
    GaussLegendreQuadrature gaussLegendre(int lmax);

    /** Structure reused by {@link #rotateRealCoef} for fields up to {@code lmax}. */
    RotationKernel rotationKernel(int lmax);

    /**
     * Rotate the coordinate frame by Euler angles (alpha, beta, gamma) in
     * radians, y convention: alpha about z, beta about the new y, gamma about
     * the new z.
     */
    double[][][] rotateRealCoef(double[][][] cilm, double[] anglesRadians, RotationKernel kernel);

    /** Tapers concentrated within a polar cap of half angle {@code thetaRadians}. */
    CapTaperSet capTapers(double thetaRadians, int lwin);

    /** The {@code ntapers} best concentrated tapers within a Driscoll-Healy region mask. */
    MaskTaperSet maskTapers(boolean[][] dhMask, int lwin, int ntapers);

    /** Power per degree of real coefficients, as if 4pi normalized. */
    double[] powerSpectrum(double[][][] cilm);

    /** Sum of squared magnitudes per degree of complex coefficients. */
    double[] powerSpectrum(Complex[][][] cilm);

    /**
     * Matrix relating the global spectrum to the expected localized spectrum,
     * {@code lmax + lwin + 1} rows by {@code lmax + 1} columns.
     *
     * @param taperPower power spectra of the tapers, {@code taperPower[l][i]}
     * @param k          number of tapers to combine
     * @param weights    taper weights, or {@code null} for equal weights
     */
    double[][] couplingMatrix(int lmax, double[][] taperPower, int k, double[] weights);

    /** Expected localized spectrum for degree-wise cap tapers. */
    double[] biasK(double[][] tapers, double[] power, int k, double[] weights);

    /** Expected localized spectrum for packed mask tapers. */
    double[] biasKMask(double[][] packedTapers, double[] power, int k, double[] weights);

    /** Localized multitaper power spectrum of {@code cilm} up to degree lmax - lwin. */
    SpectralEstimate multitaperSE(
            double[][][] cilm, double[][] packedTapers, int lmax, int k, double[] weights);

    /** Localized multitaper cross-power spectrum. */
    SpectralEstimate multitaperCSE(
            double[][][] cilm1,
            double[][][] cilm2,
            double[][] packedTapers,
            int lmax,
            int k,
            double[] weights);

    /** Pack coefficients into a vector indexed by l^2 + i l + m. */
    double[] cilmToVector(double[][][] cilm);

    /** Inverse of {@link #cilmToVector}; the length must be a perfect square. */
    double[][][] vectorToCilm(double[] vector);
}
