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
import com.github.tinemuz.spharm.convert.NormalizationConverter;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.spectrum.SpectralEstimate;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pure Java backend using direct summation over Legendre functions.
 *
 * <p>Transforms cost O(L^3) and rotations O(L^4), which is adequate up to
 * band limits of a few hundred. All work is done in 4pi normalization
 * without the Condon-Shortley phase; other conventions are converted at
 * the boundary.</p>
 */
public final class JavaShtBackend implements ShtBackend {
    private static final Logger log = LoggerFactory.getLogger(JavaShtBackend.class);

    @Override
    public double[][][] expandDh(double[][] grid, Normalization norm, CsPhase csphase) {
        int nlat = grid.length;
        DriscollHealy.checkShape(nlat, grid[0].length);
        int lmax = nlat / 2 - 1;
        double[][][] c = SphericalTransforms.analyze(
                grid, DriscollHealy.cosColatitudes(nlat), DriscollHealy.weights(nlat), lmax);
        return fromCanonical(c, norm, csphase);
    }

    @Override
    public Complex[][][] expandDhComplex(Complex[][] grid, Normalization norm, CsPhase csphase) {
        int nlat = grid.length;
        DriscollHealy.checkShape(nlat, grid[0].length);
        int lmax = nlat / 2 - 1;
        Complex[][][] c = SphericalTransforms.analyzeComplex(
                grid, DriscollHealy.cosColatitudes(nlat), DriscollHealy.weights(nlat), lmax);
        return NormalizationConverter.convert(
                c, Normalization.FOUR_PI, CsPhase.EXCLUDED, norm, csphase, lmax);
    }

    @Override
    public double[][][] expandGlq(
            double[][] grid, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase) {
        checkGlqShape(grid.length, grid[0].length, nodes);
        double[][][] c =
                SphericalTransforms.analyze(grid, nodes.zeros(), nodes.weights(), nodes.lmax());
        return fromCanonical(c, norm, csphase);
    }

    @Override
    public Complex[][][] expandGlqComplex(
            Complex[][] grid, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase) {
        checkGlqShape(grid.length, grid[0].length, nodes);
        Complex[][][] c = SphericalTransforms.analyzeComplex(
                grid, nodes.zeros(), nodes.weights(), nodes.lmax());
        return NormalizationConverter.convert(
                c, Normalization.FOUR_PI, CsPhase.EXCLUDED, norm, csphase, nodes.lmax());
    }

    @Override
    public double[][] makeGridDh(
            double[][][] cilm, int sampling, Normalization norm, CsPhase csphase) {
        int nlat = 2 * cilm[0].length;
        return SphericalTransforms.synthesize(
                toCanonical(cilm, norm, csphase),
                DriscollHealy.cosColatitudes(nlat),
                nlat * checkSampling(sampling));
    }

    @Override
    public Complex[][] makeGridDhComplex(
            Complex[][][] cilm, int sampling, Normalization norm, CsPhase csphase) {
        int lmax = cilm[0].length - 1;
        int nlat = 2 * (lmax + 1);
        Complex[][][] c = NormalizationConverter.convert(
                cilm, norm, csphase, Normalization.FOUR_PI, CsPhase.EXCLUDED, lmax);
        return SphericalTransforms.synthesizeComplex(
                c, DriscollHealy.cosColatitudes(nlat), nlat * checkSampling(sampling));
    }

    @Override
    public double[][] makeGridGlq(
            double[][][] cilm, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase) {
        return SphericalTransforms.synthesize(
                toCanonical(cilm, norm, csphase), nodes.zeros(), 2 * nodes.lmax() + 1);
    }

    @Override
    public Complex[][] makeGridGlqComplex(
            Complex[][][] cilm, GaussLegendreQuadrature nodes, Normalization norm, CsPhase csphase) {
        int lmax = cilm[0].length - 1;
        Complex[][][] c = NormalizationConverter.convert(
                cilm, norm, csphase, Normalization.FOUR_PI, CsPhase.EXCLUDED, lmax);
        return SphericalTransforms.synthesizeComplex(c, nodes.zeros(), 2 * nodes.lmax() + 1);
    }

    @Override
    public GaussLegendreQuadrature gaussLegendre(int lmax) {
        if (lmax < 0) {
            throw new DimensionMismatchException("lmax must be non-negative. Input value was " + lmax + ".");
        }
        return GaussLegendre.nodes(lmax);
    }

    @Override
    public RotationKernel rotationKernel(int lmax) {
        return new RotationKernel(lmax, gaussLegendre(lmax));
    }

    @Override
    public double[][][] rotateRealCoef(
            double[][][] cilm, double[] anglesRadians, RotationKernel kernel) {
        int lmax = cilm[0].length - 1;
        if (kernel.lmax() < lmax) {
            throw new DimensionMismatchException(
                    "Rotation kernel supports lmax " + kernel.lmax()
                            + " but coefficients have lmax " + lmax + ".");
        }
        log.debug("Rotating lmax {} by ({}, {}, {}) rad", lmax,
                anglesRadians[0], anglesRadians[1], anglesRadians[2]);
        // Body rotation B = Rz(-gamma) Ry(-beta) Rz(-alpha); the rotated field at r is f(B^T r)
        double[][] b = multiply(
                multiply(rz(-anglesRadians[2]), ry(-anglesRadians[1])), rz(-anglesRadians[0]));
        GaussLegendreQuadrature q = kernel.quadrature();
        int nlon = 2 * kernel.lmax() + 1;
        double[][] grid = new double[q.zeros().length][nlon];
        double[][] p = new double[lmax + 1][lmax + 1];
        for (int i = 0; i < q.zeros().length; i++) {
            double z = q.zeros()[i];
            double s = Math.sqrt(Math.max(0.0, 1.0 - z * z));
            for (int j = 0; j < nlon; j++) {
                double phi = 2.0 * Math.PI * j / nlon;
                double x = s * Math.cos(phi);
                double y = s * Math.sin(phi);
                double xr = b[0][0] * x + b[1][0] * y + b[2][0] * z;
                double yr = b[0][1] * x + b[1][1] * y + b[2][1] * z;
                double zr = b[0][2] * x + b[1][2] * y + b[2][2] * z;
                zr = Math.max(-1.0, Math.min(1.0, zr));
                grid[i][j] = SphericalTransforms.evaluate(cilm, p, zr, Math.atan2(yr, xr));
            }
        }
        return SphericalTransforms.analyze(grid, q.zeros(), q.weights(), lmax);
    }

    @Override
    public CapTaperSet capTapers(double thetaRadians, int lwin) {
        log.debug("Solving cap concentration problem theta={} rad lwin={}", thetaRadians, lwin);
        return TaperSolver.cap(thetaRadians, lwin);
    }

    @Override
    public MaskTaperSet maskTapers(boolean[][] dhMask, int lwin, int ntapers) {
        int size = (lwin + 1) * (lwin + 1);
        if (ntapers < 1 || ntapers > size) {
            throw new DimensionMismatchException(
                    "ntapers must be between 1 and (lwin+1)^2 = " + size
                            + ". Input value was " + ntapers + ".");
        }
        log.debug("Solving mask concentration problem lwin={} on {}x{} grid",
                lwin, dhMask.length, dhMask[0].length);
        return TaperSolver.mask(dhMask, lwin, ntapers);
    }

    @Override
    public double[] powerSpectrum(double[][][] cilm) {
        int n = cilm[0].length;
        double[] s = new double[n];
        for (int l = 0; l < n; l++) {
            for (int m = 0; m <= l; m++) {
                s[l] += cilm[0][l][m] * cilm[0][l][m] + cilm[1][l][m] * cilm[1][l][m];
            }
        }
        return s;
    }

    @Override
    public double[] powerSpectrum(Complex[][][] cilm) {
        int n = cilm[0].length;
        double[] s = new double[n];
        for (int l = 0; l < n; l++) {
            for (int m = 0; m <= l; m++) {
                double a = cilm[0][l][m].abs();
                s[l] += a * a;
                if (m > 0) {
                    double b = cilm[1][l][m].abs();
                    s[l] += b * b;
                }
            }
        }
        return s;
    }

    @Override
    public double[][] couplingMatrix(int lmax, double[][] taperPower, int k, double[] weights) {
        return Coupling.matrix(lmax, taperPower, k, weights);
    }

    @Override
    public double[] biasK(double[][] tapers, double[] power, int k, double[] weights) {
        double[][] taperPower = new double[tapers.length][k];
        for (int l = 0; l < tapers.length; l++) {
            for (int i = 0; i < k; i++) taperPower[l][i] = tapers[l][i] * tapers[l][i];
        }
        return Coupling.apply(
                Coupling.matrix(power.length - 1, taperPower, k, weights), power);
    }

    @Override
    public double[] biasKMask(double[][] packedTapers, double[] power, int k, double[] weights) {
        int lwin = PackedVectors.lmaxOf(packedTapers.length);
        double[][] taperPower = new double[lwin + 1][k];
        for (int i = 0; i < k; i++) {
            double[] s = powerSpectrum(PackedVectors.column(packedTapers, i));
            for (int l = 0; l <= lwin; l++) taperPower[l][i] = s[l];
        }
        return Coupling.apply(
                Coupling.matrix(power.length - 1, taperPower, k, weights), power);
    }

    @Override
    public SpectralEstimate multitaperSE(
            double[][][] cilm, double[][] packedTapers, int lmax, int k, double[] weights) {
        return MultitaperEstimator.estimate(cilm, cilm, packedTapers, lmax, k, weights);
    }

    @Override
    public SpectralEstimate multitaperCSE(
            double[][][] cilm1,
            double[][][] cilm2,
            double[][] packedTapers,
            int lmax,
            int k,
            double[] weights) {
        return MultitaperEstimator.estimate(cilm1, cilm2, packedTapers, lmax, k, weights);
    }

    @Override
    public double[] cilmToVector(double[][][] cilm) {
        return PackedVectors.toVector(cilm);
    }

    @Override
    public double[][][] vectorToCilm(double[] vector) {
        return PackedVectors.toCilm(vector);
    }

    private static double[][][] toCanonical(double[][][] cilm, Normalization norm, CsPhase cs) {
        if (norm == Normalization.FOUR_PI && cs == CsPhase.EXCLUDED) return cilm;
        return NormalizationConverter.convert(
                cilm, norm, cs, Normalization.FOUR_PI, CsPhase.EXCLUDED, cilm[0].length - 1);
    }

    private static double[][][] fromCanonical(double[][][] cilm, Normalization norm, CsPhase cs) {
        if (norm == Normalization.FOUR_PI && cs == CsPhase.EXCLUDED) return cilm;
        return NormalizationConverter.convert(
                cilm, Normalization.FOUR_PI, CsPhase.EXCLUDED, norm, cs, cilm[0].length - 1);
    }

    private static int checkSampling(int sampling) {
        if (sampling != 1 && sampling != 2) {
            throw new DimensionMismatchException(
                    "DH sampling must be 1 or 2. Input value was " + sampling + ".");
        }
        return sampling;
    }

    private static void checkGlqShape(int nlat, int nlon, GaussLegendreQuadrature nodes) {
        if (nlat != nodes.zeros().length || nlon != 2 * nodes.lmax() + 1) {
            throw new DimensionMismatchException(
                    "GLQ grid for lmax " + nodes.lmax() + " must be " + nodes.zeros().length
                            + " x " + (2 * nodes.lmax() + 1) + ". Input shape was ("
                            + nlat + ", " + nlon + ").");
        }
    }

    private static double[][] rz(double a) {
        double c = Math.cos(a);
        double s = Math.sin(a);
        return new double[][] {{c, -s, 0}, {s, c, 0}, {0, 0, 1}};
    }

    private static double[][] ry(double b) {
        double c = Math.cos(b);
        double s = Math.sin(b);
        return new double[][] {{c, 0, s}, {0, 1, 0}, {-s, 0, c}};
    }

    private static double[][] multiply(double[][] a, double[][] b) {
        double[][] out = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                for (int k = 0; k < 3; k++) out[i][j] += a[i][k] * b[k][j];
            }
        }
        return out;
    }
}
