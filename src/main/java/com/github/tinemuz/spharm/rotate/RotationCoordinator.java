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
package com.github.tinemuz.spharm.rotate;

import com.github.tinemuz.spharm.CoefficientSet;
import com.github.tinemuz.spharm.ComplexCoefficients;
import com.github.tinemuz.spharm.ComplexGrid;
import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.GridScheme;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.RealGrid;
import com.github.tinemuz.spharm.backend.RotationKernel;
import com.github.tinemuz.spharm.backend.ShtBackend;
import com.github.tinemuz.spharm.backend.ShtBackends;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rotates coefficient sets of either kind in any convention.
 *
 * <p>Real coefficients are rotated by the backend in 4pi normalization
 * without the Condon-Shortley phase and converted back. Complex
 * coefficients are expanded on a DH grid, their real and imaginary parts
 * rotated separately, and the result expanded again.</p>
 */
public final class RotationCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RotationCoordinator.class);

    private final ShtBackend backend;

    public RotationCoordinator() {
        this(ShtBackends.get());
    }

    public RotationCoordinator(ShtBackend backend) {
        this.backend = backend;
    }

    /**
     * @param kernel precomputed rotation structure, or {@code null} to build one
     */
    public CoefficientSet rotate(CoefficientSet coeffs, EulerAngles angles, RotationKernel kernel) {
        if (coeffs instanceof RealCoefficients) {
            return rotate((RealCoefficients) coeffs, angles, kernel);
        }
        return rotate((ComplexCoefficients) coeffs, angles, kernel);
    }

    public RealCoefficients rotate(RealCoefficients coeffs, EulerAngles angles, RotationKernel kernel) {
        if (angles.isZero()) return coeffs.copy();
        int lmax = coeffs.lmax();
        double[][][] canonical = coeffs.toArray(Normalization.FOUR_PI, CsPhase.EXCLUDED, lmax);
        double[][][] rotated = rotateCanonical(canonical, angles, kernel);
        return RealCoefficients.adopt(rotated, Normalization.FOUR_PI, CsPhase.EXCLUDED)
                .convert(coeffs.normalization(), coeffs.csphase());
    }

    public ComplexCoefficients rotate(
            ComplexCoefficients coeffs, EulerAngles angles, RotationKernel kernel) {
        if (angles.isZero()) return coeffs.copy();
        log.debug("Rotating complex coefficients lmax={} through real and imaginary grids",
                coeffs.lmax());
        ComplexGrid grid = coeffs.expand(GridScheme.DH1);
        RealCoefficients re = grid.real().expand();
        RealCoefficients im = grid.imaginary().expand();
        RotationKernel k = kernel != null ? kernel : backend.rotationKernel(coeffs.lmax());
        RealGrid reRot = rotate(re, angles, k).expand(GridScheme.DH1);
        RealGrid imRot = rotate(im, angles, k).expand(GridScheme.DH1);
        return ComplexGrid.of(reRot, imRot).expand(coeffs.normalization(), coeffs.csphase());
    }

    /**
     * Rotate a 4pi-normalized array without the Condon-Shortley phase.
     */
    public double[][][] rotateCanonical(double[][][] cilm, EulerAngles angles, RotationKernel kernel) {
        int lmax = cilm[0].length - 1;
        RotationKernel k = kernel != null ? kernel : backend.rotationKernel(lmax);
        return backend.rotateRealCoef(cilm, angles.toArray(), k);
    }
}
