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

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.DhGeometry;
import com.github.tinemuz.spharm.GridType;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealGrid;
import com.github.tinemuz.spharm.backend.MaskTaperSet;
import com.github.tinemuz.spharm.backend.ShtBackend;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.convert.NormalizationConverter;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.IncompatibleOperandsException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Tapers concentrated within an arbitrary region given on a Driscoll-Healy grid. */
public final class MaskWindowBank implements WindowBank {
    private static final Logger log = LoggerFactory.getLogger(MaskWindowBank.class);

    private final ShtBackend backend;
    private final int lwin;
    private final int nwin;
    private final double[][] tapers;
    private final double[] eigenvalues;
    private final double[] weights;

    private MaskWindowBank(ShtBackend backend, int lwin, MaskTaperSet set, double[] weights) {
        this.backend = backend;
        this.lwin = lwin;
        this.nwin = set.count();
        this.tapers = set.tapers();
        this.eigenvalues = set.eigenvalues();
        this.weights = weights == null ? null : weights.clone();
    }

    /** All (lwin+1)^2 tapers of the region. */
    public static MaskWindowBank fromMask(boolean[][] dhMask, int lwin) {
        return fromMask(dhMask, lwin, null, null, ShtBackends.get());
    }

    /**
     * Tapers of the region where {@code dhMask} is true.
     *
     * @param nwin    number of tapers to keep, or {@code null} for (lwin+1)^2
     * @param weights default taper weights with nwin entries, or {@code null}
     * @throws DimensionMismatchException if the mask is not a DH grid or nwin is out of range
     */
    public static MaskWindowBank fromMask(
            boolean[][] dhMask, int lwin, Integer nwin, double[] weights, ShtBackend backend) {
        if (dhMask == null || dhMask.length == 0) {
            throw new DimensionMismatchException("The region mask must not be empty.");
        }
        int nlon = dhMask[0].length;
        for (boolean[] row : dhMask) {
            if (row.length != nlon) {
                throw new DimensionMismatchException("The region mask rows must have equal length.");
            }
        }
        // throws on shapes that are not DH
        new DhGeometry(dhMask.length, nlon);
        if (lwin < 0) {
            throw new DimensionMismatchException("lwin must be non-negative. Input value was " + lwin + ".");
        }
        int max = (lwin + 1) * (lwin + 1);
        int n = nwin == null ? max : nwin;
        if (n < 1 || n > max) {
            throw new DimensionMismatchException(
                    "nwin must be between 1 and (lwin+1)^2 = " + max + ". Input value was " + n + ".");
        }
        if (weights != null && weights.length != n) {
            throw new DimensionMismatchException(
                    "weights must have nwin = " + n + " entries. Input length was "
                            + weights.length + ".");
        }
        MaskTaperSet set = backend.maskTapers(dhMask, lwin, n);
        log.info("Computed {} mask tapers for lwin={} on a {}x{} grid",
                n, lwin, dhMask.length, nlon);
        return new MaskWindowBank(backend, lwin, set, weights);
    }

    /** Tapers of the region where the real DH grid is nonzero. */
    public static MaskWindowBank fromMask(RealGrid grid, int lwin, Integer nwin) {
        if (grid.gridType() != GridType.DH) {
            throw new IncompatibleOperandsException("region masks must be DH grids.");
        }
        double[][] data = grid.data();
        boolean[][] mask = new boolean[data.length][data[0].length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[0].length; j++) mask[i][j] = data[i][j] != 0.0;
        }
        return fromMask(mask, lwin, nwin, null, ShtBackends.get());
    }

    @Override
    public WindowKind kind() {
        return WindowKind.MASK;
    }

    @Override
    public int lwin() {
        return lwin;
    }

    @Override
    public int nwin() {
        return nwin;
    }

    @Override
    public double[] eigenvalues() {
        return eigenvalues.clone();
    }

    @Override
    public double[] weights() {
        return weights == null ? null : weights.clone();
    }

    /** Packed taper coefficients, {@code [l^2 + i l + m][taper]}. */
    public double[][] tapers() {
        double[][] out = new double[tapers.length][];
        for (int k = 0; k < tapers.length; k++) out[k] = tapers[k].clone();
        return out;
    }

    double[][] tapersView() {
        return tapers;
    }

    @Override
    public MaskWindowBank copy() {
        return new MaskWindowBank(backend, lwin, new MaskTaperSet(tapers(), eigenvalues()), weights);
    }

    @Override
    public double[][][] toArray(int itaper, Normalization normalization, CsPhase csphase) {
        if (itaper < 0 || itaper >= nwin) {
            throw new IndexOutOfBoundsException(
                    "itaper must be between 0 and " + (nwin - 1) + ". Input value was " + itaper + ".");
        }
        double[] v = new double[tapers.length];
        for (int k = 0; k < v.length; k++) v[k] = tapers[k][itaper];
        double[][][] cilm = backend.vectorToCilm(v);
        if (normalization == Normalization.FOUR_PI && csphase == CsPhase.EXCLUDED) return cilm;
        return NormalizationConverter.convert(
                cilm, Normalization.FOUR_PI, CsPhase.EXCLUDED, normalization, csphase, lwin);
    }

    @Override
    public String toString() {
        return "MaskWindowBank[lwin=" + lwin + ", nwin=" + nwin + "]";
    }
}
