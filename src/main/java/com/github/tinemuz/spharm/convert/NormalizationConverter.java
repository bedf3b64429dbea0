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
package com.github.tinemuz.spharm.convert;

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;

import org.apache.commons.math3.complex.Complex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rescales coefficient arrays between normalization and Condon-Shortley
 * phase conventions, optionally truncating to a lower band limit.
 *
 * <p>The conversion factors depend only on the degree. Between conventions
 * with different phase, every odd order changes sign in both planes. Input
 * arrays are never modified.</p>
 */
public final class NormalizationConverter {
    private static final Logger log = LoggerFactory.getLogger(NormalizationConverter.class);
    private static final double FOUR_PI = 4.0 * Math.PI;

    private NormalizationConverter() {}

    /**
     * Factor multiplying a degree-{@code l} coefficient expressed in
     * {@code from} to express it in {@code to}.
     */
    public static double factor(Normalization from, Normalization to, int l) {
        if (from == to) return 1.0;
        return toFourPi(from, l) / toFourPi(to, l);
    }

    // Factor taking a coefficient in the given normalization to 4pi
    private static double toFourPi(Normalization norm, int l) {
        switch (norm) {
            case SCHMIDT:
                return 1.0 / Math.sqrt(2.0 * l + 1.0);
            case ORTHONORMAL:
                return 1.0 / Math.sqrt(FOUR_PI);
            default:
                return 1.0;
        }
    }

    /**
     * Convert real coefficients.
     *
     * @param lmax band limit of the result, between 0 and the band limit of the input
     * @return a new (2, lmax+1, lmax+1) array
     * @throws DimensionMismatchException if {@code lmax} is out of range
     */
    public static double[][][] convert(
            double[][][] cilm,
            Normalization from,
            CsPhase fromPhase,
            Normalization to,
            CsPhase toPhase,
            int lmax) {
        checkLmax(cilm[0].length - 1, lmax);
        boolean flip = fromPhase != toPhase;
        double[][][] out = new double[2][lmax + 1][lmax + 1];
        for (int l = 0; l <= lmax; l++) {
            double f = factor(from, to, l);
            for (int m = 0; m <= l; m++) {
                double s = flip && m % 2 == 1 ? -f : f;
                out[0][l][m] = cilm[0][l][m] * s;
                out[1][l][m] = cilm[1][l][m] * s;
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Converted real lmax {} from {}/{} to {}/{} at lmax {}",
                    cilm[0].length - 1, from.label(), fromPhase.value(),
                    to.label(), toPhase.value(), lmax);
        }
        return out;
    }

    /** Convert complex coefficients; same contract as the real overload. */
    public static Complex[][][] convert(
            Complex[][][] cilm,
            Normalization from,
            CsPhase fromPhase,
            Normalization to,
            CsPhase toPhase,
            int lmax) {
        checkLmax(cilm[0].length - 1, lmax);
        boolean flip = fromPhase != toPhase;
        Complex[][][] out = new Complex[2][lmax + 1][lmax + 1];
        for (int l = 0; l <= lmax; l++) {
            double f = factor(from, to, l);
            for (int m = 0; m <= lmax; m++) {
                if (m > l) {
                    out[0][l][m] = Complex.ZERO;
                    out[1][l][m] = Complex.ZERO;
                    continue;
                }
                double s = flip && m % 2 == 1 ? -f : f;
                out[0][l][m] = cilm[0][l][m].multiply(s);
                out[1][l][m] = cilm[1][l][m].multiply(s);
            }
        }
        return out;
    }

    private static void checkLmax(int source, int lmax) {
        if (lmax < 0 || lmax > source) {
            throw new DimensionMismatchException(
                    "lmax must be between 0 and the input band limit " + source
                            + ". Input value was " + lmax + ".");
        }
    }
}
