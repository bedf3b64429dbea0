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
import java.util.Arrays;

/** Coupling of a global spectrum into the expected localized spectrum. */
final class Coupling {
    private Coupling() {}

    static double[][] matrix(int lmax, double[][] taperPower, int k, double[] weights) {
        int lwin = taperPower.length - 1;
        double[] w = Weights.resolve(weights, k);
        double[] combined = new double[lwin + 1];
        for (int l = 0; l <= lwin; l++) {
            for (int i = 0; i < k; i++) combined[l] += w[i] * taperPower[l][i];
        }
        double[][] m = new double[lmax + lwin + 1][lmax + 1];
        for (int j = 0; j <= lmax + lwin; j++) {
            for (int l = 0; l <= lmax; l++) {
                double s = 0.0;
                for (int lw = Math.abs(j - l); lw <= Math.min(lwin, j + l); lw++) {
                    double w3 = Wigner3j.zeroOrders(j, lw, l);
                    s += combined[lw] * w3 * w3;
                }
                m[j][l] = (2.0 * j + 1.0) * s;
            }
        }
        return m;
    }

    static double[] apply(double[][] matrix, double[] power) {
        double[] out = new double[matrix.length];
        for (int j = 0; j < matrix.length; j++) {
            double s = 0.0;
            for (int l = 0; l < power.length; l++) s += matrix[j][l] * power[l];
            out[j] = s;
        }
        return out;
    }

    static final class Weights {
        private Weights() {}

        /** Equal weights 1/k when none are given. */
        static double[] resolve(double[] weights, int k) {
            if (weights == null) {
                double[] w = new double[k];
                Arrays.fill(w, 1.0 / k);
                return w;
            }
            if (weights.length < k) {
                throw new DimensionMismatchException(
                        "Need at least " + k + " taper weights. Input length was "
                                + weights.length + ".");
            }
            return weights;
        }
    }
}
