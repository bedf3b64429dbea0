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

import org.apache.commons.math3.complex.Complex;

/**
 * Direct-summation transforms between 4pi-normalized coefficients (no
 * Condon-Shortley phase) and grids whose rows sit at arbitrary colatitudes
 * and whose columns are equally spaced in longitude from 0.
 *
 * <p>Complex functions are Y(l,m) = P(l,m)/sqrt(2) exp(i m phi) for m &gt; 0,
 * Y(l,0) = P(l,0), and Y(l,-m) = (-1)^m conj(Y(l,m)). Plane 1 of a complex
 * array holds the coefficient of Y(l,-m).</p>
 */
final class SphericalTransforms {
    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);
    private static final double FOUR_PI = 4.0 * Math.PI;

    private SphericalTransforms() {}

    static double[][] synthesize(double[][][] cilm, double[] cosTheta, int nlon) {
        int lmax = cilm[0].length - 1;
        int mmax = Math.min(lmax, nlon / 2);
        double[][] cosTab = new double[mmax + 1][nlon];
        double[][] sinTab = new double[mmax + 1][nlon];
        trigTables(cosTab, sinTab, nlon);
        double[][] grid = new double[cosTheta.length][nlon];
        double[][] p = new double[lmax + 1][lmax + 1];
        double[] a = new double[mmax + 1];
        double[] b = new double[mmax + 1];
        for (int i = 0; i < cosTheta.length; i++) {
            Legendre.fill(p, lmax, cosTheta[i]);
            for (int m = 0; m <= mmax; m++) {
                double sa = 0.0;
                double sb = 0.0;
                for (int l = m; l <= lmax; l++) {
                    sa += p[l][m] * cilm[0][l][m];
                    sb += p[l][m] * cilm[1][l][m];
                }
                a[m] = sa;
                b[m] = sb;
            }
            double[] row = grid[i];
            for (int j = 0; j < nlon; j++) {
                double f = 0.0;
                for (int m = 0; m <= mmax; m++) f += a[m] * cosTab[m][j] + b[m] * sinTab[m][j];
                row[j] = f;
            }
        }
        return grid;
    }

    static double[][][] analyze(double[][] grid, double[] cosTheta, double[] weights, int lmax) {
        int nlon = grid[0].length;
        int mmax = Math.min(lmax, nlon / 2);
        double[][] cosTab = new double[mmax + 1][nlon];
        double[][] sinTab = new double[mmax + 1][nlon];
        trigTables(cosTab, sinTab, nlon);
        double[][][] cilm = new double[2][lmax + 1][lmax + 1];
        double[][] p = new double[lmax + 1][lmax + 1];
        double dphi = 2.0 * Math.PI / nlon;
        for (int i = 0; i < cosTheta.length; i++) {
            if (weights[i] == 0.0) continue;
            Legendre.fill(p, lmax, cosTheta[i]);
            double[] row = grid[i];
            for (int m = 0; m <= mmax; m++) {
                double cc = 0.0;
                double ss = 0.0;
                for (int j = 0; j < nlon; j++) {
                    cc += row[j] * cosTab[m][j];
                    ss += row[j] * sinTab[m][j];
                }
                double scale = weights[i] * dphi / FOUR_PI;
                cc *= scale;
                ss *= scale;
                for (int l = m; l <= lmax; l++) {
                    cilm[0][l][m] += p[l][m] * cc;
                    if (m > 0) cilm[1][l][m] += p[l][m] * ss;
                }
            }
        }
        return cilm;
    }

    static Complex[][] synthesizeComplex(Complex[][][] cilm, double[] cosTheta, int nlon) {
        int lmax = cilm[0].length - 1;
        double[][] cosTab = new double[lmax + 1][nlon];
        double[][] sinTab = new double[lmax + 1][nlon];
        trigTables(cosTab, sinTab, nlon);
        Complex[][] grid = new Complex[cosTheta.length][nlon];
        double[][] p = new double[lmax + 1][lmax + 1];
        // Positive-order sums (pr, pi) and negative-order sums (nr, ni) per order
        double[] pr = new double[lmax + 1];
        double[] pi = new double[lmax + 1];
        double[] nr = new double[lmax + 1];
        double[] ni = new double[lmax + 1];
        for (int i = 0; i < cosTheta.length; i++) {
            Legendre.fill(p, lmax, cosTheta[i]);
            for (int m = 0; m <= lmax; m++) {
                double s = m == 0 ? 1.0 : INV_SQRT2;
                double sign = (m % 2 == 0) ? 1.0 : -1.0;
                pr[m] = 0.0;
                pi[m] = 0.0;
                nr[m] = 0.0;
                ni[m] = 0.0;
                for (int l = m; l <= lmax; l++) {
                    double pt = p[l][m] * s;
                    pr[m] += pt * cilm[0][l][m].getReal();
                    pi[m] += pt * cilm[0][l][m].getImaginary();
                    if (m > 0) {
                        nr[m] += sign * pt * cilm[1][l][m].getReal();
                        ni[m] += sign * pt * cilm[1][l][m].getImaginary();
                    }
                }
            }
            for (int j = 0; j < nlon; j++) {
                double re = 0.0;
                double im = 0.0;
                for (int m = 0; m <= lmax; m++) {
                    double c = cosTab[m][j];
                    double sn = sinTab[m][j];
                    // (pr + i pi)(c + i sn) + (nr + i ni)(c - i sn)
                    re += pr[m] * c - pi[m] * sn + nr[m] * c + ni[m] * sn;
                    im += pr[m] * sn + pi[m] * c - nr[m] * sn + ni[m] * c;
                }
                grid[i][j] = new Complex(re, im);
            }
        }
        return grid;
    }

    static Complex[][][] analyzeComplex(
            Complex[][] grid, double[] cosTheta, double[] weights, int lmax) {
        int nlon = grid[0].length;
        double[][] cosTab = new double[lmax + 1][nlon];
        double[][] sinTab = new double[lmax + 1][nlon];
        trigTables(cosTab, sinTab, nlon);
        double[][][] re = new double[2][lmax + 1][lmax + 1];
        double[][][] im = new double[2][lmax + 1][lmax + 1];
        double[][] p = new double[lmax + 1][lmax + 1];
        double dphi = 2.0 * Math.PI / nlon;
        for (int i = 0; i < cosTheta.length; i++) {
            if (weights[i] == 0.0) continue;
            Legendre.fill(p, lmax, cosTheta[i]);
            Complex[] row = grid[i];
            double scale = weights[i] * dphi / FOUR_PI;
            for (int m = 0; m <= lmax; m++) {
                // f exp(-i m phi) summed, and f exp(+i m phi) summed
                double mr = 0.0;
                double mi = 0.0;
                double qr = 0.0;
                double qi = 0.0;
                for (int j = 0; j < nlon; j++) {
                    double fr = row[j].getReal();
                    double fi = row[j].getImaginary();
                    double c = cosTab[m][j];
                    double sn = sinTab[m][j];
                    mr += fr * c + fi * sn;
                    mi += fi * c - fr * sn;
                    qr += fr * c - fi * sn;
                    qi += fi * c + fr * sn;
                }
                double s = m == 0 ? 1.0 : INV_SQRT2;
                double sign = (m % 2 == 0) ? 1.0 : -1.0;
                for (int l = m; l <= lmax; l++) {
                    double pt = p[l][m] * s * scale;
                    re[0][l][m] += pt * mr;
                    im[0][l][m] += pt * mi;
                    if (m > 0) {
                        re[1][l][m] += sign * pt * qr;
                        im[1][l][m] += sign * pt * qi;
                    }
                }
            }
        }
        Complex[][][] cilm = new Complex[2][lmax + 1][lmax + 1];
        for (int k = 0; k < 2; k++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = 0; m <= lmax; m++) cilm[k][l][m] = new Complex(re[k][l][m], im[k][l][m]);
            }
        }
        return cilm;
    }

    /** Value of a real expansion at one point. */
    static double evaluate(double[][][] cilm, double[][] p, double cosTheta, double phi) {
        int lmax = cilm[0].length - 1;
        Legendre.fill(p, lmax, cosTheta);
        double f = 0.0;
        for (int m = 0; m <= lmax; m++) {
            double cm = Math.cos(m * phi);
            double sm = Math.sin(m * phi);
            for (int l = m; l <= lmax; l++) {
                f += p[l][m] * (cilm[0][l][m] * cm + cilm[1][l][m] * sm);
            }
        }
        return f;
    }

    private static void trigTables(double[][] cosTab, double[][] sinTab, int nlon) {
        for (int m = 0; m < cosTab.length; m++) {
            for (int j = 0; j < nlon; j++) {
                double phi = 2.0 * Math.PI * j / nlon;
                cosTab[m][j] = Math.cos(m * phi);
                sinTab[m][j] = Math.sin(m * phi);
            }
        }
    }
}
