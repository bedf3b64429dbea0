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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealVector;

/**
 * Spatio-spectral concentration problems. Each taper maximizes the fraction
 * of its power inside a region among functions band-limited to lwin; the
 * fraction is its eigenvalue.
 */
final class TaperSolver {
    private TaperSolver() {}

    /** Cap at the north pole: one small eigenproblem per order. */
    static CapTaperSet cap(double thetaRadians, int lwin) {
        double x0 = Math.cos(thetaRadians);
        GaussLegendreQuadrature q = GaussLegendre.nodes(lwin);
        int nq = q.zeros().length;
        double half = (1.0 - x0) / 2.0;
        double[][][] p = new double[nq][][];
        double[] w = new double[nq];
        for (int k = 0; k < nq; k++) {
            double x = half * q.zeros()[k] + (1.0 + x0) / 2.0;
            p[k] = Legendre.compute(lwin, x);
            w[k] = half * q.weights()[k];
        }

        List<Candidate> found = new ArrayList<>();
        for (int m = 0; m <= lwin; m++) {
            int n = lwin - m + 1;
            double scale = (m == 0 ? 2.0 : 1.0) / 4.0;
            double[][] d = new double[n][n];
            for (int a = 0; a < n; a++) {
                for (int b = a; b < n; b++) {
                    double s = 0.0;
                    for (int k = 0; k < nq; k++) s += w[k] * p[k][m + a][m] * p[k][m + b][m];
                    d[a][b] = scale * s;
                    d[b][a] = d[a][b];
                }
            }
            EigenDecomposition eig = new EigenDecomposition(new Array2DRowRealMatrix(d, false));
            double[] values = eig.getRealEigenvalues();
            for (int e = 0; e < n; e++) {
                double[] v = signFixed(eig.getEigenvector(e));
                double[] column = new double[lwin + 1];
                System.arraycopy(v, 0, column, m, n);
                found.add(new Candidate(values[e], m, column));
                if (m > 0) found.add(new Candidate(values[e], -m, column));
            }
        }
        found.sort(Comparator.comparingDouble(Candidate::eigenvalue).reversed());

        int count = found.size();
        double[][] tapers = new double[lwin + 1][count];
        double[] eigenvalues = new double[count];
        int[] orders = new int[count];
        for (int i = 0; i < count; i++) {
            Candidate c = found.get(i);
            eigenvalues[i] = c.eigenvalue();
            orders[i] = c.order();
            for (int l = 0; l <= lwin; l++) tapers[l][i] = c.vector()[l];
        }
        return new CapTaperSet(tapers, eigenvalues, orders);
    }

    /** Arbitrary region given as a Driscoll-Healy mask; keeps the best {@code ntapers}. */
    static MaskTaperSet mask(boolean[][] dhMask, int lwin, int ntapers) {
        int nlat = dhMask.length;
        int nlon = dhMask[0].length;
        DriscollHealy.checkShape(nlat, nlon);
        double[] x = DriscollHealy.cosColatitudes(nlat);
        double[] wts = DriscollHealy.weights(nlat);
        int size = (lwin + 1) * (lwin + 1);
        int[] il = new int[size];
        int[] ll = new int[size];
        int[] ml = new int[size];
        for (int l = 0; l <= lwin; l++) {
            for (int m = 0; m <= l; m++) {
                int k = PackedVectors.index(0, l, m);
                il[k] = 0;
                ll[k] = l;
                ml[k] = m;
                if (m > 0) {
                    k = PackedVectors.index(1, l, m);
                    il[k] = 1;
                    ll[k] = l;
                    ml[k] = m;
                }
            }
        }

        double[][] cosTab = new double[lwin + 1][nlon];
        double[][] sinTab = new double[lwin + 1][nlon];
        for (int m = 0; m <= lwin; m++) {
            for (int j = 0; j < nlon; j++) {
                double phi = 2.0 * Math.PI * j / nlon;
                cosTab[m][j] = Math.cos(m * phi);
                sinTab[m][j] = Math.sin(m * phi);
            }
        }

        double[][] d = new double[size][size];
        double[][] p = new double[lwin + 1][lwin + 1];
        // trig[i1][i2][m1][m2]: masked longitude sums of the products of the two trig functions
        double[][][][] trig = new double[2][2][lwin + 1][lwin + 1];
        double dphi = 2.0 * Math.PI / nlon;
        for (int r = 0; r < nlat; r++) {
            if (wts[r] == 0.0) continue;
            boolean[] row = dhMask[r];
            boolean any = false;
            for (boolean b : row) any |= b;
            if (!any) continue;
            Legendre.fill(p, lwin, x[r]);
            for (int m1 = 0; m1 <= lwin; m1++) {
                for (int m2 = 0; m2 <= lwin; m2++) {
                    double cc = 0.0;
                    double cs = 0.0;
                    double sc = 0.0;
                    double ss = 0.0;
                    for (int j = 0; j < nlon; j++) {
                        if (!row[j]) continue;
                        cc += cosTab[m1][j] * cosTab[m2][j];
                        cs += cosTab[m1][j] * sinTab[m2][j];
                        sc += sinTab[m1][j] * cosTab[m2][j];
                        ss += sinTab[m1][j] * sinTab[m2][j];
                    }
                    trig[0][0][m1][m2] = cc;
                    trig[0][1][m1][m2] = cs;
                    trig[1][0][m1][m2] = sc;
                    trig[1][1][m1][m2] = ss;
                }
            }
            double scale = wts[r] * dphi / (4.0 * Math.PI);
            for (int a = 0; a < size; a++) {
                double pa = p[ll[a]][ml[a]] * scale;
                for (int b = a; b < size; b++) {
                    d[a][b] += pa * p[ll[b]][ml[b]] * trig[il[a]][il[b]][ml[a]][ml[b]];
                }
            }
        }
        for (int a = 0; a < size; a++) {
            for (int b = 0; b < a; b++) d[a][b] = d[b][a];
        }

        EigenDecomposition eig = new EigenDecomposition(new Array2DRowRealMatrix(d, false));
        double[] values = eig.getRealEigenvalues();
        List<Candidate> found = new ArrayList<>();
        for (int e = 0; e < size; e++) {
            found.add(new Candidate(values[e], 0, signFixed(eig.getEigenvector(e))));
        }
        found.sort(Comparator.comparingDouble(Candidate::eigenvalue).reversed());

        double[][] tapers = new double[size][ntapers];
        double[] eigenvalues = new double[ntapers];
        for (int i = 0; i < ntapers; i++) {
            Candidate c = found.get(i);
            eigenvalues[i] = c.eigenvalue();
            for (int k = 0; k < size; k++) tapers[k][i] = c.vector()[k];
        }
        return new MaskTaperSet(tapers, eigenvalues);
    }

    // Unit norm, largest component positive
    private static double[] signFixed(RealVector vector) {
        double[] v = vector.unitVector().toArray();
        int big = 0;
        for (int i = 1; i < v.length; i++) {
            if (Math.abs(v[i]) > Math.abs(v[big]) + 1e-12) big = i;
        }
        if (v[big] < 0) {
            for (int i = 0; i < v.length; i++) v[i] = -v[i];
        }
        return v;
    }

    private record Candidate(double eigenvalue, int order, double[] vector) {}
}
