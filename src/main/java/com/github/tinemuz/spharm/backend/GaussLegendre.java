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

import java.util.Arrays;
import java.util.Comparator;

import org.apache.commons.math3.analysis.integration.gauss.GaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;

/** Gauss-Legendre nodes from the commons-math rule cache, reordered north first. */
final class GaussLegendre {
    private static final GaussIntegratorFactory FACTORY = new GaussIntegratorFactory();

    private GaussLegendre() {}

    /** lmax + 1 nodes, north first. */
    static GaussLegendreQuadrature nodes(int lmax) {
        int n = lmax + 1;
        GaussIntegrator rule = FACTORY.legendre(n);
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) order[i] = i;
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> rule.getPoint(i)).reversed());
        double[] zeros = new double[n];
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            zeros[i] = rule.getPoint(order[i]);
            weights[i] = rule.getWeight(order[i]);
        }
        return new GaussLegendreQuadrature(zeros, weights);
    }
}
