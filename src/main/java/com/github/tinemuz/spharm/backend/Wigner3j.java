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

import org.apache.commons.math3.util.CombinatoricsUtils;

/** Wigner 3j symbols with all three orders zero. */
final class Wigner3j {
    private Wigner3j() {}

    /** (j1 j2 j3; 0 0 0), zero when the sum is odd or the triangle condition fails. */
    static double zeroOrders(int j1, int j2, int j3) {
        int sum = j1 + j2 + j3;
        if (sum % 2 != 0) return 0.0;
        if (j3 < Math.abs(j1 - j2) || j3 > j1 + j2) return 0.0;
        int g = sum / 2;
        double logValue =
                0.5
                                * (lf(sum - 2 * j1)
                                        + lf(sum - 2 * j2)
                                        + lf(sum - 2 * j3)
                                        - lf(sum + 1))
                        + lf(g)
                        - lf(g - j1)
                        - lf(g - j2)
                        - lf(g - j3);
        double v = Math.exp(logValue);
        return g % 2 == 0 ? v : -v;
    }

    private static double lf(int n) {
        return CombinatoricsUtils.factorialLog(n);
    }
}
