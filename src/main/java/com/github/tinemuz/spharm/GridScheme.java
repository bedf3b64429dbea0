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
package com.github.tinemuz.spharm;

import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import java.util.Locale;

/**
 * Target grid of an expansion: equally sampled DH (nlon = nlat), equally
 * spaced DH (nlon = 2 nlat), or Gauss-Legendre quadrature.
 */
public enum GridScheme {
    DH1(GridType.DH, 1),
    DH2(GridType.DH, 2),
    GLQ(GridType.GLQ, 0);

    private final GridType gridType;
    private final int sampling;

    GridScheme(GridType gridType, int sampling) {
        this.gridType = gridType;
        this.sampling = sampling;
    }

    public GridType gridType() {
        return gridType;
    }

    /** DH longitude sampling factor; 0 for GLQ. */
    public int sampling() {
        return sampling;
    }

    /** Parses {@code "DH"} (same as DH1), {@code "DH1"}, {@code "DH2"} or {@code "GLQ"}. */
    public static GridScheme parse(String value) {
        if (value != null) {
            String v = value.trim().toUpperCase(Locale.ROOT);
            switch (v) {
                case "DH":
                case "DH1":
                    return DH1;
                case "DH2":
                    return DH2;
                case "GLQ":
                    return GLQ;
                default:
                    break;
            }
        }
        throw InvalidOptionException.of("grid", value, "'DH', 'DH1', 'DH2' or 'GLQ'");
    }
}
