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

import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import java.util.Locale;

/**
 * Row range of a coupling matrix. {@code FULL} returns every output degree
 * (lmax + lwin + 1 rows), {@code SAME} the first lmax + 1, and {@code VALID}
 * only the degrees unaffected by the band limit (lmax - lwin + 1).
 */
public enum CouplingMode {
    FULL("full"),
    SAME("same"),
    VALID("valid");

    private final String label;

    CouplingMode(String label) {
        this.label = label;
    }

    /** Number of output rows for the given bandwidths. */
    public int rows(int lmax, int lwin) {
        switch (this) {
            case FULL:
                return lmax + lwin + 1;
            case SAME:
                return lmax + 1;
            default:
                return lmax - lwin + 1;
        }
    }

    public static CouplingMode parse(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (CouplingMode m : values()) {
                if (m.label.equals(v)) return m;
            }
        }
        throw InvalidOptionException.of("mode", value, "'full', 'same' or 'valid'");
    }
}
