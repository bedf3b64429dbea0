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
 * Normalization of the spherical harmonic functions.
 *
 * <p>{@link #FOUR_PI} functions have mean square one over the sphere,
 * {@link #ORTHONORMAL} functions integrate to one, and {@link #SCHMIDT}
 * semi-normalized functions have mean square 1/(2l+1).</p>
 */
public enum Normalization {
    FOUR_PI("4pi", 1),
    SCHMIDT("schmidt", 2),
    ORTHONORMAL("ortho", 4);

    private final String label;
    private final int code;

    Normalization(String label, int code) {
        this.label = label;
        this.code = code;
    }

    public String label() {
        return label;
    }

    /** Integer code used by SHTOOLS-style backends (1 = 4pi, 2 = Schmidt, 4 = ortho). */
    public int code() {
        return code;
    }

    /** Parses {@code "4pi"}, {@code "ortho"} or {@code "schmidt"}, ignoring case. */
    public static Normalization parse(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (Normalization n : values()) {
                if (n.label.equals(v)) return n;
            }
        }
        throw InvalidOptionException.of(
                "normalization", value, "'4pi', 'ortho' or 'schmidt'");
    }
}
