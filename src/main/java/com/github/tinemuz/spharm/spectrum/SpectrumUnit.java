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
package com.github.tinemuz.spharm.spectrum;

import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import java.util.Locale;

/** How a spectrum is binned: per degree, per coefficient, or per log bandwidth. */
public enum SpectrumUnit {
    PER_L("per_l"),
    PER_LM("per_lm"),
    PER_DLOGL("per_dlogl");

    private final String label;

    SpectrumUnit(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SpectrumUnit parse(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (SpectrumUnit u : values()) {
                if (u.label.equals(v)) return u;
            }
        }
        throw InvalidOptionException.of(
                "unit", value, "'per_l', 'per_lm' or 'per_dlogl'");
    }
}
