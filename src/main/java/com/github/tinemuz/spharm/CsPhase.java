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

/** Condon-Shortley phase convention: (-1)^m excluded (+1) or included (-1). */
public enum CsPhase {
    EXCLUDED(1),
    INCLUDED(-1);

    private final int value;

    CsPhase(int value) {
        this.value = value;
    }

    /** The conventional integer form, +1 or -1. */
    public int value() {
        return value;
    }

    public static CsPhase of(int value) {
        if (value == 1) return EXCLUDED;
        if (value == -1) return INCLUDED;
        throw InvalidOptionException.of("csphase", value, "1 or -1");
    }

    public static CsPhase parse(String value) {
        if (value != null) {
            try {
                return of(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw InvalidOptionException.of("csphase", value, "1 or -1");
            }
        }
        throw InvalidOptionException.of("csphase", null, "1 or -1");
    }
}
