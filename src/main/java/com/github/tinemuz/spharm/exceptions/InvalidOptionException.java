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
package com.github.tinemuz.spharm.exceptions;

/**
 * Thrown when a textual option (normalization, phase convention, kind, grid
 * scheme, spectrum convention or unit, file format, coupling mode) is not one
 * of the recognized values.
 */
public class InvalidOptionException extends IllegalArgumentException {
    private static final String PREFIX = "Invalid option: ";

    public InvalidOptionException(String message) {
        super(PREFIX + message);
    }

    /** Builds the standard message listing the accepted values. */
    public static InvalidOptionException of(String option, Object value, String accepted) {
        return new InvalidOptionException(
                option + " must be one of " + accepted + ". Input value was " + value + ".");
    }
}
