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
package com.github.tinemuz.spharm.rotate;

/**
 * Euler angles in radians, y convention: rotate the frame by alpha about z,
 * then beta about the new y axis, then gamma about the new z axis.
 */
public record EulerAngles(double alpha, double beta, double gamma) {
    public static final EulerAngles ZERO = new EulerAngles(0.0, 0.0, 0.0);

    public static EulerAngles ofDegrees(double alpha, double beta, double gamma) {
        return new EulerAngles(Math.toRadians(alpha), Math.toRadians(beta), Math.toRadians(gamma));
    }

    /** Angles that undo this rotation. */
    public EulerAngles inverse() {
        return new EulerAngles(-gamma, -beta, -alpha);
    }

    public boolean isZero() {
        return alpha == 0.0 && beta == 0.0 && gamma == 0.0;
    }

    public double[] toArray() {
        return new double[] {alpha, beta, gamma};
    }
}
