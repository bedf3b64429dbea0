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

/**
 * Optional settings of a multitaper estimate.
 *
 * @param lmax          band limit of the data to use, or {@code null} for all of it
 * @param taperWeights  weights of the k tapers, or {@code null} for the bank default
 * @param clat          latitude of the analysis centre (cap windows), or {@code null}
 * @param clon          longitude of the analysis centre (cap windows), or {@code null}
 * @param coordDegrees  whether {@code clat} and {@code clon} are in degrees
 */
public record MultitaperOptions(
        Integer lmax, double[] taperWeights, Double clat, Double clon, boolean coordDegrees) {

    public static MultitaperOptions defaults() {
        return new MultitaperOptions(null, null, null, null, true);
    }

    public MultitaperOptions withLmax(int value) {
        return new MultitaperOptions(value, taperWeights, clat, clon, coordDegrees);
    }

    public MultitaperOptions withTaperWeights(double[] value) {
        return new MultitaperOptions(lmax, value, clat, clon, coordDegrees);
    }

    public MultitaperOptions withCenter(double latitude, double longitude) {
        return new MultitaperOptions(lmax, taperWeights, latitude, longitude, coordDegrees);
    }

    public MultitaperOptions inRadians() {
        return new MultitaperOptions(lmax, taperWeights, clat, clon, false);
    }
}
