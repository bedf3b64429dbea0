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

import com.github.tinemuz.spharm.config.SpharmConfig;
import com.github.tinemuz.spharm.io.CoefficientFiles;
import com.github.tinemuz.spharm.io.CoefficientFormat;
import com.github.tinemuz.spharm.rotate.EulerAngles;
import com.github.tinemuz.spharm.rotate.RotationCoordinator;
import com.github.tinemuz.spharm.spectrum.SpectralAnalyzer;
import com.github.tinemuz.spharm.spectrum.SpectrumConvention;
import com.github.tinemuz.spharm.spectrum.SpectrumUnit;
import java.io.IOException;
import java.nio.file.Path;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Spherical harmonic coefficients of a band-limited function.
 *
 * <p>Coefficients are stored with shape (2, lmax+1, lmax+1). For real sets
 * plane 0 holds cosine and plane 1 sine terms; for complex sets plane 0
 * holds order m and plane 1 order -m. Entries with m &gt; l, and the sine
 * plane at m = 0, are always zero.</p>
 *
 * <p>Instances are not thread safe. Apart from {@code setCoeffs} on the
 * concrete types, every operation returns a new instance.</p>
 */
public sealed interface CoefficientSet permits RealCoefficients, ComplexCoefficients {

    Kind kind();

    Normalization normalization();

    CsPhase csphase();

    int lmax();

    /** Which entries of the coefficient array may be nonzero. */
    default boolean[][][] mask() {
        return Masks.of(lmax());
    }

    /** 0, 1, ..., lmax. */
    default int[] degrees() {
        int[] d = new int[lmax() + 1];
        for (int l = 0; l < d.length; l++) d[l] = l;
        return d;
    }

    CoefficientSet copy();

    /** Spectrum per degree; see {@link SpectralAnalyzer}. */
    default double[] spectrum(SpectrumConvention convention, SpectrumUnit unit, double base) {
        return SpectralAnalyzer.spectrum(this, convention, unit, base);
    }

    /** Power per degree. */
    default double[] spectrum() {
        return spectrum(SpectrumConvention.POWER, SpectrumUnit.PER_L, SpharmConfig.spectrumBase());
    }

    /**
     * Coefficients in other conventions.
     *
     * @param lmax  band limit of the result, at most {@link #lmax()}
     * @param kind  kind of the result
     * @param check when converting complex to real, verify the function is real
     */
    CoefficientSet convert(
            Normalization normalization, CsPhase csphase, int lmax, Kind kind, boolean check);

    default CoefficientSet convert(Normalization normalization, CsPhase csphase) {
        return convert(normalization, csphase, lmax(), kind(), true);
    }

    /**
     * Rotate the coordinate frame by Euler angles alpha, beta, gamma (y
     * convention), given in degrees when {@code degrees} is set.
     */
    default CoefficientSet rotate(double alpha, double beta, double gamma, boolean degrees) {
        EulerAngles angles = degrees
                ? EulerAngles.ofDegrees(alpha, beta, gamma)
                : new EulerAngles(alpha, beta, gamma);
        return new RotationCoordinator().rotate(this, angles, null);
    }

    /** Inverse transform onto a grid. */
    GridSample expand(GridScheme scheme);

    default GridSample expand() {
        return expand(GridScheme.DH1);
    }

    CoefficientSet add(CoefficientSet other);

    CoefficientSet subtract(CoefficientSet other);

    CoefficientSet multiply(CoefficientSet other);

    CoefficientSet divide(CoefficientSet other);

    CoefficientSet add(double value);

    CoefficientSet subtract(double value);

    CoefficientSet multiply(double value);

    CoefficientSet divide(double value);

    /** {@code value - this} over the valid entries. */
    CoefficientSet subtractFrom(double value);

    /** {@code value / this} over the valid entries. */
    CoefficientSet divideInto(double value);

    CoefficientSet pow(double exponent);

    default void toFile(Path path, CoefficientFormat format) throws IOException {
        CoefficientFiles.write(this, path, format);
    }

    static CoefficientSet zeros(int lmax, Kind kind, Normalization normalization, CsPhase csphase) {
        return VariantDispatcher.coefficients(kind).zeros(lmax, normalization, csphase);
    }

    /**
     * Random coefficients whose expected power per degree is {@code power}.
     * With {@code exactPower} the realized power equals it exactly.
     */
    static CoefficientSet random(
            double[] power,
            Kind kind,
            Normalization normalization,
            CsPhase csphase,
            boolean exactPower,
            RandomGenerator rng) {
        return VariantDispatcher.coefficients(kind)
                .random(power, normalization, csphase, exactPower, rng);
    }

    static CoefficientSet random(double[] power, Kind kind, long seed) {
        return random(power, kind, Normalization.FOUR_PI, CsPhase.EXCLUDED, false,
                new Well19937c(seed));
    }

    /**
     * Read coefficients up to degree {@code lmax}. Binary files carry their
     * own kind, which must match {@code kind}.
     */
    static CoefficientSet fromFile(
            Path path,
            int lmax,
            CoefficientFormat format,
            Kind kind,
            Normalization normalization,
            CsPhase csphase) throws IOException {
        return CoefficientFiles.read(path, lmax, format, kind, normalization, csphase);
    }
}
