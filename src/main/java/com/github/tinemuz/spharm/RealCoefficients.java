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

import com.github.tinemuz.spharm.backend.GaussLegendreQuadrature;
import com.github.tinemuz.spharm.backend.ShtBackend;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.config.SpharmConfig;
import com.github.tinemuz.spharm.convert.KindConverter;
import com.github.tinemuz.spharm.convert.NormalizationConverter;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.IncompatibleOperandsException;
import com.github.tinemuz.spharm.rotate.EulerAngles;
import com.github.tinemuz.spharm.rotate.RotationCoordinator;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Real spherical harmonic coefficients: cosine terms in plane 0, sine terms in plane 1. */
public final class RealCoefficients implements CoefficientSet {
    private static final Logger log = LoggerFactory.getLogger(RealCoefficients.class);

    static final VariantDispatcher.CoefficientVariant VARIANT = new Variant();

    private final double[][][] coeffs;
    private final Normalization normalization;
    private final CsPhase csphase;
    private final int lmax;

    private RealCoefficients(double[][][] coeffs, Normalization normalization, CsPhase csphase) {
        this.coeffs = coeffs;
        this.normalization = normalization;
        this.csphase = csphase;
        this.lmax = coeffs[0].length - 1;
    }

    /**
     * Copy {@code coeffs}, zeroing every entry outside the valid mask.
     *
     * @throws DimensionMismatchException if the array is not (2, n, n)
     */
    public static RealCoefficients fromArray(
            double[][][] coeffs, Normalization normalization, CsPhase csphase) {
        return new RealCoefficients(Masks.maskedCopy(coeffs), normalization, csphase);
    }

    /** Copy {@code coeffs} as 4pi-normalized coefficients without the Condon-Shortley phase. */
    public static RealCoefficients fromArray(double[][][] coeffs) {
        return fromArray(coeffs, Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    /**
     * Wrap {@code coeffs} without copying. The caller hands over ownership,
     * must not touch the array afterwards, and guarantees that entries
     * outside the mask are zero.
     */
    public static RealCoefficients adopt(
            double[][][] coeffs, Normalization normalization, CsPhase csphase) {
        Masks.checkShape(coeffs);
        return new RealCoefficients(coeffs, normalization, csphase);
    }

    public static RealCoefficients zeros(int lmax, Normalization normalization, CsPhase csphase) {
        if (lmax < 0) {
            throw new DimensionMismatchException("lmax must be non-negative. Input value was " + lmax + ".");
        }
        return new RealCoefficients(new double[2][lmax + 1][lmax + 1], normalization, csphase);
    }

    /**
     * Gaussian random coefficients with expected power spectrum {@code power}
     * (4pi convention, one value per degree).
     */
    public static RealCoefficients random(
            double[] power,
            Normalization normalization,
            CsPhase csphase,
            boolean exactPower,
            RandomGenerator rng) {
        int lmax = power.length - 1;
        double[][][] c = new double[2][lmax + 1][lmax + 1];
        for (int l = 0; l <= lmax; l++) {
            double sum = 0.0;
            for (int m = 0; m <= l; m++) {
                c[0][l][m] = rng.nextGaussian();
                sum += c[0][l][m] * c[0][l][m];
                if (m > 0) {
                    c[1][l][m] = rng.nextGaussian();
                    sum += c[1][l][m] * c[1][l][m];
                }
            }
            double scale = amplitude(normalization, power[l], l);
            if (exactPower && sum > 0.0) scale *= Math.sqrt((2.0 * l + 1.0) / sum);
            for (int m = 0; m <= l; m++) {
                c[0][l][m] *= scale;
                c[1][l][m] *= scale;
            }
        }
        log.debug("Drew random real coefficients lmax={} exactPower={}", lmax, exactPower);
        return new RealCoefficients(c, normalization, csphase);
    }

    /** Amplitude per unit-variance coefficient giving power {@code power} at degree {@code l}. */
    static double amplitude(Normalization normalization, double power, int l) {
        switch (normalization) {
            case SCHMIDT:
                return Math.sqrt(power);
            case ORTHONORMAL:
                return Math.sqrt(4.0 * Math.PI * power / (2.0 * l + 1.0));
            default:
                return Math.sqrt(power / (2.0 * l + 1.0));
        }
    }

    @Override
    public Kind kind() {
        return Kind.REAL;
    }

    @Override
    public Normalization normalization() {
        return normalization;
    }

    @Override
    public CsPhase csphase() {
        return csphase;
    }

    @Override
    public int lmax() {
        return lmax;
    }

    /** A copy of the coefficient array. */
    public double[][][] toArray() {
        return Masks.copy(coeffs);
    }

    /**
     * The coefficients in other conventions, truncated to {@code lmax}.
     *
     * @throws DimensionMismatchException if {@code lmax} exceeds {@link #lmax()}
     */
    public double[][][] toArray(Normalization normalization, CsPhase csphase, int lmax) {
        return NormalizationConverter.convert(
                coeffs, this.normalization, this.csphase, normalization, csphase, lmax);
    }

    /** Coefficient of degree l and order m; negative m addresses the sine term. */
    public double coefficient(int l, int m) {
        int[] a = Masks.address(l, m, lmax);
        return coeffs[a[0]][a[1]][a[2]];
    }

    public void setCoeff(double value, int l, int m) {
        int[] a = Masks.address(l, m, lmax);
        coeffs[a[0]][a[1]][a[2]] = value;
    }

    /**
     * Set several coefficients in place. A negative order sets the sine
     * coefficient of order |m|. All positions are validated before any
     * value is written.
     */
    public void setCoeffs(double[] values, int[] ls, int[] ms) {
        if (values.length != ls.length || ls.length != ms.length) {
            throw new DimensionMismatchException(
                    "values, ls and ms must have the same length. Input lengths were "
                            + values.length + ", " + ls.length + ", " + ms.length + ".");
        }
        int[][] addr = new int[values.length][];
        for (int k = 0; k < values.length; k++) addr[k] = Masks.address(ls[k], ms[k], lmax);
        for (int k = 0; k < values.length; k++) {
            coeffs[addr[k][0]][addr[k][1]][addr[k][2]] = values[k];
        }
    }

    @Override
    public RealCoefficients copy() {
        return new RealCoefficients(Masks.copy(coeffs), normalization, csphase);
    }

    @Override
    public CoefficientSet convert(
            Normalization normalization, CsPhase csphase, int lmax, Kind kind, boolean check) {
        return VariantDispatcher.coefficients(kind).from(this, normalization, csphase, lmax, check);
    }

    @Override
    public RealCoefficients convert(Normalization normalization, CsPhase csphase) {
        return adopt(toArray(normalization, csphase, lmax), normalization, csphase);
    }

    /** The same function as complex coefficients. */
    public ComplexCoefficients toComplex() {
        return ComplexCoefficients.adopt(KindConverter.toComplex(coeffs), normalization, csphase);
    }

    @Override
    public RealCoefficients rotate(double alpha, double beta, double gamma, boolean degrees) {
        EulerAngles angles = degrees
                ? EulerAngles.ofDegrees(alpha, beta, gamma)
                : new EulerAngles(alpha, beta, gamma);
        return new RotationCoordinator().rotate(this, angles, null);
    }

    @Override
    public RealGrid expand(GridScheme scheme) {
        ShtBackend backend = ShtBackends.get();
        if (scheme.gridType() == GridType.GLQ) {
            GaussLegendreQuadrature nodes = backend.gaussLegendre(lmax);
            double[][] data = backend.makeGridGlq(coeffs, nodes, normalization, csphase);
            return RealGrid.adopt(data, new GlqGeometry(nodes));
        }
        double[][] data = backend.makeGridDh(coeffs, scheme.sampling(), normalization, csphase);
        return RealGrid.adopt(data, DhGeometry.forLmax(lmax, scheme.sampling()));
    }

    @Override
    public RealGrid expand() {
        return expand(GridScheme.DH1);
    }

    @Override
    public RealCoefficients add(CoefficientSet other) {
        return combine(other, Double::sum);
    }

    @Override
    public RealCoefficients subtract(CoefficientSet other) {
        return combine(other, (a, b) -> a - b);
    }

    @Override
    public RealCoefficients multiply(CoefficientSet other) {
        return combine(other, (a, b) -> a * b);
    }

    @Override
    public RealCoefficients divide(CoefficientSet other) {
        return combine(other, (a, b) -> a / b);
    }

    @Override
    public RealCoefficients add(double value) {
        return map(a -> a + value);
    }

    @Override
    public RealCoefficients subtract(double value) {
        return map(a -> a - value);
    }

    @Override
    public RealCoefficients multiply(double value) {
        return map(a -> a * value);
    }

    @Override
    public RealCoefficients divide(double value) {
        return map(a -> a / value);
    }

    @Override
    public RealCoefficients subtractFrom(double value) {
        return map(a -> value - a);
    }

    @Override
    public RealCoefficients divideInto(double value) {
        return map(a -> value / a);
    }

    @Override
    public RealCoefficients pow(double exponent) {
        return map(a -> Math.pow(a, exponent));
    }

    private RealCoefficients map(DoubleUnaryOperator op) {
        double[][][] out = new double[2][lmax + 1][lmax + 1];
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = i; m <= l; m++) out[i][l][m] = op.applyAsDouble(coeffs[i][l][m]);
            }
        }
        return new RealCoefficients(out, normalization, csphase);
    }

    private RealCoefficients combine(CoefficientSet other, DoubleBinaryOperator op) {
        if (!(other instanceof RealCoefficients)) {
            throw new IncompatibleOperandsException(
                    "cannot combine real coefficients with " + other.kind().label()
                            + " coefficients.");
        }
        RealCoefficients o = (RealCoefficients) other;
        checkConventions(this, o);
        double[][][] out = new double[2][lmax + 1][lmax + 1];
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = i; m <= l; m++) {
                    out[i][l][m] = op.applyAsDouble(coeffs[i][l][m], o.coeffs[i][l][m]);
                }
            }
        }
        return new RealCoefficients(out, normalization, csphase);
    }

    static void checkConventions(CoefficientSet a, CoefficientSet b) {
        if (a.normalization() != b.normalization() || a.csphase() != b.csphase()) {
            throw new IncompatibleOperandsException(
                    "normalization and csphase must match. Found " + a.normalization().label()
                            + "/" + a.csphase().value() + " and " + b.normalization().label()
                            + "/" + b.csphase().value() + ".");
        }
        if (a.lmax() != b.lmax()) {
            throw new DimensionMismatchException(
                    "band limits differ: " + a.lmax() + " and " + b.lmax() + ".");
        }
    }

    @Override
    public String toString() {
        return "RealCoefficients[lmax=" + lmax + ", normalization=" + normalization.label()
                + ", csphase=" + csphase.value() + "]";
    }

    private static final class Variant implements VariantDispatcher.CoefficientVariant {
        @Override
        public CoefficientSet zeros(int lmax, Normalization normalization, CsPhase csphase) {
            return RealCoefficients.zeros(lmax, normalization, csphase);
        }

        @Override
        public CoefficientSet random(
                double[] power,
                Normalization normalization,
                CsPhase csphase,
                boolean exactPower,
                RandomGenerator rng) {
            return RealCoefficients.random(power, normalization, csphase, exactPower, rng);
        }

        @Override
        public CoefficientSet from(
                CoefficientSet source,
                Normalization normalization,
                CsPhase csphase,
                int lmax,
                boolean check) {
            if (source instanceof RealCoefficients) {
                RealCoefficients r = (RealCoefficients) source;
                return adopt(r.toArray(normalization, csphase, checkLmax(r, lmax)),
                        normalization, csphase);
            }
            ComplexCoefficients c = (ComplexCoefficients) source;
            Complex[][][] converted = c.toArray(normalization, csphase, checkLmax(c, lmax));
            double[][][] real = KindConverter.toReal(
                    converted, check, SpharmConfig.realCheckTolerance());
            return adopt(real, normalization, csphase);
        }
    }

    static int checkLmax(CoefficientSet source, int lmax) {
        if (lmax < 0 || lmax > source.lmax()) {
            throw new DimensionMismatchException(
                    "lmax must be between 0 and " + source.lmax() + ". Input value was " + lmax + ".");
        }
        return lmax;
    }
}
