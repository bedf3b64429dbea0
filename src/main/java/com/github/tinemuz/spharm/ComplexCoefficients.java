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
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Complex spherical harmonic coefficients: order m in plane 0, order -m in
 * plane 1.
 */
public final class ComplexCoefficients implements CoefficientSet {
    private static final Logger log = LoggerFactory.getLogger(ComplexCoefficients.class);
    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);

    static final VariantDispatcher.CoefficientVariant VARIANT = new Variant();

    private final Complex[][][] coeffs;
    private final Normalization normalization;
    private final CsPhase csphase;
    private final int lmax;

    private ComplexCoefficients(Complex[][][] coeffs, Normalization normalization, CsPhase csphase) {
        this.coeffs = coeffs;
        this.normalization = normalization;
        this.csphase = csphase;
        this.lmax = coeffs[0].length - 1;
    }

    /**
     * Copy {@code coeffs}, zeroing every entry outside the valid mask. Null
     * entries are read as zero.
     */
    public static ComplexCoefficients fromArray(
            Complex[][][] coeffs, Normalization normalization, CsPhase csphase) {
        return new ComplexCoefficients(Masks.maskedCopy(coeffs), normalization, csphase);
    }

    public static ComplexCoefficients fromArray(Complex[][][] coeffs) {
        return fromArray(coeffs, Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    /**
     * Wrap {@code coeffs} without copying. The caller hands over ownership,
     * must not touch the array afterwards, and guarantees that every entry
     * is non-null and entries outside the mask are zero.
     */
    public static ComplexCoefficients adopt(
            Complex[][][] coeffs, Normalization normalization, CsPhase csphase) {
        Masks.checkShape(coeffs);
        return new ComplexCoefficients(coeffs, normalization, csphase);
    }

    public static ComplexCoefficients zeros(int lmax, Normalization normalization, CsPhase csphase) {
        if (lmax < 0) {
            throw new DimensionMismatchException("lmax must be non-negative. Input value was " + lmax + ".");
        }
        return new ComplexCoefficients(Masks.zerosComplex(lmax), normalization, csphase);
    }

    /**
     * Random coefficients with independent real and imaginary parts and
     * expected power spectrum {@code power}.
     */
    public static ComplexCoefficients random(
            double[] power,
            Normalization normalization,
            CsPhase csphase,
            boolean exactPower,
            RandomGenerator rng) {
        int lmax = power.length - 1;
        Complex[][][] c = Masks.zerosComplex(lmax);
        for (int l = 0; l <= lmax; l++) {
            double sum = 0.0;
            for (int i = 0; i < 2; i++) {
                for (int m = i; m <= l; m++) {
                    Complex z = new Complex(rng.nextGaussian(), rng.nextGaussian()).multiply(INV_SQRT2);
                    c[i][l][m] = z;
                    double a = z.abs();
                    sum += a * a;
                }
            }
            double scale = RealCoefficients.amplitude(normalization, power[l], l);
            if (exactPower && sum > 0.0) scale *= Math.sqrt((2.0 * l + 1.0) / sum);
            for (int i = 0; i < 2; i++) {
                for (int m = i; m <= l; m++) c[i][l][m] = c[i][l][m].multiply(scale);
            }
        }
        log.debug("Drew random complex coefficients lmax={} exactPower={}", lmax, exactPower);
        return new ComplexCoefficients(c, normalization, csphase);
    }

    @Override
    public Kind kind() {
        return Kind.COMPLEX;
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

    public Complex[][][] toArray() {
        return Masks.copy(coeffs);
    }

    /**
     * The coefficients in other conventions, truncated to {@code lmax}.
     *
     * @throws DimensionMismatchException if {@code lmax} exceeds {@link #lmax()}
     */
    public Complex[][][] toArray(Normalization normalization, CsPhase csphase, int lmax) {
        return NormalizationConverter.convert(
                coeffs, this.normalization, this.csphase, normalization, csphase, lmax);
    }

    /** Coefficient of degree l and signed order m. */
    public Complex coefficient(int l, int m) {
        int[] a = Masks.address(l, m, lmax);
        return coeffs[a[0]][a[1]][a[2]];
    }

    public void setCoeff(Complex value, int l, int m) {
        int[] a = Masks.address(l, m, lmax);
        coeffs[a[0]][a[1]][a[2]] = value;
    }

    /**
     * Set several coefficients in place; negative orders address plane 1.
     * All positions are validated before any value is written.
     */
    public void setCoeffs(Complex[] values, int[] ls, int[] ms) {
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
    public ComplexCoefficients copy() {
        return new ComplexCoefficients(Masks.copy(coeffs), normalization, csphase);
    }

    @Override
    public CoefficientSet convert(
            Normalization normalization, CsPhase csphase, int lmax, Kind kind, boolean check) {
        return VariantDispatcher.coefficients(kind).from(this, normalization, csphase, lmax, check);
    }

    @Override
    public ComplexCoefficients convert(Normalization normalization, CsPhase csphase) {
        return adopt(toArray(normalization, csphase, lmax), normalization, csphase);
    }

    /**
     * The same function as real coefficients.
     *
     * @param check verify that the coefficients describe a real function
     */
    public RealCoefficients toReal(boolean check) {
        return RealCoefficients.adopt(
                KindConverter.toReal(coeffs, check, SpharmConfig.realCheckTolerance()),
                normalization, csphase);
    }

    @Override
    public ComplexCoefficients rotate(double alpha, double beta, double gamma, boolean degrees) {
        EulerAngles angles = degrees
                ? EulerAngles.ofDegrees(alpha, beta, gamma)
                : new EulerAngles(alpha, beta, gamma);
        return new RotationCoordinator().rotate(this, angles, null);
    }

    @Override
    public ComplexGrid expand(GridScheme scheme) {
        ShtBackend backend = ShtBackends.get();
        if (scheme.gridType() == GridType.GLQ) {
            GaussLegendreQuadrature nodes = backend.gaussLegendre(lmax);
            Complex[][] data = backend.makeGridGlqComplex(coeffs, nodes, normalization, csphase);
            return ComplexGrid.adopt(data, new GlqGeometry(nodes));
        }
        Complex[][] data = backend.makeGridDhComplex(coeffs, scheme.sampling(), normalization, csphase);
        return ComplexGrid.adopt(data, DhGeometry.forLmax(lmax, scheme.sampling()));
    }

    @Override
    public ComplexGrid expand() {
        return expand(GridScheme.DH1);
    }

    @Override
    public ComplexCoefficients add(CoefficientSet other) {
        return combine(other, Complex::add);
    }

    @Override
    public ComplexCoefficients subtract(CoefficientSet other) {
        return combine(other, Complex::subtract);
    }

    @Override
    public ComplexCoefficients multiply(CoefficientSet other) {
        return combine(other, Complex::multiply);
    }

    @Override
    public ComplexCoefficients divide(CoefficientSet other) {
        return combine(other, Complex::divide);
    }

    @Override
    public ComplexCoefficients add(double value) {
        return map(a -> a.add(value));
    }

    public ComplexCoefficients add(Complex value) {
        return map(a -> a.add(value));
    }

    @Override
    public ComplexCoefficients subtract(double value) {
        return map(a -> a.subtract(value));
    }

    public ComplexCoefficients subtract(Complex value) {
        return map(a -> a.subtract(value));
    }

    @Override
    public ComplexCoefficients multiply(double value) {
        return map(a -> a.multiply(value));
    }

    public ComplexCoefficients multiply(Complex value) {
        return map(a -> a.multiply(value));
    }

    @Override
    public ComplexCoefficients divide(double value) {
        return map(a -> a.divide(value));
    }

    public ComplexCoefficients divide(Complex value) {
        return map(a -> a.divide(value));
    }

    @Override
    public ComplexCoefficients subtractFrom(double value) {
        return map(a -> new Complex(value).subtract(a));
    }

    @Override
    public ComplexCoefficients divideInto(double value) {
        return map(a -> new Complex(value).divide(a));
    }

    @Override
    public ComplexCoefficients pow(double exponent) {
        return map(a -> complexPow(a, exponent));
    }

    /** {@code base^exponent}, with a zero base following {@link Math#pow} instead of yielding NaN. */
    static Complex complexPow(Complex base, double exponent) {
        if (base.getReal() == 0.0 && base.getImaginary() == 0.0) {
            if (Double.isNaN(exponent)) return Complex.NaN;
            if (exponent == 0.0) return Complex.ONE;
            return exponent > 0.0 ? Complex.ZERO : Complex.INF;
        }
        return base.pow(exponent);
    }

    private ComplexCoefficients map(UnaryOperator<Complex> op) {
        Complex[][][] out = Masks.zerosComplex(lmax);
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = i; m <= l; m++) out[i][l][m] = op.apply(coeffs[i][l][m]);
            }
        }
        return new ComplexCoefficients(out, normalization, csphase);
    }

    private ComplexCoefficients combine(CoefficientSet other, BinaryOperator<Complex> op) {
        if (!(other instanceof ComplexCoefficients)) {
            throw new IncompatibleOperandsException(
                    "cannot combine complex coefficients with " + other.kind().label()
                            + " coefficients.");
        }
        ComplexCoefficients o = (ComplexCoefficients) other;
        RealCoefficients.checkConventions(this, o);
        Complex[][][] out = Masks.zerosComplex(lmax);
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                for (int m = i; m <= l; m++) out[i][l][m] = op.apply(coeffs[i][l][m], o.coeffs[i][l][m]);
            }
        }
        return new ComplexCoefficients(out, normalization, csphase);
    }

    @Override
    public String toString() {
        return "ComplexCoefficients[lmax=" + lmax + ", normalization=" + normalization.label()
                + ", csphase=" + csphase.value() + "]";
    }

    private static final class Variant implements VariantDispatcher.CoefficientVariant {
        @Override
        public CoefficientSet zeros(int lmax, Normalization normalization, CsPhase csphase) {
            return ComplexCoefficients.zeros(lmax, normalization, csphase);
        }

        @Override
        public CoefficientSet random(
                double[] power,
                Normalization normalization,
                CsPhase csphase,
                boolean exactPower,
                RandomGenerator rng) {
            return ComplexCoefficients.random(power, normalization, csphase, exactPower, rng);
        }

        @Override
        public CoefficientSet from(
                CoefficientSet source,
                Normalization normalization,
                CsPhase csphase,
                int lmax,
                boolean check) {
            int target = RealCoefficients.checkLmax(source, lmax);
            if (source instanceof ComplexCoefficients) {
                ComplexCoefficients c = (ComplexCoefficients) source;
                return adopt(c.toArray(normalization, csphase, target), normalization, csphase);
            }
            RealCoefficients r = (RealCoefficients) source;
            double[][][] converted = r.toArray(normalization, csphase, target);
            return adopt(KindConverter.toComplex(converted), normalization, csphase);
        }
    }
}
