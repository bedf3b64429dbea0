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

import com.github.tinemuz.spharm.backend.ShtBackend;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.IncompatibleOperandsException;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

import org.apache.commons.math3.complex.Complex;

/** Complex-valued grid. */
public final class ComplexGrid implements GridSample {
    private final Complex[][] data;
    private final GridGeometry geometry;

    private ComplexGrid(Complex[][] data, GridGeometry geometry) {
        this.data = data;
        this.geometry = geometry;
    }

    /** Copy {@code data} into a new grid of the given type. */
    public static ComplexGrid fromArray(Complex[][] data, GridType gridType) {
        int[] shape = RealGrid.shapeOf(data);
        GridGeometry geometry = VariantDispatcher.geometry(gridType, shape[0], shape[1]);
        return new ComplexGrid(copy(data), geometry);
    }

    /** Complex grid with zero imaginary part. */
    public static ComplexGrid fromReal(RealGrid grid) {
        double[][] re = grid.data();
        Complex[][] out = new Complex[re.length][re[0].length];
        for (int i = 0; i < re.length; i++) {
            for (int j = 0; j < re[0].length; j++) out[i][j] = new Complex(re[i][j], 0.0);
        }
        return new ComplexGrid(out, grid.geometry());
    }

    /**
     * Wrap {@code data} without copying. The caller hands over ownership and
     * must not modify the array afterwards.
     */
    public static ComplexGrid adopt(Complex[][] data, GridGeometry geometry) {
        int[] shape = RealGrid.shapeOf(data);
        if (shape[0] != geometry.nlat() || shape[1] != geometry.nlon()) {
            throw new DimensionMismatchException(
                    "Grid data (" + shape[0] + ", " + shape[1] + ") does not match geometry ("
                            + geometry.nlat() + ", " + geometry.nlon() + ").");
        }
        return new ComplexGrid(data, geometry);
    }

    @Override
    public Kind kind() {
        return Kind.COMPLEX;
    }

    @Override
    public GridGeometry geometry() {
        return geometry;
    }

    public Complex[][] data() {
        return copy(data);
    }

    public Complex get(int lat, int lon) {
        return data[lat][lon];
    }

    /** Real part as a real grid on the same geometry. */
    public RealGrid real() {
        return part(true);
    }

    /** Imaginary part as a real grid on the same geometry. */
    public RealGrid imaginary() {
        return part(false);
    }

    /** Recombine real and imaginary grids sharing one geometry. */
    public static ComplexGrid of(RealGrid re, RealGrid im) {
        RealGrid.checkCompatible(re, im);
        Complex[][] out = new Complex[re.nlat()][re.nlon()];
        for (int i = 0; i < re.nlat(); i++) {
            for (int j = 0; j < re.nlon(); j++) out[i][j] = new Complex(re.get(i, j), im.get(i, j));
        }
        return new ComplexGrid(out, re.geometry());
    }

    private RealGrid part(boolean real) {
        double[][] out = new double[data.length][data[0].length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[0].length; j++) {
                out[i][j] = real ? data[i][j].getReal() : data[i][j].getImaginary();
            }
        }
        return RealGrid.adopt(out, geometry);
    }

    @Override
    public ComplexCoefficients expand(Normalization normalization, CsPhase csphase) {
        ShtBackend backend = ShtBackends.get();
        Complex[][][] cilm;
        if (geometry instanceof GlqGeometry) {
            cilm = backend.expandGlqComplex(
                    data, ((GlqGeometry) geometry).nodes(), normalization, csphase);
        } else {
            cilm = backend.expandDhComplex(data, normalization, csphase);
        }
        return ComplexCoefficients.adopt(cilm, normalization, csphase);
    }

    @Override
    public ComplexCoefficients expand() {
        return expand(Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    @Override
    public ComplexGrid copy() {
        return new ComplexGrid(copy(data), geometry);
    }

    @Override
    public ComplexGrid add(GridSample other) {
        return combine(other, Complex::add);
    }

    @Override
    public ComplexGrid subtract(GridSample other) {
        return combine(other, Complex::subtract);
    }

    @Override
    public ComplexGrid multiply(GridSample other) {
        return combine(other, Complex::multiply);
    }

    @Override
    public ComplexGrid divide(GridSample other) {
        return combine(other, Complex::divide);
    }

    @Override
    public ComplexGrid add(double value) {
        return map(a -> a.add(value));
    }

    public ComplexGrid add(Complex value) {
        return map(a -> a.add(value));
    }

    @Override
    public ComplexGrid subtract(double value) {
        return map(a -> a.subtract(value));
    }

    public ComplexGrid subtract(Complex value) {
        return map(a -> a.subtract(value));
    }

    @Override
    public ComplexGrid multiply(double value) {
        return map(a -> a.multiply(value));
    }

    public ComplexGrid multiply(Complex value) {
        return map(a -> a.multiply(value));
    }

    @Override
    public ComplexGrid divide(double value) {
        return map(a -> a.divide(value));
    }

    public ComplexGrid divide(Complex value) {
        return map(a -> a.divide(value));
    }

    @Override
    public ComplexGrid subtractFrom(double value) {
        return map(a -> new Complex(value).subtract(a));
    }

    @Override
    public ComplexGrid divideInto(double value) {
        return map(a -> new Complex(value).divide(a));
    }

    @Override
    public ComplexGrid pow(double exponent) {
        return map(a -> ComplexCoefficients.complexPow(a, exponent));
    }

    private ComplexGrid map(UnaryOperator<Complex> op) {
        Complex[][] out = new Complex[data.length][data[0].length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[0].length; j++) out[i][j] = op.apply(data[i][j]);
        }
        return new ComplexGrid(out, geometry);
    }

    private ComplexGrid combine(GridSample other, BinaryOperator<Complex> op) {
        if (!(other instanceof ComplexGrid)) {
            throw new IncompatibleOperandsException(
                    "cannot combine a complex grid with a " + other.kind().label() + " grid.");
        }
        ComplexGrid o = (ComplexGrid) other;
        RealGrid.checkCompatible(this, o);
        Complex[][] out = new Complex[data.length][data[0].length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[0].length; j++) out[i][j] = op.apply(data[i][j], o.data[i][j]);
        }
        return new ComplexGrid(out, geometry);
    }

    private static Complex[][] copy(Complex[][] a) {
        Complex[][] out = new Complex[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = a[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return "ComplexGrid[grid=" + gridType() + ", nlat=" + nlat() + ", nlon=" + nlon()
                + ", lmax=" + lmax() + "]";
    }
}
