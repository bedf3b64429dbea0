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
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/** Real-valued grid. */
public final class RealGrid implements GridSample {
    private final double[][] data;
    private final GridGeometry geometry;

    private RealGrid(double[][] data, GridGeometry geometry) {
        this.data = data;
        this.geometry = geometry;
    }

    /**
     * Copy {@code data} into a new grid of the given type.
     *
     * @throws DimensionMismatchException if the shape is invalid for the grid type
     */
    public static RealGrid fromArray(double[][] data, GridType gridType) {
        int[] shape = shapeOf(data);
        GridGeometry geometry = VariantDispatcher.geometry(gridType, shape[0], shape[1]);
        return new RealGrid(copy(data), geometry);
    }

    /** Copy {@code data}; a DH grid is assumed. */
    public static RealGrid fromArray(double[][] data) {
        return fromArray(data, GridType.DH);
    }

    /**
     * Wrap {@code data} without copying. The caller hands over ownership and
     * must not modify the array afterwards.
     */
    public static RealGrid adopt(double[][] data, GridGeometry geometry) {
        int[] shape = shapeOf(data);
        if (shape[0] != geometry.nlat() || shape[1] != geometry.nlon()) {
            throw new DimensionMismatchException(
                    "Grid data (" + shape[0] + ", " + shape[1] + ") does not match geometry ("
                            + geometry.nlat() + ", " + geometry.nlon() + ").");
        }
        return new RealGrid(data, geometry);
    }

    @Override
    public Kind kind() {
        return Kind.REAL;
    }

    @Override
    public GridGeometry geometry() {
        return geometry;
    }

    /** A copy of the samples, indexed [latitude][longitude]. */
    public double[][] data() {
        return copy(data);
    }

    public double get(int lat, int lon) {
        return data[lat][lon];
    }

    @Override
    public RealCoefficients expand(Normalization normalization, CsPhase csphase) {
        ShtBackend backend = ShtBackends.get();
        double[][][] cilm;
        if (geometry instanceof GlqGeometry) {
            cilm = backend.expandGlq(data, ((GlqGeometry) geometry).nodes(), normalization, csphase);
        } else {
            cilm = backend.expandDh(data, normalization, csphase);
        }
        return RealCoefficients.adopt(cilm, normalization, csphase);
    }

    @Override
    public RealCoefficients expand() {
        return expand(Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    @Override
    public RealGrid copy() {
        return new RealGrid(copy(data), geometry);
    }

    @Override
    public RealGrid add(GridSample other) {
        return combine(other, Double::sum);
    }

    @Override
    public RealGrid subtract(GridSample other) {
        return combine(other, (a, b) -> a - b);
    }

    @Override
    public RealGrid multiply(GridSample other) {
        return combine(other, (a, b) -> a * b);
    }

    @Override
    public RealGrid divide(GridSample other) {
        return combine(other, (a, b) -> a / b);
    }

    @Override
    public RealGrid add(double value) {
        return map(a -> a + value);
    }

    @Override
    public RealGrid subtract(double value) {
        return map(a -> a - value);
    }

    @Override
    public RealGrid multiply(double value) {
        return map(a -> a * value);
    }

    @Override
    public RealGrid divide(double value) {
        return map(a -> a / value);
    }

    @Override
    public RealGrid subtractFrom(double value) {
        return map(a -> value - a);
    }

    @Override
    public RealGrid divideInto(double value) {
        return map(a -> value / a);
    }

    @Override
    public RealGrid pow(double exponent) {
        return map(a -> Math.pow(a, exponent));
    }

    private RealGrid map(DoubleUnaryOperator op) {
        double[][] out = new double[data.length][data[0].length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[0].length; j++) out[i][j] = op.applyAsDouble(data[i][j]);
        }
        return new RealGrid(out, geometry);
    }

    private RealGrid combine(GridSample other, DoubleBinaryOperator op) {
        if (!(other instanceof RealGrid)) {
            throw new IncompatibleOperandsException(
                    "cannot combine a real grid with a " + other.kind().label() + " grid.");
        }
        RealGrid o = (RealGrid) other;
        checkCompatible(this, o);
        double[][] out = new double[data.length][data[0].length];
        for (int i = 0; i < data.length; i++) {
            for (int j = 0; j < data[0].length; j++) {
                out[i][j] = op.applyAsDouble(data[i][j], o.data[i][j]);
            }
        }
        return new RealGrid(out, geometry);
    }

    static void checkCompatible(GridSample a, GridSample b) {
        if (a.gridType() != b.gridType()) {
            throw new IncompatibleOperandsException(
                    "grid types differ: " + a.gridType() + " and " + b.gridType() + ".");
        }
        if (a.nlat() != b.nlat() || a.nlon() != b.nlon()) {
            throw new DimensionMismatchException(
                    "grid shapes differ: (" + a.nlat() + ", " + a.nlon() + ") and ("
                            + b.nlat() + ", " + b.nlon() + ").");
        }
    }

    static int[] shapeOf(Object[] rows) {
        if (rows == null || rows.length == 0) {
            throw new DimensionMismatchException("Grid data must have at least one row.");
        }
        int nlon = -1;
        for (Object row : rows) {
            int len = row instanceof double[] ? ((double[]) row).length : ((Object[]) row).length;
            if (nlon < 0) nlon = len;
            if (len != nlon || len == 0) {
                throw new DimensionMismatchException("Grid rows must all have the same nonzero length.");
            }
        }
        return new int[] {rows.length, nlon};
    }

    private static double[][] copy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = a[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return "RealGrid[grid=" + gridType() + ", nlat=" + nlat() + ", nlon=" + nlon()
                + ", lmax=" + lmax()
                + (geometry instanceof DhGeometry ? ", sampling=" + ((DhGeometry) geometry).sampling() : "")
                + "]";
    }
}
