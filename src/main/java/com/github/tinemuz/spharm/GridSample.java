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

import com.github.tinemuz.spharm.io.GridFiles;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Values of a function sampled on a Driscoll-Healy or Gauss-Legendre grid.
 *
 * <p>Grids are immutable: arithmetic returns new grids. Operands of
 * grid/grid arithmetic must share kind, grid type and shape.</p>
 */
public sealed interface GridSample permits RealGrid, ComplexGrid {

    Kind kind();

    GridGeometry geometry();

    default GridType gridType() {
        return geometry().gridType();
    }

    default int nlat() {
        return geometry().nlat();
    }

    default int nlon() {
        return geometry().nlon();
    }

    default int lmax() {
        return geometry().lmax();
    }

    /** Latitudes of the rows, north first, in degrees. */
    default double[] lats() {
        return lats(true);
    }

    default double[] lats(boolean degrees) {
        return geometry().lats(degrees);
    }

    /** Longitudes of the columns, starting at zero, in degrees. */
    default double[] lons() {
        return lons(true);
    }

    default double[] lons(boolean degrees) {
        return geometry().lons(degrees);
    }

    /** Forward transform to coefficients of the given conventions. */
    CoefficientSet expand(Normalization normalization, CsPhase csphase);

    default CoefficientSet expand() {
        return expand(Normalization.FOUR_PI, CsPhase.EXCLUDED);
    }

    GridSample copy();

    GridSample add(GridSample other);

    GridSample subtract(GridSample other);

    GridSample multiply(GridSample other);

    GridSample divide(GridSample other);

    GridSample add(double value);

    GridSample subtract(double value);

    GridSample multiply(double value);

    GridSample divide(double value);

    /** {@code value - this}. */
    GridSample subtractFrom(double value);

    /** {@code value / this}. */
    GridSample divideInto(double value);

    GridSample pow(double exponent);

    /** Write as text ({@code binary == false}) or in the binary array format. */
    default void toFile(Path path, boolean binary) throws IOException {
        GridFiles.write(this, path, binary);
    }

    /** Read a grid, inferring DH or GLQ from its shape. */
    static GridSample fromFile(Path path, boolean binary) throws IOException {
        return GridFiles.read(path, binary);
    }
}
