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

import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Resolves the concrete variant for a kind or grid type through fixed
 * enum-keyed tables.
 */
public final class VariantDispatcher {

    /** Factories for one coefficient kind. */
    public interface CoefficientVariant {
        CoefficientSet zeros(int lmax, Normalization normalization, CsPhase csphase);

        CoefficientSet random(
                double[] power,
                Normalization normalization,
                CsPhase csphase,
                boolean exactPower,
                RandomGenerator rng);

        /** {@code source} expressed as this kind in the given conventions. */
        CoefficientSet from(
                CoefficientSet source,
                Normalization normalization,
                CsPhase csphase,
                int lmax,
                boolean check);
    }

    @FunctionalInterface
    private interface GeometryFactory {
        GridGeometry create(int nlat, int nlon);
    }

    private static final Map<Kind, CoefficientVariant> COEFFICIENTS = new EnumMap<>(Kind.class);
    private static final Map<GridType, GeometryFactory> GEOMETRIES = new EnumMap<>(GridType.class);

    static {
        COEFFICIENTS.put(Kind.REAL, RealCoefficients.VARIANT);
        COEFFICIENTS.put(Kind.COMPLEX, ComplexCoefficients.VARIANT);
        GEOMETRIES.put(GridType.DH, DhGeometry::new);
        GEOMETRIES.put(GridType.GLQ, VariantDispatcher::glq);
    }

    private VariantDispatcher() {}

    public static CoefficientVariant coefficients(Kind kind) {
        CoefficientVariant v = kind == null ? null : COEFFICIENTS.get(kind);
        if (v == null) throw InvalidOptionException.of("kind", kind, "'real' or 'complex'");
        return v;
    }

    /**
     * Geometry of a grid with the given shape.
     *
     * @throws DimensionMismatchException if the shape is invalid for the grid type
     */
    public static GridGeometry geometry(GridType gridType, int nlat, int nlon) {
        GeometryFactory f = gridType == null ? null : GEOMETRIES.get(gridType);
        if (f == null) throw InvalidOptionException.of("grid", gridType, "'DH' or 'GLQ'");
        return f.create(nlat, nlon);
    }

    /**
     * Grid type implied by a shape: nlon equal to nlat or 2 nlat is DH,
     * nlon = 2 nlat - 1 is GLQ.
     */
    public static GridType inferGridType(int nlat, int nlon) {
        if (nlon == nlat || nlon == 2 * nlat) return GridType.DH;
        if (nlon == 2 * nlat - 1) return GridType.GLQ;
        throw new DimensionMismatchException(
                "Cannot tell the grid type from shape (" + nlat + ", " + nlon
                        + "). DH grids have nlon = nlat or 2 nlat, GLQ grids 2 nlat - 1.");
    }

    private static GridGeometry glq(int nlat, int nlon) {
        int lmax = nlat - 1;
        if (nlat < 1 || nlon != 2 * lmax + 1) {
            throw new DimensionMismatchException(
                    "GLQ grids need nlon = 2 lmax + 1 with lmax = nlat - 1. Input (nlat, nlon) was ("
                            + nlat + ", " + nlon + ").");
        }
        return new GlqGeometry(ShtBackends.get().gaussLegendre(lmax));
    }
}
