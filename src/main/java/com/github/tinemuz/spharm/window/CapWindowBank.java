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

import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.backend.CapTaperSet;
import com.github.tinemuz.spharm.backend.RotationKernel;
import com.github.tinemuz.spharm.backend.ShtBackend;
import com.github.tinemuz.spharm.backend.ShtBackends;
import com.github.tinemuz.spharm.convert.NormalizationConverter;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import com.github.tinemuz.spharm.rotate.EulerAngles;
import com.github.tinemuz.spharm.rotate.RotationCoordinator;
import com.github.tinemuz.spharm.spectrum.SpectralAnalyzer;
import com.github.tinemuz.spharm.spectrum.SpectrumConvention;
import com.github.tinemuz.spharm.spectrum.SpectrumUnit;
import java.util.Arrays;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tapers concentrated within a spherical cap.
 *
 * <p>The tapers are computed for a cap centred on the north pole, where each
 * has a single nonzero order. {@link #rotate} moves them to another centre
 * and caches the rotated coefficients; that cache is the only state that
 * changes after construction.</p>
 */
public final class CapWindowBank implements WindowBank {
    private static final Logger log = LoggerFactory.getLogger(CapWindowBank.class);

    private final ShtBackend backend;
    private final double thetaRadians;
    private final int lwin;
    private final int nwin;
    private final double[][] tapers;
    private final double[] eigenvalues;
    private final int[] orders;
    private final double[] weights;
    private RotationKernel kernel;

    // Rotated cache, packed [(lwin+1)^2][nwinrot]
    private double[][] rotated;
    private int nwinrot;
    private Double clat;
    private Double clon;

    private CapWindowBank(
            ShtBackend backend,
            double thetaRadians,
            int lwin,
            CapTaperSet set,
            int nwin,
            double[] weights,
            RotationKernel kernel) {
        this.backend = backend;
        this.thetaRadians = thetaRadians;
        this.lwin = lwin;
        this.nwin = nwin;
        this.tapers = new double[lwin + 1][nwin];
        for (int l = 0; l <= lwin; l++) System.arraycopy(set.tapers()[l], 0, tapers[l], 0, nwin);
        this.eigenvalues = Arrays.copyOf(set.eigenvalues(), nwin);
        this.orders = Arrays.copyOf(set.orders(), nwin);
        this.weights = weights == null ? null : weights.clone();
        this.kernel = kernel;
    }

    private CapWindowBank(CapWindowBank other) {
        this.backend = other.backend;
        this.thetaRadians = other.thetaRadians;
        this.lwin = other.lwin;
        this.nwin = other.nwin;
        this.tapers = deepCopy(other.tapers);
        this.eigenvalues = other.eigenvalues.clone();
        this.orders = other.orders.clone();
        this.weights = other.weights == null ? null : other.weights.clone();
        this.kernel = other.kernel;
        this.rotated = other.rotated == null ? null : deepCopy(other.rotated);
        this.nwinrot = other.nwinrot;
        this.clat = other.clat;
        this.clon = other.clon;
    }

    /** All (lwin+1)^2 tapers of a cap with half angle {@code thetaDegrees}, at the north pole. */
    public static CapWindowBank of(double thetaDegrees, int lwin) {
        return builder(thetaDegrees, lwin).build();
    }

    public static Builder builder(double theta, int lwin) {
        return new Builder(theta, lwin);
    }

    @Override
    public WindowKind kind() {
        return WindowKind.CAP;
    }

    @Override
    public int lwin() {
        return lwin;
    }

    @Override
    public int nwin() {
        return nwin;
    }

    @Override
    public double[] eigenvalues() {
        return eigenvalues.clone();
    }

    @Override
    public double[] weights() {
        return weights == null ? null : weights.clone();
    }

    public double theta(boolean degrees) {
        return degrees ? Math.toDegrees(thetaRadians) : thetaRadians;
    }

    /** Order of each taper; negative values are sine terms. */
    public int[] orders() {
        return orders.clone();
    }

    /** Degree-wise coefficients of the unrotated tapers, {@code [l][taper]}. */
    public double[][] tapers() {
        return deepCopy(tapers);
    }

    /** Power of taper {@code itaper}; unaffected by rotation, so every taper stays available. */
    @Override
    public double[] powerSpectrum(int itaper, SpectrumUnit unit, double base, boolean energy) {
        if (itaper < 0 || itaper >= nwin) {
            throw new IndexOutOfBoundsException(
                    "itaper must be between 0 and " + (nwin - 1) + ". Input value was " + itaper + ".");
        }
        double[] l2 = new double[lwin + 1];
        for (int l = 0; l <= lwin; l++) l2[l] = tapers[l][itaper] * tapers[l][itaper];
        return SpectralAnalyzer.scale(l2, Normalization.FOUR_PI,
                energy ? SpectrumConvention.ENERGY : SpectrumConvention.POWER, unit, base);
    }

    /** Latitude in degrees of the current centre, if the tapers were rotated. */
    public OptionalDouble clat() {
        return clat == null ? OptionalDouble.empty() : OptionalDouble.of(clat);
    }

    /** Longitude in degrees of the current centre, if the tapers were rotated. */
    public OptionalDouble clon() {
        return clon == null ? OptionalDouble.empty() : OptionalDouble.of(clon);
    }

    /** Number of tapers held in the rotated cache. */
    public int nwinrot() {
        return nwinrot;
    }

    @Override
    public CapWindowBank copy() {
        return new CapWindowBank(this);
    }

    /**
     * Centre the first {@code nwinrot} tapers on (clat, clon) and cache them.
     *
     * @throws DimensionMismatchException if {@code nwinrot} is not in 1..nwin
     */
    public void rotate(double clat, double clon, boolean coordDegrees, int nwinrot) {
        if (nwinrot < 1 || nwinrot > nwin) {
            throw new DimensionMismatchException(
                    "nwinrot must be between 1 and nwin = " + nwin + ". Input value was "
                            + nwinrot + ".");
        }
        double latDeg = coordDegrees ? clat : Math.toDegrees(clat);
        double lonDeg = coordDegrees ? clon : Math.toDegrees(clon);
        int size = (lwin + 1) * (lwin + 1);
        double[][] packed = new double[size][nwinrot];
        boolean atPole = latDeg == 90.0 && lonDeg == 0.0;
        RotationCoordinator coordinator = atPole ? null : new RotationCoordinator(backend);
        EulerAngles angles = EulerAngles.ofDegrees(0.0, -(90.0 - latDeg), -lonDeg);
        if (!atPole && kernel == null) kernel = backend.rotationKernel(lwin);
        for (int i = 0; i < nwinrot; i++) {
            double[][][] cilm = unrotated(i);
            if (!atPole) cilm = coordinator.rotateCanonical(cilm, angles, kernel);
            double[] v = backend.cilmToVector(cilm);
            for (int k = 0; k < size; k++) packed[k][i] = v[k];
        }
        this.rotated = packed;
        this.nwinrot = nwinrot;
        this.clat = latDeg;
        this.clon = lonDeg;
        log.debug("Centred {} cap tapers at ({}, {})", nwinrot, latDeg, lonDeg);
    }

    @Override
    public double[][][] toArray(int itaper, Normalization normalization, CsPhase csphase) {
        double[][][] cilm;
        if (rotated == null) {
            if (itaper < 0 || itaper >= nwin) {
                throw new IndexOutOfBoundsException(
                        "itaper must be between 0 and " + (nwin - 1) + ". Input value was "
                                + itaper + ".");
            }
            cilm = unrotated(itaper);
        } else {
            if (itaper < 0 || itaper >= nwinrot) {
                throw new IndexOutOfBoundsException(
                        "Only " + nwinrot + " rotated tapers are available. Input value was "
                                + itaper + ".");
            }
            double[] v = new double[rotated.length];
            for (int k = 0; k < v.length; k++) v[k] = rotated[k][itaper];
            cilm = backend.vectorToCilm(v);
        }
        if (normalization == Normalization.FOUR_PI && csphase == CsPhase.EXCLUDED) return cilm;
        return NormalizationConverter.convert(
                cilm, Normalization.FOUR_PI, CsPhase.EXCLUDED, normalization, csphase, lwin);
    }

    /**
     * Make sure the cache holds at least {@code k} tapers centred where
     * requested, rotating if needed. Without a requested centre the stored
     * one is kept, or the north pole used when there is none.
     */
    void ensureCentered(Double lat, Double lon, boolean coordDegrees, int k) {
        if ((lat == null) != (lon == null)) {
            throw new InvalidOptionException("clat and clon must be given together.");
        }
        if (lat != null) {
            double latDeg = coordDegrees ? lat : Math.toDegrees(lat);
            double lonDeg = coordDegrees ? lon : Math.toDegrees(lon);
            boolean same = rotated != null && clat == latDeg && clon == lonDeg;
            if (!same || k > nwinrot) rotate(latDeg, lonDeg, true, k);
        } else if (rotated == null) {
            rotate(90.0, 0.0, true, k);
        } else if (k > nwinrot) {
            rotate(clat, clon, true, k);
        }
    }

    /** Packed coefficients of the cached tapers, {@code [index][taper]}. */
    double[][] rotatedTapers() {
        return rotated;
    }

    double[][] tapersView() {
        return tapers;
    }

    private double[][][] unrotated(int i) {
        double[][][] cilm = new double[2][lwin + 1][lwin + 1];
        int order = orders[i];
        int plane = order < 0 ? 1 : 0;
        int m = Math.abs(order);
        for (int l = 0; l <= lwin; l++) cilm[plane][l][m] = tapers[l][i];
        return cilm;
    }

    private static double[][] deepCopy(double[][] a) {
        double[][] out = new double[a.length][];
        for (int i = 0; i < a.length; i++) out[i] = a[i].clone();
        return out;
    }

    @Override
    public String toString() {
        return "CapWindowBank[theta=" + theta(true) + " deg, lwin=" + lwin + ", nwin=" + nwin
                + (clat == null ? "" : ", center=(" + clat + ", " + clon + "), nwinrot=" + nwinrot)
                + "]";
    }

    /** Options for {@link CapWindowBank}. */
    public static final class Builder {
        private final double theta;
        private final int lwin;
        private boolean thetaDegrees = true;
        private boolean coordDegrees = true;
        private Integer nwin;
        private Double clat;
        private Double clon;
        private double[] weights;
        private RotationKernel kernel;
        private ShtBackend backend;

        private Builder(double theta, int lwin) {
            this.theta = theta;
            this.lwin = lwin;
        }

        /** Whether the half angle is in degrees (default) or radians. */
        public Builder thetaDegrees(boolean value) {
            this.thetaDegrees = value;
            return this;
        }

        /** Whether the centre coordinates are in degrees (default) or radians. */
        public Builder coordDegrees(boolean value) {
            this.coordDegrees = value;
            return this;
        }

        public Builder nwin(int value) {
            this.nwin = value;
            return this;
        }

        public Builder center(double latitude, double longitude) {
            this.clat = latitude;
            this.clon = longitude;
            return this;
        }

        public Builder weights(double[] value) {
            this.weights = value == null ? null : value.clone();
            return this;
        }

        /** Precomputed rotation structure for band limit lwin. */
        public Builder kernel(RotationKernel value) {
            this.kernel = value;
            return this;
        }

        public Builder backend(ShtBackend value) {
            this.backend = value;
            return this;
        }

        /**
         * @throws DimensionMismatchException if nwin exceeds (lwin+1)^2 or the
         *     weights do not have nwin entries
         */
        public CapWindowBank build() {
            if (lwin < 0) {
                throw new DimensionMismatchException("lwin must be non-negative. Input value was " + lwin + ".");
            }
            int max = (lwin + 1) * (lwin + 1);
            int n = nwin == null ? max : nwin;
            if (n < 1 || n > max) {
                throw new DimensionMismatchException(
                        "nwin must be between 1 and (lwin+1)^2 = " + max + ". Input value was "
                                + n + ".");
            }
            if (weights != null && weights.length != n) {
                throw new DimensionMismatchException(
                        "weights must have nwin = " + n + " entries. Input length was "
                                + weights.length + ".");
            }
            if (kernel != null && kernel.lmax() < lwin) {
                throw new DimensionMismatchException(
                        "Rotation kernel lmax " + kernel.lmax() + " is below lwin " + lwin + ".");
            }
            ShtBackend b = backend != null ? backend : ShtBackends.get();
            double thetaRad = thetaDegrees ? Math.toRadians(theta) : theta;
            CapTaperSet set = b.capTapers(thetaRad, lwin);
            log.info("Computed {} cap tapers for theta={} deg, lwin={}",
                    n, Math.toDegrees(thetaRad), lwin);
            CapWindowBank bank = new CapWindowBank(b, thetaRad, lwin, set, n, weights, kernel);
            if (clat != null) bank.rotate(clat, clon, coordDegrees, n);
            return bank;
        }
    }
}
