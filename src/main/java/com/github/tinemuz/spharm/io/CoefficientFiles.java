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
package com.github.tinemuz.spharm.io;

import com.github.tinemuz.spharm.CoefficientSet;
import com.github.tinemuz.spharm.ComplexCoefficients;
import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Kind;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes coefficient sets.
 *
 * <p>The SHTOOLS text format holds one {@code l, m, cos, sin} row per
 * coefficient pair, separated by commas or whitespace. Blank lines, lines
 * starting with {@code #} and header lines whose first two fields are not
 * integers are skipped. Fortran {@code D} exponents are accepted.
 */
public final class CoefficientFiles {
    private static final Logger log = LoggerFactory.getLogger(CoefficientFiles.class);
    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");
    private static final String ROW_FORMAT = "%d, %d, %.16e, %.16e%n";

    private CoefficientFiles() {}

    /**
     * Read coefficients up to degree {@code lmax}. Text files are read in
     * the conventions given by the caller. Binary files carry their own
     * kind, which must match {@code kind}.
     */
    public static CoefficientSet read(
            Path path,
            int lmax,
            CoefficientFormat format,
            Kind kind,
            Normalization normalization,
            CsPhase csphase) throws IOException {
        if (lmax < 0) {
            throw new DimensionMismatchException("lmax must be non-negative. Input value was " + lmax + ".");
        }
        try {
            return switch (format) {
                case SHTOOLS -> readShtools(path, lmax, kind, normalization, csphase);
                case BINARY -> readBinary(path, lmax, kind, normalization, csphase);
            };
        } catch (IOException e) {
            log.error("Error reading coefficients from {}", path, e);
            throw e;
        }
    }

    public static void write(CoefficientSet coefficients, Path path, CoefficientFormat format) throws IOException {
        try {
            switch (format) {
                case SHTOOLS -> writeShtools(coefficients, path);
                case BINARY -> BinaryArrays.write(path, coefficients instanceof RealCoefficients
                        ? BinaryArrays.of(((RealCoefficients) coefficients).toArray())
                        : BinaryArrays.of(((ComplexCoefficients) coefficients).toArray()));
            }
        } catch (IOException e) {
            log.error("Error writing coefficients to {}", path, e);
            throw e;
        }
        log.debug("Wrote {} coefficients with lmax {} to {}", coefficients.kind().label(), coefficients.lmax(), path);
    }

    private static RealCoefficients readShtools(
            Path path, int lmax, Kind kind, Normalization normalization, CsPhase csphase) throws IOException {
        if (kind == Kind.COMPLEX) {
            throw new UnsupportedOperationException(
                    "Complex coefficients cannot be read from the SHTOOLS text format. Use the binary format.");
        }
        double[][][] coeffs = new double[2][lmax + 1][lmax + 1];
        int maxDegree = -1;
        int lineNumber = 0;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Compression.open(path), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                String[] fields = SEPARATOR.split(trimmed);
                if (fields.length < 3) continue;
                int l;
                int m;
                try {
                    l = Integer.parseInt(fields[0]);
                    m = Integer.parseInt(fields[1]);
                } catch (NumberFormatException e) {
                    log.debug("Skipping header line {} of {}", lineNumber, path);
                    continue;
                }
                if (l < 0 || m < 0 || m > l) {
                    throw new DimensionMismatchException(
                            "Invalid degree and order (" + l + ", " + m + ") on line " + lineNumber + " of " + path + ".");
                }
                if (l > lmax) continue;
                coeffs[0][l][m] = parseDouble(fields[2]);
                if (fields.length > 3 && m > 0) {
                    coeffs[1][l][m] = parseDouble(fields[3]);
                }
                maxDegree = Math.max(maxDegree, l);
            }
        }
        if (maxDegree < 0) {
            throw new DimensionMismatchException("No coefficients found in " + path + ".");
        }
        if (maxDegree < lmax) {
            coeffs = truncate(coeffs, maxDegree);
        }
        return RealCoefficients.adopt(coeffs, normalization, csphase);
    }

    private static CoefficientSet readBinary(
            Path path, int lmax, Kind kind, Normalization normalization, CsPhase csphase) throws IOException {
        BinaryArrays.Block block = BinaryArrays.read(path);
        int[] shape = block.shape();
        if (block.rank() != 3 || shape[0] != 2 || shape[1] != shape[2] || shape[1] < 1) {
            throw new DimensionMismatchException(
                    "Coefficient arrays must have shape (2, lmax + 1, lmax + 1). Found "
                            + Arrays.toString(shape) + " in " + path + ".");
        }
        if (block.kind() != kind) {
            throw new InvalidOptionException("File " + path + " holds " + block.kind().label()
                    + " coefficients but " + kind.label() + " were requested.");
        }
        int target = Math.min(lmax, shape[1] - 1);
        if (kind == Kind.REAL) {
            double[][][] coeffs = BinaryArrays.toReal3(block);
            return RealCoefficients.fromArray(truncate(coeffs, target), normalization, csphase);
        }
        var full = ComplexCoefficients.fromArray(BinaryArrays.toComplex3(block), normalization, csphase);
        return target == full.lmax()
                ? full
                : ComplexCoefficients.adopt(full.toArray(normalization, csphase, target), normalization, csphase);
    }

    private static void writeShtools(CoefficientSet coefficients, Path path) throws IOException {
        if (!(coefficients instanceof RealCoefficients)) {
            throw new UnsupportedOperationException(
                    "Complex coefficients cannot be written in the SHTOOLS text format. Use the binary format.");
        }
        RealCoefficients real = (RealCoefficients) coefficients;
        double[][][] c = real.toArray();
        try (Writer writer = new BufferedWriter(
                new OutputStreamWriter(Compression.create(path), StandardCharsets.UTF_8))) {
            for (int l = 0; l <= real.lmax(); l++) {
                for (int m = 0; m <= l; m++) {
                    writer.write(String.format(Locale.ROOT, ROW_FORMAT, l, m, c[0][l][m], c[1][l][m]));
                }
            }
        }
    }

    private static double parseDouble(String field) {
        return Double.parseDouble(field.replace('D', 'E').replace('d', 'e'));
    }

    private static double[][][] truncate(double[][][] coeffs, int lmax) {
        if (coeffs[0].length == lmax + 1) return coeffs;
        double[][][] out = new double[2][lmax + 1][];
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l <= lmax; l++) {
                out[i][l] = Arrays.copyOf(coeffs[i][l], lmax + 1);
            }
        }
        return out;
    }
}
