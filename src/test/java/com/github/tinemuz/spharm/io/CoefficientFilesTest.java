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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.spharm.CoefficientSet;
import com.github.tinemuz.spharm.ComplexCoefficients;
import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.Kind;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import com.github.tinemuz.spharm.exceptions.InvalidOptionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoefficientFilesTest {

    @TempDir
    Path tempDir;

    private static RealCoefficients sample(int lmax) {
        double[] power = new double[lmax + 1];
        for (int l = 0; l <= lmax; l++) power[l] = 1.0;
        return RealCoefficients.random(power, Normalization.SCHMIDT, CsPhase.INCLUDED, false, new Well19937c(3));
    }

    private static void assertSameCoefficients(RealCoefficients a, RealCoefficients b) {
        double[][][] x = a.toArray();
        double[][][] y = b.toArray();
        assertEquals(x[0].length, y[0].length);
        for (int i = 0; i < 2; i++) {
            for (int l = 0; l < x[0].length; l++) assertArrayEquals(x[i][l], y[i][l], 0.0);
        }
    }

    @Nested
    @DisplayName("SHTOOLS text")
    class Shtools {

        @Test
        @DisplayName("Written coefficients read back exactly")
        void roundTrip() throws IOException {
            RealCoefficients c = sample(6);
            Path file = tempDir.resolve("coeffs.txt");
            c.toFile(file, CoefficientFormat.SHTOOLS);
            CoefficientSet back = CoefficientSet.fromFile(file, 6, CoefficientFormat.SHTOOLS,
                    Kind.REAL, Normalization.SCHMIDT, CsPhase.INCLUDED);
            assertEquals(Normalization.SCHMIDT, back.normalization());
            assertSameCoefficients(c, (RealCoefficients) back);
        }

        @Test
        @DisplayName("Headers, comments and degrees above lmax are skipped")
        void parsing() throws IOException {
            Path file = tempDir.resolve("model.sh");
            Files.writeString(file, String.join("\n",
                    "# test model",
                    "3396.0, 3.0, 0.0, 2",
                    "",
                    "0, 0, 1.0D0, 0.0",
                    "1 0 0.5 0.0",
                    "1, 1, 0.25, -0.75",
                    "2, 0, 9.0, 0.0",
                    ""), StandardCharsets.UTF_8);
            RealCoefficients c = (RealCoefficients) CoefficientFiles.read(file, 1, CoefficientFormat.SHTOOLS,
                    Kind.REAL, Normalization.FOUR_PI, CsPhase.EXCLUDED);
            assertEquals(1, c.lmax());
            assertEquals(1.0, c.coefficient(0, 0), 0.0);
            assertEquals(0.5, c.coefficient(1, 0), 0.0);
            assertEquals(-0.75, c.coefficient(1, -1), 0.0);
        }

        @Test
        @DisplayName("Files shorter than lmax give a smaller set")
        void shortFile() throws IOException {
            Path file = tempDir.resolve("short.txt");
            Files.writeString(file, "0, 0, 1.0, 0.0\n1, 0, 2.0, 0.0\n1, 1, 3.0, 4.0\n", StandardCharsets.UTF_8);
            CoefficientSet c = CoefficientFiles.read(file, 10, CoefficientFormat.SHTOOLS,
                    Kind.REAL, Normalization.FOUR_PI, CsPhase.EXCLUDED);
            assertEquals(1, c.lmax());
        }

        @Test
        @DisplayName("Invalid rows and complex sets are rejected")
        void rejected() throws IOException {
            Path bad = tempDir.resolve("bad.txt");
            Files.writeString(bad, "0, 0, 1.0, 0.0\n1, 2, 3.0, 4.0\n", StandardCharsets.UTF_8);
            assertThrows(DimensionMismatchException.class, () -> CoefficientFiles.read(bad, 2,
                    CoefficientFormat.SHTOOLS, Kind.REAL, Normalization.FOUR_PI, CsPhase.EXCLUDED));
            Path empty = tempDir.resolve("empty.txt");
            Files.writeString(empty, "# nothing\n", StandardCharsets.UTF_8);
            assertThrows(DimensionMismatchException.class, () -> CoefficientFiles.read(empty, 2,
                    CoefficientFormat.SHTOOLS, Kind.REAL, Normalization.FOUR_PI, CsPhase.EXCLUDED));
            assertThrows(UnsupportedOperationException.class, () -> CoefficientFiles.read(bad, 2,
                    CoefficientFormat.SHTOOLS, Kind.COMPLEX, Normalization.FOUR_PI, CsPhase.EXCLUDED));
            ComplexCoefficients z = ComplexCoefficients.zeros(2, Normalization.FOUR_PI, CsPhase.EXCLUDED);
            assertThrows(UnsupportedOperationException.class,
                    () -> z.toFile(tempDir.resolve("z.txt"), CoefficientFormat.SHTOOLS));
        }

        @Test
        @DisplayName("Gzip-compressed files are handled transparently")
        void gzip() throws IOException {
            RealCoefficients c = sample(3);
            Path file = tempDir.resolve("coeffs.txt.gz");
            c.toFile(file, CoefficientFormat.SHTOOLS);
            assertSameCoefficients(c, (RealCoefficients) CoefficientFiles.read(file, 3,
                    CoefficientFormat.SHTOOLS, Kind.REAL, Normalization.SCHMIDT, CsPhase.INCLUDED));
        }
    }

    @Nested
    @DisplayName("Binary arrays")
    class Binary {

        @Test
        @DisplayName("Real and complex sets round trip")
        void roundTrip() throws IOException {
            RealCoefficients c = sample(4);
            Path real = tempDir.resolve("real.bin");
            c.toFile(real, CoefficientFormat.BINARY);
            assertSameCoefficients(c, (RealCoefficients) CoefficientFiles.read(real, 4,
                    CoefficientFormat.BINARY, Kind.REAL, Normalization.SCHMIDT, CsPhase.INCLUDED));

            ComplexCoefficients z = c.toComplex();
            Path complex = tempDir.resolve("complex.bin");
            z.toFile(complex, CoefficientFormat.BINARY);
            ComplexCoefficients back = (ComplexCoefficients) CoefficientFiles.read(complex, 2,
                    CoefficientFormat.BINARY, Kind.COMPLEX, Normalization.SCHMIDT, CsPhase.INCLUDED);
            assertEquals(2, back.lmax());
            Complex expected = z.coefficient(2, -1);
            assertEquals(expected.getReal(), back.coefficient(2, -1).getReal(), 0.0);
            assertEquals(expected.getImaginary(), back.coefficient(2, -1).getImaginary(), 0.0);
        }

        @Test
        @DisplayName("A kind mismatch is reported")
        void kindMismatch() throws IOException {
            Path real = tempDir.resolve("real.bin");
            sample(2).toFile(real, CoefficientFormat.BINARY);
            assertThrows(InvalidOptionException.class, () -> CoefficientFiles.read(real, 2,
                    CoefficientFormat.BINARY, Kind.COMPLEX, Normalization.FOUR_PI, CsPhase.EXCLUDED));
        }

        @Test
        @DisplayName("Files without the magic number are not read")
        void badMagic() throws IOException {
            Path junk = tempDir.resolve("junk.bin");
            Files.write(junk, new byte[] {1, 2, 3, 4, 5, 6, 7, 8});
            assertThrows(IOException.class, () -> CoefficientFiles.read(junk, 2,
                    CoefficientFormat.BINARY, Kind.REAL, Normalization.FOUR_PI, CsPhase.EXCLUDED));
        }
    }
}
