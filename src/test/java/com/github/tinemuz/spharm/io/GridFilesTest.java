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

import com.github.tinemuz.spharm.ComplexGrid;
import com.github.tinemuz.spharm.CsPhase;
import com.github.tinemuz.spharm.GridSample;
import com.github.tinemuz.spharm.GridScheme;
import com.github.tinemuz.spharm.GridType;
import com.github.tinemuz.spharm.Normalization;
import com.github.tinemuz.spharm.RealCoefficients;
import com.github.tinemuz.spharm.RealGrid;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GridFilesTest {

    @TempDir
    Path tempDir;

    private static RealGrid sample(GridScheme scheme) {
        RealCoefficients c = RealCoefficients.random(new double[] {1.0, 1.0, 1.0, 1.0},
                Normalization.FOUR_PI, CsPhase.EXCLUDED, false, new Well19937c(2));
        return c.expand(scheme);
    }

    private static void assertSameData(double[][] a, double[][] b) {
        assertEquals(a.length, b.length);
        for (int i = 0; i < a.length; i++) assertArrayEquals(a[i], b[i], 0.0);
    }

    @Test
    @DisplayName("Text grids round trip and keep their type")
    void textRoundTrip() throws IOException {
        for (GridScheme scheme : GridScheme.values()) {
            RealGrid g = sample(scheme);
            Path file = tempDir.resolve(scheme + ".txt");
            g.toFile(file, false);
            GridSample back = GridSample.fromFile(file, false);
            assertEquals(scheme.gridType(), back.gridType());
            assertSameData(g.data(), ((RealGrid) back).data());
        }
    }

    @Test
    @DisplayName("Binary grids keep complex values")
    void binaryComplex() throws IOException {
        ComplexGrid g = ComplexGrid.fromReal(sample(GridScheme.GLQ)).multiply(new Complex(0.0, 2.0));
        Path file = tempDir.resolve("grid.bin.gz");
        g.toFile(file, true);
        GridSample back = GridSample.fromFile(file, true);
        assertEquals(GridType.GLQ, back.gridType());
        assertSameData(g.imaginary().data(), ((ComplexGrid) back).imaginary().data());
    }

    @Test
    @DisplayName("Complex grids are not written as text")
    void complexText() {
        ComplexGrid g = ComplexGrid.fromReal(sample(GridScheme.DH1));
        assertThrows(UnsupportedOperationException.class, () -> g.toFile(tempDir.resolve("c.txt"), false));
    }

    @Test
    @DisplayName("Ragged or unrecognised text grids are rejected")
    void badText() throws IOException {
        Path ragged = tempDir.resolve("ragged.txt");
        Files.writeString(ragged, "1 2 3 4\n1 2 3\n", StandardCharsets.UTF_8);
        assertThrows(DimensionMismatchException.class, () -> GridSample.fromFile(ragged, false));
        Path odd = tempDir.resolve("odd.txt");
        Files.writeString(odd, "1 2 3 4\n1 2 3 4\n1 2 3 4\n", StandardCharsets.UTF_8);
        assertThrows(DimensionMismatchException.class, () -> GridSample.fromFile(odd, false));
    }
}
