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

import com.github.tinemuz.spharm.ComplexGrid;
import com.github.tinemuz.spharm.GridSample;
import com.github.tinemuz.spharm.Kind;
import com.github.tinemuz.spharm.RealGrid;
import com.github.tinemuz.spharm.VariantDispatcher;
import com.github.tinemuz.spharm.exceptions.DimensionMismatchException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes grids. Text files hold one latitude row per line with
 * whitespace-separated values and support real grids only. The grid type is
 * inferred from the shape.
 */
public final class GridFiles {
    private static final Logger log = LoggerFactory.getLogger(GridFiles.class);
    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");

    private GridFiles() {}

    public static GridSample read(Path path, boolean binary) throws IOException {
        try {
            return binary ? readBinary(path) : readText(path);
        } catch (IOException e) {
            log.error("Error reading grid from {}", path, e);
            throw e;
        }
    }

    public static void write(GridSample grid, Path path, boolean binary) throws IOException {
        try {
            if (binary) {
                BinaryArrays.write(path, grid instanceof RealGrid
                        ? BinaryArrays.of(((RealGrid) grid).data())
                        : BinaryArrays.of(((ComplexGrid) grid).data()));
            } else {
                writeText(grid, path);
            }
        } catch (IOException e) {
            log.error("Error writing grid to {}", path, e);
            throw e;
        }
    }

    private static GridSample readText(Path path) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Compression.open(path), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                String[] fields = SEPARATOR.split(trimmed);
                double[] row = new double[fields.length];
                for (int j = 0; j < fields.length; j++) row[j] = Double.parseDouble(fields[j]);
                if (!rows.isEmpty() && rows.get(0).length != row.length) {
                    throw new DimensionMismatchException("Row " + rows.size() + " of " + path + " has "
                            + row.length + " values, expected " + rows.get(0).length + ".");
                }
                rows.add(row);
            }
        }
        if (rows.isEmpty()) {
            throw new DimensionMismatchException("No grid values found in " + path + ".");
        }
        double[][] data = rows.toArray(new double[0][]);
        return RealGrid.fromArray(data, VariantDispatcher.inferGridType(data.length, data[0].length));
    }

    private static GridSample readBinary(Path path) throws IOException {
        BinaryArrays.Block block = BinaryArrays.read(path);
        int[] shape = block.shape();
        if (block.rank() != 2 || shape[0] < 1 || shape[1] < 1) {
            throw new DimensionMismatchException(
                    "Grid arrays must have rank 2. Found " + Arrays.toString(shape) + " in " + path + ".");
        }
        var type = VariantDispatcher.inferGridType(shape[0], shape[1]);
        return block.kind() == Kind.REAL
                ? RealGrid.fromArray(BinaryArrays.toReal2(block), type)
                : ComplexGrid.fromArray(BinaryArrays.toComplex2(block), type);
    }

    private static void writeText(GridSample grid, Path path) throws IOException {
        if (!(grid instanceof RealGrid)) {
            throw new UnsupportedOperationException(
                    "Complex grids cannot be written as text. Use the binary format.");
        }
        double[][] data = ((RealGrid) grid).data();
        try (Writer writer = new BufferedWriter(
                new OutputStreamWriter(Compression.create(path), StandardCharsets.UTF_8))) {
            StringBuilder sb = new StringBuilder();
            for (double[] row : data) {
                sb.setLength(0);
                for (int j = 0; j < row.length; j++) {
                    if (j > 0) sb.append(' ');
                    sb.append(String.format(Locale.ROOT, "%.16e", row[j]));
                }
                sb.append(System.lineSeparator());
                writer.write(sb.toString());
            }
        }
    }
}
